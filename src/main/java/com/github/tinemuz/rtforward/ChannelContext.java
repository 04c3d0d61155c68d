/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.tinemuz.rtforward;

import com.github.tinemuz.rtforward.model.ChannelCatalog;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SpectralChannel;

/** Position of one channel within a forward call. All indices are 0-based. */
record ChannelContext(int profileIndex, ChannelCatalog catalog, int l, int runningIndex) {

    SensorCoefficients sensor() {
        return catalog.sensor();
    }

    String sensorId() {
        return catalog.sensorId();
    }

    /** Index of the channel in the sensor's coefficient data. */
    int channelIndex() {
        return catalog.channelIndex(l);
    }

    int sensorChannel() {
        return catalog.sensorChannel(l);
    }

    SpectralChannel channel() {
        return catalog.channel(l);
    }

    StageException fail(Stage stage, Throwable cause) {
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return StageException.forChannel(stage, profileIndex, sensorId(), sensorChannel(), reason, cause);
    }

    StageException fail(Stage stage, String reason) {
        return StageException.forChannel(stage, profileIndex, sensorId(), sensorChannel(), reason, null);
    }
}
