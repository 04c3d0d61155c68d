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

/**
 * A pipeline stage failed. Carries the profile index and, where the stage runs
 * per sensor or channel, the sensor id and published channel number. All
 * indices are 0-based.
 */
public final class StageException extends ForwardModelException {
    private static final long serialVersionUID = 1L;
    /** Channel number used when the failure is not tied to a channel. */
    public static final int NO_CHANNEL = -1;

    private final Stage stage;
    private final int profileIndex;
    private final String sensorId;
    private final int sensorChannel;

    StageException(Stage stage, int profileIndex, String sensorId, int sensorChannel, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.profileIndex = profileIndex;
        this.sensorId = sensorId;
        this.sensorChannel = sensorChannel;
    }

    /** Failure of a profile-scope stage. */
    static StageException forProfile(Stage stage, int profileIndex, String what, Throwable cause) {
        return new StageException(stage, profileIndex, null, NO_CHANNEL,
                "Error " + what + " for profile #" + profileIndex + detail(cause), cause);
    }

    /** Failure of a sensor-scope stage. */
    static StageException forSensor(
            Stage stage, int profileIndex, int sensorIndex, String sensorId, String what, Throwable cause) {
        return new StageException(stage, profileIndex, sensorId, NO_CHANNEL,
                "Error " + what + " for profile #" + profileIndex + " and sensor #" + sensorIndex
                        + " (" + sensorId + ")" + detail(cause), cause);
    }

    /** Failure of a channel-scope stage. */
    static StageException forChannel(
            Stage stage, int profileIndex, String sensorId, int sensorChannel, String reason, Throwable cause) {
        return new StageException(stage, profileIndex, sensorId, sensorChannel,
                "Error computing " + stage.label() + " for " + sensorId + ", channel " + sensorChannel
                        + ", profile #" + profileIndex + ": " + reason, cause);
    }

    private static String detail(Throwable cause) {
        if (cause == null) return "";
        return ": " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    }

    public Stage stage() {
        return stage;
    }

    public int profileIndex() {
        return profileIndex;
    }

    /** Sensor id, or {@code null} for profile-scope stages. */
    public String sensorId() {
        return sensorId;
    }

    /** Published channel number, or {@link #NO_CHANNEL}. */
    public int sensorChannel() {
        return sensorChannel;
    }
}
