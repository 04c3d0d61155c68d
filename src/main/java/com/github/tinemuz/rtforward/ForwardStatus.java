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

import java.util.List;
import java.util.Optional;

/**
 * Aggregate outcome of a forward call.
 *
 * <p>{@link Severity#WARNING} means every result was computed but at least one
 * scoped workspace failed to release. A {@link Severity#FAILURE} carries the
 * first fatal error in profile, sensor, channel, stage order; cleanup warnings
 * raised while unwinding from it are kept alongside but never replace it.</p>
 */
public final class ForwardStatus {

    public enum Severity { SUCCESS, WARNING, FAILURE }

    private final Severity severity;
    private final String message;
    private final List<String> warnings;
    private final ForwardModelException failure;

    private ForwardStatus(Severity severity, String message, List<String> warnings, ForwardModelException failure) {
        this.severity = severity;
        this.message = message;
        this.warnings = List.copyOf(warnings);
        this.failure = failure;
    }

    static ForwardStatus completed(List<String> warnings) {
        if (warnings.isEmpty()) return new ForwardStatus(Severity.SUCCESS, "", warnings, null);
        return new ForwardStatus(Severity.WARNING, warnings.get(0), warnings, null);
    }

    static ForwardStatus failed(ForwardModelException failure, List<String> warnings) {
        return new ForwardStatus(Severity.FAILURE, failure.getMessage(), warnings, failure);
    }

    public Severity severity() {
        return severity;
    }

    /** True unless the call failed; results are complete for SUCCESS and WARNING. */
    public boolean isSuccess() {
        return severity != Severity.FAILURE;
    }

    public boolean isFailure() {
        return severity == Severity.FAILURE;
    }

    /** Failure message, first warning, or empty on a clean success. */
    public String message() {
        return message;
    }

    public List<String> warnings() {
        return warnings;
    }

    public Optional<ForwardModelException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return message.isEmpty() ? severity.toString() : severity + ": " + message;
    }
}
