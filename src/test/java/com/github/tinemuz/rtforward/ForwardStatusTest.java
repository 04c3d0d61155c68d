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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ForwardStatusTest {

    @Test
    @DisplayName("No warnings is a clean success")
    void success() {
        ForwardStatus status = ForwardStatus.completed(List.of());

        assertEquals(ForwardStatus.Severity.SUCCESS, status.severity());
        assertEquals("", status.message());
        assertEquals("SUCCESS", status.toString());
    }

    @Test
    @DisplayName("Cleanup warnings downgrade success to warning")
    void warning() {
        ForwardStatus status = ForwardStatus.completed(List.of("first", "second"));

        assertEquals(ForwardStatus.Severity.WARNING, status.severity());
        assertTrue(status.isSuccess());
        assertEquals("first", status.message());
        assertEquals(2, status.warnings().size());
    }

    @Test
    @DisplayName("Failure keeps the exception and any warnings")
    void failure() {
        ValidationException e = new ValidationException("bad input");
        ForwardStatus status = ForwardStatus.failed(e, List.of("cleanup"));

        assertTrue(status.isFailure());
        assertSame(e, status.failure().orElseThrow());
        assertEquals("bad input", status.message());
        assertEquals(List.of("cleanup"), status.warnings());
    }
}
