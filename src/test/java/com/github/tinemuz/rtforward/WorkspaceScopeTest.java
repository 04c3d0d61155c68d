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

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.Workspace;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WorkspaceScopeTest {

    @Test
    @DisplayName("Workspaces are released newest first")
    void reverseOrder() {
        List<String> released = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        try (WorkspaceScope scope = new WorkspaceScope("profile #0", warnings)) {
            scope.hold(named("optics", released));
            scope.hold(named("surface", released));
            scope.hold(named("predictors", released));
            assertEquals(3, scope.size());
        }

        assertEquals(List.of("predictors", "surface", "optics"), released);
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("A failing release becomes a warning and the rest still run")
    void failingReleaseIsWarning() {
        List<String> released = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Workspace broken = () -> {
            throw new BackendException("device busy");
        };

        try (WorkspaceScope scope = new WorkspaceScope("profile #3 sensor #1", warnings)) {
            scope.hold(named("optics", released));
            scope.hold(broken);
        }

        assertEquals(List.of("optics"), released);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("profile #3 sensor #1"), warnings.get(0));
        assertTrue(warnings.get(0).contains("device busy"), warnings.get(0));
    }

    @Test
    @DisplayName("An unchecked exception from a release is also a warning")
    void uncheckedReleaseIsWarning() {
        List<String> released = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Workspace broken = () -> {
            throw new IllegalStateException("handle closed");
        };

        try (WorkspaceScope scope = new WorkspaceScope("profile #1", warnings)) {
            scope.hold(named("optics", released));
            scope.hold(broken);
        }

        assertEquals(List.of("optics"), released);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("handle closed"), warnings.get(0));
    }

    @Test
    @DisplayName("Workspaces are released when the scope exits by exception")
    void releasedOnException() {
        List<String> released = new ArrayList<>();

        assertThrows(IllegalStateException.class, () -> {
            try (WorkspaceScope scope = new WorkspaceScope("profile #0", new ArrayList<>())) {
                scope.hold(named("optics", released));
                throw new IllegalStateException("stage failed");
            }
        });

        assertEquals(List.of("optics"), released);
    }

    private static Workspace named(String name, List<String> released) {
        return () -> released.add(name);
    }
}
