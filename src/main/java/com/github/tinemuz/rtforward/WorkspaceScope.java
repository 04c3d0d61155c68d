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

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.Workspace;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the workspaces of one loop scope and releases them, newest first, when
 * the scope exits by any path. A release failure becomes a cleanup warning; it
 * is logged and recorded but never thrown.
 */
final class WorkspaceScope implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceScope.class);

    private final String name;
    private final List<String> warnings;
    private final Deque<Workspace> held = new ArrayDeque<>();

    WorkspaceScope(String name, List<String> warnings) {
        this.name = name;
        this.warnings = warnings;
    }

    <T extends Workspace> T hold(T workspace) {
        held.push(workspace);
        return workspace;
    }

    int size() {
        return held.size();
    }

    @Override
    public void close() {
        while (!held.isEmpty()) {
            Workspace ws = held.pop();
            try {
                ws.release();
            } catch (BackendException | RuntimeException e) {
                String msg = "Error deallocating " + describe(ws) + " for " + name
                        + ": " + e.getMessage();
                log.warn(msg);
                warnings.add(msg);
            }
        }
    }

    private static String describe(Workspace ws) {
        String simple = ws.getClass().getSimpleName();
        return simple.isEmpty() ? ws.getClass().getName() : simple;
    }
}
