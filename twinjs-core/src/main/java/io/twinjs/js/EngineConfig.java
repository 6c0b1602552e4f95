/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.twinjs.js;

import java.nio.file.Path;

/**
 * Immutable engine settings. Defaults can be overridden with the system properties
 * {@code twinjs.mode}, {@code twinjs.maxCallDepth}, {@code twinjs.maxTasks} and {@code twinjs.moduleRoot}.
 */
public final class EngineConfig {

    public static final int DEFAULT_MAX_CALL_DEPTH = 400;
    public static final long DEFAULT_MAX_TASKS = 100_000;

    private final ExecutionMode mode;
    private final int maxCallDepth;
    private final long maxTasks;
    private final boolean runEventLoop;
    private final Path moduleRoot;

    private EngineConfig(ExecutionMode mode, int maxCallDepth, long maxTasks, boolean runEventLoop, Path moduleRoot) {
        this.mode = mode;
        this.maxCallDepth = maxCallDepth;
        this.maxTasks = maxTasks;
        this.runEventLoop = runEventLoop;
        this.moduleRoot = moduleRoot;
    }

    public static EngineConfig defaults() {
        ExecutionMode mode = ExecutionMode.valueOf(System.getProperty("twinjs.mode", ExecutionMode.BYTECODE.name()).toUpperCase());
        int maxCallDepth = Integer.parseInt(System.getProperty("twinjs.maxCallDepth", String.valueOf(DEFAULT_MAX_CALL_DEPTH)));
        long maxTasks = Long.parseLong(System.getProperty("twinjs.maxTasks", String.valueOf(DEFAULT_MAX_TASKS)));
        String root = System.getProperty("twinjs.moduleRoot");
        return new EngineConfig(mode, maxCallDepth, maxTasks, true, root == null ? Path.of("") : Path.of(root));
    }

    public EngineConfig withMode(ExecutionMode mode) {
        return new EngineConfig(mode, maxCallDepth, maxTasks, runEventLoop, moduleRoot);
    }

    public EngineConfig withMaxCallDepth(int maxCallDepth) {
        return new EngineConfig(mode, maxCallDepth, maxTasks, runEventLoop, moduleRoot);
    }

    public EngineConfig withMaxTasks(long maxTasks) {
        return new EngineConfig(mode, maxCallDepth, maxTasks, runEventLoop, moduleRoot);
    }

    /**
     * Whether {@link Engine#eval} drains the microtask and timer queues before returning.
     */
    public EngineConfig withRunEventLoop(boolean runEventLoop) {
        return new EngineConfig(mode, maxCallDepth, maxTasks, runEventLoop, moduleRoot);
    }

    public EngineConfig withModuleRoot(Path moduleRoot) {
        return new EngineConfig(mode, maxCallDepth, maxTasks, runEventLoop, moduleRoot);
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public long getMaxTasks() {
        return maxTasks;
    }

    public boolean isRunEventLoop() {
        return runEventLoop;
    }

    public Path getModuleRoot() {
        return moduleRoot;
    }

    @Override
    public String toString() {
        return "mode=" + mode + " maxCallDepth=" + maxCallDepth + " maxTasks=" + maxTasks + " moduleRoot=" + moduleRoot;
    }

}
