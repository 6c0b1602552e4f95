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

import io.twinjs.vm.Chunk;

/**
 * Execution strategy of a function, decided once per function literal: run by the tree-walk
 * interpreter, run by the VM from a compiled chunk, or bridged whole to the interpreter
 * because the compiler declined part of it.
 */
public final class FunctionBody {

    public enum Kind {
        INTERPRETED, COMPILED, BRIDGED
    }

    public static final FunctionBody INTERPRETED = new FunctionBody(Kind.INTERPRETED, null, null);

    public final Kind kind;
    public final Chunk chunk;
    public final String reason;

    private FunctionBody(Kind kind, Chunk chunk, String reason) {
        this.kind = kind;
        this.chunk = chunk;
        this.reason = reason;
    }

    public static FunctionBody compiled(Chunk chunk) {
        return new FunctionBody(Kind.COMPILED, chunk, null);
    }

    public static FunctionBody bridged(String reason) {
        return new FunctionBody(Kind.BRIDGED, null, reason);
    }

    @Override
    public String toString() {
        return reason == null ? kind.toString() : kind + " (" + reason + ")";
    }

}
