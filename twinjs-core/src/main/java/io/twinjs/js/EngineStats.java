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

/**
 * Counters for how functions were executed, so the bridging decision can be audited.
 */
public class EngineStats {

    int compiledFunctions;
    int bridgedFunctions;
    long vmCalls;
    long bridgedCalls;
    long interpretedCalls;

    public int getCompiledFunctions() {
        return compiledFunctions;
    }

    public int getBridgedFunctions() {
        return bridgedFunctions;
    }

    /**
     * Invocations run by the VM opcode loop.
     */
    public long getVmCalls() {
        return vmCalls;
    }

    /**
     * Invocations of bridged functions redirected whole to the tree-walk evaluator.
     */
    public long getBridgedCalls() {
        return bridgedCalls;
    }

    public long getInterpretedCalls() {
        return interpretedCalls;
    }

    public void incrementVmCalls() {
        vmCalls++;
    }

    @Override
    public String toString() {
        return "compiled=" + compiledFunctions + " bridged=" + bridgedFunctions
                + " vmCalls=" + vmCalls + " bridgedCalls=" + bridgedCalls + " interpretedCalls=" + interpretedCalls;
    }

}
