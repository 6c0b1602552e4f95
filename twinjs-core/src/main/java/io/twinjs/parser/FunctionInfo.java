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
package io.twinjs.parser;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scope facts collected while parsing a function body or the program, attached to the
 * function node so that neither evaluator has to re-scan the body.
 */
public class FunctionInfo {

    // var-declared names, including those nested in blocks and loop heads
    public final Set<String> varNames = new LinkedHashSet<>();

    public final boolean arrow;
    public final boolean async;

    // name inferred from the binding or property the function is assigned to
    public String inferredName;

    public boolean usesArguments;
    public boolean hasAwait;
    public boolean generator;

    public FunctionInfo(boolean arrow, boolean async) {
        this.arrow = arrow;
        this.async = async;
    }

}
