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

import io.twinjs.parser.SourcePosition;

import java.util.List;

/**
 * The single throw signal of both evaluators. Carries the thrown JS value verbatim, so a
 * {@code catch} clause receives exactly what was thrown, plus where and in which call stack.
 */
public class JsException extends RuntimeException {

    private final transient Object value;
    private final ErrorKind kind;
    private final SourcePosition position;
    private final List<StackEntry> jsStack;

    public JsException(Object value, ErrorKind kind, SourcePosition position, List<StackEntry> jsStack) {
        super(describe(value), null, false, false);
        this.value = value;
        this.kind = kind;
        this.position = position == null ? SourcePosition.UNKNOWN : position;
        this.jsStack = jsStack == null ? List.of() : List.copyOf(jsStack);
    }

    private static String describe(Object value) {
        if (value instanceof JsError error) {
            return error.toString();
        }
        return "Uncaught " + Display.inspect(value);
    }

    public Object getValue() {
        return value;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public List<StackEntry> getJsStack() {
        return jsStack;
    }

    public ErrorReport toReport() {
        String name;
        String message;
        if (value instanceof JsError error) {
            name = error.getName();
            message = error.getMessage();
        } else {
            name = "Uncaught";
            message = Display.inspect(value);
        }
        return new ErrorReport(kind, name, message, position, jsStack);
    }

}
