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

import io.twinjs.parser.LexerException;
import io.twinjs.parser.ParserException;
import io.twinjs.parser.SourcePosition;

import java.util.List;

/**
 * Host-facing description of a failure: enough to render a trace without re-deriving anything.
 */
public record ErrorReport(ErrorKind kind, String name, String message, SourcePosition position, List<StackEntry> stack) {

    public static ErrorReport of(LexerException e) {
        return new ErrorReport(ErrorKind.LEX_ERROR, "SyntaxError", e.getMessage(), e.getPosition(), List.of());
    }

    public static ErrorReport of(ParserException e) {
        return new ErrorReport(ErrorKind.PARSE_ERROR, "SyntaxError", e.getMessage(), e.getPosition(), List.of());
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(": ").append(message);
        if (stack.isEmpty()) {
            sb.append("\n    at ").append(position);
        }
        for (StackEntry entry : stack) {
            sb.append("\n    ").append(entry);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

}
