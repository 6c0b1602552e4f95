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

public class ParserException extends RuntimeException {

    private final SourcePosition position;
    private final String expected;

    public ParserException(String expected, Token token) {
        super(message(expected, token));
        this.position = token.getPosition();
        this.expected = expected;
    }

    private static String message(String expected, Token token) {
        String found = token.type == TokenType.EOF ? "end of input" : "'" + token.text + "'";
        StringBuilder sb = new StringBuilder();
        sb.append(expected).append(", found ").append(found).append(" at ").append(token.getPosition());
        String lineText = token.getLineText();
        if (!lineText.isBlank()) {
            sb.append('\n').append(lineText.trim());
        }
        return sb.toString();
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * @return description of the construct the parser was looking for
     */
    public String getExpected() {
        return expected;
    }

}
