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

import io.twinjs.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static io.twinjs.parser.TokenType.*;

/**
 * Token cursor shared by the recursive-descent parser: look-ahead, conditional consumption
 * and automatic semicolon insertion. Errors abort the whole parse, no partial tree is kept.
 */
public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    protected final Resource resource;
    protected final List<Token> tokens;
    private final int size;

    private int position = 0;

    protected BaseParser(Resource resource) {
        this.resource = resource;
        this.tokens = JsLexer.getTokens(resource);
        this.size = tokens.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 5);
        int end = Math.min(position + 5, size);
        for (int i = start; i < end; i++) {
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i)).append(' ');
        }
        return sb.toString().trim();
    }

    protected ParserException error(String expected) {
        if (logger.isTraceEnabled()) {
            logger.trace("parse error, state: {}", this);
        }
        return new ParserException(expected, peekToken());
    }

    protected Token peekToken() {
        return position < size ? tokens.get(position) : tokens.get(size - 1);
    }

    protected Token peekToken(int offset) {
        int index = position + offset;
        return index < size ? tokens.get(index) : tokens.get(size - 1);
    }

    protected TokenType peek() {
        return peekToken().type;
    }

    protected TokenType peek(int offset) {
        return peekToken(offset).type;
    }

    protected int position() {
        return position;
    }

    protected void reset(int position) {
        this.position = position;
    }

    protected Token next() {
        Token token = peekToken();
        if (position < size - 1) {
            position++;
        }
        return token;
    }

    protected boolean consumeIf(TokenType type) {
        if (peek() == type) {
            next();
            return true;
        }
        return false;
    }

    protected Token consume(TokenType type, String expected) {
        if (peek() != type) {
            throw error(expected);
        }
        return next();
    }

    protected boolean isIdent(String text) {
        Token token = peekToken();
        return token.type == IDENT && token.text.equals(text);
    }

    protected boolean isIdent(int offset, String text) {
        Token token = peekToken(offset);
        return token.type == IDENT && token.text.equals(text);
    }

    /**
     * End of statement: an explicit semicolon, or one inserted before a newline, a closing brace or the end of input.
     */
    protected void eos() {
        if (consumeIf(SEMI)) {
            return;
        }
        Token token = peekToken();
        if (token.type == R_CURLY || token.type == EOF || token.isNewlineBefore()) {
            return;
        }
        throw error("expected ';'");
    }

}
