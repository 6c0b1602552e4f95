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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static io.twinjs.parser.TokenType.*;

/**
 * Hand-rolled lexer for the supported JavaScript subset. White-space and comments are
 * consumed here and only recorded as the "newline before" flag on the next token.
 */
public class JsLexer {

    protected final Resource resource;
    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    private final ArrayDeque<LexerState> stateStack = new ArrayDeque<>();

    protected enum LexerState {
        INITIAL, BRACE, TEMPLATE, PLACEHOLDER
    }

    public JsLexer(Resource resource) {
        this.resource = resource;
        this.source = resource.getText();
        this.length = source.length();
        stateStack.push(LexerState.INITIAL);
    }

    public static List<Token> getTokens(Resource resource) {
        JsLexer lexer = new JsLexer(resource);
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            list.add(token);
        } while (token.type != EOF);
        return list;
    }

    // ========== Public API ==========

    public Token nextToken() {
        boolean newline = false;
        if (currentState() != LexerState.TEMPLATE) {
            newline = skipWhitespaceAndComments();
        }
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = scanToken();
        Token token = new Token(resource, type, tokenStart, tokenLine, tokenCol, source.substring(tokenStart, pos));
        token.newlineBefore = newline;
        return token;
    }

    // ========== State Management ==========

    protected LexerState currentState() {
        return stateStack.peek();
    }

    protected void pushState(LexerState state) {
        stateStack.push(state);
    }

    protected LexerState popState() {
        if (stateStack.size() > 1) {
            return stateStack.pop();
        }
        return stateStack.peek();
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private LexerException error(String message) {
        return new LexerException(message, new SourcePosition(resource.getRelativePath(), tokenLine + 1, tokenCol + 1));
    }

    // ========== White-space and Comments ==========

    private boolean skipWhitespaceAndComments() {
        boolean newline = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == ' ' || c == '﻿') {
                advance();
            } else if (c == '\n') {
                advance();
                newline = true;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < length && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                tokenLine = line;
                tokenCol = col;
                advance();
                advance();
                boolean closed = false;
                while (pos < length) {
                    if (source.charAt(pos) == '*' && peek(1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    if (advance() == '\n') {
                        newline = true;
                    }
                }
                if (!closed) {
                    throw error("unterminated comment");
                }
            } else {
                break;
            }
        }
        return newline;
    }

    // ========== Main Scanner ==========

    protected TokenType scanToken() {
        if (currentState() == LexerState.TEMPLATE) {
            return scanTemplateContent();
        }
        if (isAtEnd()) {
            return EOF;
        }
        char c = source.charAt(pos);
        if (c == '"' || c == '\'') {
            return scanString(c);
        }
        if (c == '`') {
            advance();
            pushState(LexerState.TEMPLATE);
            return BACKTICK;
        }
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$') {
            return scanIdentifier();
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber();
        }
        if (c > 127 && Character.isJavaIdentifierStart(c)) {
            return scanIdentifier();
        }
        return scanOperator();
    }

    // ========== Strings ==========

    private TokenType scanString(char quote) {
        advance(); // opening quote
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated string literal");
            }
            char c = peek();
            if (c == quote) {
                advance();
                break;
            }
            if (c == '\n') {
                throw error("unterminated string literal");
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    throw error("unterminated string literal");
                }
            }
            advance();
        }
        return quote == '"' ? D_STRING : S_STRING;
    }

    // ========== Template Literals ==========

    private TokenType scanTemplateContent() {
        if (isAtEnd()) {
            throw error("unterminated template literal");
        }
        char c = peek();
        if (c == '`') {
            advance();
            popState();
            return BACKTICK;
        }
        if (c == '$' && peek(1) == '{') {
            advance();
            advance();
            pushState(LexerState.PLACEHOLDER);
            return DOLLAR_L_CURLY;
        }
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated template literal");
            }
            c = peek();
            if (c == '`' || (c == '$' && peek(1) == '{')) {
                break;
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    throw error("unterminated template literal");
                }
            }
            advance();
        }
        return T_STRING;
    }

    // ========== Numbers ==========

    private TokenType scanNumber() {
        char c = peek();
        if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            advance();
            advance();
            if (!isHexDigit(peek())) {
                throw error("invalid hexadecimal literal");
            }
            while (isHexDigit(peek())) {
                advance();
            }
            return NUMBER;
        }
        if (c == '0' && (peek(1) == 'b' || peek(1) == 'B' || peek(1) == 'o' || peek(1) == 'O')) {
            advance();
            advance();
            if (!isDigit(peek())) {
                throw error("invalid numeric literal");
            }
            while (isDigit(peek())) {
                advance();
            }
            return NUMBER;
        }
        while (isDigit(peek()) || peek() == '_') {
            advance();
        }
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!isDigit(peek())) {
                throw error("invalid exponent in numeric literal");
            }
            while (isDigit(peek())) {
                advance();
            }
        }
        if (isIdentifierStart(peek())) {
            throw error("identifier starts immediately after numeric literal");
        }
        return NUMBER;
    }

    // ========== Identifiers and Keywords ==========

    private TokenType scanIdentifier() {
        while (pos < length) {
            char c = source.charAt(pos);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '$'
                    || (c > 127 && Character.isJavaIdentifierPart(c))) {
                advance();
            } else {
                break;
            }
        }
        return keywordOrIdent(source.substring(tokenStart, pos));
    }

    private static TokenType keywordOrIdent(String text) {
        return switch (text) {
            case "null" -> NULL;
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "function" -> FUNCTION;
            case "return" -> RETURN;
            case "try" -> TRY;
            case "catch" -> CATCH;
            case "finally" -> FINALLY;
            case "throw" -> THROW;
            case "new" -> NEW;
            case "var" -> VAR;
            case "let" -> LET;
            case "const" -> CONST;
            case "if" -> IF;
            case "else" -> ELSE;
            case "typeof" -> TYPEOF;
            case "instanceof" -> INSTANCEOF;
            case "delete" -> DELETE;
            case "for" -> FOR;
            case "in" -> IN;
            case "of" -> OF;
            case "do" -> DO;
            case "while" -> WHILE;
            case "switch" -> SWITCH;
            case "case" -> CASE;
            case "default" -> DEFAULT;
            case "break" -> BREAK;
            case "continue" -> CONTINUE;
            case "this" -> THIS;
            case "void" -> VOID;
            case "class" -> CLASS;
            case "extends" -> EXTENDS;
            case "super" -> SUPER;
            case "await" -> AWAIT;
            case "import" -> IMPORT;
            case "export" -> EXPORT;
            default -> IDENT;
        };
    }

    // ========== Operators and Punctuation ==========

    private TokenType scanOperator() {
        char c = advance();
        switch (c) {
            case '{':
                pushState(LexerState.BRACE);
                return L_CURLY;
            case '}':
                popState(); // BRACE or PLACEHOLDER
                return R_CURLY;
            case '[':
                return L_BRACKET;
            case ']':
                return R_BRACKET;
            case '(':
                return L_PAREN;
            case ')':
                return R_PAREN;
            case ',':
                return COMMA;
            case ':':
                return COLON;
            case ';':
                return SEMI;
            case '~':
                return TILDE;
            case '.':
                if (peek() == '.' && peek(1) == '.') {
                    advance();
                    advance();
                    return DOT_DOT_DOT;
                }
                return DOT;
            case '?':
                if (peek() == '.' && !isDigit(peek(1))) {
                    advance();
                    return QUES_DOT;
                }
                if (match('?')) {
                    return match('=') ? QUES_QUES_EQ : QUES_QUES;
                }
                return QUES;
            case '=':
                if (match('=')) {
                    return match('=') ? EQ_EQ_EQ : EQ_EQ;
                }
                if (match('>')) {
                    return EQ_GT;
                }
                return EQ;
            case '<':
                if (match('<')) {
                    return match('=') ? LT_LT_EQ : LT_LT;
                }
                return match('=') ? LT_EQ : LT;
            case '>':
                if (match('>')) {
                    if (match('>')) {
                        return match('=') ? GT_GT_GT_EQ : GT_GT_GT;
                    }
                    return match('=') ? GT_GT_EQ : GT_GT;
                }
                return match('=') ? GT_EQ : GT;
            case '!':
                if (match('=')) {
                    return match('=') ? NOT_EQ_EQ : NOT_EQ;
                }
                return NOT;
            case '|':
                if (match('|')) {
                    return match('=') ? PIPE_PIPE_EQ : PIPE_PIPE;
                }
                return match('=') ? PIPE_EQ : PIPE;
            case '&':
                if (match('&')) {
                    return match('=') ? AMP_AMP_EQ : AMP_AMP;
                }
                return match('=') ? AMP_EQ : AMP;
            case '^':
                return match('=') ? CARET_EQ : CARET;
            case '+':
                if (match('+')) {
                    return PLUS_PLUS;
                }
                return match('=') ? PLUS_EQ : PLUS;
            case '-':
                if (match('-')) {
                    return MINUS_MINUS;
                }
                return match('=') ? MINUS_EQ : MINUS;
            case '*':
                if (match('*')) {
                    return match('=') ? STAR_STAR_EQ : STAR_STAR;
                }
                return match('=') ? STAR_EQ : STAR;
            case '/':
                return match('=') ? SLASH_EQ : SLASH;
            case '%':
                return match('=') ? PERCENT_EQ : PERCENT;
            default:
                throw error("invalid character '" + c + "'");
        }
    }

    // ========== Literal Decoding ==========

    /**
     * Decodes escape sequences of a string literal body or template fragment.
     */
    public static String unescape(String raw) {
        if (raw.indexOf('\\') == -1) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i++);
            if (c != '\\' || i >= n) {
                sb.append(c);
                continue;
            }
            char e = raw.charAt(i++);
            switch (e) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000b');
                case '0' -> sb.append('\0');
                case '\n' -> {
                    // line continuation
                }
                case 'x' -> {
                    if (i + 2 <= n) {
                        sb.append((char) Integer.parseInt(raw.substring(i, i + 2), 16));
                        i += 2;
                    }
                }
                case 'u' -> {
                    if (i < n && raw.charAt(i) == '{') {
                        int end = raw.indexOf('}', i);
                        sb.appendCodePoint(Integer.parseInt(raw.substring(i + 1, end), 16));
                        i = end + 1;
                    } else if (i + 4 <= n) {
                        sb.append((char) Integer.parseInt(raw.substring(i, i + 4), 16));
                        i += 4;
                    }
                }
                default -> sb.append(e);
            }
        }
        return sb.toString();
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    protected static boolean isIdentifierStart(char c) {
        return c != '\0' && Character.isJavaIdentifierStart(c);
    }

}
