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

public enum TokenType {

    EOF,
    BACKTICK,
    L_CURLY,
    R_CURLY,
    L_BRACKET,
    R_BRACKET,
    L_PAREN,
    R_PAREN,
    COMMA,
    COLON,
    SEMI,
    DOT_DOT_DOT,
    QUES_DOT,
    DOT,
    //==== keywords
    NULL(true),
    TRUE(true),
    FALSE(true),
    FUNCTION(true),
    RETURN(true),
    TRY(true),
    CATCH(true),
    FINALLY(true),
    THROW(true),
    NEW(true),
    VAR(true),
    LET(true),
    CONST(true),
    IF(true),
    ELSE(true),
    TYPEOF(true),
    INSTANCEOF(true),
    DELETE(true),
    FOR(true),
    IN(true),
    OF(true),
    DO(true),
    WHILE(true),
    SWITCH(true),
    CASE(true),
    DEFAULT(true),
    BREAK(true),
    CONTINUE(true),
    THIS(true),
    VOID(true),
    CLASS(true),
    EXTENDS(true),
    SUPER(true),
    AWAIT(true),
    IMPORT(true),
    EXPORT(true),
    //====
    EQ_EQ_EQ,
    EQ_EQ,
    EQ,
    EQ_GT, // arrow
    LT_LT_EQ,
    LT_LT,
    LT_EQ,
    LT,
    GT_GT_GT_EQ,
    GT_GT_GT,
    GT_GT_EQ,
    GT_GT,
    GT_EQ,
    GT,
    //====
    NOT_EQ_EQ,
    NOT_EQ,
    NOT,
    PIPE_PIPE_EQ,
    PIPE_PIPE,
    PIPE_EQ,
    PIPE,
    AMP_AMP_EQ,
    AMP_AMP,
    AMP_EQ,
    AMP,
    CARET_EQ,
    CARET,
    QUES_QUES_EQ,
    QUES_QUES,
    QUES,
    //====
    PLUS_PLUS,
    PLUS_EQ,
    PLUS,
    MINUS_MINUS,
    MINUS_EQ,
    MINUS,
    STAR_STAR_EQ,
    STAR_STAR,
    STAR_EQ,
    STAR,
    SLASH_EQ,
    SLASH,
    PERCENT_EQ,
    PERCENT,
    TILDE,
    //====
    S_STRING,
    D_STRING,
    NUMBER,
    IDENT,
    //====
    DOLLAR_L_CURLY,
    T_STRING;

    public final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    public boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

    /**
     * Assignment operators map to the binary operator they combine with, e.g. {@code +=} to {@code +}.
     */
    public TokenType binaryOf() {
        return switch (this) {
            case PLUS_EQ -> PLUS;
            case MINUS_EQ -> MINUS;
            case STAR_EQ -> STAR;
            case SLASH_EQ -> SLASH;
            case PERCENT_EQ -> PERCENT;
            case STAR_STAR_EQ -> STAR_STAR;
            case LT_LT_EQ -> LT_LT;
            case GT_GT_EQ -> GT_GT;
            case GT_GT_GT_EQ -> GT_GT_GT;
            case AMP_EQ -> AMP;
            case PIPE_EQ -> PIPE;
            case CARET_EQ -> CARET;
            case AMP_AMP_EQ -> AMP_AMP;
            case PIPE_PIPE_EQ -> PIPE_PIPE;
            case QUES_QUES_EQ -> QUES_QUES;
            default -> null;
        };
    }

    /**
     * Source text of an operator or punctuation token, the lower-cased name for keywords.
     */
    public String symbol() {
        if (keyword) {
            return name().toLowerCase();
        }
        return switch (this) {
            case L_CURLY -> "{";
            case R_CURLY -> "}";
            case L_BRACKET -> "[";
            case R_BRACKET -> "]";
            case L_PAREN -> "(";
            case R_PAREN -> ")";
            case COMMA -> ",";
            case COLON -> ":";
            case SEMI -> ";";
            case DOT_DOT_DOT -> "...";
            case QUES_DOT -> "?.";
            case DOT -> ".";
            case EQ_EQ_EQ -> "===";
            case EQ_EQ -> "==";
            case EQ -> "=";
            case EQ_GT -> "=>";
            case LT_LT_EQ -> "<<=";
            case LT_LT -> "<<";
            case LT_EQ -> "<=";
            case LT -> "<";
            case GT_GT_GT_EQ -> ">>>=";
            case GT_GT_GT -> ">>>";
            case GT_GT_EQ -> ">>=";
            case GT_GT -> ">>";
            case GT_EQ -> ">=";
            case GT -> ">";
            case NOT_EQ_EQ -> "!==";
            case NOT_EQ -> "!=";
            case NOT -> "!";
            case PIPE_PIPE_EQ -> "||=";
            case PIPE_PIPE -> "||";
            case PIPE_EQ -> "|=";
            case PIPE -> "|";
            case AMP_AMP_EQ -> "&&=";
            case AMP_AMP -> "&&";
            case AMP_EQ -> "&=";
            case AMP -> "&";
            case CARET_EQ -> "^=";
            case CARET -> "^";
            case QUES_QUES_EQ -> "??=";
            case QUES_QUES -> "??";
            case QUES -> "?";
            case PLUS_PLUS -> "++";
            case PLUS_EQ -> "+=";
            case PLUS -> "+";
            case MINUS_MINUS -> "--";
            case MINUS_EQ -> "-=";
            case MINUS -> "-";
            case STAR_STAR_EQ -> "**=";
            case STAR_STAR -> "**";
            case STAR_EQ -> "*=";
            case STAR -> "*";
            case SLASH_EQ -> "/=";
            case SLASH -> "/";
            case PERCENT_EQ -> "%=";
            case PERCENT -> "%";
            case TILDE -> "~";
            case BACKTICK -> "`";
            case DOLLAR_L_CURLY -> "${";
            default -> name();
        };
    }

}
