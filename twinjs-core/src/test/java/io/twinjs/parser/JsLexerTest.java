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
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.twinjs.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class JsLexerTest {

    private static List<Token> tokenize(String text) {
        return JsLexer.getTokens(Resource.text(text));
    }

    private static List<TokenType> types(String text) {
        return tokenize(text).stream().map(t -> t.type).toList();
    }

    private static List<String> texts(String text) {
        return tokenize(text).stream().map(t -> t.text).toList();
    }

    @Test
    void testOperatorLongestMatch() {
        assertEquals(List.of(IDENT, EQ_EQ_EQ, IDENT, EOF), types("a === b"));
        assertEquals(List.of(IDENT, GT_GT_GT_EQ, NUMBER, EOF), types("a >>>= 2"));
        assertEquals(List.of(IDENT, QUES_QUES_EQ, IDENT, EOF), types("a ??= b"));
        assertEquals(List.of(IDENT, QUES_DOT, IDENT, EOF), types("a?.b"));
        assertEquals(List.of(DOT_DOT_DOT, IDENT, EOF), types("...xs"));
        assertEquals(List.of(IDENT, STAR_STAR, NUMBER, EOF), types("x ** 2"));
    }

    @Test
    void testKeywordsAndIdentifiers() {
        assertEquals(List.of(CONST, IDENT, EQ, NEW, IDENT, L_PAREN, R_PAREN, EOF), types("const $x = new Foo()"));
        assertEquals(List.of(IDENT, EOF), types("letter"));
        assertTrue(LET.keyword);
        assertFalse(IDENT.keyword);
    }

    @Test
    void testNumbers() {
        assertEquals(List.of("1", "2.5", "0xff", "1e3", ".5", ""), texts("1 2.5 0xff 1e3 .5"));
        assertEquals(255, JsParser.numberValue("0xff"));
        assertEquals(1000, JsParser.numberValue("1e3"));
        assertEquals(0.5, JsParser.numberValue(".5"));
    }

    @Test
    void testStrings() {
        assertEquals(List.of(S_STRING, D_STRING, EOF), types("'a' \"b\""));
        assertEquals("a\nb", JsLexer.unescape("a\\nb"));
        assertEquals("it's", JsLexer.unescape("it\\'s"));
    }

    @Test
    void testTemplate() {
        assertEquals(List.of(BACKTICK, T_STRING, DOLLAR_L_CURLY, IDENT, R_CURLY, T_STRING, BACKTICK, EOF), types("`a${x}b`"));
        assertEquals(List.of(BACKTICK, BACKTICK, EOF), types("``"));
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of(IDENT, IDENT, EOF), types("a // line\n/* block\n */ b"));
    }

    @Test
    void testPositionsAndNewlines() {
        List<Token> tokens = tokenize("a\n  bb");
        assertEquals("1:1", tokens.get(0).getPositionDisplay());
        assertEquals("2:3", tokens.get(1).getPositionDisplay());
        assertFalse(tokens.get(0).isNewlineBefore());
        assertTrue(tokens.get(1).isNewlineBefore());
    }

    @Test
    void testErrors() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("x = 'abc"));
        assertEquals(5, e.getPosition().column);
        assertEquals("unterminated string literal", e.getMessage());
        assertThrows(LexerException.class, () -> tokenize("/* never closed"));
        assertThrows(LexerException.class, () -> tokenize("`open ${x}"));
    }

}
