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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InspectorTest {

    @Test
    void testTokens() {
        assertEquals(List.of("1:1 LET let", "1:5 IDENT x", "1:7 EQ =", "1:9 NUMBER 1"), Inspector.tokens("let x = 1"));
    }

    @Test
    void testAst() {
        String ast = Inspector.ast("1 + a");
        assertTrue(ast.startsWith("(PROGRAM"), ast);
        assertTrue(ast.contains("(BINARY_EXPR + (LITERAL 1) (IDENT a))"), ast);
    }

    @Test
    void testChunk() {
        String listing = Inspector.chunk("let a = 1; a + 2");
        assertTrue(listing.startsWith("== <main> =="), listing);
        assertTrue(listing.contains("ADD"), listing);
    }

    @Test
    void testChunkReportsBridging() {
        String listing = Inspector.chunk("const [a, b] = [1, 2];");
        assertTrue(listing.startsWith("bridged: "), listing);
    }

    @Test
    void testEvaluate() {
        assertEquals("[ 1, 2 ]", Inspector.evaluate("[1, 2]", ExecutionMode.TREE_WALK).display());
        assertEquals("[ 1, 2 ]", Inspector.evaluate("[1, 2]", ExecutionMode.BYTECODE).display());
        assertTrue(Inspector.evaluate("(", ExecutionMode.BYTECODE).isError());
    }

}
