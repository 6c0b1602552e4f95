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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsParserTest {

    private static String sexpr(String text) {
        return JsParser.parse(text).toSexpr();
    }

    private static void contains(String text, String expected) {
        String actual = sexpr(text);
        assertTrue(actual.contains(expected), "expected " + expected + " in " + actual);
    }

    private static ParserException error(String text) {
        return assertThrows(ParserException.class, () -> JsParser.parse(text));
    }

    @Test
    void testPrecedence() {
        contains("1 + 2 * 3", "(BINARY_EXPR + (LITERAL 1) (BINARY_EXPR * (LITERAL 2) (LITERAL 3)))");
        contains("(1 + 2) * 3", "(BINARY_EXPR * (BINARY_EXPR + (LITERAL 1) (LITERAL 2)) (LITERAL 3))");
        contains("2 ** 3 ** 2", "(BINARY_EXPR ** (LITERAL 2) (BINARY_EXPR ** (LITERAL 3) (LITERAL 2)))");
        contains("a || b && c", "(LOGICAL_EXPR || (IDENT a) (LOGICAL_EXPR && (IDENT b) (IDENT c)))");
    }

    @Test
    void testAssignmentIsRightAssociative() {
        contains("a = b = 1", "(ASSIGN_EXPR = (IDENT a) (ASSIGN_EXPR = (IDENT b) (LITERAL 1)))");
        contains("o.x += 2", "(ASSIGN_EXPR += (MEMBER_EXPR x (IDENT o)) (LITERAL 2))");
    }

    @Test
    void testLiterals() {
        contains("'it\\'s'", "(LITERAL \"it's\")");
        contains("null", "(LITERAL null)");
        contains("0x10", "(LITERAL 16)");
    }

    @Test
    void testStatementsAreSplitByNewlines() {
        assertEquals(3, JsParser.parse("let a = 1\nlet b = a\nb").size());
        assertEquals(2, JsParser.parse("function A() {} function B() {}").size());
    }

    @Test
    void testFunctionInfo() {
        Node program = JsParser.parse("function f() { var a; { var b; } for (var i of []) {} return arguments.length; }");
        FunctionInfo info = program.get(0).getFunctionInfo();
        assertEquals(List.of("a", "b", "i"), List.copyOf(info.varNames));
        assertTrue(info.usesArguments);
        assertFalse(info.async);
    }

    @Test
    void testArrowDoesNotOwnArguments() {
        Node program = JsParser.parse("function outer() { const f = () => arguments[0]; return f(); }");
        assertTrue(program.get(0).getFunctionInfo().usesArguments);
    }

    @Test
    void testAsyncAndAwait() {
        Node program = JsParser.parse("async function f() { await g(); }");
        FunctionInfo info = program.get(0).getFunctionInfo();
        assertTrue(info.async);
        assertTrue(info.hasAwait);
        contains("async function f() { await g(); }", "(AWAIT_EXPR");
    }

    @Test
    void testInferredNames() {
        Node program = JsParser.parse("const add = (a, b) => a + b;");
        Node arrow = program.get(0).get(0).get(1);
        assertEquals(NodeType.ARROW_FN, arrow.type);
        assertEquals("add", arrow.getFunctionInfo().inferredName);
    }

    @Test
    void testPatterns() {
        contains("const {a, b: [c] = []} = o", "(OBJECT_PATTERN");
        contains("const [x, , ...rest] = list", "(REST (IDENT rest))");
    }

    @Test
    void testOptionalChain() {
        contains("a?.b", "(OPTIONAL_CHAIN");
        contains("a?.b", "?.");
    }

    @Test
    void testClass() {
        contains("class A extends B { static make() { return new A(); } x = 1; }", "(CLASS_DECL");
        contains("class A { static make() {} }", "static");
    }

    @Test
    void testModuleSyntax() {
        contains("import x, { y as z } from './m.js'", "(IMPORT_DECL \"./m.js\"");
        contains("export const a = 1", "(EXPORT_DECL");
        contains("export default 42", "(EXPORT_DEFAULT (LITERAL 42))");
    }

    @Test
    void testErrors() {
        ParserException e = error("let x = (1 + ;");
        assertEquals(1, e.getPosition().line);
        assertTrue(e.getMessage().contains("found ';'"), e.getMessage());
        error("if (x");
        error("const [a, ...b, c] = d");
        assertTrue(error("foo(").getMessage().contains("end of input"));
    }

    @Test
    void testParenthesizedUnaryBeforeExponent() {
        contains("(-2) ** 2", "(BINARY_EXPR ** (UNARY_EXPR - (LITERAL 2)) (LITERAL 2))");
        assertTrue(error("-2 ** 2").getMessage().startsWith("unparenthesized unary expression before '**'"));
    }

    @Test
    void testAccessors() {
        contains("class A { get x() { return 1; } set x(v) {} }", "(CLASS_METHOD get");
        contains("class A { static set x(v) {} }", "(CLASS_METHOD static set");
        contains("({ get total() { return 1; } })", "(PROPERTY get");
        contains("({ get: 1, set() {} })", "(PROPERTY (LITERAL \"get\") (LITERAL 1))");
        contains("class A { get() {} }", "(CLASS_METHOD");
        assertTrue(error("({ get x(a) {} })").getMessage().startsWith("getter must not have parameters"));
        assertTrue(error("class A { set x() {} }").getMessage().startsWith("setter must have exactly one parameter"));
        assertTrue(error("class A { get constructor() {} }").getMessage().startsWith("class constructor cannot be an accessor"));
    }

    @Test
    void testGenerators() {
        contains("function* g() { yield 1; }", "(FN_DECL * (IDENT g)");
        contains("function* g() { yield 1; }", "(YIELD_EXPR (LITERAL 1))");
        contains("function* g() { yield; }", "(YIELD_EXPR ())");
        contains("function* g() { yield* [1, 2]; }", "(YIELD_EXPR *");
        contains("({ *items() { yield 1; } })", "(FN_EXPR *");
        // plain identifier outside generators
        contains("let yield = 1", "(IDENT yield)");
        assertTrue(error("async function* g() {}").getMessage().startsWith("async generators are not supported"));
    }

    @Test
    void testRejectedConstructs() {
        assertTrue(error("function f() { await g(); }").getMessage().startsWith("'await' outside an async function"));
        assertTrue(error("for await (const x of xs) {}").getMessage().startsWith("for await is not supported"));
    }

}
