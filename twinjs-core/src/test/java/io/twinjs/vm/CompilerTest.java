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
package io.twinjs.vm;

import io.twinjs.parser.JsParser;
import io.twinjs.parser.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {

    private static Node function(String text) {
        return JsParser.parse(text).get(0);
    }

    private static Chunk compileFunction(String text) {
        return Compiler.compileFunction(function(text));
    }

    private static List<Opcode> opcodes(Chunk chunk) {
        List<Opcode> list = new ArrayList<>();
        int offset = 0;
        while (offset < chunk.size()) {
            Opcode op = chunk.getOpcode(offset);
            list.add(op);
            offset += 1 + op.operands;
        }
        return list;
    }

    private static String bridgeReason(String text) {
        UnsupportedSyntaxException e = assertThrows(UnsupportedSyntaxException.class, () -> compileFunction(text));
        assertNotNull(e.getNode());
        return e.getMessage();
    }

    @Test
    void testParametersLiveInSlots() {
        Chunk chunk = compileFunction("function add(a, b) { return a + b; }");
        assertEquals("add", chunk.getName());
        assertEquals(2, chunk.getSlotCount());
        List<Opcode> ops = opcodes(chunk);
        assertEquals(List.of(Opcode.ARG, Opcode.INIT_SLOT, Opcode.ARG, Opcode.INIT_SLOT), ops.subList(0, 4));
        assertTrue(ops.contains(Opcode.ADD));
        assertFalse(ops.contains(Opcode.LOAD_NAME));
    }

    @Test
    void testDisassembly() {
        String listing = compileFunction("function add(a, b) {\n  return a + b;\n}").disassemble();
        assertTrue(listing.startsWith("== add ==\nslots: 0=a 1=b\n"), listing);
        assertTrue(listing.contains("LOAD_SLOT 0    ; a"), listing);
        assertTrue(listing.contains("   2 "), listing);
    }

    @Test
    void testCapturedNames() {
        Node fn = function("function f() { let a = 1; let b = 2; function g() { return a; } return g; }");
        assertEquals(Set.of("a"), Compiler.capturedNames(fn));
        String listing = Compiler.compileFunction(fn).disassemble();
        assertTrue(listing.contains("slots: 0=b"), listing);
        assertTrue(listing.contains("; a"), listing);
    }

    @Test
    void testOnlyNestedReferencesAreCaptured() {
        Set<String> names = Compiler.capturedNames(function("function f(p) { let x; let y = p; function inner() { return x; } return inner; }"));
        assertTrue(names.contains("x"));
        assertFalse(names.contains("p"));
        assertFalse(names.contains("y"));
        assertFalse(names.contains("inner"));
    }

    @Test
    void testProgramKeepsBindingsInEnvironment() {
        Chunk chunk = Compiler.compileProgram(JsParser.parse("let x = 1; const y = x + 1; y"));
        assertEquals("<main>", chunk.getName());
        assertEquals(0, chunk.getSlotCount());
        assertTrue(opcodes(chunk).contains(Opcode.LOAD_NAME));
        assertEquals(Opcode.RETURN, opcodes(chunk).get(opcodes(chunk).size() - 1));
    }

    @Test
    void testCallsCarryLineNumbers() {
        Chunk chunk = Compiler.compileProgram(JsParser.parse("1;\n\nfoo();"));
        int offset = 0;
        while (chunk.getOpcode(offset) != Opcode.CALL) {
            offset += 1 + chunk.getOpcode(offset).operands;
        }
        assertEquals(3, chunk.getLine(offset));
        assertEquals("foo", chunk.getConstant(chunk.code[offset + 2]));
    }

    @Test
    void testBridgeReasons() {
        assertTrue(bridgeReason("function f({a}) { return a; }").startsWith("destructuring parameter"));
        assertTrue(bridgeReason("function f() { return arguments[0]; }").startsWith("uses 'arguments'"));
        assertTrue(bridgeReason("function f() { try { return 1; } finally { g(); } }").startsWith("return inside try with finally"));
        assertTrue(bridgeReason("function f() { const [a] = g(); }").startsWith("destructuring declaration"));
        assertTrue(bridgeReason("function f(k) { return class { [k]() {} }; }").startsWith("computed class member"));
    }

    @Test
    void testModuleSyntaxIsBridged() {
        assertThrows(UnsupportedSyntaxException.class, () -> Compiler.compileProgram(JsParser.parse("export const a = 1;")));
    }

    @Test
    void testArrowBodiesCompile() {
        Node program = JsParser.parse("const f = x => x * 2;");
        Node arrow = program.get(0).get(0).get(1);
        Chunk chunk = Compiler.compileFunction(arrow);
        assertEquals("f", chunk.getName());
        assertEquals(Opcode.RETURN, opcodes(chunk).get(opcodes(chunk).size() - 1));
    }

}
