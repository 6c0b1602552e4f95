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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionsTest extends EvalBase {

    @Test
    void testMapBasics() {
        String js = "const m = new Map();\n"
                + "m.set('a', 1).set('b', 2).set('a', 3);\n"
                + "[m.size, m.get('a'), m.has('b'), m.has('z'), m.delete('b'), m.delete('b'), m.size]";
        assertEquals(List.of(2, 3, true, false, true, false, 1), eval(js));
        assertNull(eval("new Map().get('missing')"));
        assertEquals(0, eval("const m = new Map([[1, 'x'], [2, 'y']]); m.clear(); m.size"));
    }

    @Test
    void testMapKeysBySameValueZero() {
        String js = "const k = {}; const m = new Map([[NaN, 'nan'], [0, 'zero'], [k, 'obj'], ['1', 'str']]);\n"
                + "[m.get(NaN), m.get(-0), m.get(k), m.get({}), m.get(1), m.get('1')]";
        List<?> result = (List<?>) eval(js);
        assertEquals("nan", result.get(0));
        assertEquals("zero", result.get(1));
        assertEquals("obj", result.get(2));
        assertNull(result.get(3));
        assertNull(result.get(4));
        assertEquals("str", result.get(5));
    }

    @Test
    void testMapIterationKeepsInsertionOrder() {
        String js = "const m = new Map([['z', 1], ['a', 2]]); m.set('m', 3); m.set('z', 4);\n"
                + "const r = []; for (const [k, v] of m) { r.push(k + v); }\n"
                + "[r, [...m.keys()], [...m.values()], [...m.entries()].length]";
        assertEquals(List.of(List.of("z4", "a2", "m3"), List.of("z", "a", "m"), List.of(4, 2, 3), 3), eval(js));
    }

    @Test
    void testMapForEach() {
        String js = "const m = new Map([['a', 1], ['b', 2]]);\n"
                + "m.forEach((v, k, map) => console.log(k, v, map === m));";
        assertEquals(List.of("a 1 true", "b 2 true"), print(js));
    }

    @Test
    void testSetBasics() {
        String js = "const s = new Set([1, 2, 2, 3]);\n"
                + "s.add(4).add(1);\n"
                + "[s.size, s.has(2), s.has(9), s.delete(2), s.delete(2), [...s]]";
        assertEquals(List.of(4, true, false, true, false, List.of(1, 3, 4)), eval(js));
        assertEquals(List.of("a", "b"), eval("[...new Set('abba')]"));
        assertEquals(1, eval("new Set([NaN, NaN]).size"));
    }

    @Test
    void testSetIteration() {
        String js = "const s = new Set(['x', 'y']);\n"
                + "s.forEach((v, k) => console.log(v, k));\n"
                + "for (const v of s) console.log(v);\n"
                + "console.log([...s.entries()].length);";
        assertEquals(List.of("x x", "y y", "x", "y", "2"), print(js));
    }

    @Test
    void testDisplay() {
        assertEquals(List.of("Map(2) { 'a' => 1, 2 => [ 1 ] }", "Map(0) {}", "Set(2) { 1, 'two' }", "Set(0) {}"),
                print("console.log(new Map([['a', 1], [2, [1]]])); console.log(new Map());"
                        + " console.log(new Set([1, 'two'])); console.log(new Set());"));
        assertEquals(List.of("object", "function"), eval("[typeof new Map(), typeof Set]"));
        assertEquals("[object Map]", eval("new Map().toString()"));
    }

    @Test
    void testToJava() {
        assertEquals(Map.of("a", 1), eval("new Map([['a', 1]])"));
        assertEquals(List.of(1, 2), eval("new Set([1, 2])"));
    }

    @Test
    void testErrors() {
        assertEquals("Constructor Map requires 'new'", eval("let msg; try { Map(); } catch (e) { msg = e.message; } msg"));
        assertEquals("Constructor Set requires 'new'", eval("let msg; try { Set(); } catch (e) { msg = e.message; } msg"));
        assertEquals(true, eval("let ok = false; try { new Map([1]); } catch (e) { ok = e instanceof TypeError; } ok"));
        assertEquals(true, eval("let ok = false; try { Map.prototype.get.call({}, 1); } catch (e) { ok = e instanceof TypeError; } ok"));
    }

    @Test
    void testSubclass() {
        String js = "class Counter extends Map { inc(k) { return this.set(k, (this.get(k) || 0) + 1); } }\n"
                + "const c = new Counter(); c.inc('a').inc('a').inc('b');\n"
                + "[c.get('a'), c.size, c instanceof Map]";
        assertEquals(List.of(2, 2, true), eval(js));
    }

}
