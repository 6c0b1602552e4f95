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

class JsJsonTest extends EvalBase {

    @Test
    void testParseKeepsKeyOrder() {
        assertEquals(List.of("z", "a", "m"), eval("Object.keys(JSON.parse('{\"z\": 1, \"a\": 2, \"m\": 3}'))"));
    }

    @Test
    void testParseNumbers() {
        assertEquals(List.of(1, 2.5, 10000000000.0), eval("JSON.parse('[1, 2.5, 10000000000]')"));
    }

    @Test
    void testParseInvalid() {
        ErrorReport report = error("JSON.parse('{bad')");
        assertEquals(ErrorKind.SYNTAX_ERROR, report.kind());
        assertTrue(report.message().startsWith("Unexpected token in JSON"));
    }

    @Test
    void testStringifySkipsUndefinedAndFunctions() {
        assertEquals("{\"a\":1,\"c\":[null,null]}", eval("JSON.stringify({a: 1, b: undefined, f() {}, c: [undefined, () => 1]})"));
        assertNull(eval("JSON.stringify(undefined)"));
    }

    @Test
    void testStringifyIndent() {
        assertEquals("{\n  \"a\": [\n    1\n  ]\n}", eval("JSON.stringify({a: [1]}, null, 2)"));
    }

    @Test
    void testStringifyEscapes() {
        assertEquals("\"say \\\"hi\\\"\\n\"", eval("JSON.stringify('say \"hi\"\\n')"));
    }

    @Test
    void testStringifyReplacerList() {
        assertEquals("{\"b\":2}", eval("JSON.stringify({a: 1, b: 2}, ['b'])"));
    }

    @Test
    void testStringifyUsesToJson() {
        assertEquals("{\"when\":\"today\"}", eval("JSON.stringify({when: {toJSON() { return 'today'; }}})"));
    }

    @Test
    void testStringifyCircular() {
        ErrorReport report = error("const o = {}; o.self = o; JSON.stringify(o)");
        assertEquals(ErrorKind.TYPE_ERROR, report.kind());
        assertEquals("Converting circular structure to JSON", report.message());
    }

    @Test
    void testRoundTripThroughEngine() {
        Object result = eval("JSON.parse(JSON.stringify({n: [1, {x: 'y'}], t: true}))");
        assertEquals(Map.of("n", List.of(1, Map.of("x", "y")), "t", true), result);
    }

}
