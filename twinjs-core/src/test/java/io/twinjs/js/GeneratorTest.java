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

class GeneratorTest extends EvalBase {

    @Test
    void testNextUntilDone() {
        String js = "function* g() { yield 1; yield 2; return 3; }\n"
                + "const it = g(); const r = [];\n"
                + "for (let i = 0; i < 4; i++) { const s = it.next(); r.push(s.value + ':' + s.done); }\n"
                + "r";
        assertEquals(List.of("1:false", "2:false", "3:true", "undefined:true"), eval(js));
    }

    @Test
    void testBodyRunsOnDemand() {
        String js = "function* g() { console.log('start'); yield 1; console.log('end'); }\n"
                + "const it = g(); console.log('created'); it.next(); console.log('between'); it.next();";
        assertEquals(List.of("created", "start", "between", "end"), print(js));
    }

    @Test
    void testValuesSentThroughNext() {
        String js = "function* g() { const a = yield 'first'; const b = yield a * 2; return a + b; }\n"
                + "const it = g(); [it.next().value, it.next(5).value, it.next(10).value]";
        assertEquals(List.of("first", 10, 15), eval(js));
    }

    @Test
    void testForOfStopsAtBreak() {
        String js = "let produced = 0;\n"
                + "function* naturals() { let n = 0; while (true) { produced++; yield n++; } }\n"
                + "const r = []; for (const n of naturals()) { if (n > 3) break; r.push(n); }\n"
                + "[r, produced]";
        assertEquals(List.of(List.of(0, 1, 2, 3), 5), eval(js));
    }

    @Test
    void testSpreadAndDelegation() {
        String js = "function* inner() { yield 1; yield 2; }\n"
                + "function* outer() { yield 0; yield* inner(); yield* [3, 4]; yield 5; }\n"
                + "[...outer()]";
        assertEquals(List.of(0, 1, 2, 3, 4, 5), eval(js));
    }

    @Test
    void testLoopBindingsSurviveSuspension() {
        String js = "function* g() { for (let i = 0; i < 3; i++) { yield () => i; } }\n"
                + "[...g()].map(f => f())";
        assertEquals(List.of(0, 1, 2), eval(js));
    }

    @Test
    void testThrowIntoGenerator() {
        String js = "function* g() { try { yield 1; yield 2; } catch (e) { yield 'caught ' + e; } }\n"
                + "const it = g(); it.next(); const t = it.throw('boom'); const after = it.next();\n"
                + "[t.value, t.done, after.done]";
        assertEquals(List.of("caught boom", false, true), eval(js));
        String uncaught = "function* g() { yield 1; }\n"
                + "const it = g(); let msg; try { it.throw(new Error('early')); } catch (e) { msg = e.message; }\n"
                + "[msg, it.next().done]";
        assertEquals(List.of("early", true), eval(uncaught));
    }

    @Test
    void testReturnFinishesGenerator() {
        String js = "function* g() { yield 1; yield 2; }\n"
                + "const it = g(); it.next(); const r = it.return(7);\n"
                + "[r.value, r.done, it.next().done]";
        assertEquals(List.of(7, true, true), eval(js));
    }

    @Test
    void testIndependentInstances() {
        String js = "function* count(from) { let n = from; while (true) yield n++; }\n"
                + "const a = count(1), b = count(10);\n"
                + "[a.next().value, b.next().value, a.next().value, b.next().value]";
        assertEquals(List.of(1, 10, 2, 11), eval(js));
    }

    @Test
    void testGeneratorMethods() {
        String js = "class Range { constructor(n) { this.n = n; } *values() { for (let i = 0; i < this.n; i++) yield i * 10; } }\n"
                + "const o = { *pairs() { yield 'a'; yield 'b'; } };\n"
                + "[...new Range(3).values(), ...o.pairs()]";
        assertEquals(List.of(0, 10, 20, "a", "b"), eval(js));
    }

    @Test
    void testGeneratorObjects() {
        assertEquals(List.of("Object [Generator] {}"), print("function* g() {} console.log(g())"));
        assertEquals("object", eval("function* g() {} typeof g()"));
        assertEquals("[object Generator]", eval("function* g() {} g().toString()"));
        assertEquals(true, eval("function* g() {} let ok = false; try { new g(); } catch (e) { ok = e instanceof TypeError; } ok"));
    }

    @Test
    void testReentrantNextIsRejected() {
        String js = "function* g() { it.next(); }\n"
                + "const it = g(); let msg; try { it.next(); } catch (e) { msg = e.message; } msg";
        assertEquals("Generator is already running", eval(js));
    }

}
