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

class AsyncTest extends EvalBase {

    @Test
    void testMicrotasksRunBeforeTimers() {
        String js = "setTimeout(() => console.log('timeout'), 0);\n"
                + "Promise.resolve().then(() => console.log('then'));\n"
                + "console.log('sync');";
        assertEquals(List.of("sync", "then", "timeout"), print(js));
    }

    @Test
    void testTimersFireInDelayOrder() {
        String js = "setTimeout(() => console.log('late'), 20);\n"
                + "setTimeout(() => console.log('early'), 5);\n"
                + "const id = setTimeout(() => console.log('never'), 1); clearTimeout(id);";
        assertEquals(List.of("early", "late"), print(js));
    }

    @Test
    void testAwaitResumesAfterSyncCode() {
        String js = "async function add(a, b) { return a + b; }\n"
                + "async function main() { const s = await add(1, 2); console.log('sum ' + s); }\n"
                + "main(); console.log('first');";
        assertEquals(List.of("first", "sum 3"), print(js));
    }

    @Test
    void testAwaitRejectionInTryCatchFinally() {
        String js = "async function f() {\n"
                + "  try { await Promise.reject(new Error('no')); console.log('skipped'); }\n"
                + "  catch (e) { console.log('caught ' + e.message); }\n"
                + "  finally { console.log('finally'); }\n"
                + "  return 'end';\n"
                + "}\n"
                + "f().then(v => console.log(v));";
        assertEquals(List.of("caught no", "finally", "end"), print(js));
    }

    @Test
    void testAsyncFunctionsInterleave() {
        String js = "async function a() { console.log('a1'); await null; console.log('a2'); }\n"
                + "async function b() { console.log('b1'); await null; console.log('b2'); }\n"
                + "a(); b(); console.log('sync');";
        assertEquals(List.of("a1", "b1", "sync", "a2", "b2"), print(js));
    }

    @Test
    void testAwaitInsideLoop() {
        String js = "async function total(items) { let t = 0; for (const p of items) { t += await p; } return t; }\n"
                + "total([Promise.resolve(1), 2, Promise.resolve(3)]).then(t => console.log(t));";
        assertEquals(List.of("6"), print(js));
    }

    @Test
    void testAsyncArrowAndThrow() {
        String js = "const fail = async () => { await 1; throw new TypeError('bad'); };\n"
                + "fail().catch(e => console.log(e.name + ': ' + e.message));";
        assertEquals(List.of("TypeError: bad"), print(js));
    }

    @Test
    void testPromiseCombinators() {
        String js = "async function main() {\n"
                + "  console.log(await Promise.all([1, Promise.resolve(2)]));\n"
                + "  console.log(await Promise.race([new Promise(r => setTimeout(() => r('slow'), 10)), Promise.resolve('fast')]));\n"
                + "  console.log((await Promise.allSettled([Promise.reject('x')]))[0].status);\n"
                + "}\n"
                + "main();";
        assertEquals(List.of("[ 1, 2 ]", "fast", "rejected"), print(js));
    }

    @Test
    void testUnhandledRejectionIsReported() {
        print("Promise.reject(new Error('lost'));");
        List<Diagnostic> diagnostics = engine.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.UNHANDLED_REJECTION, diagnostics.get(0).kind());
        assertEquals("lost", diagnostics.get(0).report().message());
    }

    @Test
    void testHandledRejectionIsNotReported() {
        assertEquals(List.of("handled"), print("Promise.reject(1).catch(() => console.log('handled'));"));
        assertTrue(engine.getDiagnostics().isEmpty());
    }

    @Test
    void testThrowInTimerCallbackIsReported() {
        assertEquals(List.of("after"), print("setTimeout(() => { throw new Error('in timer'); }, 0); setTimeout(() => console.log('after'), 1);"));
        assertEquals(Diagnostic.Kind.UNCAUGHT_ERROR, engine.getDiagnostics().get(0).kind());
    }

}
