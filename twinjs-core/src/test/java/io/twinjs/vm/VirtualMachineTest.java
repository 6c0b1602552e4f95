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

import io.twinjs.js.Engine;
import io.twinjs.js.EngineConfig;
import io.twinjs.js.ErrorKind;
import io.twinjs.js.EvalResult;
import io.twinjs.js.ExecutionMode;
import io.twinjs.js.JsException;
import io.twinjs.js.Realm;
import io.twinjs.parser.JsParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VirtualMachineTest {

    private static Engine engine() {
        return new Engine(EngineConfig.defaults().withMode(ExecutionMode.BYTECODE));
    }

    @Test
    void testRunProgram() {
        Realm realm = engine().getRealm();
        Chunk chunk = Compiler.compileProgram(JsParser.parse("let total = 0; for (let i = 1; i <= 100; i++) { total += i; } total"));
        assertEquals(5050, realm.getVirtualMachine().runProgram(chunk, realm.getGlobals()));
        assertEquals(0, realm.getVirtualMachine().getFrameCount());
    }

    @Test
    void testDeepRecursionStaysOnTheLoop() {
        Engine engine = new Engine(EngineConfig.defaults().withMode(ExecutionMode.BYTECODE).withMaxCallDepth(20_000));
        assertEquals(10_000, engine.eval("function depth(n) { return n === 0 ? 0 : 1 + depth(n - 1); } depth(10000)"));
        assertEquals(10_001, engine.getStats().getVmCalls());
    }

    @Test
    void testCallDepthLimit() {
        Engine engine = engine();
        EvalResult result = engine.run("function r() { return r(); } r()");
        assertEquals(ErrorKind.RANGE_ERROR, result.error().kind());
        assertEquals(0, engine.getRealm().getVirtualMachine().getFrameCount());
        assertEquals(0, engine.getRealm().getCallDepth());
        // still usable afterwards
        assertEquals("function", engine.eval("typeof r"));
    }

    @Test
    void testThrowAcrossNativeCallback() {
        Engine engine = engine();
        Object result = engine.eval("function f() { try { [1, 2].map(x => { if (x > 1) throw 'bad ' + x; return x; }); } "
                + "catch (e) { return 'caught ' + e; } } f()");
        assertEquals("caught bad 2", result);
        assertEquals(0, engine.getRealm().getVirtualMachine().getFrameCount());
    }

    @Test
    void testUncaughtErrorUnwindsAllFrames() {
        Engine engine = engine();
        JsException e = assertThrows(JsException.class, () -> engine.eval("function a() { b(); } function b() { null.x; } a()"));
        assertEquals(ErrorKind.TYPE_ERROR, e.getKind());
        assertEquals(List.of("b", "a"), e.getJsStack().subList(0, 2).stream().map(s -> s.functionName()).toList());
        assertEquals(0, engine.getRealm().getVirtualMachine().getFrameCount());
    }

    @Test
    void testNestedFinallyOrder() {
        Engine engine = engine();
        Object result = engine.eval("function f() { const log = []; "
                + "for (const i of [1, 2]) { try { try { if (i === 2) throw i; log.push('body' + i); } finally { log.push('inner' + i); } } "
                + "catch (e) { log.push('caught' + e); } finally { log.push('outer' + i); } } return log; } f()");
        assertEquals(List.of("body1", "inner1", "outer1", "inner2", "caught2", "outer2"), result);
    }

    @Test
    void testCompiledCallsBridgedFunction() {
        Engine engine = engine();
        Object result = engine.eval("function pick({a, b}) { return a + b; } function run() { let s = 0; for (let i = 0; i < 3; i++) s += pick({a: i, b: 1}); return s; } run()");
        assertEquals(6, result);
        assertEquals(3, engine.getStats().getBridgedCalls());
    }

    @Test
    void testAsyncFrameSuspendsAndResumes() {
        Engine engine = engine();
        Object result = engine.eval("let out = []; async function f() { out.push(1); const v = await 2; out.push(v); return v * 2; } "
                + "f().then(r => out.push(r)); out.push('sync'); out");
        assertEquals(List.of(1, "sync", 2, 4), result);
        assertEquals(0, engine.getRealm().getVirtualMachine().getFrameCount());
    }

}
