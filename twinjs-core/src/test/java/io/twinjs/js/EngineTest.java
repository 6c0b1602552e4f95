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

import io.twinjs.parser.ParserException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineTest {

    private static final String MIXED = "function plain(x) { return x + 1; }\n"
            + "function pattern({a}) { return a; }\n"
            + "plain(1) + pattern({a: 2})";

    @Test
    void testBytecodeModeCompilesAndBridgesPerFunction() {
        Engine engine = new Engine(EngineConfig.defaults().withMode(ExecutionMode.BYTECODE));
        assertEquals(4, engine.eval(MIXED));
        EngineStats stats = engine.getStats();
        assertEquals(2, stats.getCompiledFunctions());
        assertEquals(1, stats.getBridgedFunctions());
        assertEquals(1, stats.getVmCalls());
        assertEquals(1, stats.getBridgedCalls());
    }

    @Test
    void testTreeWalkModeCompilesNothing() {
        Engine engine = new Engine(EngineConfig.defaults().withMode(ExecutionMode.TREE_WALK));
        assertEquals(4, engine.eval(MIXED));
        EngineStats stats = engine.getStats();
        assertEquals(0, stats.getCompiledFunctions());
        assertEquals(0, stats.getVmCalls());
        assertEquals(2, stats.getInterpretedCalls());
    }

    @Test
    void testGlobalsPersistAcrossEvals() {
        Engine engine = new Engine();
        engine.put("base", 10);
        engine.eval("var total = base * 2; function twice(x) { return x * 2; }");
        assertEquals(40, engine.eval("twice(total)"));
        assertEquals(20, engine.get("total"));
        assertNull(engine.get("missing"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToJava() {
        Engine engine = new Engine();
        Object result = engine.eval("({name: 'x', list: [1, undefined, {deep: true}], nothing: null})");
        Map<String, Object> map = (Map<String, Object>) result;
        assertEquals("x", map.get("name"));
        assertEquals(java.util.Arrays.asList(1, null, Map.of("deep", true)), map.get("list"));
        assertTrue(map.containsKey("nothing"));
        assertNull(map.get("nothing"));
        assertTrue(engine.eval("() => 1") instanceof JsFunction);
    }

    @Test
    void testEvalThrowsUncaughtErrors() {
        Engine engine = new Engine();
        JsException e = assertThrows(JsException.class, () -> engine.eval("null.x"));
        assertEquals(ErrorKind.TYPE_ERROR, e.getKind());
        assertThrows(ParserException.class, () -> engine.eval("let = ;"));
    }

    @Test
    void testRunReportsParseErrors() {
        EvalResult result = new Engine().run("let x = (1 + ;");
        assertTrue(result.isError());
        assertEquals(ErrorKind.PARSE_ERROR, result.error().kind());
        assertEquals("SyntaxError", result.error().name());
        assertEquals(1, result.error().position().line);
    }

    @Test
    void testRunReportsLexErrors() {
        EvalResult result = new Engine().run("const s = 'open");
        assertEquals(ErrorKind.LEX_ERROR, result.error().kind());
        assertTrue(result.error().message().startsWith("unterminated string literal"));
        assertEquals(11, result.error().position().column);
    }

    @Test
    void testRunCapturesOutput() {
        Engine engine = new Engine();
        List<String> seen = new ArrayList<>();
        engine.setOnConsoleLog(seen::add);
        EvalResult result = engine.run("console.log('a', 1, [1, 'b'], {k: 'v'}); 'done'");
        assertEquals(List.of("a 1 [ 1, 'b' ] { k: 'v' }"), result.output());
        assertEquals(result.output(), seen);
        assertEquals("'done'", result.display());
    }

    @Test
    void testErrorReportFormat() {
        EvalResult result = new Engine().run("function inner() { throw new Error('deep'); }\n"
                + "function outer() { inner(); }\n"
                + "outer();");
        ErrorReport report = result.error();
        assertEquals(ErrorKind.USER_THROW, report.kind());
        assertEquals("Error", report.name());
        assertEquals(1, report.position().line);
        assertEquals(List.of("inner", "outer"), report.stack().subList(0, 2).stream().map(StackEntry::functionName).toList());
        assertTrue(report.format().startsWith("Error: deep\n    at inner"));
    }

    @Test
    void testTaskLimitStopsRunawayLoop() {
        Engine engine = new Engine(EngineConfig.defaults().withMaxTasks(50));
        engine.eval("function spin() { Promise.resolve().then(spin); } spin();");
        assertEquals(Diagnostic.Kind.TASK_LIMIT, engine.getDiagnostics().get(0).kind());
    }

    @Test
    void testEventLoopCanBeDeferred() {
        Engine engine = new Engine(EngineConfig.defaults().withRunEventLoop(false));
        List<String> seen = new ArrayList<>();
        engine.setOnConsoleLog(seen::add);
        engine.eval("setTimeout(() => console.log('later'), 0)");
        assertTrue(seen.isEmpty());
        engine.getRealm().getEventLoop().run();
        assertEquals(List.of("later"), seen);
    }

    @Test
    void testHostFaultBecomesCatchableError() {
        for (ExecutionMode mode : ExecutionMode.values()) {
            Engine engine = new Engine(EngineConfig.defaults().withMode(mode));
            engine.put("device", new JsObject(null) {
                @Override
                public Object get(String key) {
                    throw new IllegalStateException("device offline");
                }
            });
            EvalResult result = engine.run("device.status");
            assertTrue(result.isError(), mode + ": " + result);
            assertEquals(ErrorKind.ERROR, result.error().kind());
            assertEquals("device offline", result.error().message());
            EvalResult caught = engine.run("let msg; try { device.status; } catch (e) { msg = e.message; } msg");
            assertEquals("device offline", caught.value(), mode.toString());
        }
    }

}
