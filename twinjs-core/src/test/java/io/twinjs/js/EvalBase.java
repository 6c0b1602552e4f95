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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every snippet under both execution modes and fails when they disagree on the
 * result, the printed output or the thrown error.
 */
class EvalBase {

    static final Logger logger = LoggerFactory.getLogger(EvalBase.class);

    Engine engine;
    List<String> output;

    EvalResult run(String text, ExecutionMode mode) {
        engine = new Engine(EngineConfig.defaults().withMode(mode));
        output = new ArrayList<>();
        engine.setOnConsoleLog(output::add);
        EvalResult result = engine.run(text);
        logger.debug("{}: {}", mode, result);
        return result;
    }

    EvalResult runBoth(String text) {
        EvalResult interpreted = run(text, ExecutionMode.TREE_WALK);
        List<String> interpretedOutput = output;
        EvalResult compiled = run(text, ExecutionMode.BYTECODE);
        assertEquals(interpretedOutput, output, "printed output differs between modes");
        assertEquals(interpreted.isError(), compiled.isError(), "one mode threw: " + interpreted + " / " + compiled);
        if (interpreted.isError()) {
            assertEquals(interpreted.error().kind(), compiled.error().kind());
            assertEquals(interpreted.error().message(), compiled.error().message());
            assertEquals(interpreted.error().position(), compiled.error().position());
        } else {
            assertEquals(comparable(interpreted.value()), comparable(compiled.value()), "result differs between modes");
        }
        return compiled;
    }

    private static Object comparable(Object value) {
        Object java = Engine.toJava(value);
        return java instanceof JsObject ? Display.inspect(java) : java;
    }

    Object eval(String text) {
        EvalResult result = runBoth(text);
        if (result.isError()) {
            fail("unexpected error: " + result.error().format());
        }
        return Engine.toJava(result.value());
    }

    List<String> print(String text) {
        EvalResult result = runBoth(text);
        if (result.isError()) {
            fail("unexpected error: " + result.error().format());
        }
        return output;
    }

    ErrorReport error(String text) {
        EvalResult result = runBoth(text);
        assertTrue(result.isError(), "expected an error, got: " + result.value());
        return result.error();
    }

}
