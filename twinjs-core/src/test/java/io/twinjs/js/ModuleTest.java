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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModuleTest {

    @TempDir
    Path dir;

    @BeforeEach
    void beforeEach() throws IOException {
        write("math.js", "export function square(x) { return x * x; }\n"
                + "export const PI = 3;\n"
                + "export default function cube(x) { return x * x * x; }\n");
        write("counter.js", "let n = 0;\nexport function next() { return ++n; }\n");
        write("first.js", "import { next } from './counter.js';\nexport const first = next();\n");
        write("a.js", "import { b } from './b.js';\n"
                + "export function a() { return 'a'; }\n"
                + "export const fromB = b();\n");
        write("b.js", "import { a } from './a.js';\n"
                + "export function b() { return 'b sees ' + a(); }\n");
        write("nested/util.js", "import { PI } from '../math.js';\nexport const TAU = PI * 2;\n");
    }

    private void write(String name, String text) throws IOException {
        Path path = dir.resolve(name);
        Files.createDirectories(path.getParent());
        Files.writeString(path, text);
    }

    private Engine engine(ExecutionMode mode) {
        return new Engine(EngineConfig.defaults().withMode(mode).withModuleRoot(dir));
    }

    @ParameterizedTest
    @EnumSource(ExecutionMode.class)
    void testNamedDefaultAndNamespaceImports(ExecutionMode mode) {
        Object result = engine(mode).eval("import cube, { square, PI } from './math.js';\n"
                + "import * as m from './math.js';\n"
                + "[square(3), PI, cube(2), m.PI]");
        assertEquals(List.of(9, 3, 8, 3), result);
    }

    @ParameterizedTest
    @EnumSource(ExecutionMode.class)
    void testModulesAreEvaluatedOnce(ExecutionMode mode) {
        Object result = engine(mode).eval("import { first } from './first.js';\n"
                + "import { next } from './counter.js';\n"
                + "[first, next()]");
        assertEquals(List.of(1, 2), result);
    }

    @Test
    void testRelativeImportFromSubdirectory() {
        assertEquals(6, engine(ExecutionMode.BYTECODE).eval("import { TAU } from 'nested/util.js'; TAU"));
    }

    @ParameterizedTest
    @EnumSource(ExecutionMode.class)
    void testCircularImportSeesHoistedFunctions(ExecutionMode mode) {
        Engine engine = engine(mode);
        assertEquals("b sees a", engine.eval("import { fromB } from './a.js'; fromB"));
        List<Diagnostic> diagnostics = engine.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.CIRCULAR_IMPORT, diagnostics.get(0).kind());
    }

    @Test
    void testMissingModule() {
        EvalResult result = engine(ExecutionMode.BYTECODE).run("import { x } from './nope.js';");
        assertTrue(result.isError());
        assertEquals(ErrorKind.ERROR, result.error().kind());
        assertTrue(result.error().message().startsWith("Cannot find module './nope.js'"));
    }

    @Test
    void testMissingExport() {
        EvalResult result = engine(ExecutionMode.BYTECODE).run("import { nope } from './math.js';");
        assertEquals(ErrorKind.SYNTAX_ERROR, result.error().kind());
        assertEquals("The requested module './math.js' does not provide an export named 'nope'", result.error().message());
    }

    @Test
    void testModuleWithParseError() throws IOException {
        write("broken.js", "export const = 1;\n");
        EvalResult result = engine(ExecutionMode.BYTECODE).run("import './broken.js';");
        assertEquals(ErrorKind.SYNTAX_ERROR, result.error().kind());
    }

}
