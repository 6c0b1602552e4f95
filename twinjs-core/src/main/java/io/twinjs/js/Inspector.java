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

import io.twinjs.common.Resource;
import io.twinjs.parser.JsLexer;
import io.twinjs.parser.JsParser;
import io.twinjs.parser.Node;
import io.twinjs.parser.Token;
import io.twinjs.parser.TokenType;
import io.twinjs.vm.Compiler;
import io.twinjs.vm.UnsupportedSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Views of the pipeline stages for a piece of source, for tooling and debugging. Each call
 * works on fresh state.
 */
public class Inspector {

    private Inspector() {
        // static only
    }

    /**
     * One line per token, e.g. {@code 1:5 IDENT x}. The trailing EOF is left out.
     */
    public static List<String> tokens(String source) {
        List<String> lines = new ArrayList<>();
        for (Token token : JsLexer.getTokens(Resource.text(source))) {
            if (token.type != TokenType.EOF) {
                lines.add(token.getPositionDisplay() + " " + token.type + " " + token.text);
            }
        }
        return lines;
    }

    public static String ast(String source) {
        return JsParser.parse(source).toSexpr();
    }

    /**
     * Disassembly of the compiled top level, or the reason it would be bridged.
     */
    public static String chunk(String source) {
        Node program = JsParser.parse(source);
        try {
            return Compiler.compileProgram(program).disassemble();
        } catch (UnsupportedSyntaxException e) {
            return "bridged: " + e.getMessage();
        }
    }

    public static EvalResult evaluate(String source, ExecutionMode mode) {
        Engine engine = new Engine(EngineConfig.defaults().withMode(mode));
        return engine.run(source);
    }

}
