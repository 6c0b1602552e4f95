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

/**
 * The {@code console} object. Every level writes to the same host sink so the output of
 * a program is one ordered stream.
 */
class JsConsole extends Prototype {

    JsConsole(Realm realm) {
        super(realm, realm.objectPrototype);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "log", "info", "warn", "error", "debug", "trace" -> (JsCallable) (realm, thisObject, args) -> {
                realm.print(format(realm, args));
                return Terms.UNDEFINED;
            };
            default -> null;
        };
    }

    /**
     * Space-separated line: top-level strings raw, everything else inspected.
     */
    static String format(Realm realm, Object[] args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            Object arg = args[i];
            sb.append(arg instanceof String s ? s : Display.inspect(arg));
        }
        return sb.toString();
    }

}
