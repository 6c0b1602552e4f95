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
 * The {@code String} function. Calling it converts, {@code new String()} is not supported.
 */
class JsStringConstructor extends JsNativeFunction {

    JsStringConstructor(Realm realm) {
        super(realm.functionPrototype, "String", null);
        putHidden("prototype", realm.stringPrototype);
        realm.stringPrototype.putHidden("constructor", this);
        putHidden("fromCharCode", realm.function("fromCharCode", (r, thisObject, args) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.length; i++) {
                sb.append((char) Terms.toUint32(Args.num(r, args, i)));
            }
            return sb.toString();
        }));
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        if (args.length == 0) {
            return "";
        }
        return Terms.toStr(realm, args[0]);
    }

}
