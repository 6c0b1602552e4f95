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
 * Prototype of {@code Error} and its subtypes, carrying the {@code name} and a default empty message.
 */
class JsErrorPrototype extends Prototype {

    JsErrorPrototype(Realm realm, JsObject proto, String name) {
        super(realm, proto);
        putHidden("name", name);
        putHidden("message", "");
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        if ("toString".equals(name)) {
            return (JsCallable) (realm, thisObject, args) -> {
                JsObject object = thisObject(realm, thisObject, "Error.prototype.toString");
                String errorName = Terms.toStr(realm, object.get("name"));
                String message = Terms.toStr(realm, object.get("message"));
                if (message.isEmpty()) {
                    return errorName;
                }
                return errorName.isEmpty() ? message : errorName + ": " + message;
            };
        }
        return null;
    }

}
