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

class JsGeneratorPrototype extends Prototype {

    JsGeneratorPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "next" -> (JsCallable) (realm, thisObject, args) -> generator(realm, thisObject, "next").next(Args.get(args, 0));
            case "return" -> (JsCallable) (realm, thisObject, args) -> generator(realm, thisObject, "return").doReturn(Args.get(args, 0));
            case "throw" -> (JsCallable) (realm, thisObject, args) -> generator(realm, thisObject, "throw").doThrow(Args.get(args, 0));
            case "toString" -> (JsCallable) (realm, thisObject, args) -> "[object Generator]";
            default -> null;
        };
    }

    private static JsGenerator generator(Realm realm, Object thisObject, String method) {
        if (thisObject instanceof JsGenerator g) {
            return g;
        }
        throw realm.typeError("Method [Generator].prototype." + method + " called on incompatible receiver " + Display.inspect(thisObject));
    }

}
