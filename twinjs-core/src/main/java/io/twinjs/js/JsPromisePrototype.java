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

class JsPromisePrototype extends Prototype {

    JsPromisePrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "then" -> (JsCallable) (realm, thisObject, args) ->
                    promise(realm, thisObject, "then").then(Args.get(args, 0), Args.get(args, 1));
            case "catch" -> (JsCallable) (realm, thisObject, args) ->
                    promise(realm, thisObject, "catch").then(Terms.UNDEFINED, Args.get(args, 0));
            case "finally" -> (JsCallable) this::doFinally;
            case "toString" -> (JsCallable) (realm, thisObject, args) -> "[object Promise]";
            default -> null;
        };
    }

    private static JsPromise promise(Realm realm, Object thisObject, String method) {
        if (thisObject instanceof JsPromise p) {
            return p;
        }
        throw realm.typeError("Method Promise.prototype." + method + " called on incompatible receiver " + Display.inspect(thisObject));
    }

    // the callback sees no argument and cannot change the outcome unless it throws
    private Object doFinally(Realm realm, Object thisObject, Object[] args) {
        JsPromise promise = promise(realm, thisObject, "finally");
        Object callback = Args.get(args, 0);
        if (!(callback instanceof JsFunction fn)) {
            return promise.then(callback, callback);
        }
        JsNativeFunction onFulfilled = realm.function("", (r, t, a) -> {
            Object value = Args.get(a, 0);
            JsPromise done = JsPromise.resolved(r, fn.call(r, Terms.UNDEFINED, new Object[0]));
            return done.then(r.function("", (r2, t2, a2) -> value), Terms.UNDEFINED);
        });
        JsNativeFunction onRejected = realm.function("", (r, t, a) -> {
            Object reason = Args.get(a, 0);
            JsPromise done = JsPromise.resolved(r, fn.call(r, Terms.UNDEFINED, new Object[0]));
            return done.then(r.function("", (r2, t2, a2) -> {
                throw r2.userThrow(reason);
            }), Terms.UNDEFINED);
        });
        return promise.then(onFulfilled, onRejected);
    }

}
