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

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code Promise} function and its combinators.
 */
class JsPromiseConstructor extends JsNativeFunction {

    JsPromiseConstructor(Realm realm) {
        super(realm.functionPrototype, "Promise", null);
        constructor(p -> new JsPromise(realm, p), JsPromiseConstructor::initialize, realm.promisePrototype);
        putHidden("resolve", realm.function("resolve", (r, thisObject, args) -> JsPromise.resolved(r, Args.get(args, 0))));
        putHidden("reject", realm.function("reject", (r, thisObject, args) -> JsPromise.rejected(r, Args.get(args, 0))));
        putHidden("all", realm.function("all", JsPromiseConstructor::all));
        putHidden("allSettled", realm.function("allSettled", JsPromiseConstructor::allSettled));
        putHidden("race", realm.function("race", JsPromiseConstructor::race));
        putHidden("any", realm.function("any", JsPromiseConstructor::any));
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        throw realm.typeError("Promise constructor cannot be invoked without 'new'");
    }

    private static Object initialize(Realm realm, Object thisObject, Object[] args) {
        JsPromise promise = (JsPromise) thisObject;
        Object executor = Args.get(args, 0);
        if (!(executor instanceof JsFunction fn)) {
            throw realm.typeError("Promise resolver " + Display.inspect(executor) + " is not a function");
        }
        JsNativeFunction resolve = realm.function("resolve", (r, t, a) -> {
            promise.resolve(Args.get(a, 0));
            return Terms.UNDEFINED;
        });
        JsNativeFunction reject = realm.function("reject", (r, t, a) -> {
            promise.reject(Args.get(a, 0));
            return Terms.UNDEFINED;
        });
        try {
            fn.call(realm, Terms.UNDEFINED, new Object[]{resolve, reject});
        } catch (JsException e) {
            promise.reject(e.getValue());
        }
        return Terms.UNDEFINED;
    }

    private static List<JsPromise> inputs(Realm realm, Object[] args) {
        List<Object> items = PropertyAccess.iterate(realm, Args.get(args, 0));
        List<JsPromise> promises = new ArrayList<>(items.size());
        for (Object item : items) {
            promises.add(JsPromise.resolved(realm, item));
        }
        return promises;
    }

    private static Object all(Realm realm, Object thisObject, Object[] args) {
        List<JsPromise> promises = inputs(realm, args);
        JsPromise result = new JsPromise(realm);
        JsArray values = new JsArray(realm.arrayPrototype);
        int[] remaining = {promises.size()};
        if (promises.isEmpty()) {
            result.resolve(values);
        }
        for (int i = 0; i < promises.size(); i++) {
            int index = i;
            values.add(Terms.UNDEFINED);
            promises.get(i).whenSettled(value -> {
                values.set(index, value);
                if (--remaining[0] == 0) {
                    result.resolve(values);
                }
            }, result::reject);
        }
        return result;
    }

    private static Object allSettled(Realm realm, Object thisObject, Object[] args) {
        List<JsPromise> promises = inputs(realm, args);
        JsPromise result = new JsPromise(realm);
        JsArray values = new JsArray(realm.arrayPrototype);
        int[] remaining = {promises.size()};
        if (promises.isEmpty()) {
            result.resolve(values);
        }
        for (int i = 0; i < promises.size(); i++) {
            int index = i;
            values.add(Terms.UNDEFINED);
            promises.get(i).whenSettled(value -> {
                values.set(index, outcome(realm, "fulfilled", "value", value));
                if (--remaining[0] == 0) {
                    result.resolve(values);
                }
            }, reason -> {
                values.set(index, outcome(realm, "rejected", "reason", reason));
                if (--remaining[0] == 0) {
                    result.resolve(values);
                }
            });
        }
        return result;
    }

    private static JsObject outcome(Realm realm, String status, String key, Object value) {
        JsObject object = new JsObject(realm.objectPrototype);
        object.put("status", status);
        object.put(key, value);
        return object;
    }

    private static Object race(Realm realm, Object thisObject, Object[] args) {
        JsPromise result = new JsPromise(realm);
        for (JsPromise promise : inputs(realm, args)) {
            promise.whenSettled(result::resolve, result::reject);
        }
        return result;
    }

    private static Object any(Realm realm, Object thisObject, Object[] args) {
        List<JsPromise> promises = inputs(realm, args);
        JsPromise result = new JsPromise(realm);
        JsArray errors = new JsArray(realm.arrayPrototype);
        int[] remaining = {promises.size()};
        if (promises.isEmpty()) {
            result.reject(aggregate(realm, errors));
        }
        for (int i = 0; i < promises.size(); i++) {
            int index = i;
            errors.add(Terms.UNDEFINED);
            promises.get(i).whenSettled(result::resolve, reason -> {
                errors.set(index, reason);
                if (--remaining[0] == 0) {
                    result.reject(aggregate(realm, errors));
                }
            });
        }
        return result;
    }

    private static Object aggregate(Realm realm, JsArray errors) {
        Object error = realm.error(ErrorKind.ERROR, "All promises were rejected").getValue();
        ((JsObject) error).put("errors", errors);
        return error;
    }

}
