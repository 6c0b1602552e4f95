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
 * The {@code Array} function: {@code Array(n)}, {@code Array(a, b)}, isArray, from and of.
 */
class JsArrayConstructor extends JsNativeFunction {

    JsArrayConstructor(Realm realm) {
        super(realm.functionPrototype, "Array", null);
        constructor(JsArray::new, JsArrayConstructor::initialize, realm.arrayPrototype);
        putHidden("isArray", realm.function("isArray", (r, thisObject, args) -> Args.get(args, 0) instanceof JsArray));
        putHidden("of", realm.function("of", (r, thisObject, args) -> new JsArray(r.arrayPrototype, new ArrayList<>(List.of(args)))));
        putHidden("from", realm.function("from", JsArrayConstructor::from));
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        return construct(realm, args);
    }

    private static Object initialize(Realm realm, Object thisObject, Object[] args) {
        JsArray array = (JsArray) thisObject;
        if (args.length == 1 && args[0] instanceof Number n) {
            double d = n.doubleValue();
            if (d < 0 || d != Math.rint(d) || d > Integer.MAX_VALUE) {
                throw realm.rangeError("Invalid array length");
            }
            array.setLength((int) d);
        } else {
            for (Object arg : args) {
                array.add(arg);
            }
        }
        return Terms.UNDEFINED;
    }

    private static Object from(Realm realm, Object thisObject, Object[] args) {
        Object source = Args.get(args, 0);
        List<Object> items;
        if (source instanceof JsArray || source instanceof String) {
            items = PropertyAccess.iterate(realm, source);
        } else if (source instanceof JsObject object) {
            // array-like: { length: n }
            int length = (int) Math.max(0, Terms.toNumber(realm, object.get("length")));
            items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(object.get(Integer.toString(i)));
            }
        } else if (Terms.isNullish(source)) {
            throw realm.typeError(Display.inspect(source) + " is not iterable");
        } else {
            items = new ArrayList<>();
        }
        Object mapFn = Args.get(args, 1);
        if (mapFn instanceof JsFunction fn) {
            for (int i = 0; i < items.size(); i++) {
                items.set(i, fn.call(realm, Terms.UNDEFINED, new Object[]{items.get(i), i}));
            }
        }
        return new JsArray(realm.arrayPrototype, items);
    }

}
