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
 * The {@code Map} function: {@code new Map()} or {@code new Map(iterableOfEntries)}.
 */
class JsMapConstructor extends JsNativeFunction {

    JsMapConstructor(Realm realm) {
        super(realm.functionPrototype, "Map", null);
        constructor(JsMap::new, JsMapConstructor::initialize, realm.mapPrototype);
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        throw realm.typeError("Constructor Map requires 'new'");
    }

    private static Object initialize(Realm realm, Object thisObject, Object[] args) {
        JsMap map = (JsMap) thisObject;
        Object source = Args.get(args, 0);
        if (Terms.isNullish(source)) {
            return Terms.UNDEFINED;
        }
        for (Object entry : PropertyAccess.iterate(realm, source)) {
            if (!(entry instanceof JsObject)) {
                throw realm.typeError("Iterator value " + Display.inspect(entry) + " is not an entry object");
            }
            map.setEntry(PropertyAccess.getIndex(realm, entry, 0), PropertyAccess.getIndex(realm, entry, 1));
        }
        return Terms.UNDEFINED;
    }

}
