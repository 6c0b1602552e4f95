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

import java.util.List;

/**
 * The {@code Object} function and its static methods.
 */
class JsObjectConstructor extends JsNativeFunction {

    JsObjectConstructor(Realm realm) {
        super(realm.functionPrototype, "Object", null);
        constructor(JsObject::new, (r, thisObject, args) -> Terms.UNDEFINED, realm.objectPrototype);
        putHidden("keys", realm.function("keys", this::keys));
        putHidden("values", realm.function("values", this::values));
        putHidden("entries", realm.function("entries", this::entries));
        putHidden("assign", realm.function("assign", this::assign));
        putHidden("create", realm.function("create", this::create));
        putHidden("getPrototypeOf", realm.function("getPrototypeOf", this::getPrototypeOf));
        putHidden("setPrototypeOf", realm.function("setPrototypeOf", this::setPrototypeOf));
        putHidden("fromEntries", realm.function("fromEntries", this::fromEntries));
        putHidden("getOwnPropertyNames", realm.function("getOwnPropertyNames", this::keys));
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        Object value = Args.get(args, 0);
        if (value instanceof JsObject) {
            return value;
        }
        return new JsObject(realm.objectPrototype);
    }

    private static JsObject object(Realm realm, Object[] args, String method) {
        Object value = Args.get(args, 0);
        if (value instanceof JsObject object) {
            return object;
        }
        if (Terms.isNullish(value)) {
            throw realm.typeError("Cannot convert undefined or null to object");
        }
        return null;
    }

    private static List<String> ownKeys(Realm realm, Object[] args, String method) {
        Object value = Args.get(args, 0);
        if (value instanceof String s) {
            return new JsArray(null, JsStringPrototype.chars(s)).keys();
        }
        JsObject object = object(realm, args, method);
        return object == null ? List.of() : object.keys();
    }

    private Object keys(Realm realm, Object thisObject, Object[] args) {
        JsArray result = new JsArray(realm.arrayPrototype);
        for (String key : ownKeys(realm, args, "keys")) {
            result.add(key);
        }
        return result;
    }

    private Object values(Realm realm, Object thisObject, Object[] args) {
        JsArray result = new JsArray(realm.arrayPrototype);
        Object target = Args.get(args, 0);
        for (String key : ownKeys(realm, args, "values")) {
            result.add(PropertyAccess.get(realm, target, key));
        }
        return result;
    }

    private Object entries(Realm realm, Object thisObject, Object[] args) {
        JsArray result = new JsArray(realm.arrayPrototype);
        Object target = Args.get(args, 0);
        for (String key : ownKeys(realm, args, "entries")) {
            JsArray entry = new JsArray(realm.arrayPrototype);
            entry.add(key);
            entry.add(PropertyAccess.get(realm, target, key));
            result.add(entry);
        }
        return result;
    }

    private Object assign(Realm realm, Object thisObject, Object[] args) {
        JsObject target = object(realm, args, "assign");
        if (target == null) {
            throw realm.typeError("Object.assign target must be an object");
        }
        for (int i = 1; i < args.length; i++) {
            if (args[i] instanceof JsObject source) {
                for (String key : source.keys()) {
                    PropertyAccess.set(realm, target, key, PropertyAccess.getOwn(realm, source, key));
                }
            }
        }
        return target;
    }

    private Object create(Realm realm, Object thisObject, Object[] args) {
        Object proto = Args.get(args, 0);
        if (proto != null && !(proto instanceof JsObject)) {
            throw realm.typeError("Object prototype may only be an Object or null: " + Display.inspect(proto));
        }
        JsObject result = new JsObject((JsObject) proto);
        if (Args.get(args, 1) instanceof JsObject props) {
            for (String key : props.keys()) {
                if (props.getOwn(key) instanceof JsObject descriptor) {
                    result.put(key, descriptor.get("value"));
                }
            }
        }
        return result;
    }

    private Object getPrototypeOf(Realm realm, Object thisObject, Object[] args) {
        Object value = Args.get(args, 0);
        JsObject proto = PropertyAccess.prototypeOf(realm, value);
        if (proto == null && Terms.isNullish(value)) {
            throw realm.typeError("Cannot convert undefined or null to object");
        }
        return proto;
    }

    private Object setPrototypeOf(Realm realm, Object thisObject, Object[] args) {
        Object target = Args.get(args, 0);
        Object proto = Args.get(args, 1);
        if (proto != null && !(proto instanceof JsObject)) {
            throw realm.typeError("Object prototype may only be an Object or null: " + Display.inspect(proto));
        }
        if (target instanceof JsObject object && !object.setPrototype((JsObject) proto)) {
            throw realm.typeError("Cyclic __proto__ value");
        }
        return target;
    }

    private Object fromEntries(Realm realm, Object thisObject, Object[] args) {
        JsObject result = new JsObject(realm.objectPrototype);
        for (Object entry : PropertyAccess.iterate(realm, Args.get(args, 0))) {
            result.put(Terms.toPropertyKey(realm, PropertyAccess.getIndex(realm, entry, 0)), PropertyAccess.getIndex(realm, entry, 1));
        }
        return result;
    }

}
