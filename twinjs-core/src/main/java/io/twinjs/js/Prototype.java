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

import java.util.HashSet;
import java.util.Set;

/**
 * Base for built-in prototypes and namespace objects. Built-in members come from
 * {@link #getBuiltinProperty(String)} on first access and are then cached as hidden own
 * properties, so user code can shadow, replace or delete them like ordinary properties.
 */
abstract class Prototype extends JsObject {

    final Realm realm;
    // deleted built-ins stay deleted
    private Set<String> removedKeys;

    Prototype(Realm realm, JsObject proto) {
        super(proto);
        this.realm = realm;
    }

    /**
     * @return a method, a constant value, or null if this object has no such built-in
     */
    protected abstract Object getBuiltinProperty(String name);

    private Object builtin(String name) {
        Object value = getBuiltinProperty(name);
        if (value instanceof JsCallable callable && !(value instanceof JsFunction)) {
            JsNativeFunction fn = new JsNativeFunction(realm.functionPrototype, name, callable);
            putHidden(name, fn);
            return fn;
        }
        return value;
    }

    @Override
    public boolean hasOwnProperty(String key) {
        return super.hasOwnProperty(key) || (!removed(key) && builtin(key) != null);
    }

    @Override
    public Object getOwn(String key) {
        if (super.hasOwnProperty(key)) {
            return super.getOwn(key);
        }
        if (removed(key)) {
            return Terms.UNDEFINED;
        }
        Object value = builtin(key);
        return value == null ? Terms.UNDEFINED : value;
    }

    private boolean removed(String key) {
        return removedKeys != null && removedKeys.contains(key);
    }

    @Override
    public boolean remove(String key) {
        if (removedKeys == null) {
            removedKeys = new HashSet<>();
        }
        removedKeys.add(key);
        return super.remove(key);
    }

    @Override
    public void put(String key, Object value) {
        if (removedKeys != null) {
            removedKeys.remove(key);
        }
        super.put(key, value);
    }

    static JsObject thisObject(Realm realm, Object thisObject, String method) {
        if (thisObject instanceof JsObject object) {
            return object;
        }
        throw realm.typeError(method + " called on " + Display.inspect(thisObject));
    }

}
