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
 * Base for every callable value. Construction is split in two steps so that class
 * hierarchies can allocate the instance at the root and initialize it top-down.
 */
public abstract class JsFunction extends JsObject implements JsCallable {

    protected String name;

    protected JsFunction(JsObject proto, String name) {
        super(proto);
        this.name = name == null ? "" : name;
    }

    public String getName() {
        return name;
    }

    public boolean isConstructor() {
        return false;
    }

    /**
     * Creates the bare instance, with the given prototype, that {@link #initialize} fills in.
     */
    JsObject allocate(JsObject proto) {
        return new JsObject(proto);
    }

    /**
     * Runs the constructor body against an allocated instance.
     *
     * @return an object that replaces the instance, or any other value to keep it
     */
    Object initialize(Realm realm, JsObject instance, Object[] args) {
        throw realm.typeError(displayName() + " is not a constructor");
    }

    public Object construct(Realm realm, Object[] args) {
        if (!isConstructor()) {
            throw realm.typeError(displayName() + " is not a constructor");
        }
        Object prototype = get("prototype");
        JsObject proto = prototype instanceof JsObject p ? p : realm.objectPrototype;
        JsObject instance = allocate(proto);
        Object result = initialize(realm, instance, args);
        return result instanceof JsObject ? result : instance;
    }

    public String displayName() {
        return name.isEmpty() ? "anonymous" : name;
    }

    @Override
    public boolean hasOwnProperty(String key) {
        return "name".equals(key) || super.hasOwnProperty(key);
    }

    @Override
    public Object getOwn(String key) {
        if ("name".equals(key) && !super.hasOwnProperty(key)) {
            return name;
        }
        return super.getOwn(key);
    }

}
