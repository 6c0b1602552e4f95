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

import java.util.function.Function;

/**
 * Built-in function implemented in Java. Constructible natives carry an allocator for the
 * instance and an initializer invoked with the instance as {@code this}.
 */
public class JsNativeFunction extends JsFunction {

    private final JsCallable callable;
    private Function<JsObject, JsObject> allocator;
    private JsCallable initializer;

    public JsNativeFunction(JsObject proto, String name, JsCallable callable) {
        super(proto, name);
        this.callable = callable;
    }

    JsNativeFunction constructor(Function<JsObject, JsObject> allocator, JsCallable initializer, JsObject prototype) {
        this.allocator = allocator;
        this.initializer = initializer;
        putHidden("prototype", prototype);
        prototype.putHidden("constructor", this);
        return this;
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        return callable.call(realm, thisObject, args);
    }

    @Override
    public boolean isConstructor() {
        return allocator != null;
    }

    @Override
    JsObject allocate(JsObject proto) {
        return allocator == null ? super.allocate(proto) : allocator.apply(proto);
    }

    @Override
    Object initialize(Realm realm, JsObject instance, Object[] args) {
        if (initializer == null) {
            return super.initialize(realm, instance, args);
        }
        return initializer.call(realm, instance, args);
    }

}
