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
 * Getter / setter pair stored in place of a property value. Reads and writes through
 * {@link PropertyAccess} call the pair with the original receiver as {@code this}.
 */
public final class JsAccessor {

    JsFunction getter;
    JsFunction setter;

    JsAccessor(JsFunction getter, JsFunction setter) {
        this.getter = getter;
        this.setter = setter;
    }

    public JsFunction getGetter() {
        return getter;
    }

    public JsFunction getSetter() {
        return setter;
    }

    Object get(Realm realm, Object receiver) {
        if (getter == null) {
            return Terms.UNDEFINED;
        }
        return realm.call(getter, receiver, new Object[0]);
    }

    // assignments to a getter-only property are dropped
    void set(Realm realm, Object receiver, Object value) {
        if (setter != null) {
            realm.call(setter, receiver, new Object[]{value});
        }
    }

    @Override
    public String toString() {
        if (getter != null && setter != null) {
            return "[Getter/Setter]";
        }
        return getter != null ? "[Getter]" : "[Setter]";
    }

}
