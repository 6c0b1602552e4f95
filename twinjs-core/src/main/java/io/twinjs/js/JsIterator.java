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

import java.util.Iterator;

/**
 * Iterator object over a Java iterator, returned by the {@code keys()}, {@code values()} and
 * {@code entries()} methods of maps and sets.
 */
public class JsIterator extends JsObject {

    private final Iterator<Object> source;

    JsIterator(JsObject proto, Iterator<Object> source) {
        super(proto);
        this.source = source;
    }

    Iterator<Object> iterator() {
        return source;
    }

    JsObject next(Realm realm) {
        if (source.hasNext()) {
            return result(realm, source.next(), false);
        }
        return result(realm, Terms.UNDEFINED, true);
    }

    /**
     * The {@code { value, done }} object of the iterator protocol.
     */
    static JsObject result(Realm realm, Object value, boolean done) {
        JsObject result = new JsObject(realm.objectPrototype);
        result.put("value", value);
        result.put("done", done);
        return result;
    }

}
