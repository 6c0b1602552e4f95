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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code Map} instance: insertion-ordered entries keyed by SameValueZero, so {@code NaN}
 * matches itself, {@code -0} matches {@code 0} and objects match by identity.
 */
public class JsMap extends JsObject {

    private final Map<Object, Object> entries = new LinkedHashMap<>();

    JsMap(JsObject proto) {
        super(proto);
    }

    static Object normalize(Object key) {
        if (key instanceof Number n) {
            double d = n.doubleValue();
            return d == 0 ? Integer.valueOf(0) : Terms.narrow(d);
        }
        return key;
    }

    public int size() {
        return entries.size();
    }

    public Object getEntry(Object key) {
        Object normalized = normalize(key);
        Object value = entries.get(normalized);
        if (value == null && !entries.containsKey(normalized)) {
            return Terms.UNDEFINED;
        }
        return value;
    }

    public void setEntry(Object key, Object value) {
        entries.put(normalize(key), value);
    }

    public boolean hasEntry(Object key) {
        return entries.containsKey(normalize(key));
    }

    public boolean deleteEntry(Object key) {
        Object normalized = normalize(key);
        if (!entries.containsKey(normalized)) {
            return false;
        }
        entries.remove(normalized);
        return true;
    }

    public void clear() {
        entries.clear();
    }

    List<Object> keyList() {
        return new ArrayList<>(entries.keySet());
    }

    List<Object> valueList() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Snapshot of the entries as {@code [key, value]} arrays.
     */
    List<Object> entries(Realm realm) {
        List<Object> list = new ArrayList<>(entries.size());
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            List<Object> pair = new ArrayList<>(2);
            pair.add(entry.getKey());
            pair.add(entry.getValue());
            list.add(new JsArray(realm.arrayPrototype, pair));
        }
        return list;
    }

}
