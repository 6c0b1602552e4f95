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
 * Array backed by a list. {@code length} is always the highest set index + 1: indexed
 * writes past the end pad with undefined, and writing {@code length} truncates or extends.
 * Deleting an element leaves undefined in its slot and keeps the length.
 */
public class JsArray extends JsObject {

    final List<Object> list;

    public JsArray(JsObject proto, List<Object> list) {
        super(proto);
        this.list = list;
    }

    public JsArray(JsObject proto) {
        this(proto, new ArrayList<>());
    }

    public int size() {
        return list.size();
    }

    public Object get(int index) {
        if (index < 0 || index >= list.size()) {
            return Terms.UNDEFINED;
        }
        return list.get(index);
    }

    public void set(int index, Object value) {
        while (list.size() <= index) {
            list.add(Terms.UNDEFINED);
        }
        list.set(index, value);
    }

    public void add(Object value) {
        list.add(value);
    }

    public List<Object> toList() {
        return list;
    }

    void setLength(int length) {
        if (length < list.size()) {
            list.subList(length, list.size()).clear();
        } else {
            while (list.size() < length) {
                list.add(Terms.UNDEFINED);
            }
        }
    }

    @Override
    public boolean hasOwnProperty(String key) {
        if ("length".equals(key)) {
            return true;
        }
        int index = Terms.toIndex(key);
        if (index >= 0) {
            return index < list.size();
        }
        return super.hasOwnProperty(key);
    }

    @Override
    public Object getOwn(String key) {
        if ("length".equals(key)) {
            return list.size();
        }
        int index = Terms.toIndex(key);
        if (index >= 0) {
            return get(index);
        }
        return super.getOwn(key);
    }

    @Override
    public void put(String key, Object value) {
        if ("length".equals(key)) {
            double d = value instanceof Number n ? n.doubleValue() : Double.NaN;
            if (d < 0 || d != Math.rint(d) || d > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Invalid array length");
            }
            setLength((int) d);
            return;
        }
        int index = Terms.toIndex(key);
        if (index >= 0) {
            set(index, value);
            return;
        }
        super.put(key, value);
    }

    @Override
    public boolean remove(String key) {
        int index = Terms.toIndex(key);
        if (index >= 0) {
            if (index < list.size()) {
                list.set(index, Terms.UNDEFINED);
            }
            return true;
        }
        if ("length".equals(key)) {
            return false;
        }
        return super.remove(key);
    }

    @Override
    public List<String> keys() {
        List<String> own = super.keys();
        List<String> keys = new ArrayList<>(list.size() + own.size());
        for (int i = 0; i < list.size(); i++) {
            keys.add(Integer.toString(i));
        }
        keys.addAll(own);
        return keys;
    }

}
