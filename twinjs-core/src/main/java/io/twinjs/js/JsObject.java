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
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered property map plus a prototype link. The link is lookup-only: writes
 * land on the receiver itself unless an accessor up the chain takes them, reads fall through
 * the chain and end in undefined.
 */
public class JsObject {

    // walks longer than this switch to explicit cycle detection
    private static final int CHAIN_CHECK_DEPTH = 256;

    Map<String, Object> props;
    private Set<String> hidden;
    private JsObject proto;

    public JsObject(JsObject proto) {
        this.proto = proto;
    }

    public JsObject getPrototype() {
        return proto;
    }

    /**
     * @return false if the new link would make the chain cyclic, leaving it unchanged
     */
    public boolean setPrototype(JsObject proto) {
        JsObject temp = proto;
        while (temp != null) {
            if (temp == this) {
                return false;
            }
            temp = temp.proto;
        }
        this.proto = proto;
        return true;
    }

    //==================================================================================================================
    // own properties

    public boolean hasOwnProperty(String key) {
        return props != null && props.containsKey(key);
    }

    /**
     * @return the own value, or undefined when absent
     */
    public Object getOwn(String key) {
        if (props == null) {
            return Terms.UNDEFINED;
        }
        Object value = props.get(key);
        if (value == null && !props.containsKey(key)) {
            return Terms.UNDEFINED;
        }
        return value;
    }

    public void put(String key, Object value) {
        if (props == null) {
            props = new LinkedHashMap<>();
        }
        props.put(key, value);
    }

    /**
     * Own property excluded from enumeration, like built-in methods and class members.
     */
    public void putHidden(String key, Object value) {
        put(key, value);
        if (hidden == null) {
            hidden = new HashSet<>();
        }
        hidden.add(key);
    }

    /**
     * Defines one half of an accessor property, merging with an own accessor of the same key.
     *
     * @param hidden true for class members, which do not enumerate
     */
    public void defineAccessor(String key, JsFunction getter, JsFunction setter, boolean hidden) {
        Object existing = props == null ? null : props.get(key);
        if (existing instanceof JsAccessor accessor) {
            if (getter != null) {
                accessor.getter = getter;
            }
            if (setter != null) {
                accessor.setter = setter;
            }
            return;
        }
        JsAccessor accessor = new JsAccessor(getter, setter);
        if (hidden) {
            putHidden(key, accessor);
        } else {
            put(key, accessor);
        }
    }

    /**
     * The accessor a write to {@code key} has to go through, found on the receiver or the
     * first object up the chain that has the key, or null for a plain data write.
     */
    JsAccessor findAccessor(String key) {
        JsObject object = this;
        int depth = 0;
        while (object != null) {
            if (object.props != null && object.props.containsKey(key)) {
                return object.props.get(key) instanceof JsAccessor accessor ? accessor : null;
            }
            object = object.proto;
            if (++depth > CHAIN_CHECK_DEPTH * 4) {
                throw new IllegalStateException("cyclic prototype chain at key: " + key);
            }
        }
        return null;
    }

    public boolean remove(String key) {
        if (props != null) {
            props.remove(key);
        }
        if (hidden != null) {
            hidden.remove(key);
        }
        return true;
    }

    boolean isEnumerable(String key) {
        return hidden == null || !hidden.contains(key);
    }

    /**
     * Own enumerable keys in insertion order.
     */
    public List<String> keys() {
        if (props == null) {
            return Collections.emptyList();
        }
        List<String> list = new ArrayList<>(props.size());
        for (String key : props.keySet()) {
            if (isEnumerable(key)) {
                list.add(key);
            }
        }
        return list;
    }

    //==================================================================================================================
    // prototype chain

    public Object get(String key) {
        JsObject object = this;
        int depth = 0;
        Set<JsObject> seen = null;
        while (object != null) {
            if (object.hasOwnProperty(key)) {
                return object.getOwn(key);
            }
            object = object.proto;
            if (++depth > CHAIN_CHECK_DEPTH) {
                if (seen == null) {
                    seen = Collections.newSetFromMap(new IdentityHashMap<>());
                }
                if (object != null && !seen.add(object)) {
                    throw new IllegalStateException("cyclic prototype chain at key: " + key);
                }
            }
        }
        return Terms.UNDEFINED;
    }

    public boolean hasProperty(String key) {
        JsObject object = this;
        int depth = 0;
        while (object != null) {
            if (object.hasOwnProperty(key)) {
                return true;
            }
            object = object.proto;
            if (++depth > CHAIN_CHECK_DEPTH * 4) {
                throw new IllegalStateException("cyclic prototype chain at key: " + key);
            }
        }
        return false;
    }

    boolean hasInChain(JsObject target) {
        JsObject object = proto;
        int depth = 0;
        while (object != null) {
            if (object == target) {
                return true;
            }
            object = object.proto;
            if (++depth > CHAIN_CHECK_DEPTH * 4) {
                throw new IllegalStateException("cyclic prototype chain");
            }
        }
        return false;
    }

    /**
     * Enumerable keys of this object and its prototypes, own keys first, for {@code for-in}.
     */
    List<String> enumerableKeys() {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        JsObject object = this;
        int depth = 0;
        while (object != null) {
            List<String> own = object.keys();
            for (String key : own) {
                if (seen.add(key)) {
                    result.add(key);
                }
            }
            if (object.props != null) {
                // shadowed non-enumerable keys hide inherited ones
                seen.addAll(object.props.keySet());
            }
            object = object.proto;
            if (++depth > CHAIN_CHECK_DEPTH * 4) {
                throw new IllegalStateException("cyclic prototype chain");
            }
        }
        return result;
    }

    /**
     * Name of the nearest constructor on the chain, used when displaying instances.
     */
    String getClassName() {
        JsObject p = proto;
        if (p == null) {
            return "[Object: null prototype]";
        }
        Object ctor = p.getOwn("constructor");
        if (ctor instanceof JsFunction fn) {
            return fn.getName();
        }
        return "Object";
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : keys()) {
            map.put(key, getOwn(key));
        }
        return map;
    }

    @Override
    public String toString() {
        return Display.format(this);
    }

}
