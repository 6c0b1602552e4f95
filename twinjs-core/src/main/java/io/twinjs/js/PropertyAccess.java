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

import io.twinjs.parser.Node;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Property reads and writes on any value, primitives included. Both evaluators go through
 * here so that lookup, the write-to-own rule and the error messages are the same.
 */
public class PropertyAccess {

    private PropertyAccess() {
        // static only
    }

    /**
     * The object property lookup starts from for a value, null for null and undefined.
     */
    public static JsObject prototypeOf(Realm realm, Object value) {
        if (value instanceof JsObject object) {
            return object.getPrototype();
        }
        if (value instanceof String) {
            return realm.stringPrototype;
        }
        if (value instanceof Number) {
            return realm.numberPrototype;
        }
        if (value instanceof Boolean) {
            return realm.booleanPrototype;
        }
        return null;
    }

    public static Object get(Realm realm, Object target, String key) {
        if (target instanceof JsObject object) {
            Object value = object.get(key);
            return value instanceof JsAccessor accessor ? accessor.get(realm, target) : value;
        }
        if (target instanceof String s) {
            if ("length".equals(key)) {
                return s.length();
            }
            int index = Terms.toIndex(key);
            if (index >= 0) {
                return index < s.length() ? String.valueOf(s.charAt(index)) : Terms.UNDEFINED;
            }
            return realm.stringPrototype.get(key);
        }
        if (Terms.isNullish(target)) {
            throw realm.typeError("Cannot read properties of " + Terms.toStr(realm, target) + " (reading '" + key + "')");
        }
        JsObject proto = prototypeOf(realm, target);
        if (proto == null) {
            return Terms.UNDEFINED;
        }
        Object value = proto.get(key);
        return value instanceof JsAccessor accessor ? accessor.get(realm, target) : value;
    }

    /**
     * Own property value with accessors resolved against the object itself.
     */
    public static Object getOwn(Realm realm, JsObject object, String key) {
        Object value = object.getOwn(key);
        return value instanceof JsAccessor accessor ? accessor.get(realm, object) : value;
    }

    public static Object getIndex(Realm realm, Object target, Object key) {
        if (target instanceof JsArray array && key instanceof Integer i) {
            return i >= 0 ? array.get(i) : array.get(Terms.toPropertyKey(realm, key));
        }
        if (target instanceof String s && key instanceof Integer i) {
            return i >= 0 && i < s.length() ? String.valueOf(s.charAt(i)) : Terms.UNDEFINED;
        }
        if (Terms.isNullish(target)) {
            throw realm.typeError("Cannot read properties of " + Terms.toStr(realm, target) + " (reading '" + Terms.toPropertyKey(realm, key) + "')");
        }
        return get(realm, target, Terms.toPropertyKey(realm, key));
    }

    public static void set(Realm realm, Object target, String key, Object value) {
        if (target instanceof JsObject object) {
            JsAccessor accessor = object.findAccessor(key);
            if (accessor != null) {
                accessor.set(realm, object, value);
                return;
            }
            try {
                object.put(key, value);
            } catch (IllegalArgumentException e) {
                throw realm.wrap(e);
            }
            return;
        }
        if (Terms.isNullish(target)) {
            throw realm.typeError("Cannot set properties of " + Terms.toStr(realm, target) + " (setting '" + key + "')");
        }
        // writes to primitives are dropped
    }

    public static void setIndex(Realm realm, Object target, Object key, Object value) {
        if (target instanceof JsArray array && key instanceof Integer i && i >= 0) {
            array.set(i, value);
            return;
        }
        if (Terms.isNullish(target)) {
            throw realm.typeError("Cannot set properties of " + Terms.toStr(realm, target) + " (setting '" + Terms.toPropertyKey(realm, key) + "')");
        }
        set(realm, target, Terms.toPropertyKey(realm, key), value);
    }

    public static boolean delete(Realm realm, Object target, Object key) {
        if (Terms.isNullish(target)) {
            throw realm.typeError("Cannot convert undefined or null to object");
        }
        if (target instanceof JsObject object) {
            return object.remove(Terms.toPropertyKey(realm, key));
        }
        return true;
    }

    /**
     * Method lookup for a call; throws the TypeError for calling a non-function.
     */
    public static JsFunction function(Realm realm, Object value, String description) {
        if (value instanceof JsFunction fn) {
            return fn;
        }
        throw realm.typeError(description + " is not a function");
    }

    /**
     * Elements of an iterable value, drained into a list for spread and destructuring.
     */
    public static List<Object> iterate(Realm realm, Object value) {
        if (value instanceof JsArray array) {
            return new ArrayList<>(array.toList());
        }
        List<Object> items = new ArrayList<>();
        iterator(realm, value).forEachRemaining(items::add);
        return items;
    }

    /**
     * Cursor over an iterable value for for-of: arrays, strings, maps, sets and generators.
     * Generators are advanced one element at a time, so a loop that breaks early stops them.
     */
    public static Iterator<Object> iterator(Realm realm, Object value) {
        if (value instanceof JsArray array) {
            return new ArrayList<>(array.toList()).iterator();
        }
        if (value instanceof String s) {
            return JsStringPrototype.chars(s).iterator();
        }
        if (value instanceof JsGenerator generator) {
            return generator.iterator();
        }
        if (value instanceof JsIterator iterator) {
            return iterator.iterator();
        }
        if (value instanceof JsMap map) {
            return map.entries(realm).iterator();
        }
        if (value instanceof JsSet set) {
            return set.values().iterator();
        }
        throw realm.typeError(Display.inspect(value) + " is not iterable");
    }

    /**
     * Keys visited by for-in: array indices and enumerable keys along the prototype chain.
     */
    public static List<String> forInKeys(Object value) {
        if (value instanceof JsObject object) {
            return object.enumerableKeys();
        }
        if (value instanceof String s) {
            List<String> keys = new ArrayList<>(s.length());
            for (int i = 0; i < s.length(); i++) {
                keys.add(Integer.toString(i));
            }
            return keys;
        }
        return List.of();
    }

    /**
     * Copies own enumerable properties for object spread and rest patterns.
     */
    public static void copyOwn(Realm realm, JsObject target, Object source, Set<String> excluded) {
        if (source instanceof JsObject object) {
            for (String key : object.keys()) {
                if (excluded == null || !excluded.contains(key)) {
                    target.put(key, getOwn(realm, object, key));
                }
            }
        } else if (source instanceof String s) {
            for (int i = 0; i < s.length(); i++) {
                String key = Integer.toString(i);
                if (excluded == null || !excluded.contains(key)) {
                    target.put(key, String.valueOf(s.charAt(i)));
                }
            }
        }
    }

    /**
     * Source text of a callee for error messages, like {@code obj.name} or {@code fn}.
     */
    public static String describe(Node node) {
        switch (node.type) {
            case IDENT:
                return node.getName();
            case THIS:
                return "this";
            case SUPER:
                return "super";
            case MEMBER_EXPR:
                return describe(node.get(0)) + "." + node.getName();
            case INDEX_EXPR:
                return describe(node.get(0)) + "[...]";
            case CALL_EXPR:
                return describe(node.get(0)) + "(...)";
            case OPTIONAL_CHAIN:
                return describe(node.get(0));
            default:
                return "expression";
        }
    }

}
