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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders values the way {@code console.log} shows them.
 */
public class Display {

    private static final int MAX_DEPTH = 2;

    private Display() {
        // static only
    }

    /**
     * Top-level form: strings are printed raw.
     */
    public static String format(Object value) {
        if (value instanceof String s) {
            return s;
        }
        return inspect(value);
    }

    /**
     * Nested form: strings are quoted.
     */
    public static String inspect(Object value) {
        StringBuilder sb = new StringBuilder();
        inspect(value, sb, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private static void inspect(Object value, StringBuilder sb, int depth, Set<Object> seen) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            sb.append('\'').append(s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n")).append('\'');
        } else if (value instanceof Number n) {
            sb.append(Terms.numberToString(n));
        } else if (value instanceof JsClass cls) {
            sb.append("[class ").append(cls.getName().isEmpty() ? "(anonymous)" : cls.getName());
            if (cls.getSuperclass() != null) {
                sb.append(" extends ").append(cls.getSuperclass().getName());
            }
            sb.append(']');
        } else if (value instanceof JsFunction fn) {
            sb.append(fn.getName().isEmpty() ? "[Function (anonymous)]" : "[Function: " + fn.getName() + "]");
        } else if (value instanceof JsError error) {
            sb.append(error);
        } else if (value instanceof JsObject object) {
            if (!seen.add(object)) {
                sb.append("[Circular]");
                return;
            }
            if (object instanceof JsPromise promise) {
                inspectPromise(promise, sb, depth, seen);
            } else if (object instanceof JsMap map) {
                inspectMap(map, sb, depth, seen);
            } else if (object instanceof JsSet set) {
                inspectSet(set, sb, depth, seen);
            } else if (object instanceof JsGenerator) {
                sb.append("Object [Generator] {}");
            } else if (object instanceof JsIterator) {
                sb.append("Object [Iterator] {}");
            } else if (object instanceof JsArray array) {
                inspectArray(array, sb, depth, seen);
            } else {
                inspectObject(object, sb, depth, seen);
            }
            seen.remove(object);
        } else {
            sb.append(value);
        }
    }

    private static void inspectPromise(JsPromise promise, StringBuilder sb, int depth, Set<Object> seen) {
        sb.append("Promise { ");
        switch (promise.getState()) {
            case PENDING:
                sb.append("<pending>");
                break;
            case REJECTED:
                sb.append("<rejected> ");
                inspect(promise.getResult(), sb, depth + 1, seen);
                break;
            default:
                inspect(promise.getResult(), sb, depth + 1, seen);
        }
        sb.append(" }");
    }

    private static void inspectMap(JsMap map, StringBuilder sb, int depth, Set<Object> seen) {
        sb.append("Map(").append(map.size()).append(") ");
        if (map.size() == 0) {
            sb.append("{}");
            return;
        }
        if (depth > MAX_DEPTH) {
            sb.append("[Map]");
            return;
        }
        sb.append("{ ");
        boolean first = true;
        for (Object key : map.keyList()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            inspect(key, sb, depth + 1, seen);
            sb.append(" => ");
            inspect(map.getEntry(key), sb, depth + 1, seen);
        }
        sb.append(" }");
    }

    private static void inspectSet(JsSet set, StringBuilder sb, int depth, Set<Object> seen) {
        sb.append("Set(").append(set.size()).append(") ");
        if (set.size() == 0) {
            sb.append("{}");
            return;
        }
        if (depth > MAX_DEPTH) {
            sb.append("[Set]");
            return;
        }
        sb.append("{ ");
        boolean first = true;
        for (Object value : set.values()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            inspect(value, sb, depth + 1, seen);
        }
        sb.append(" }");
    }

    private static void inspectArray(JsArray array, StringBuilder sb, int depth, Set<Object> seen) {
        List<Object> list = array.toList();
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        if (depth > MAX_DEPTH) {
            sb.append("[Array]");
            return;
        }
        sb.append("[ ");
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            inspect(list.get(i), sb, depth + 1, seen);
        }
        sb.append(" ]");
    }

    private static void inspectObject(JsObject object, StringBuilder sb, int depth, Set<Object> seen) {
        String className = object.getClassName();
        String prefix = "Object".equals(className) ? "" : className + " ";
        List<String> keys = object.keys();
        if (keys.isEmpty()) {
            sb.append(prefix).append("{}");
            return;
        }
        if (depth > MAX_DEPTH) {
            sb.append(prefix.isEmpty() ? "[Object]" : "[" + className + "]");
            return;
        }
        sb.append(prefix).append("{ ");
        boolean first = true;
        for (String key : keys) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(isIdentifier(key) ? key : "'" + key + "'").append(": ");
            inspect(object.getOwn(key), sb, depth + 1, seen);
        }
        sb.append(" }");
    }

    static boolean isIdentifier(String key) {
        if (key.isEmpty() || Character.isDigit(key.charAt(0))) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '$') {
                return false;
            }
        }
        return true;
    }

}
