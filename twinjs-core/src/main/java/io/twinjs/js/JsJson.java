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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The {@code JSON} namespace. Parsing and string escaping are done by json-smart, the
 * structure is written here so numbers print the JS way.
 */
class JsJson extends Prototype {

    private static final JSONStyle STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    JsJson(Realm realm) {
        super(realm, realm.objectPrototype);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "parse" -> (JsCallable) this::parse;
            case "stringify" -> (JsCallable) this::stringify;
            default -> null;
        };
    }

    private Object parse(Realm realm, Object thisObject, Object[] args) {
        String text = Args.str(realm, args, 0);
        if (!JSONValue.isValidJsonStrict(text)) {
            throw realm.syntaxError("Unexpected token in JSON: " + abbreviate(text));
        }
        return toJs(realm, JSONValue.parseKeepingOrder(text));
    }

    private static String abbreviate(String text) {
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }

    @SuppressWarnings("unchecked")
    static Object toJs(Realm realm, Object value) {
        if (value instanceof Map<?, ?> map) {
            JsObject object = new JsObject(realm.objectPrototype);
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) map).entrySet()) {
                object.put(entry.getKey(), toJs(realm, entry.getValue()));
            }
            return object;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toJs(realm, item));
            }
            return new JsArray(realm.arrayPrototype, items);
        }
        if (value instanceof Integer) {
            return value;
        }
        if (value instanceof Number n) {
            return Terms.narrow(n instanceof BigInteger || n instanceof BigDecimal ? Double.parseDouble(n.toString()) : n.doubleValue());
        }
        return value;
    }

    private Object stringify(Realm realm, Object thisObject, Object[] args) {
        Object space = Args.get(args, 2);
        String indent = "";
        if (space instanceof Number n) {
            indent = " ".repeat(Math.max(0, Math.min(n.intValue(), 10)));
        } else if (space instanceof String s) {
            indent = s.length() > 10 ? s.substring(0, 10) : s;
        }
        List<String> allowed = null;
        if (Args.get(args, 1) instanceof JsArray replacer) {
            allowed = new ArrayList<>();
            for (Object key : replacer.toList()) {
                allowed.add(Terms.toStr(realm, key));
            }
        }
        StringBuilder sb = new StringBuilder();
        Set<JsObject> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        if (!write(realm, Args.get(args, 0), sb, indent, "", allowed, seen)) {
            return Terms.UNDEFINED;
        }
        return sb.toString();
    }

    /**
     * @return false if the value has no JSON form (undefined or a function)
     */
    private static boolean write(Realm realm, Object value, StringBuilder sb, String indent, String current,
                                 List<String> allowed, Set<JsObject> seen) {
        if (value instanceof JsObject object && !(value instanceof JsFunction)) {
            Object toJson = object.get("toJSON");
            if (toJson instanceof JsFunction fn) {
                value = fn.call(realm, object, new Object[0]);
            }
        }
        if (value == Terms.UNDEFINED || value instanceof JsFunction) {
            return false;
        }
        if (value == null) {
            sb.append("null");
            return true;
        }
        if (value instanceof Boolean) {
            sb.append(value);
            return true;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            sb.append(Double.isNaN(d) || Double.isInfinite(d) ? "null" : Terms.numberToString(n));
            return true;
        }
        if (value instanceof String s) {
            sb.append('"').append(JSONValue.escape(s, STYLE)).append('"');
            return true;
        }
        JsObject object = (JsObject) value;
        if (!seen.add(object)) {
            throw realm.typeError("Converting circular structure to JSON");
        }
        String inner = current + indent;
        boolean pretty = !indent.isEmpty();
        if (object instanceof JsArray array) {
            List<Object> list = array.toList();
            if (list.isEmpty()) {
                sb.append("[]");
            } else {
                sb.append('[');
                for (int i = 0; i < list.size(); i++) {
                    if (i > 0) {
                        sb.append(',');
                    }
                    if (pretty) {
                        sb.append('\n').append(inner);
                    }
                    if (!write(realm, list.get(i), sb, indent, inner, allowed, seen)) {
                        sb.append("null");
                    }
                }
                if (pretty) {
                    sb.append('\n').append(current);
                }
                sb.append(']');
            }
        } else {
            sb.append('{');
            boolean first = true;
            for (String key : object.keys()) {
                if (allowed != null && !allowed.contains(key)) {
                    continue;
                }
                int mark = sb.length();
                if (!first) {
                    sb.append(',');
                }
                if (pretty) {
                    sb.append('\n').append(inner);
                }
                sb.append('"').append(JSONValue.escape(key, STYLE)).append("\":");
                if (pretty) {
                    sb.append(' ');
                }
                if (write(realm, PropertyAccess.getOwn(realm, object, key), sb, indent, inner, allowed, seen)) {
                    first = false;
                } else {
                    sb.setLength(mark);
                }
            }
            if (pretty && !first) {
                sb.append('\n').append(current);
            }
            sb.append('}');
        }
        seen.remove(object);
        return true;
    }

}
