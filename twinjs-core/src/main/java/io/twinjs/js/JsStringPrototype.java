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
 * {@code String.prototype}. Strings are UTF-16 like in JS: indices and length count chars.
 */
class JsStringPrototype extends Prototype {

    JsStringPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "charAt" -> (JsCallable) this::charAt;
            case "charCodeAt" -> (JsCallable) this::charCodeAt;
            case "indexOf" -> (JsCallable) this::indexOf;
            case "lastIndexOf" -> (JsCallable) this::lastIndexOf;
            case "includes" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).contains(Args.str(realm, args, 0));
            case "startsWith" -> (JsCallable) this::startsWith;
            case "endsWith" -> (JsCallable) this::endsWith;
            case "slice" -> (JsCallable) this::slice;
            case "substring" -> (JsCallable) this::substring;
            case "toUpperCase" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).toUpperCase();
            case "toLowerCase" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).toLowerCase();
            case "trim" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).strip();
            case "trimStart" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).stripLeading();
            case "trimEnd" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject).stripTrailing();
            case "split" -> (JsCallable) this::split;
            case "replace" -> (JsCallable) (realm, thisObject, args) -> replace(realm, thisObject, args, false);
            case "replaceAll" -> (JsCallable) (realm, thisObject, args) -> replace(realm, thisObject, args, true);
            case "repeat" -> (JsCallable) this::repeat;
            case "padStart" -> (JsCallable) (realm, thisObject, args) -> pad(realm, thisObject, args, true);
            case "padEnd" -> (JsCallable) (realm, thisObject, args) -> pad(realm, thisObject, args, false);
            case "at" -> (JsCallable) this::at;
            case "concat" -> (JsCallable) this::concat;
            case "toString", "valueOf" -> (JsCallable) (realm, thisObject, args) -> str(realm, thisObject);
            default -> null;
        };
    }

    /**
     * Characters of a string as one-character strings, surrogate pairs kept together.
     */
    static List<Object> chars(String s) {
        List<Object> list = new ArrayList<>(s.length());
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int n = Character.charCount(cp);
            list.add(s.substring(i, i + n));
            i += n;
        }
        return list;
    }

    private static String str(Realm realm, Object thisObject) {
        if (Terms.isNullish(thisObject)) {
            throw realm.typeError("String.prototype method called on null or undefined");
        }
        return Terms.toStr(realm, thisObject);
    }

    private Object charAt(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int index = Args.integer(realm, args, 0, 0);
        return index < 0 || index >= s.length() ? "" : String.valueOf(s.charAt(index));
    }

    private Object charCodeAt(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int index = Args.integer(realm, args, 0, 0);
        return index < 0 || index >= s.length() ? Terms.NAN : (Object) (int) s.charAt(index);
    }

    private Object indexOf(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        return s.indexOf(Args.str(realm, args, 0), Math.max(0, Args.integer(realm, args, 1, 0)));
    }

    private Object lastIndexOf(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        return s.lastIndexOf(Args.str(realm, args, 0), Args.integer(realm, args, 1, s.length()));
    }

    private Object startsWith(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int position = Math.max(0, Math.min(Args.integer(realm, args, 1, 0), s.length()));
        return s.startsWith(Args.str(realm, args, 0), position);
    }

    private Object endsWith(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int end = Math.max(0, Math.min(Args.integer(realm, args, 1, s.length()), s.length()));
        return s.substring(0, end).endsWith(Args.str(realm, args, 0));
    }

    private Object slice(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int start = Args.relative(realm, args, 0, s.length(), 0);
        int end = Args.relative(realm, args, 1, s.length(), s.length());
        return start < end ? s.substring(start, end) : "";
    }

    private Object substring(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int start = Math.max(0, Math.min(Args.integer(realm, args, 0, 0), s.length()));
        int end = Math.max(0, Math.min(Args.integer(realm, args, 1, s.length()), s.length()));
        return s.substring(Math.min(start, end), Math.max(start, end));
    }

    private Object split(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        List<Object> parts = new ArrayList<>();
        int limit = Args.integer(realm, args, 1, Integer.MAX_VALUE);
        if (!Args.has(args, 0)) {
            parts.add(s);
        } else {
            String separator = Args.str(realm, args, 0);
            if (separator.isEmpty()) {
                for (int i = 0; i < s.length(); i++) {
                    parts.add(String.valueOf(s.charAt(i)));
                }
            } else {
                int from = 0;
                int index;
                while ((index = s.indexOf(separator, from)) >= 0) {
                    parts.add(s.substring(from, index));
                    from = index + separator.length();
                }
                parts.add(s.substring(from));
            }
        }
        if (parts.size() > limit) {
            parts = new ArrayList<>(parts.subList(0, Math.max(0, limit)));
        }
        return new JsArray(realm.arrayPrototype, parts);
    }

    private Object replace(Realm realm, Object thisObject, Object[] args, boolean all) {
        String s = str(realm, thisObject);
        String pattern = Args.str(realm, args, 0);
        Object replacement = Args.get(args, 1);
        StringBuilder sb = new StringBuilder();
        int from = 0;
        int index;
        while ((index = s.indexOf(pattern, from)) >= 0) {
            sb.append(s, from, index);
            if (replacement instanceof JsFunction fn) {
                sb.append(Terms.toStr(realm, fn.call(realm, Terms.UNDEFINED, new Object[]{pattern, index, s})));
            } else {
                sb.append(Terms.toStr(realm, replacement));
            }
            from = index + pattern.length();
            if (!all) {
                break;
            }
            if (pattern.isEmpty()) {
                if (from >= s.length()) {
                    break;
                }
                sb.append(s.charAt(from));
                from++;
            }
        }
        sb.append(s.substring(Math.min(from, s.length())));
        return sb.toString();
    }

    private Object repeat(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        double count = Args.num(realm, args, 0);
        if (Double.isNaN(count)) {
            count = 0;
        }
        if (count < 0 || Double.isInfinite(count)) {
            throw realm.rangeError("Invalid count value: " + Terms.numberToString(count));
        }
        return s.repeat((int) count);
    }

    private Object pad(Realm realm, Object thisObject, Object[] args, boolean start) {
        String s = str(realm, thisObject);
        int length = Args.integer(realm, args, 0, 0);
        String filler = Args.has(args, 1) ? Args.str(realm, args, 1) : " ";
        if (length <= s.length() || filler.isEmpty()) {
            return s;
        }
        StringBuilder padding = new StringBuilder();
        while (padding.length() < length - s.length()) {
            padding.append(filler);
        }
        padding.setLength(length - s.length());
        return start ? padding + s : s + padding;
    }

    private Object at(Realm realm, Object thisObject, Object[] args) {
        String s = str(realm, thisObject);
        int index = Args.integer(realm, args, 0, 0);
        if (index < 0) {
            index += s.length();
        }
        return index < 0 || index >= s.length() ? Terms.UNDEFINED : String.valueOf(s.charAt(index));
    }

    private Object concat(Realm realm, Object thisObject, Object[] args) {
        StringBuilder sb = new StringBuilder(str(realm, thisObject));
        for (Object arg : args) {
            sb.append(Terms.toStr(realm, arg));
        }
        return sb.toString();
    }

}
