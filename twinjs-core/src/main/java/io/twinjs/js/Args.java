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
 * Argument access for built-ins: missing arguments read as undefined.
 */
public class Args {

    private Args() {
        // static only
    }

    public static Object get(Object[] args, int index) {
        return index < args.length ? args[index] : Terms.UNDEFINED;
    }

    public static boolean has(Object[] args, int index) {
        return index < args.length && args[index] != Terms.UNDEFINED;
    }

    public static String str(Realm realm, Object[] args, int index) {
        return Terms.toStr(realm, get(args, index));
    }

    public static double num(Realm realm, Object[] args, int index) {
        return Terms.toNumber(realm, get(args, index));
    }

    /**
     * Integer conversion: NaN becomes 0 and the value is truncated, clamped to the int range.
     */
    public static int integer(Realm realm, Object[] args, int index, int defaultValue) {
        if (!has(args, index)) {
            return defaultValue;
        }
        double d = num(realm, args, index);
        if (Double.isNaN(d)) {
            return 0;
        }
        if (d >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (d <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) d;
    }

    /**
     * Relative index as used by slice and friends: negative counts from the end, clamped to [0, length].
     */
    public static int relative(Realm realm, Object[] args, int index, int length, int defaultValue) {
        int value = integer(realm, args, index, defaultValue);
        if (value < 0) {
            return Math.max(0, length + value);
        }
        return Math.min(value, length);
    }

    public static JsFunction function(Realm realm, Object[] args, int index) {
        Object value = get(args, index);
        if (value instanceof JsFunction fn) {
            return fn;
        }
        throw realm.typeError(Display.inspect(value) + " is not a function");
    }

    public static Object[] rest(Object[] args, int from) {
        if (from >= args.length) {
            return new Object[0];
        }
        Object[] result = new Object[args.length - from];
        System.arraycopy(args, from, result, 0, result.length);
        return result;
    }

}
