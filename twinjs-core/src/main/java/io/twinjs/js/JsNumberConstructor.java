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
 * The {@code Number} function with its constants and predicates, plus the global
 * {@code parseInt} and {@code parseFloat}.
 */
class JsNumberConstructor extends JsNativeFunction {

    JsNumberConstructor(Realm realm) {
        super(realm.functionPrototype, "Number", null);
        putHidden("prototype", realm.numberPrototype);
        realm.numberPrototype.putHidden("constructor", this);
        putHidden("MAX_SAFE_INTEGER", 9007199254740991d);
        putHidden("MIN_SAFE_INTEGER", -9007199254740991d);
        putHidden("MAX_VALUE", Double.MAX_VALUE);
        putHidden("MIN_VALUE", Double.MIN_VALUE);
        putHidden("EPSILON", Math.ulp(1.0));
        putHidden("POSITIVE_INFINITY", Double.POSITIVE_INFINITY);
        putHidden("NEGATIVE_INFINITY", Double.NEGATIVE_INFINITY);
        putHidden("NaN", Double.NaN);
        putHidden("isInteger", realm.function("isInteger", (r, thisObject, args) ->
                Args.get(args, 0) instanceof Number n && isFinite(n.doubleValue()) && n.doubleValue() == Math.rint(n.doubleValue())));
        putHidden("isSafeInteger", realm.function("isSafeInteger", (r, thisObject, args) ->
                Args.get(args, 0) instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()) && Math.abs(n.doubleValue()) <= 9007199254740991d));
        putHidden("isFinite", realm.function("isFinite", (r, thisObject, args) ->
                Args.get(args, 0) instanceof Number n && isFinite(n.doubleValue())));
        putHidden("isNaN", realm.function("isNaN", (r, thisObject, args) ->
                Args.get(args, 0) instanceof Number n && Double.isNaN(n.doubleValue())));
        putHidden("parseFloat", realm.function("parseFloat", JsNumberConstructor::parseFloat));
        putHidden("parseInt", realm.function("parseInt", JsNumberConstructor::parseInt));
    }

    private static boolean isFinite(double d) {
        return !Double.isNaN(d) && !Double.isInfinite(d);
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        if (args.length == 0) {
            return 0;
        }
        return Terms.narrow(Terms.toNumber(realm, args[0]));
    }

    static Object parseFloat(Realm realm, Object thisObject, Object[] args) {
        String s = Args.str(realm, args, 0).strip();
        int end = 0;
        int length = s.length();
        if (end < length && (s.charAt(end) == '+' || s.charAt(end) == '-')) {
            end++;
        }
        if (s.startsWith("Infinity", end)) {
            return s.charAt(0) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        boolean digits = false;
        while (end < length && Character.isDigit(s.charAt(end))) {
            end++;
            digits = true;
        }
        if (end < length && s.charAt(end) == '.') {
            end++;
            while (end < length && Character.isDigit(s.charAt(end))) {
                end++;
                digits = true;
            }
        }
        if (!digits) {
            return Double.NaN;
        }
        if (end < length && (s.charAt(end) == 'e' || s.charAt(end) == 'E')) {
            int mark = end;
            end++;
            if (end < length && (s.charAt(end) == '+' || s.charAt(end) == '-')) {
                end++;
            }
            int expStart = end;
            while (end < length && Character.isDigit(s.charAt(end))) {
                end++;
            }
            if (end == expStart) {
                end = mark;
            }
        }
        return Terms.narrow(Double.parseDouble(s.substring(0, end)));
    }

    static Object parseInt(Realm realm, Object thisObject, Object[] args) {
        String s = Args.str(realm, args, 0).strip();
        int radix = Args.integer(realm, args, 1, 0);
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if ((radix == 0 || radix == 16) && (s.startsWith("0x") || s.startsWith("0X"))) {
            s = s.substring(2);
            radix = 16;
        }
        if (radix == 0) {
            radix = 10;
        }
        if (radix < 2 || radix > 36) {
            return Double.NaN;
        }
        int end = 0;
        while (end < s.length() && Character.digit(s.charAt(end), radix) >= 0) {
            end++;
        }
        if (end == 0) {
            return Double.NaN;
        }
        double value = 0;
        for (int i = 0; i < end; i++) {
            value = value * radix + Character.digit(s.charAt(i), radix);
        }
        return Terms.narrow(negative ? -value : value);
    }

}
