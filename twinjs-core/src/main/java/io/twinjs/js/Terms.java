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

import io.twinjs.parser.TokenType;

import java.math.BigDecimal;

/**
 * Type conversions and operators shared by the tree-walk interpreter and the VM, so that
 * both produce identical values for the same operation.
 * <p>
 * Numbers are Java {@link Number}s: {@link Integer} when integral and in range, {@link Double}
 * otherwise (see {@link #narrow(double)}). Arithmetic is always IEEE-754 double.
 */
public class Terms {

    public static final Object UNDEFINED = JsUndefined.INSTANCE;

    static final Double NAN = Double.NaN;

    private Terms() {
        // static only
    }

    public static Number narrow(double d) {
        if (d == (int) d && !(d == 0 && 1 / d < 0)) {
            return (int) d;
        }
        return d;
    }

    public static boolean isNullish(Object value) {
        return value == null || value == UNDEFINED;
    }

    public static boolean isPrimitive(Object value) {
        return value == null || value == UNDEFINED || value instanceof String
                || value instanceof Number || value instanceof Boolean;
    }

    public static boolean isTruthy(Object value) {
        if (value == null || value == UNDEFINED) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    public static String typeOf(Object value) {
        if (value == UNDEFINED) {
            return "undefined";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof JsFunction) {
            return "function";
        }
        return "object";
    }

    //==================================================================================================================
    // conversions

    /**
     * Converts an object to a primitive by calling its valueOf / toString. Without a realm
     * no user code is run and objects fall back to their default string form.
     */
    static Object toPrimitive(Realm realm, Object value, boolean preferString) {
        if (!(value instanceof JsObject object)) {
            return value;
        }
        if (realm != null) {
            String[] order = preferString ? new String[]{"toString", "valueOf"} : new String[]{"valueOf", "toString"};
            for (String name : order) {
                Object method = object.get(name);
                if (method instanceof JsFunction fn) {
                    Object result = fn.call(realm, object, new Object[0]);
                    if (isPrimitive(result)) {
                        return result;
                    }
                }
            }
            throw realm.typeError("Cannot convert object to primitive value");
        }
        if (object instanceof JsArray array) {
            return JsArrayPrototype.join(null, array.toList(), ",");
        }
        if (object instanceof JsFunction fn) {
            return "function " + fn.getName() + "() { [native code] }";
        }
        if (object instanceof JsError error) {
            return error.toString();
        }
        return "[object Object]";
    }

    public static double toNumber(Realm realm, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value == null) {
            return 0;
        }
        if (value == UNDEFINED) {
            return Double.NaN;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            return stringToNumber(s);
        }
        return toNumber(realm, toPrimitive(realm, value, false));
    }

    static double stringToNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return 0;
        }
        switch (s) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
        }
        if (s.length() > 2 && s.charAt(0) == '0') {
            int radix = switch (Character.toLowerCase(s.charAt(1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                case 'b' -> 2;
                default -> 10;
            };
            if (radix != 10) {
                try {
                    return new java.math.BigInteger(s.substring(2), radix).doubleValue();
                } catch (NumberFormatException e) {
                    return Double.NaN;
                }
            }
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            // Double.parseDouble accepts suffixes like 'd' and 'f' and hex floats
            if (!(c >= '0' && c <= '9') && c != '.' && c != 'e' && c != 'E' && c != '+' && c != '-') {
                return Double.NaN;
            }
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public static String toStr(Realm realm, Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number n) {
            return numberToString(n);
        }
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean || value == UNDEFINED) {
            return value.toString();
        }
        return toStr(realm, toPrimitive(realm, value, true));
    }

    public static String numberToString(Number n) {
        if (n instanceof Integer) {
            return n.toString();
        }
        return numberToString(n.doubleValue());
    }

    /**
     * Integral values below 1e21 print without a fraction, other values use the shortest
     * round-trip digits, in exponent form when the magnitude is at least 1e21 or below 1e-6.
     */
    public static String numberToString(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) {
            return "0";
        }
        double abs = Math.abs(d);
        if (d == Math.rint(d) && abs < 1e21) {
            if (abs < 1e18) {
                return Long.toString((long) d);
            }
            return new BigDecimal(d).toPlainString();
        }
        BigDecimal bd = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        if (abs >= 1e-6 && abs < 1e21) {
            return bd.toPlainString();
        }
        String digits = bd.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - bd.scale();
        StringBuilder sb = new StringBuilder();
        if (d < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? "-" : "+").append(Math.abs(exponent));
        return sb.toString();
    }

    static String numberToString(double d, int radix) {
        if (radix == 10 || Double.isNaN(d) || Double.isInfinite(d)) {
            return numberToString(d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 9e15) {
            return Long.toString((long) d, radix);
        }
        // fractional digits in another radix
        boolean negative = d < 0;
        double abs = Math.abs(d);
        long intPart = (long) abs;
        double frac = abs - intPart;
        StringBuilder sb = new StringBuilder(Long.toString(intPart, radix));
        sb.append('.');
        for (int i = 0; i < 20 && frac > 0; i++) {
            frac *= radix;
            int digit = (int) frac;
            sb.append(Character.forDigit(digit, radix));
            frac -= digit;
        }
        return negative ? "-" + sb : sb.toString();
    }

    static int toInt32(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        return (int) (long) d;
    }

    static long toUint32(double d) {
        return toInt32(d) & 0xFFFFFFFFL;
    }

    public static String toPropertyKey(Realm realm, Object key) {
        if (key instanceof String s) {
            return s;
        }
        return toStr(realm, key);
    }

    /**
     * Array index for a property key, or -1 when the key is not a canonical index.
     */
    static int toIndex(Object key) {
        if (key instanceof Integer i) {
            return i >= 0 ? i : -1;
        }
        if (key instanceof Double d) {
            return d >= 0 && d == Math.rint(d) && d < Integer.MAX_VALUE ? d.intValue() : -1;
        }
        if (key instanceof String s) {
            int length = s.length();
            if (length == 0 || length > 10 || (length > 1 && s.charAt(0) == '0')) {
                return -1;
            }
            long value = 0;
            for (int i = 0; i < length; i++) {
                char c = s.charAt(i);
                if (c < '0' || c > '9') {
                    return -1;
                }
                value = value * 10 + (c - '0');
            }
            return value < Integer.MAX_VALUE ? (int) value : -1;
        }
        return -1;
    }

    //==================================================================================================================
    // operators

    public static Object add(Realm realm, Object lhs, Object rhs) {
        if (lhs instanceof Integer a && rhs instanceof Integer b) {
            return narrow((double) a + b);
        }
        Object left = toPrimitive(realm, lhs, false);
        Object right = toPrimitive(realm, rhs, false);
        if (left instanceof String || right instanceof String) {
            return toStr(realm, left) + toStr(realm, right);
        }
        return narrow(toNumber(realm, left) + toNumber(realm, right));
    }

    public static Object binary(Realm realm, TokenType op, Object lhs, Object rhs) {
        switch (op) {
            case PLUS:
                return add(realm, lhs, rhs);
            case EQ_EQ_EQ:
                return strictEquals(lhs, rhs);
            case NOT_EQ_EQ:
                return !strictEquals(lhs, rhs);
            case EQ_EQ:
                return looseEquals(realm, lhs, rhs);
            case NOT_EQ:
                return !looseEquals(realm, lhs, rhs);
            case LT:
            case GT:
            case LT_EQ:
            case GT_EQ:
                return compare(realm, op, lhs, rhs);
            case INSTANCEOF:
                return instanceOf(realm, lhs, rhs);
            case IN:
                return in(realm, lhs, rhs);
            default:
                return arithmetic(realm, op, lhs, rhs);
        }
    }

    static Number arithmetic(Realm realm, TokenType op, Object lhs, Object rhs) {
        double a = toNumber(realm, lhs);
        double b = toNumber(realm, rhs);
        return switch (op) {
            case MINUS -> narrow(a - b);
            case STAR -> narrow(a * b);
            case SLASH -> narrow(a / b);
            case PERCENT -> narrow(a % b);
            case STAR_STAR -> narrow(Double.isNaN(b) || (Math.abs(a) == 1 && Double.isInfinite(b)) ? Double.NaN : Math.pow(a, b));
            case AMP -> toInt32(a) & toInt32(b);
            case PIPE -> toInt32(a) | toInt32(b);
            case CARET -> toInt32(a) ^ toInt32(b);
            case LT_LT -> toInt32(a) << (toUint32(b) & 0x1F);
            case GT_GT -> toInt32(a) >> (toUint32(b) & 0x1F);
            case GT_GT_GT -> narrow((double) (toUint32(a) >>> (toUint32(b) & 0x1F)));
            default -> throw new IllegalArgumentException("not an arithmetic operator: " + op);
        };
    }

    public static Object unary(Realm realm, TokenType op, Object value) {
        return switch (op) {
            case NOT -> !isTruthy(value);
            case MINUS -> narrow(-toNumber(realm, value));
            case PLUS -> narrow(toNumber(realm, value));
            case TILDE -> ~toInt32(toNumber(realm, value));
            case TYPEOF -> typeOf(value);
            case VOID -> UNDEFINED;
            default -> throw new IllegalArgumentException("not a unary operator: " + op);
        };
    }

    public static boolean strictEquals(Object lhs, Object rhs) {
        if (lhs == rhs) {
            return !(lhs instanceof Double d && d.isNaN());
        }
        if (lhs instanceof Number a && rhs instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        if (lhs instanceof String a && rhs instanceof String b) {
            return a.equals(b);
        }
        if (lhs instanceof Boolean a && rhs instanceof Boolean b) {
            return a.booleanValue() == b.booleanValue();
        }
        return false;
    }

    static boolean looseEquals(Realm realm, Object lhs, Object rhs) {
        if (isNullish(lhs) || isNullish(rhs)) {
            return isNullish(lhs) && isNullish(rhs);
        }
        if (lhs.getClass() == rhs.getClass() || (lhs instanceof Number && rhs instanceof Number)) {
            return strictEquals(lhs, rhs);
        }
        if (lhs instanceof JsObject && rhs instanceof JsObject) {
            return lhs == rhs;
        }
        if (lhs instanceof Boolean) {
            return looseEquals(realm, toNumber(realm, lhs), rhs);
        }
        if (rhs instanceof Boolean) {
            return looseEquals(realm, lhs, toNumber(realm, rhs));
        }
        if (lhs instanceof JsObject) {
            return looseEquals(realm, toPrimitive(realm, lhs, false), rhs);
        }
        if (rhs instanceof JsObject) {
            return looseEquals(realm, lhs, toPrimitive(realm, rhs, false));
        }
        // number and string
        return toNumber(realm, lhs) == toNumber(realm, rhs);
    }

    static boolean sameValueZero(Object lhs, Object rhs) {
        if (lhs instanceof Number a && rhs instanceof Number b) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            return x == y || (Double.isNaN(x) && Double.isNaN(y));
        }
        return strictEquals(lhs, rhs);
    }

    static Boolean compare(Realm realm, TokenType op, Object lhs, Object rhs) {
        Object left = toPrimitive(realm, lhs, false);
        Object right = toPrimitive(realm, rhs, false);
        if (left instanceof String a && right instanceof String b) {
            int c = a.compareTo(b);
            return switch (op) {
                case LT -> c < 0;
                case GT -> c > 0;
                case LT_EQ -> c <= 0;
                default -> c >= 0;
            };
        }
        double a = toNumber(realm, left);
        double b = toNumber(realm, right);
        return switch (op) {
            case LT -> a < b;
            case GT -> a > b;
            case LT_EQ -> a <= b;
            default -> a >= b;
        };
    }

    static boolean instanceOf(Realm realm, Object value, Object target) {
        if (!(target instanceof JsFunction fn)) {
            throw realm.typeError("Right-hand side of 'instanceof' is not callable");
        }
        if (!(value instanceof JsObject object)) {
            return false;
        }
        Object prototype = fn.get("prototype");
        if (!(prototype instanceof JsObject)) {
            return false;
        }
        return object.hasInChain((JsObject) prototype);
    }

    static boolean in(Realm realm, Object key, Object target) {
        if (!(target instanceof JsObject object)) {
            throw realm.typeError("Cannot use 'in' operator to search for '" + toStr(realm, key) + "' in " + toStr(realm, target));
        }
        return object.hasProperty(toPropertyKey(realm, key));
    }

}
