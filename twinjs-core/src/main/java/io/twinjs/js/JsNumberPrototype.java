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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code Number.prototype}.
 */
class JsNumberPrototype extends Prototype {

    JsNumberPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "toFixed" -> (JsCallable) this::toFixed;
            case "toString" -> (JsCallable) this::toStringMethod;
            case "valueOf" -> (JsCallable) (realm, thisObject, args) -> number(realm, thisObject);
            default -> null;
        };
    }

    private static Number number(Realm realm, Object thisObject) {
        if (thisObject instanceof Number n) {
            return n;
        }
        throw realm.typeError("Number.prototype method called on " + Display.inspect(thisObject));
    }

    private Object toFixed(Realm realm, Object thisObject, Object[] args) {
        double d = number(realm, thisObject).doubleValue();
        int digits = Args.integer(realm, args, 0, 0);
        if (digits < 0 || digits > 100) {
            throw realm.rangeError("toFixed() digits argument must be between 0 and 100");
        }
        if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 1e21) {
            return Terms.numberToString(d);
        }
        return new BigDecimal(d).setScale(digits, RoundingMode.HALF_UP).toPlainString();
    }

    private Object toStringMethod(Realm realm, Object thisObject, Object[] args) {
        Number n = number(realm, thisObject);
        int radix = Args.integer(realm, args, 0, 10);
        if (radix < 2 || radix > 36) {
            throw realm.rangeError("toString() radix must be between 2 and 36");
        }
        return radix == 10 ? Terms.numberToString(n) : Terms.numberToString(n.doubleValue(), radix);
    }

}
