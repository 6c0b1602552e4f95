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

import java.util.concurrent.ThreadLocalRandom;

class JsMath extends Prototype {

    JsMath(Realm realm) {
        super(realm, realm.objectPrototype);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "PI" -> Math.PI;
            case "E" -> Math.E;
            case "LN2" -> Math.log(2);
            case "LN10" -> Math.log(10);
            case "LOG2E" -> 1 / Math.log(2);
            case "LOG10E" -> 1 / Math.log(10);
            case "SQRT2" -> Math.sqrt(2);
            case "SQRT1_2" -> Math.sqrt(0.5);
            case "abs" -> unary(Math::abs);
            case "acos" -> unary(Math::acos);
            case "asin" -> unary(Math::asin);
            case "atan" -> unary(Math::atan);
            case "cbrt" -> unary(Math::cbrt);
            case "ceil" -> unary(Math::ceil);
            case "cos" -> unary(Math::cos);
            case "exp" -> unary(Math::exp);
            case "floor" -> unary(Math::floor);
            case "log" -> unary(Math::log);
            case "log2" -> unary(d -> Math.log(d) / Math.log(2));
            case "log10" -> unary(Math::log10);
            case "round" -> unary(d -> Double.isNaN(d) || Double.isInfinite(d) ? d : Math.floor(d + 0.5));
            case "sign" -> unary(Math::signum);
            case "sin" -> unary(Math::sin);
            case "sqrt" -> unary(Math::sqrt);
            case "tan" -> unary(Math::tan);
            case "trunc" -> unary(d -> d < 0 ? Math.ceil(d) : Math.floor(d));
            case "atan2" -> (JsCallable) (realm, thisObject, args) -> Terms.narrow(Math.atan2(Args.num(realm, args, 0), Args.num(realm, args, 1)));
            case "pow" -> (JsCallable) (realm, thisObject, args) -> Terms.arithmetic(realm, TokenType.STAR_STAR, Args.get(args, 0), Args.get(args, 1));
            case "random" -> (JsCallable) (realm, thisObject, args) -> ThreadLocalRandom.current().nextDouble();
            case "max" -> (JsCallable) (realm, thisObject, args) -> extreme(realm, args, true);
            case "min" -> (JsCallable) (realm, thisObject, args) -> extreme(realm, args, false);
            default -> null;
        };
    }

    private interface DoubleOp {

        double apply(double d);

    }

    private static JsCallable unary(DoubleOp op) {
        return (realm, thisObject, args) -> Terms.narrow(op.apply(Args.num(realm, args, 0)));
    }

    private static Object extreme(Realm realm, Object[] args, boolean max) {
        double result = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (int i = 0; i < args.length; i++) {
            double d = Args.num(realm, args, i);
            if (Double.isNaN(d)) {
                return Double.NaN;
            }
            result = max ? Math.max(result, d) : Math.min(result, d);
        }
        return Terms.narrow(result);
    }

}
