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
 * {@code Function.prototype}: call, apply and bind.
 */
class JsFunctionPrototype extends Prototype {

    JsFunctionPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "call" -> (JsCallable) this::callMethod;
            case "apply" -> (JsCallable) this::apply;
            case "bind" -> (JsCallable) this::bind;
            case "toString" -> (JsCallable) this::toStringMethod;
            default -> null;
        };
    }

    private static JsFunction self(Realm realm, Object thisObject) {
        if (thisObject instanceof JsFunction fn) {
            return fn;
        }
        throw realm.typeError("Function.prototype method called on incompatible receiver " + Display.inspect(thisObject));
    }

    private Object callMethod(Realm realm, Object thisObject, Object[] args) {
        return self(realm, thisObject).call(realm, Args.get(args, 0), Args.rest(args, 1));
    }

    private Object apply(Realm realm, Object thisObject, Object[] args) {
        JsFunction fn = self(realm, thisObject);
        Object list = Args.get(args, 1);
        Object[] callArgs;
        if (Terms.isNullish(list)) {
            callArgs = new Object[0];
        } else if (list instanceof JsArray array) {
            callArgs = array.toList().toArray();
        } else {
            throw realm.typeError("CreateListFromArrayLike called on non-object");
        }
        return fn.call(realm, Args.get(args, 0), callArgs);
    }

    private Object bind(Realm realm, Object thisObject, Object[] args) {
        JsFunction target = self(realm, thisObject);
        Object boundThis = Args.get(args, 0);
        Object[] boundArgs = Args.rest(args, 1);
        return new JsNativeFunction(realm.functionPrototype, "bound " + target.getName(), (r, t, callArgs) -> {
            Object[] all = new Object[boundArgs.length + callArgs.length];
            System.arraycopy(boundArgs, 0, all, 0, boundArgs.length);
            System.arraycopy(callArgs, 0, all, boundArgs.length, callArgs.length);
            return target.call(r, boundThis, all);
        });
    }

    private Object toStringMethod(Realm realm, Object thisObject, Object[] args) {
        JsFunction fn = self(realm, thisObject);
        if (fn instanceof JsClass) {
            return "class " + fn.getName() + " { }";
        }
        if (fn instanceof JsClosure closure) {
            return "function " + closure.getName() + "() { [code] }";
        }
        return "function " + fn.getName() + "() { [native code] }";
    }

}
