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
 * {@code Object.prototype}, the end of every ordinary prototype chain.
 */
class JsObjectPrototype extends Prototype {

    JsObjectPrototype(Realm realm) {
        super(realm, null);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "hasOwnProperty" -> (JsCallable) this::hasOwnPropertyMethod;
            case "isPrototypeOf" -> (JsCallable) this::isPrototypeOf;
            case "toString" -> (JsCallable) this::toStringMethod;
            case "valueOf" -> (JsCallable) (realm, thisObject, args) -> thisObject;
            default -> null;
        };
    }

    private Object hasOwnPropertyMethod(Realm realm, Object thisObject, Object[] args) {
        String key = Terms.toPropertyKey(realm, Args.get(args, 0));
        if (thisObject instanceof JsObject object) {
            return object.hasOwnProperty(key);
        }
        if (thisObject instanceof String s) {
            int index = Terms.toIndex(key);
            return "length".equals(key) || (index >= 0 && index < s.length());
        }
        return false;
    }

    private Object isPrototypeOf(Realm realm, Object thisObject, Object[] args) {
        return Args.get(args, 0) instanceof JsObject object && thisObject instanceof JsObject proto && object.hasInChain(proto);
    }

    private Object toStringMethod(Realm realm, Object thisObject, Object[] args) {
        if (thisObject == Terms.UNDEFINED) {
            return "[object Undefined]";
        }
        if (thisObject == null) {
            return "[object Null]";
        }
        if (thisObject instanceof JsArray) {
            return "[object Array]";
        }
        if (thisObject instanceof JsFunction) {
            return "[object Function]";
        }
        if (thisObject instanceof JsError) {
            return "[object Error]";
        }
        return "[object Object]";
    }

}
