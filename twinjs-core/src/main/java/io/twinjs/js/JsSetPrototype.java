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

class JsSetPrototype extends Prototype {

    private JsAccessor size;

    JsSetPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "size" -> size();
            case "add" -> (JsCallable) (realm, thisObject, args) -> {
                JsSet set = set(realm, thisObject, "add");
                set.add(Args.get(args, 0));
                return set;
            };
            case "has" -> (JsCallable) (realm, thisObject, args) -> set(realm, thisObject, "has").has(Args.get(args, 0));
            case "delete" -> (JsCallable) (realm, thisObject, args) -> set(realm, thisObject, "delete").delete(Args.get(args, 0));
            case "clear" -> (JsCallable) (realm, thisObject, args) -> {
                set(realm, thisObject, "clear").clear();
                return Terms.UNDEFINED;
            };
            case "forEach" -> (JsCallable) this::forEach;
            case "keys", "values" -> (JsCallable) (realm, thisObject, args) ->
                    new JsIterator(realm.iteratorPrototype, set(realm, thisObject, name).values().iterator());
            case "entries" -> (JsCallable) this::entries;
            case "toString" -> (JsCallable) (realm, thisObject, args) -> "[object Set]";
            default -> null;
        };
    }

    private JsAccessor size() {
        if (size == null) {
            size = new JsAccessor(realm.function("size", (r, thisObject, args) -> set(r, thisObject, "size").size()), null);
            putHidden("size", size);
        }
        return size;
    }

    private static JsSet set(Realm realm, Object thisObject, String method) {
        if (thisObject instanceof JsSet set) {
            return set;
        }
        throw realm.typeError("Method Set.prototype." + method + " called on incompatible receiver " + Display.inspect(thisObject));
    }

    // callback(value, value, set), like Map's forEach
    private Object forEach(Realm realm, Object thisObject, Object[] args) {
        JsSet set = set(realm, thisObject, "forEach");
        JsFunction fn = Args.function(realm, args, 0);
        Object self = Args.get(args, 1);
        for (Object value : set.values()) {
            if (set.has(value)) {
                fn.call(realm, self, new Object[]{value, value, set});
            }
        }
        return Terms.UNDEFINED;
    }

    // [value, value] pairs
    private Object entries(Realm realm, Object thisObject, Object[] args) {
        List<Object> pairs = new ArrayList<>();
        for (Object value : set(realm, thisObject, "entries").values()) {
            List<Object> pair = new ArrayList<>(2);
            pair.add(value);
            pair.add(value);
            pairs.add(new JsArray(realm.arrayPrototype, pair));
        }
        return new JsIterator(realm.iteratorPrototype, pairs.iterator());
    }

}
