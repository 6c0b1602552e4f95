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

class JsMapPrototype extends Prototype {

    private JsAccessor size;

    JsMapPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "size" -> size();
            case "get" -> (JsCallable) (realm, thisObject, args) -> map(realm, thisObject, "get").getEntry(Args.get(args, 0));
            case "set" -> (JsCallable) (realm, thisObject, args) -> {
                JsMap map = map(realm, thisObject, "set");
                map.setEntry(Args.get(args, 0), Args.get(args, 1));
                return map;
            };
            case "has" -> (JsCallable) (realm, thisObject, args) -> map(realm, thisObject, "has").hasEntry(Args.get(args, 0));
            case "delete" -> (JsCallable) (realm, thisObject, args) -> map(realm, thisObject, "delete").deleteEntry(Args.get(args, 0));
            case "clear" -> (JsCallable) (realm, thisObject, args) -> {
                map(realm, thisObject, "clear").clear();
                return Terms.UNDEFINED;
            };
            case "forEach" -> (JsCallable) this::forEach;
            case "keys" -> (JsCallable) (realm, thisObject, args) ->
                    new JsIterator(realm.iteratorPrototype, map(realm, thisObject, "keys").keyList().iterator());
            case "values" -> (JsCallable) (realm, thisObject, args) ->
                    new JsIterator(realm.iteratorPrototype, map(realm, thisObject, "values").valueList().iterator());
            case "entries" -> (JsCallable) (realm, thisObject, args) ->
                    new JsIterator(realm.iteratorPrototype, map(realm, thisObject, "entries").entries(realm).iterator());
            case "toString" -> (JsCallable) (realm, thisObject, args) -> "[object Map]";
            default -> null;
        };
    }

    private JsAccessor size() {
        if (size == null) {
            size = new JsAccessor(realm.function("size", (r, thisObject, args) -> map(r, thisObject, "size").size()), null);
            putHidden("size", size);
        }
        return size;
    }

    private static JsMap map(Realm realm, Object thisObject, String method) {
        if (thisObject instanceof JsMap map) {
            return map;
        }
        throw realm.typeError("Method Map.prototype." + method + " called on incompatible receiver " + Display.inspect(thisObject));
    }

    // callback(value, key, map) over a snapshot of the entries
    private Object forEach(Realm realm, Object thisObject, Object[] args) {
        JsMap map = map(realm, thisObject, "forEach");
        JsFunction fn = Args.function(realm, args, 0);
        Object self = Args.get(args, 1);
        for (Object key : map.keyList()) {
            if (map.hasEntry(key)) {
                fn.call(realm, self, new Object[]{map.getEntry(key), key, map});
            }
        }
        return Terms.UNDEFINED;
    }

}
