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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * {@code Array.prototype}. Callback methods read the array length as it was when the method
 * was called, like the engine they imitate.
 */
class JsArrayPrototype extends Prototype {

    JsArrayPrototype(Realm realm, JsObject proto) {
        super(realm, proto);
    }

    @Override
    protected Object getBuiltinProperty(String name) {
        return switch (name) {
            case "push" -> (JsCallable) this::push;
            case "pop" -> (JsCallable) this::pop;
            case "shift" -> (JsCallable) this::shift;
            case "unshift" -> (JsCallable) this::unshift;
            case "slice" -> (JsCallable) this::slice;
            case "splice" -> (JsCallable) this::splice;
            case "concat" -> (JsCallable) this::concat;
            case "join" -> (JsCallable) this::joinMethod;
            case "toString" -> (JsCallable) (realm, thisObject, args) -> join(realm, list(realm, thisObject), ",");
            case "indexOf" -> (JsCallable) this::indexOf;
            case "lastIndexOf" -> (JsCallable) this::lastIndexOf;
            case "includes" -> (JsCallable) this::includes;
            case "map" -> (JsCallable) this::map;
            case "filter" -> (JsCallable) this::filter;
            case "reduce" -> (JsCallable) (realm, thisObject, args) -> reduce(realm, thisObject, args, false);
            case "reduceRight" -> (JsCallable) (realm, thisObject, args) -> reduce(realm, thisObject, args, true);
            case "forEach" -> (JsCallable) this::forEach;
            case "find" -> (JsCallable) (realm, thisObject, args) -> find(realm, thisObject, args, false, false);
            case "findIndex" -> (JsCallable) (realm, thisObject, args) -> find(realm, thisObject, args, true, false);
            case "findLast" -> (JsCallable) (realm, thisObject, args) -> find(realm, thisObject, args, false, true);
            case "findLastIndex" -> (JsCallable) (realm, thisObject, args) -> find(realm, thisObject, args, true, true);
            case "some" -> (JsCallable) (realm, thisObject, args) -> test(realm, thisObject, args, true);
            case "every" -> (JsCallable) (realm, thisObject, args) -> test(realm, thisObject, args, false);
            case "reverse" -> (JsCallable) this::reverse;
            case "sort" -> (JsCallable) this::sort;
            case "flat" -> (JsCallable) this::flat;
            case "flatMap" -> (JsCallable) this::flatMap;
            case "fill" -> (JsCallable) this::fill;
            case "at" -> (JsCallable) this::at;
            case "keys" -> (JsCallable) this::keys;
            default -> null;
        };
    }

    // helpers

    private static JsArray array(Realm realm, Object thisObject) {
        if (thisObject instanceof JsArray array) {
            return array;
        }
        throw realm.typeError("Array.prototype method called on " + Display.inspect(thisObject));
    }

    private static List<Object> list(Realm realm, Object thisObject) {
        return array(realm, thisObject).toList();
    }

    private JsArray newArray(List<Object> list) {
        return new JsArray(realm.arrayPrototype, list);
    }

    private static Object callback(Realm realm, JsFunction fn, Object thisArg, Object item, int index, JsArray array) {
        return fn.call(realm, thisArg, new Object[]{item, index, array});
    }

    static String join(Realm realm, List<Object> list, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            Object item = list.get(i);
            if (!Terms.isNullish(item)) {
                sb.append(Terms.toStr(realm, item));
            }
        }
        return sb.toString();
    }

    // mutators

    private Object push(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        Collections.addAll(list, args);
        return list.size();
    }

    private Object pop(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        return list.isEmpty() ? Terms.UNDEFINED : list.remove(list.size() - 1);
    }

    private Object shift(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        return list.isEmpty() ? Terms.UNDEFINED : list.remove(0);
    }

    private Object unshift(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        for (int i = args.length - 1; i >= 0; i--) {
            list.add(0, args[i]);
        }
        return list.size();
    }

    private Object splice(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        int size = list.size();
        int start = Args.relative(realm, args, 0, size, 0);
        int deleteCount;
        if (args.length == 0) {
            deleteCount = 0;
        } else if (args.length == 1) {
            deleteCount = size - start;
        } else {
            deleteCount = Math.max(0, Math.min(Args.integer(realm, args, 1, 0), size - start));
        }
        List<Object> range = list.subList(start, start + deleteCount);
        List<Object> removed = new ArrayList<>(range);
        range.clear();
        for (int i = 2; i < args.length; i++) {
            list.add(start + i - 2, args[i]);
        }
        return newArray(removed);
    }

    private Object reverse(Realm realm, Object thisObject, Object[] args) {
        Collections.reverse(list(realm, thisObject));
        return thisObject;
    }

    private Object sort(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        Object compareFn = Args.get(args, 0);
        Comparator<Object> comparator;
        if (compareFn instanceof JsFunction fn) {
            comparator = (a, b) -> {
                double d = Terms.toNumber(realm, fn.call(realm, Terms.UNDEFINED, new Object[]{a, b}));
                return d < 0 ? -1 : d > 0 ? 1 : 0;
            };
        } else if (compareFn == Terms.UNDEFINED) {
            comparator = (a, b) -> Terms.toStr(realm, a).compareTo(Terms.toStr(realm, b));
        } else {
            throw realm.typeError("The comparison function must be either a function or undefined");
        }
        // undefined always sorts last and is never passed to the comparator
        List<Object> defined = new ArrayList<>(list.size());
        int undefinedCount = 0;
        for (Object item : list) {
            if (item == Terms.UNDEFINED) {
                undefinedCount++;
            } else {
                defined.add(item);
            }
        }
        try {
            defined.sort(comparator);
        } catch (IllegalArgumentException e) {
            // inconsistent comparator, the partially sorted order is kept
            Realm.logger.debug("sort: {}", e.getMessage());
        }
        list.clear();
        list.addAll(defined);
        for (int i = 0; i < undefinedCount; i++) {
            list.add(Terms.UNDEFINED);
        }
        return thisObject;
    }

    private Object fill(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        int size = list.size();
        int start = Args.relative(realm, args, 1, size, 0);
        int end = Args.relative(realm, args, 2, size, size);
        for (int i = start; i < end; i++) {
            list.set(i, Args.get(args, 0));
        }
        return thisObject;
    }

    // accessors

    private Object slice(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        int size = list.size();
        int start = Args.relative(realm, args, 0, size, 0);
        int end = Args.relative(realm, args, 1, size, size);
        return newArray(start < end ? new ArrayList<>(list.subList(start, end)) : new ArrayList<>());
    }

    private Object concat(Realm realm, Object thisObject, Object[] args) {
        List<Object> result = new ArrayList<>(list(realm, thisObject));
        for (Object arg : args) {
            if (arg instanceof JsArray array) {
                result.addAll(array.toList());
            } else {
                result.add(arg);
            }
        }
        return newArray(result);
    }

    private Object joinMethod(Realm realm, Object thisObject, Object[] args) {
        String separator = Args.has(args, 0) ? Args.str(realm, args, 0) : ",";
        return join(realm, list(realm, thisObject), separator);
    }

    private Object indexOf(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        Object target = Args.get(args, 0);
        for (int i = Args.relative(realm, args, 1, list.size(), 0); i < list.size(); i++) {
            if (Terms.strictEquals(list.get(i), target)) {
                return i;
            }
        }
        return -1;
    }

    private Object lastIndexOf(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        Object target = Args.get(args, 0);
        int from = Args.has(args, 1) ? Args.relative(realm, args, 1, list.size(), 0) : list.size() - 1;
        for (int i = Math.min(from, list.size() - 1); i >= 0; i--) {
            if (Terms.strictEquals(list.get(i), target)) {
                return i;
            }
        }
        return -1;
    }

    private Object includes(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        Object target = Args.get(args, 0);
        for (int i = Args.relative(realm, args, 1, list.size(), 0); i < list.size(); i++) {
            if (Terms.sameValueZero(list.get(i), target)) {
                return true;
            }
        }
        return false;
    }

    private Object at(Realm realm, Object thisObject, Object[] args) {
        List<Object> list = list(realm, thisObject);
        int index = Args.integer(realm, args, 0, 0);
        if (index < 0) {
            index += list.size();
        }
        return index < 0 || index >= list.size() ? Terms.UNDEFINED : list.get(index);
    }

    private Object keys(Realm realm, Object thisObject, Object[] args) {
        int size = list(realm, thisObject).size();
        List<Object> keys = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            keys.add(i);
        }
        return newArray(keys);
    }

    private void flatten(List<Object> source, List<Object> result, int depth) {
        for (Object item : source) {
            if (depth > 0 && item instanceof JsArray array) {
                flatten(array.toList(), result, depth - 1);
            } else {
                result.add(item);
            }
        }
    }

    private Object flat(Realm realm, Object thisObject, Object[] args) {
        List<Object> result = new ArrayList<>();
        flatten(list(realm, thisObject), result, Args.integer(realm, args, 0, 1));
        return newArray(result);
    }

    // iteration

    private Object map(Realm realm, Object thisObject, Object[] args) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        List<Object> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(callback(realm, fn, Args.get(args, 1), array.get(i), i, array));
        }
        return newArray(result);
    }

    private Object flatMap(Realm realm, Object thisObject, Object[] args) {
        JsArray mapped = (JsArray) map(realm, thisObject, args);
        List<Object> result = new ArrayList<>();
        flatten(mapped.toList(), result, 1);
        return newArray(result);
    }

    private Object filter(Realm realm, Object thisObject, Object[] args) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        List<Object> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Object item = array.get(i);
            if (Terms.isTruthy(callback(realm, fn, Args.get(args, 1), item, i, array))) {
                result.add(item);
            }
        }
        return newArray(result);
    }

    private Object forEach(Realm realm, Object thisObject, Object[] args) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        for (int i = 0; i < size && i < array.size(); i++) {
            callback(realm, fn, Args.get(args, 1), array.get(i), i, array);
        }
        return Terms.UNDEFINED;
    }

    private Object reduce(Realm realm, Object thisObject, Object[] args, boolean right) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        int i = right ? size - 1 : 0;
        int step = right ? -1 : 1;
        Object acc;
        if (args.length > 1) {
            acc = args[1];
        } else {
            if (size == 0) {
                throw realm.typeError("Reduce of empty array with no initial value");
            }
            acc = array.get(i);
            i += step;
        }
        for (; i >= 0 && i < size; i += step) {
            acc = fn.call(realm, Terms.UNDEFINED, new Object[]{acc, array.get(i), i, array});
        }
        return acc;
    }

    private Object find(Realm realm, Object thisObject, Object[] args, boolean index, boolean last) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        for (int n = 0; n < size; n++) {
            int i = last ? size - 1 - n : n;
            Object item = array.get(i);
            if (Terms.isTruthy(callback(realm, fn, Args.get(args, 1), item, i, array))) {
                return index ? i : item;
            }
        }
        return index ? -1 : Terms.UNDEFINED;
    }

    private Object test(Realm realm, Object thisObject, Object[] args, boolean some) {
        JsArray array = array(realm, thisObject);
        JsFunction fn = Args.function(realm, args, 0);
        int size = array.size();
        for (int i = 0; i < size; i++) {
            boolean result = Terms.isTruthy(callback(realm, fn, Args.get(args, 1), array.get(i), i, array));
            if (result == some) {
                return some;
            }
        }
        return !some;
    }

}
