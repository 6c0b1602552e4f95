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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A scope: ordered name-to-binding map linked to its enclosing scope, the chain ending at
 * the global scope. Closures hold on to the environment they were created in.
 */
public class Environment {

    final Environment parent;
    private Map<String, Binding> bindings;

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment getParent() {
        return parent;
    }

    public Binding lookup(String name) {
        Environment env = this;
        while (env != null) {
            if (env.bindings != null) {
                Binding binding = env.bindings.get(name);
                if (binding != null) {
                    return binding;
                }
            }
            env = env.parent;
        }
        return null;
    }

    public Binding getOwn(String name) {
        return bindings == null ? null : bindings.get(name);
    }

    public boolean hasOwn(String name) {
        return bindings != null && bindings.containsKey(name);
    }

    public Set<String> names() {
        return bindings == null ? Collections.emptySet() : bindings.keySet();
    }

    /**
     * Creates or replaces a binding in this scope. A {@code var} re-declaration keeps the existing value.
     */
    public void declare(String name, BindingType type, Object value, boolean initialized) {
        if (bindings == null) {
            bindings = new LinkedHashMap<>();
        }
        Binding existing = bindings.get(name);
        if (existing != null && type == BindingType.VAR && existing.type == BindingType.VAR) {
            if (initialized) {
                existing.value = value;
            }
            return;
        }
        bindings.put(name, new Binding(type, value, initialized));
    }

    public void declare(String name, BindingType type, Object value) {
        declare(name, type, value, true);
    }

    /**
     * Like {@link #lookup} but falls back to creating a built-in global on first use.
     */
    public Binding find(Realm realm, String name) {
        Binding binding = lookup(name);
        if (binding == null) {
            Object global = realm.initGlobal(name);
            if (global != null) {
                realm.globals.declare(name, BindingType.VAR, global);
                binding = realm.globals.getOwn(name);
            }
        }
        return binding;
    }

    public Object get(Realm realm, String name) {
        Binding binding = find(realm, name);
        if (binding == null) {
            throw realm.referenceError(name + " is not defined");
        }
        if (!binding.initialized) {
            throw realm.referenceError("Cannot access '" + name + "' before initialization");
        }
        return binding.value;
    }

    /**
     * Assignment to an existing binding; an undeclared name becomes a global.
     */
    public void assign(Realm realm, String name, Object value) {
        Binding binding = lookup(name);
        if (binding == null) {
            Environment global = this;
            while (global.parent != null) {
                global = global.parent;
            }
            global.declare(name, BindingType.VAR, value);
            return;
        }
        if (!binding.initialized) {
            throw realm.referenceError("Cannot access '" + name + "' before initialization");
        }
        if (binding.type == BindingType.CONST) {
            throw realm.typeError("Assignment to constant variable.");
        }
        binding.value = value;
    }

    /**
     * Completes the declaration of a let / const binding that was hoisted in its dead zone.
     */
    public void initialize(String name, Object value) {
        Binding binding = bindings == null ? null : bindings.get(name);
        if (binding == null) {
            declare(name, BindingType.LET, value);
            return;
        }
        binding.value = value;
        binding.initialized = true;
    }

    /**
     * Fresh scope with copies of this scope's bindings, one per loop iteration.
     */
    public Environment copy() {
        Environment env = new Environment(parent);
        if (bindings != null) {
            env.bindings = new LinkedHashMap<>();
            for (Map.Entry<String, Binding> entry : bindings.entrySet()) {
                env.bindings.put(entry.getKey(), entry.getValue().copy());
            }
        }
        return env;
    }

}
