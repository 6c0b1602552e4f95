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

import io.twinjs.common.Resource;

/**
 * A module instance: its source, its namespace object and whether its top level has finished.
 */
public class ModuleRecord {

    public enum State {
        LOADING, LOADED
    }

    private final String name;
    private final Resource resource;
    private final JsObject namespace;
    private State state = State.LOADING;

    public ModuleRecord(Realm realm, String name, Resource resource) {
        this.name = name;
        this.resource = resource;
        this.namespace = new JsObject(realm.objectPrototype);
    }

    public String getName() {
        return name;
    }

    public Resource getResource() {
        return resource;
    }

    /**
     * Exported values by name, filled in while the module top level runs.
     */
    public JsObject getNamespace() {
        return namespace;
    }

    public State getState() {
        return state;
    }

    public boolean isLoaded() {
        return state == State.LOADED;
    }

    void export(String name, Object value) {
        namespace.put(name, value);
    }

    void setLoaded() {
        state = State.LOADED;
    }

    @Override
    public String toString() {
        return name + " (" + state + ")";
    }

}
