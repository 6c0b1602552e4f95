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

import io.twinjs.parser.FunctionInfo;
import io.twinjs.parser.Node;

/**
 * Function created from source: the function node plus shared ownership of the scope it was
 * created in. How a call executes depends on the body variant the realm decided for the node.
 */
public class JsClosure extends JsFunction {

    final Node node;
    final Environment env;
    final FunctionInfo info;
    final boolean arrow;
    final boolean async;
    final boolean generator;
    // lexical 'this' of arrow functions
    final Object capturedThis;
    // object whose prototype 'super.x' starts from
    JsObject homeObject;
    // class whose constructor or field initializer this is, for 'super(...)'
    JsClass ownerClass;
    boolean method;
    boolean classConstructor;

    private final JsObject objectPrototype;
    private FunctionBody body;
    private JsObject prototype;

    JsClosure(Realm realm, Node node, Environment env, Object capturedThis, String name) {
        super(realm.functionPrototype, name);
        this.node = node;
        this.env = env;
        this.info = node.getFunctionInfo();
        this.arrow = info.arrow;
        this.async = info.async;
        this.generator = info.generator;
        this.capturedThis = capturedThis;
        this.objectPrototype = realm.objectPrototype;
    }

    public Node getNode() {
        return node;
    }

    public Environment getEnvironment() {
        return env;
    }

    public boolean isArrow() {
        return arrow;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean isGenerator() {
        return generator;
    }

    /**
     * Constructor of a class with an {@code extends} clause: 'this' is unbound until super() returns.
     */
    public boolean isDerivedConstructor() {
        return classConstructor && node.is(Node.DERIVED);
    }

    public JsObject getHomeObject() {
        return homeObject;
    }

    public JsClass getOwnerClass() {
        return ownerClass;
    }

    public Object getCapturedThis() {
        return capturedThis;
    }

    public FunctionBody getBody(Realm realm) {
        if (body == null) {
            body = realm.functionBody(node);
        }
        return body;
    }

    /**
     * Marks an object literal method: not constructible, {@code super} resolves above the object.
     */
    public void setHomeObject(JsObject homeObject) {
        this.homeObject = homeObject;
        this.method = true;
    }

    /**
     * Names an anonymous function stored under a computed key.
     */
    public void inferName(String inferred) {
        if (name.isEmpty()) {
            name = inferred;
        }
    }

    public Node getParams() {
        return node.get(1);
    }

    public Node getBodyNode() {
        return node.get(2);
    }

    public boolean isExpressionBody() {
        return node.is(Node.EXPRESSION_BODY);
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        FunctionBody fb = getBody(realm);
        switch (fb.kind) {
            case COMPILED:
                return realm.getVirtualMachine().invoke(this, thisObject, args);
            case BRIDGED:
                realm.stats.bridgedCalls++;
                return Interpreter.invoke(realm, this, thisObject, args);
            default:
                return Interpreter.invoke(realm, this, thisObject, args);
        }
    }

    @Override
    public boolean isConstructor() {
        return !arrow && !async && !generator && !method;
    }

    @Override
    Object initialize(Realm realm, JsObject instance, Object[] args) {
        return call(realm, instance, args);
    }

    private JsObject prototype() {
        if (prototype == null && isConstructor()) {
            prototype = new JsObject(objectPrototype);
            prototype.putHidden("constructor", this);
            putHidden("prototype", prototype);
        }
        return prototype;
    }

    @Override
    public boolean hasOwnProperty(String key) {
        if ("prototype".equals(key) && isConstructor()) {
            prototype();
            return true;
        }
        return super.hasOwnProperty(key);
    }

    @Override
    public Object getOwn(String key) {
        if ("prototype".equals(key) && isConstructor()) {
            prototype();
        }
        return super.getOwn(key);
    }

    @Override
    public void put(String key, Object value) {
        if ("prototype".equals(key) && value instanceof JsObject p) {
            prototype = p;
        }
        super.put(key, value);
    }

}
