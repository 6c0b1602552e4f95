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

import io.twinjs.parser.Node;
import io.twinjs.parser.NodeType;

/**
 * A class: optional constructor closure, the prototype holding the methods, the superclass
 * link and the synthesized field initializers. Instances are allocated by the root of the
 * hierarchy and initialized top-down, so a class extending a built-in gets the built-in's
 * instance type.
 */
public class JsClass extends JsFunction {

    public static final String SUPER_NOT_CALLED = "Must call super constructor in derived class before accessing 'this' or returning from derived constructor";
    public static final String SUPER_CALLED_TWICE = "Super constructor may only be called once";

    /**
     * Evaluates a computed member key in the scope the class is defined in.
     */
    public interface KeyEvaluator {

        Object evalKey(Node keyExpr);

    }

    final Node node;
    final JsObject prototype;
    final JsFunction superclass;
    JsClosure constructor;
    JsClosure fieldInitializer;

    JsClass(JsObject proto, String name, Node node, JsObject prototype, JsFunction superclass) {
        super(proto, name);
        this.node = node;
        this.prototype = prototype;
        this.superclass = superclass;
        putHidden("prototype", prototype);
        prototype.putHidden("constructor", this);
    }

    public JsFunction getSuperclass() {
        return superclass;
    }

    public JsObject getPrototypeObject() {
        return prototype;
    }

    @Override
    public Object call(Realm realm, Object thisObject, Object[] args) {
        throw realm.typeError("Class constructor " + displayName() + " cannot be invoked without 'new'");
    }

    @Override
    public boolean isConstructor() {
        return true;
    }

    @Override
    JsObject allocate(JsObject proto) {
        return superclass == null ? super.allocate(proto) : superclass.allocate(proto);
    }

    @Override
    Object initialize(Realm realm, JsObject instance, Object[] args) {
        if (constructor == null) {
            Object result = Terms.UNDEFINED;
            if (superclass != null) {
                result = superclass.initialize(realm, instance, args);
            }
            initializeFields(realm, instance);
            return result;
        }
        if (superclass == null) {
            initializeFields(realm, instance);
        }
        // a derived constructor initializes fields when it calls super()
        return constructor.call(realm, instance, args);
    }

    void initializeFields(Realm realm, JsObject instance) {
        if (fieldInitializer != null) {
            fieldInitializer.call(realm, instance, new Object[0]);
        }
    }

    /**
     * {@code super(...)} inside the constructor of {@code owner}.
     */
    public static Object superConstruct(Realm realm, JsClass owner, Object thisObject, Object[] args) {
        if (owner == null || owner.superclass == null) {
            throw realm.syntaxError("'super' keyword unexpected here");
        }
        if (!(thisObject instanceof JsObject instance)) {
            throw realm.typeError("super constructor called on a non-object");
        }
        owner.superclass.initialize(realm, instance, args);
        owner.initializeFields(realm, instance);
        return Terms.UNDEFINED;
    }

    /**
     * Property lookup for {@code super.name}, starting above the home object. Getters run
     * against the receiver.
     */
    public static Object superGet(Realm realm, JsObject homeObject, String key, Object receiver) {
        if (homeObject == null) {
            throw realm.syntaxError("'super' keyword unexpected here");
        }
        JsObject parent = homeObject.getPrototype();
        if (parent == null) {
            return Terms.UNDEFINED;
        }
        Object value = parent.get(key);
        return value instanceof JsAccessor accessor ? accessor.get(realm, receiver) : value;
    }

    /**
     * Creates the class for a class declaration or expression. Shared by both evaluators.
     *
     * @param superValue the evaluated {@code extends} expression, ignored for a base class
     * @param keys evaluator for computed member keys, null when the class has none
     */
    public static JsClass define(Realm realm, Node node, Object superValue, Environment env, KeyEvaluator keys) {
        Node nameNode = node.get(0);
        String name = nameNode.type == NodeType.IDENT ? nameNode.getName() : node.getName();
        if (name == null) {
            name = "";
        }
        JsFunction superclass = null;
        JsObject parentPrototype = realm.objectPrototype;
        JsObject classProto = realm.functionPrototype;
        if (node.is(Node.DERIVED)) {
            if (superValue == null) {
                parentPrototype = null;
            } else if (superValue instanceof JsFunction fn && fn.isConstructor()) {
                superclass = fn;
                Object p = fn.get("prototype");
                parentPrototype = p instanceof JsObject o ? o : null;
                classProto = fn;
            } else {
                throw realm.typeError("Class extends value " + Display.inspect(superValue) + " is not a constructor or null");
            }
        }
        Environment scope = env;
        if (node.type == NodeType.CLASS_EXPR && nameNode.type == NodeType.IDENT) {
            scope = new Environment(env);
            scope.declare(name, BindingType.CONST, null, false);
        }
        JsObject prototype = new JsObject(parentPrototype);
        JsClass cls = new JsClass(classProto, name, node, prototype, superclass);
        for (Node member : node.get(2)) {
            Node keyNode = member.get(0);
            Node fnNode = member.get(1);
            boolean isStatic = member.is(Node.STATIC);
            if (member.is(Node.CONSTRUCTOR)) {
                JsClosure ctor = realm.newClosure(fnNode, scope, Terms.UNDEFINED, null, name);
                ctor.classConstructor = true;
                ctor.method = true;
                ctor.homeObject = prototype;
                ctor.ownerClass = cls;
                cls.constructor = ctor;
                continue;
            }
            String key;
            if (member.is(Node.COMPUTED)) {
                if (keys == null) {
                    throw new IllegalStateException("computed class member without key evaluator");
                }
                key = Terms.toPropertyKey(realm, keys.evalKey(keyNode));
            } else {
                key = keyNode.getName();
            }
            JsClosure method = realm.newClosure(fnNode, scope, Terms.UNDEFINED, null, key);
            method.method = true;
            method.homeObject = isStatic ? cls : prototype;
            method.ownerClass = cls;
            JsObject target = isStatic ? cls : prototype;
            if (member.is(Node.GETTER)) {
                target.defineAccessor(key, method, null, true);
            } else if (member.is(Node.SETTER)) {
                target.defineAccessor(key, null, method, true);
            } else {
                target.putHidden(key, method);
            }
        }
        if (!node.get(3).isEmpty()) {
            JsClosure init = realm.newClosure(node.get(3), scope, Terms.UNDEFINED, null, name);
            init.method = true;
            init.homeObject = prototype;
            init.ownerClass = cls;
            cls.fieldInitializer = init;
        }
        if (scope != env) {
            scope.initialize(name, cls);
        }
        if (!node.get(4).isEmpty()) {
            JsClosure init = realm.newClosure(node.get(4), scope, Terms.UNDEFINED, null, name);
            init.method = true;
            init.homeObject = cls;
            init.ownerClass = cls;
            init.call(realm, cls, new Object[0]);
        }
        return cls;
    }

}
