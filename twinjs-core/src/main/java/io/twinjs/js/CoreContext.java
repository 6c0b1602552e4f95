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

import java.util.function.Supplier;

/**
 * State of one tree-walk activation: the current scope, {@code this}, the executing function
 * and the pending non-local exit. Thrown values travel as {@link JsException} instead.
 */
class CoreContext {

    enum ExitType {
        BREAK, CONTINUE, RETURN
    }

    final Realm realm;
    // null at the top level of a program or module
    final JsClosure function;
    final Object thisObject;
    // null unless the body can suspend
    final Activation activation;
    final Realm.ActiveCall call;
    ModuleRecord module;

    Environment env;
    // inside a derived constructor until super() returns
    boolean thisPending;
    // value of the last top-level expression statement, the result of a program
    Object completion = Terms.UNDEFINED;

    private ExitType exitType;
    private Object returnValue;

    CoreContext(Realm realm, JsClosure function, Object thisObject, Environment env, Activation activation, Realm.ActiveCall call) {
        this.realm = realm;
        this.function = function;
        this.thisObject = thisObject;
        this.env = env;
        this.activation = activation;
        this.call = call;
        this.thisPending = function != null && function.isDerivedConstructor();
    }

    Object thisValue() {
        if (thisPending) {
            throw realm.referenceError(JsClass.SUPER_NOT_CALLED);
        }
        return thisObject;
    }

    void mark(Node node) {
        call.setToken(node.token);
    }

    //==================================================================================================================
    // non-local exits

    Object stopAndBreak() {
        exitType = ExitType.BREAK;
        returnValue = null;
        return Terms.UNDEFINED;
    }

    Object stopAndContinue() {
        exitType = ExitType.CONTINUE;
        returnValue = null;
        return Terms.UNDEFINED;
    }

    Object stopAndReturn(Object value) {
        exitType = ExitType.RETURN;
        returnValue = value;
        return value;
    }

    boolean isStopped() {
        return exitType != null;
    }

    ExitType getExitType() {
        return exitType;
    }

    Object getReturnValue() {
        return returnValue;
    }

    void reset() {
        exitType = null;
        returnValue = null;
    }

    void restore(ExitType exitType, Object returnValue) {
        this.exitType = exitType;
        this.returnValue = returnValue;
    }

    //==================================================================================================================
    // replay

    /**
     * A value computed once per evaluation of {@code node}, reproduced when a suspended
     * activation replays its way back to the pending {@code await} or {@code yield}.
     */
    Object remember(Node node, Supplier<Object> supplier) {
        if (activation == null) {
            return supplier.get();
        }
        if (activation.replaying && activation.values.containsKey(node)) {
            return activation.values.get(node);
        }
        Object value = supplier.get();
        activation.values.put(node, value);
        return value;
    }

    /**
     * Per-node state that must survive a suspension: a scope, loop iteration or try phase.
     * Fresh state is created and saved while running, the saved one is returned when replaying.
     */
    @SuppressWarnings("unchecked")
    <T> T state(Node node, Supplier<T> factory) {
        if (activation == null) {
            return factory.get();
        }
        if (activation.replaying) {
            Object saved = activation.states.get(node);
            if (saved != null) {
                return (T) saved;
            }
        }
        T value = factory.get();
        activation.states.put(node, value);
        return value;
    }

    boolean isReplaying() {
        return activation != null && activation.replaying;
    }

    void saveState(Node node, Object state) {
        if (activation != null) {
            activation.states.put(node, state);
        }
    }

}
