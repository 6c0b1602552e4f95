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

import java.util.Iterator;

/**
 * Suspendable invocation of a generator function under the tree-walk evaluator. Each
 * {@code next()} runs the body up to the following {@code yield}, replaying the completed
 * part of the body first.
 */
class GeneratorActivation extends Activation {

    enum State {
        SUSPENDED_START, SUSPENDED_YIELD, RUNNING, DONE
    }

    enum ResumeMode {
        NEXT, RETURN, THROW
    }

    // iterator behind a pending 'yield*'
    private static final class DelegateState {

        Iterator<Object> iterator;

    }

    private final Realm realm;
    private final JsClosure function;
    private final Object thisObject;
    private final Environment env;
    State state = State.SUSPENDED_START;

    private GeneratorActivation(Realm realm, JsClosure function, Object thisObject) {
        this.realm = realm;
        this.function = function;
        this.thisObject = thisObject;
        this.env = new Environment(function.env);
    }

    /**
     * Binds the arguments and returns the generator object; the body does not run until
     * the first {@code next()}.
     */
    static JsGenerator start(Realm realm, JsClosure function, Object thisObject, Object[] args, Realm.ActiveCall call) {
        GeneratorActivation activation = new GeneratorActivation(realm, function, thisObject);
        CoreContext context = new CoreContext(realm, function, thisObject, activation.env, activation, call);
        Interpreter.bindArguments(context, function, args);
        return new JsGenerator(realm.generatorPrototype, activation);
    }

    /**
     * Runs the body to the next {@code yield} or to completion.
     *
     * @return the iterator result object
     */
    JsObject resume(Object value, ResumeMode mode) {
        switch (state) {
            case RUNNING:
                throw realm.typeError("Generator is already running");
            case DONE:
                if (mode == ResumeMode.THROW) {
                    throw realm.userThrow(value);
                }
                return result(mode == ResumeMode.RETURN ? value : Terms.UNDEFINED, true);
            case SUSPENDED_START:
                if (mode != ResumeMode.NEXT) {
                    finish();
                    if (mode == ResumeMode.THROW) {
                        throw realm.userThrow(value);
                    }
                    return result(value, true);
                }
                break;
            default:
                if (mode == ResumeMode.RETURN) {
                    // pending finally blocks are skipped
                    finish();
                    return result(value, true);
                }
                prepareResume(value, mode == ResumeMode.THROW);
        }
        int depth = realm.getCallDepth();
        Realm.ActiveCall call = realm.enter(function.displayName(), function.node.token);
        state = State.RUNNING;
        try {
            CoreContext context = new CoreContext(realm, function, thisObject, env, this, call);
            Object returned = Interpreter.evalFunctionBody(context, function);
            finish();
            return result(returned, true);
        } catch (Suspend s) {
            state = State.SUSPENDED_YIELD;
            return result(s.value, false);
        } finally {
            if (state == State.RUNNING) {
                // the body threw
                finish();
            }
            realm.unwindTo(depth);
        }
    }

    private void finish() {
        state = State.DONE;
        replaying = false;
        clear();
    }

    private JsObject result(Object value, boolean done) {
        return JsIterator.result(realm, value, done);
    }

    /**
     * {@code yield* iterable}: suspends once per element of the delegate, then evaluates
     * to undefined.
     */
    Object delegate(Node node, CoreContext context) {
        DelegateState delegate = context.state(node, DelegateState::new);
        if (replaying) {
            resumed(realm);
        } else {
            delegate.iterator = PropertyAccess.iterator(realm, Interpreter.eval(node.get(0), context));
        }
        if (delegate.iterator.hasNext()) {
            throw new Suspend(delegate.iterator.next());
        }
        return Terms.UNDEFINED;
    }

}
