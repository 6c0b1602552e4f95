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
 * Suspendable invocation of an async function under the tree-walk evaluator. Each
 * {@code await} suspends and registers a reaction on the awaited promise that resumes it.
 */
class AsyncActivation extends Activation {

    private final Realm realm;
    private final JsClosure function;
    private final Object thisObject;
    private final Object[] args;
    private final Environment env;
    final JsPromise promise;

    private int suspensions;

    private AsyncActivation(Realm realm, JsClosure function, Object thisObject, Object[] args) {
        this.realm = realm;
        this.function = function;
        this.thisObject = thisObject;
        this.args = args;
        this.env = new Environment(function.env);
        this.promise = new JsPromise(realm);
    }

    static JsPromise start(Realm realm, JsClosure function, Object thisObject, Object[] args, Realm.ActiveCall call) {
        AsyncActivation activation = new AsyncActivation(realm, function, thisObject, args);
        activation.step(call, true);
        return activation.promise;
    }

    private void step(Realm.ActiveCall call, boolean first) {
        CoreContext context = new CoreContext(realm, function, thisObject, env, this, call);
        try {
            if (first) {
                Interpreter.bindArguments(context, function, args);
            }
            promise.resolve(Interpreter.evalFunctionBody(context, function));
        } catch (Suspend s) {
            suspensions++;
            JsPromise.resolved(realm, s.value).whenSettled(v -> resume(v, false), r -> resume(r, true));
        } catch (JsException e) {
            promise.reject(e.getValue());
        }
    }

    private void resume(Object value, boolean rejected) {
        prepareResume(value, rejected);
        int depth = realm.getCallDepth();
        if (Interpreter.logger.isTraceEnabled()) {
            Interpreter.logger.trace("resume {} after {} suspensions", function.displayName(), suspensions);
        }
        try {
            Realm.ActiveCall call = realm.enter(function.displayName(), function.node.token);
            step(call, false);
        } catch (JsException e) {
            promise.reject(e.getValue());
        } catch (StackOverflowError e) {
            realm.unwindTo(depth);
            promise.reject(realm.rangeError("Maximum call stack size exceeded").getValue());
        } finally {
            realm.unwindTo(depth);
        }
    }

}
