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
import java.util.function.Consumer;

/**
 * Promise state machine. Settling is one-shot and immediately queues the reactions of the
 * matching queue, in registration order, as microtasks.
 */
public class JsPromise extends JsObject {

    public enum State {
        PENDING, FULFILLED, REJECTED
    }

    private static class Reaction {

        final Object onFulfilled;
        final Object onRejected;
        final JsPromise derived;
        final Consumer<Object> hostFulfilled;
        final Consumer<Object> hostRejected;

        Reaction(Object onFulfilled, Object onRejected, JsPromise derived) {
            this.onFulfilled = onFulfilled;
            this.onRejected = onRejected;
            this.derived = derived;
            this.hostFulfilled = null;
            this.hostRejected = null;
        }

        Reaction(Consumer<Object> hostFulfilled, Consumer<Object> hostRejected) {
            this.onFulfilled = null;
            this.onRejected = null;
            this.derived = null;
            this.hostFulfilled = hostFulfilled;
            this.hostRejected = hostRejected;
        }

    }

    private final Realm realm;
    private State state = State.PENDING;
    private Object result = Terms.UNDEFINED;
    // true once resolve() locked this promise in to another thenable
    private boolean resolving;
    private boolean handled;
    private List<Reaction> fulfillReactions = new ArrayList<>();
    private List<Reaction> rejectReactions = new ArrayList<>();

    public JsPromise(Realm realm) {
        this(realm, realm.promisePrototype);
    }

    JsPromise(Realm realm, JsObject proto) {
        super(proto);
        this.realm = realm;
    }

    public State getState() {
        return state;
    }

    public Object getResult() {
        return result;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    /**
     * Promise already settled with, or following, the given value.
     */
    public static JsPromise resolved(Realm realm, Object value) {
        if (value instanceof JsPromise p) {
            return p;
        }
        JsPromise promise = new JsPromise(realm);
        promise.resolve(value);
        return promise;
    }

    public static JsPromise rejected(Realm realm, Object reason) {
        JsPromise promise = new JsPromise(realm);
        promise.reject(reason);
        return promise;
    }

    public void resolve(Object value) {
        if (state != State.PENDING || resolving) {
            return;
        }
        if (value == this) {
            settle(State.REJECTED, realm.typeError("Chaining cycle detected for promise").getValue());
            return;
        }
        if (value instanceof JsPromise other) {
            resolving = true;
            realm.eventLoop.queueMicrotask(() -> other.whenSettled(this::adopt, this::adoptRejection));
            return;
        }
        if (value instanceof JsObject object) {
            Object then = object.get("then");
            if (then instanceof JsFunction fn) {
                resolving = true;
                JsNativeFunction onFulfilled = new JsNativeFunction(realm.functionPrototype, "", (r, t, args) -> {
                    adopt(arg(args));
                    return Terms.UNDEFINED;
                });
                JsNativeFunction onRejected = new JsNativeFunction(realm.functionPrototype, "", (r, t, args) -> {
                    adoptRejection(arg(args));
                    return Terms.UNDEFINED;
                });
                realm.eventLoop.queueMicrotask(() -> {
                    try {
                        fn.call(realm, object, new Object[]{onFulfilled, onRejected});
                    } catch (JsException e) {
                        adoptRejection(e.getValue());
                    }
                });
                return;
            }
        }
        settle(State.FULFILLED, value);
    }

    public void reject(Object reason) {
        if (state != State.PENDING || resolving) {
            return;
        }
        settle(State.REJECTED, reason);
    }

    private void adopt(Object value) {
        resolving = false;
        resolve(value);
    }

    private void adoptRejection(Object reason) {
        resolving = false;
        reject(reason);
    }

    private static Object arg(Object[] args) {
        return args.length == 0 ? Terms.UNDEFINED : args[0];
    }

    private void settle(State newState, Object value) {
        state = newState;
        result = value;
        List<Reaction> reactions = newState == State.FULFILLED ? fulfillReactions : rejectReactions;
        fulfillReactions = null;
        rejectReactions = null;
        for (Reaction reaction : reactions) {
            schedule(reaction);
        }
        if (newState == State.REJECTED && !handled) {
            realm.trackRejection(this);
        }
    }

    private void schedule(Reaction reaction) {
        boolean fulfilled = state == State.FULFILLED;
        Object value = result;
        realm.eventLoop.queueMicrotask(() -> runReaction(reaction, fulfilled, value));
    }

    private void runReaction(Reaction reaction, boolean fulfilled, Object value) {
        if (reaction.derived == null) {
            (fulfilled ? reaction.hostFulfilled : reaction.hostRejected).accept(value);
            return;
        }
        Object handler = fulfilled ? reaction.onFulfilled : reaction.onRejected;
        if (!(handler instanceof JsFunction fn)) {
            if (fulfilled) {
                reaction.derived.resolve(value);
            } else {
                reaction.derived.reject(value);
            }
            return;
        }
        try {
            reaction.derived.resolve(fn.call(realm, Terms.UNDEFINED, new Object[]{value}));
        } catch (JsException e) {
            reaction.derived.reject(e.getValue());
        }
    }

    private void register(Reaction reaction) {
        if (!handled) {
            handled = true;
            realm.untrackRejection(this);
        }
        if (state == State.PENDING) {
            fulfillReactions.add(reaction);
            rejectReactions.add(reaction);
        } else {
            schedule(reaction);
        }
    }

    public JsPromise then(Object onFulfilled, Object onRejected) {
        JsPromise derived = new JsPromise(realm);
        register(new Reaction(onFulfilled, onRejected, derived));
        return derived;
    }

    /**
     * Host reaction, used by {@code await} in both evaluators.
     */
    public void whenSettled(Consumer<Object> onFulfilled, Consumer<Object> onRejected) {
        register(new Reaction(onFulfilled, onRejected));
    }

}
