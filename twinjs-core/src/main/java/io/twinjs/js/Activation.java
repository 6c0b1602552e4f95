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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Tree-walk invocation that can suspend at an {@code await} or {@code yield} and later
 * resume where it stopped.
 * <p>
 * Suspension unwinds the Java stack with {@link Suspend}. Resumption evaluates the body again
 * in replay mode: nodes completed on the path to the pending suspension point return their
 * recorded values, scopes and loop states are the saved ones, and the pending point produces
 * the resume value. From there on evaluation runs normally.
 */
abstract class Activation {

    /**
     * Unwinds to the activation driver. Never observable by JS code, so {@code finally}
     * blocks do not run for it.
     */
    static final class Suspend extends RuntimeException {

        final transient Object value;

        Suspend(Object value) {
            super(null, null, false, false);
            this.value = value;
        }

    }

    // completed node values along the active path
    final Map<Node, Object> values = new IdentityHashMap<>();
    // scopes, loop and try state keyed by node
    final Map<Node, Object> states = new IdentityHashMap<>();
    boolean replaying;
    private Object resumeValue;
    private boolean resumeRejected;

    void prepareResume(Object value, boolean rejected) {
        replaying = true;
        resumeValue = value;
        resumeRejected = rejected;
    }

    /**
     * The resume value of the pending suspension point, thrown when resumed with an error.
     */
    Object resumed(Realm realm) {
        replaying = false;
        Object value = resumeValue;
        resumeValue = null;
        if (resumeRejected) {
            throw realm.userThrow(value);
        }
        return value;
    }

    /**
     * Evaluates a suspension point: the resume value of the pending one when replaying,
     * otherwise the operand followed by suspension.
     */
    Object suspendAt(Node node, CoreContext context) {
        if (replaying) {
            return resumed(context.realm);
        }
        Object value = Interpreter.eval(node.get(0), context);
        throw new Suspend(value);
    }

    void clear() {
        values.clear();
        states.clear();
    }

}
