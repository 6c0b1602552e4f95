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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Generator object returned by calling a {@code function*}.
 */
public class JsGenerator extends JsObject {

    private final GeneratorActivation activation;

    JsGenerator(JsObject proto, GeneratorActivation activation) {
        super(proto);
        this.activation = activation;
    }

    public boolean isDone() {
        return activation.state == GeneratorActivation.State.DONE;
    }

    JsObject next(Object value) {
        return activation.resume(value, GeneratorActivation.ResumeMode.NEXT);
    }

    JsObject doReturn(Object value) {
        return activation.resume(value, GeneratorActivation.ResumeMode.RETURN);
    }

    JsObject doThrow(Object value) {
        return activation.resume(value, GeneratorActivation.ResumeMode.THROW);
    }

    /**
     * Java view for for-of and spread, advancing the generator one element at a time.
     */
    Iterator<Object> iterator() {
        return new Iterator<>() {

            private Object pending;
            private boolean ready;

            @Override
            public boolean hasNext() {
                if (!ready && !isDone()) {
                    JsObject result = JsGenerator.this.next(Terms.UNDEFINED);
                    if (!Terms.isTruthy(result.get("done"))) {
                        pending = result.get("value");
                        ready = true;
                    }
                }
                return ready;
            }

            @Override
            public Object next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ready = false;
                Object value = pending;
                pending = null;
                return value;
            }

        };
    }

}
