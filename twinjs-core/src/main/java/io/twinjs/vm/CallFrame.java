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
package io.twinjs.vm;

import io.twinjs.js.Environment;
import io.twinjs.js.JsClosure;
import io.twinjs.js.JsPromise;
import io.twinjs.js.Terms;
import io.twinjs.parser.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * One VM invocation: the chunk, its position, its window on the shared operand stack and
 * its scope. An async frame carries its result promise and, while suspended, the detached
 * part of the operand stack.
 */
public class CallFrame {

    record Handler(int target, int sp, Environment env) {
    }

    final Chunk chunk;
    // null for the program
    final JsClosure closure;
    final Object thisObject;
    final Object[] args;
    final Object[] slots;
    final String name;
    Environment env;

    // next instruction
    int ip;
    // instruction being executed, for positions
    int pc;
    // stack height at entry
    int base;
    // realm call depth before the frame was entered
    int callDepth;
    List<Handler> handlers;
    JsPromise promise;
    Object completion = Terms.UNDEFINED;
    Object[] saved;
    // derived constructor before super() returns
    boolean thisPending;

    CallFrame(Chunk chunk, JsClosure closure, Object thisObject, Object[] args, Environment env, String name) {
        this.chunk = chunk;
        this.closure = closure;
        this.thisObject = thisObject;
        this.args = args;
        this.env = env;
        this.name = name;
        slots = new Object[chunk.slotNames.length];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = chunk.lexicalSlots[i] ? VirtualMachine.HOLE : Terms.UNDEFINED;
        }
    }

    void pushHandler(int target, int sp) {
        if (handlers == null) {
            handlers = new ArrayList<>(2);
        }
        handlers.add(new Handler(target, sp - base, env));
    }

    Handler popHandler() {
        return handlers.remove(handlers.size() - 1);
    }

    boolean hasHandler() {
        return handlers != null && !handlers.isEmpty();
    }

    public String getName() {
        return name;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public SourcePosition getPosition() {
        return chunk.getPosition(pc);
    }

    @Override
    public String toString() {
        return name + "@" + pc;
    }

}
