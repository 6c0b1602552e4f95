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

import io.twinjs.js.Binding;
import io.twinjs.js.BindingType;
import io.twinjs.js.Environment;
import io.twinjs.js.FunctionBody;
import io.twinjs.js.JsArray;
import io.twinjs.js.JsClass;
import io.twinjs.js.JsClosure;
import io.twinjs.js.JsException;
import io.twinjs.js.JsFunction;
import io.twinjs.js.JsObject;
import io.twinjs.js.JsPromise;
import io.twinjs.js.PropertyAccess;
import io.twinjs.js.Realm;
import io.twinjs.js.Terms;
import io.twinjs.parser.Node;
import io.twinjs.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Executes compiled chunks. One operand stack is shared by all frames of a realm; calls
 * between compiled closures push a frame on the same loop, anything else goes through the
 * function's own {@code call}, which bridges to the tree-walk evaluator where needed.
 * <p>
 * An {@code await} detaches the frame's part of the operand stack and resumes it from the
 * settled promise's reaction, so suspension never holds a Java thread.
 */
public class VirtualMachine {

    static final Logger logger = LoggerFactory.getLogger(VirtualMachine.class);

    // uninitialized let / const / class slot
    static final Object HOLE = new Object() {
        @Override
        public String toString() {
            return "<hole>";
        }
    };

    private static final Opcode[] OPCODES = Opcode.values();
    private static final TokenType[] TOKEN_TYPES = TokenType.values();
    private static final BindingType[] BINDING_TYPES = BindingType.values();
    private static final Object[] NO_ARGS = new Object[0];

    // for-in / for-of cursor, lives on the operand stack
    private static final class Cursor {

        final Iterator<?> items;

        Cursor(Iterator<?> items) {
            this.items = items;
        }

    }

    private final Realm realm;
    private final List<CallFrame> frames = new ArrayList<>();
    private Object[] stack = new Object[256];
    private int sp;

    public VirtualMachine(Realm realm) {
        this.realm = realm;
    }

    //==================================================================================================================
    // entry points

    public Object runProgram(Chunk chunk, Environment env) {
        CallFrame frame = new CallFrame(chunk, null, Terms.UNDEFINED, NO_ARGS, env, "<main>");
        return execute(frame);
    }

    /**
     * Runs a compiled closure to completion, or for an async closure until its first
     * suspension, and returns its result or promise.
     */
    public Object invoke(JsClosure fn, Object thisObject, Object[] args) {
        return execute(newFrame(fn, thisObject, args));
    }

    public int getFrameCount() {
        return frames.size();
    }

    private CallFrame newFrame(JsClosure fn, Object thisObject, Object[] args) {
        Chunk chunk = fn.getBody(realm).chunk;
        Object self = fn.isArrow() ? fn.getCapturedThis() : thisObject;
        CallFrame frame = new CallFrame(chunk, fn, self, args, new Environment(fn.getEnvironment()), fn.displayName());
        if (fn.isAsync()) {
            frame.promise = new JsPromise(realm);
        }
        frame.thisPending = fn.isDerivedConstructor();
        realm.getStats().incrementVmCalls();
        return frame;
    }

    private Object execute(CallFrame frame) {
        int entryDepth = frames.size();
        int entrySp = sp;
        pushFrame(frame);
        try {
            return run(entryDepth, null);
        } catch (RuntimeException | Error e) {
            abandon(entryDepth, entrySp);
            throw e;
        }
    }

    // drops frames left behind by an exception that escaped the run loop
    private void abandon(int entryDepth, int entrySp) {
        while (frames.size() > entryDepth) {
            CallFrame frame = frames.remove(frames.size() - 1);
            realm.unwindTo(frame.callDepth);
        }
        Arrays.fill(stack, entrySp, Math.max(entrySp, sp), null);
        sp = entrySp;
    }

    private void pushFrame(CallFrame frame) {
        frame.callDepth = realm.getCallDepth();
        realm.enter(frame.name, frame);
        frame.base = sp;
        frames.add(frame);
    }

    private void popFrame(CallFrame frame) {
        frames.remove(frames.size() - 1);
        realm.unwindTo(frame.callDepth);
        sp = frame.base;
    }

    //==================================================================================================================
    // async

    private void suspend(CallFrame frame, Object value) {
        frame.saved = Arrays.copyOfRange(stack, frame.base, sp);
        popFrame(frame);
        if (logger.isTraceEnabled()) {
            logger.trace("suspended: {}", frame);
        }
        JsPromise.resolved(realm, value).whenSettled(
                result -> resume(frame, result, false),
                reason -> resume(frame, reason, true));
    }

    private void resume(CallFrame frame, Object value, boolean rejected) {
        if (logger.isTraceEnabled()) {
            logger.trace("resumed: {}", frame);
        }
        int entryDepth = frames.size();
        int entrySp = sp;
        try {
            pushFrame(frame);
        } catch (JsException e) {
            frame.promise.reject(e.getValue());
            return;
        }
        Object[] saved = frame.saved;
        frame.saved = null;
        ensure(saved.length + 1);
        System.arraycopy(saved, 0, stack, sp, saved.length);
        sp += saved.length;
        JsException thrown = null;
        if (rejected) {
            thrown = realm.userThrow(value);
        } else {
            push(value);
        }
        try {
            run(entryDepth, thrown);
        } catch (RuntimeException | Error e) {
            abandon(entryDepth, entrySp);
            throw e;
        }
    }

    //==================================================================================================================
    // operand stack

    private void ensure(int extra) {
        if (sp + extra > stack.length) {
            stack = Arrays.copyOf(stack, Math.max(stack.length * 2, sp + extra));
        }
    }

    private void push(Object value) {
        if (sp == stack.length) {
            stack = Arrays.copyOf(stack, stack.length * 2);
        }
        stack[sp++] = value;
    }

    private Object pop() {
        Object value = stack[--sp];
        stack[sp] = null;
        return value;
    }

    private Object peek() {
        return stack[sp - 1];
    }

    private Object[] popArgs(int count) {
        if (count == 0) {
            return NO_ARGS;
        }
        Object[] args = new Object[count];
        sp -= count;
        System.arraycopy(stack, sp, args, 0, count);
        Arrays.fill(stack, sp, sp + count, null);
        return args;
    }

    //==================================================================================================================
    // run loop

    /**
     * Runs until the frame at {@code entryDepth} returns or suspends, dispatching exceptions to
     * the innermost handler of the frames above it.
     */
    private Object run(int entryDepth, JsException initial) {
        JsException thrown = initial;
        while (true) {
            if (thrown != null) {
                int top = sp;
                CallFrame frame = frames.get(frames.size() - 1);
                while (!frame.hasHandler()) {
                    popFrame(frame);
                    if (frame.promise != null) {
                        frame.promise.reject(thrown.getValue());
                        thrown = null;
                        if (frames.size() == entryDepth) {
                            return frame.promise;
                        }
                        push(frame.promise);
                        break;
                    }
                    if (frames.size() == entryDepth) {
                        throw thrown;
                    }
                    frame = frames.get(frames.size() - 1);
                }
                if (thrown != null) {
                    CallFrame.Handler handler = frame.popHandler();
                    sp = frame.base + handler.sp();
                    Arrays.fill(stack, sp, top, null);
                    frame.env = handler.env();
                    frame.ip = handler.target();
                    push(thrown);
                    thrown = null;
                }
            }
            try {
                return loop(entryDepth);
            } catch (JsException e) {
                thrown = e;
            } catch (StackOverflowError e) {
                thrown = realm.rangeError("Maximum call stack size exceeded");
            } catch (RuntimeException e) {
                thrown = realm.wrap(e);
            }
        }
    }

    private Object loop(int entryDepth) {
        boolean trace = logger.isTraceEnabled();
        while (true) {
            CallFrame frame = frames.get(frames.size() - 1);
            int[] code = frame.chunk.code;
            Object[] constants = frame.chunk.constants;
            int ip = frame.ip;
            Opcode op = OPCODES[code[ip]];
            frame.pc = ip;
            frame.ip = ip + 1 + op.operands;
            if (trace) {
                logger.trace("{} {} {}", frame.name, ip, op);
            }
            switch (op) {
                case CONST:
                    push(constants[code[ip + 1]]);
                    break;
                case UNDEFINED:
                    push(Terms.UNDEFINED);
                    break;
                case NULL:
                    push(null);
                    break;
                case TRUE:
                    push(Boolean.TRUE);
                    break;
                case FALSE:
                    push(Boolean.FALSE);
                    break;
                case POP:
                    pop();
                    break;
                case DUP:
                    push(peek());
                    break;
                case DUP2: {
                    Object a = stack[sp - 2];
                    Object b = stack[sp - 1];
                    push(a);
                    push(b);
                    break;
                }
                case SWAP: {
                    Object top = stack[sp - 1];
                    stack[sp - 1] = stack[sp - 2];
                    stack[sp - 2] = top;
                    break;
                }

                // slots
                case LOAD_SLOT:
                    push(checkSlot(frame, code[ip + 1]));
                    break;
                case STORE_SLOT: {
                    int slot = code[ip + 1];
                    checkSlot(frame, slot);
                    frame.slots[slot] = peek();
                    break;
                }
                case INIT_SLOT:
                    frame.slots[code[ip + 1]] = pop();
                    break;
                case CLEAR_SLOT:
                    frame.slots[code[ip + 1]] = HOLE;
                    break;
                case CONST_ERROR:
                    checkSlot(frame, code[ip + 1]);
                    throw realm.typeError("Assignment to constant variable.");

                // names
                case LOAD_NAME:
                    push(frame.env.get(realm, (String) constants[code[ip + 1]]));
                    break;
                case STORE_NAME:
                    frame.env.assign(realm, (String) constants[code[ip + 1]], peek());
                    break;
                case DECLARE_VAR: {
                    String name = (String) constants[code[ip + 1]];
                    if (!frame.env.hasOwn(name)) {
                        frame.env.declare(name, BindingType.VAR, Terms.UNDEFINED);
                    }
                    break;
                }
                case DECLARE:
                    frame.env.declare((String) constants[code[ip + 1]], BINDING_TYPES[code[ip + 2]], pop());
                    break;
                case DECLARE_HOLE:
                    frame.env.declare((String) constants[code[ip + 1]], BINDING_TYPES[code[ip + 2]], Terms.UNDEFINED, false);
                    break;
                case INIT_NAME: {
                    String name = (String) constants[code[ip + 1]];
                    Object value = pop();
                    Binding binding = frame.env.getOwn(name);
                    if (binding != null && !binding.isInitialized()) {
                        frame.env.initialize(name, value);
                    } else {
                        frame.env.declare(name, BINDING_TYPES[code[ip + 2]], value);
                    }
                    break;
                }
                case TYPEOF_NAME: {
                    String name = (String) constants[code[ip + 1]];
                    push(frame.env.find(realm, name) == null ? "undefined" : Terms.typeOf(frame.env.get(realm, name)));
                    break;
                }
                case PUSH_SCOPE:
                    frame.env = new Environment(frame.env);
                    break;
                case POP_SCOPE:
                    frame.env = frame.env.getParent();
                    break;
                case COPY_SCOPE:
                    frame.env = frame.env.copy();
                    break;
                case LOAD_THIS:
                    if (frame.thisPending) {
                        throw realm.referenceError(JsClass.SUPER_NOT_CALLED);
                    }
                    push(frame.thisObject);
                    break;
                case ARG: {
                    int index = code[ip + 1];
                    push(index < frame.args.length ? frame.args[index] : Terms.UNDEFINED);
                    break;
                }
                case REST_ARGS: {
                    List<Object> rest = new ArrayList<>();
                    for (int i = code[ip + 1]; i < frame.args.length; i++) {
                        rest.add(frame.args[i]);
                    }
                    push(new JsArray(realm.arrayPrototype, rest));
                    break;
                }

                // properties
                case GET_PROP:
                    push(PropertyAccess.get(realm, pop(), (String) constants[code[ip + 1]]));
                    break;
                case GET_INDEX: {
                    Object key = pop();
                    push(PropertyAccess.getIndex(realm, pop(), key));
                    break;
                }
                case SET_PROP: {
                    Object value = pop();
                    PropertyAccess.set(realm, pop(), (String) constants[code[ip + 1]], value);
                    push(value);
                    break;
                }
                case SET_INDEX: {
                    Object value = pop();
                    Object key = pop();
                    PropertyAccess.setIndex(realm, pop(), key, value);
                    push(value);
                    break;
                }
                case DELETE_PROP:
                    push(PropertyAccess.delete(realm, pop(), constants[code[ip + 1]]));
                    break;
                case DELETE_INDEX: {
                    Object key = pop();
                    push(PropertyAccess.delete(realm, pop(), key));
                    break;
                }
                case GET_SUPER:
                    push(JsClass.superGet(realm, homeObject(frame), (String) constants[code[ip + 1]], frame.thisObject));
                    break;
                case SUPER_INDEX:
                    push(JsClass.superGet(realm, homeObject(frame), Terms.toPropertyKey(realm, pop()), frame.thisObject));
                    break;
                case UPDATE_PROP: {
                    Object object = pop();
                    String key = (String) constants[code[ip + 1]];
                    int flags = code[ip + 2];
                    double old = Terms.toNumber(realm, PropertyAccess.get(realm, object, key));
                    double updated = (flags & Opcode.INCREMENT) != 0 ? old + 1 : old - 1;
                    PropertyAccess.set(realm, object, key, Terms.narrow(updated));
                    push(Terms.narrow((flags & Opcode.PREFIX) != 0 ? updated : old));
                    break;
                }
                case UPDATE_INDEX: {
                    Object key = pop();
                    Object object = pop();
                    int flags = code[ip + 1];
                    double old = Terms.toNumber(realm, PropertyAccess.getIndex(realm, object, key));
                    double updated = (flags & Opcode.INCREMENT) != 0 ? old + 1 : old - 1;
                    PropertyAccess.setIndex(realm, object, key, Terms.narrow(updated));
                    push(Terms.narrow((flags & Opcode.PREFIX) != 0 ? updated : old));
                    break;
                }

                // operators
                case ADD: {
                    Object rhs = pop();
                    push(Terms.add(realm, pop(), rhs));
                    break;
                }
                case SUB: {
                    Object rhs = pop();
                    Object lhs = pop();
                    if (lhs instanceof Integer a && rhs instanceof Integer b) {
                        push(Terms.narrow((double) a - b));
                    } else {
                        push(Terms.binary(realm, TokenType.MINUS, lhs, rhs));
                    }
                    break;
                }
                case LT: {
                    Object rhs = pop();
                    Object lhs = pop();
                    if (lhs instanceof Integer a && rhs instanceof Integer b) {
                        push(a < b);
                    } else {
                        push(Terms.binary(realm, TokenType.LT, lhs, rhs));
                    }
                    break;
                }
                case BINARY: {
                    Object rhs = pop();
                    push(Terms.binary(realm, TOKEN_TYPES[code[ip + 1]], pop(), rhs));
                    break;
                }
                case UNARY:
                    push(Terms.unary(realm, TOKEN_TYPES[code[ip + 1]], pop()));
                    break;
                case NOT:
                    push(!Terms.isTruthy(pop()));
                    break;
                case TO_NUMBER:
                    push(Terms.narrow(Terms.toNumber(realm, pop())));
                    break;
                case TO_STRING:
                    push(Terms.toStr(realm, pop()));
                    break;
                case INC:
                    push(Terms.narrow(((Number) pop()).doubleValue() + 1));
                    break;
                case DEC:
                    push(Terms.narrow(((Number) pop()).doubleValue() - 1));
                    break;

                // jumps
                case JUMP:
                    frame.ip = code[ip + 1];
                    break;
                case JUMP_IF_FALSE:
                    if (!Terms.isTruthy(pop())) {
                        frame.ip = code[ip + 1];
                    }
                    break;
                case JUMP_IF_TRUE:
                    if (Terms.isTruthy(pop())) {
                        frame.ip = code[ip + 1];
                    }
                    break;
                case JUMP_IF_FALSE_KEEP:
                    if (!Terms.isTruthy(peek())) {
                        frame.ip = code[ip + 1];
                    } else {
                        pop();
                    }
                    break;
                case JUMP_IF_TRUE_KEEP:
                    if (Terms.isTruthy(peek())) {
                        frame.ip = code[ip + 1];
                    } else {
                        pop();
                    }
                    break;
                case JUMP_IF_NULLISH:
                    if (Terms.isNullish(peek())) {
                        frame.ip = code[ip + 1];
                    }
                    break;
                case JUMP_IF_NOT_NULLISH:
                    if (!Terms.isNullish(peek())) {
                        frame.ip = code[ip + 1];
                    } else {
                        pop();
                    }
                    break;
                case JUMP_IF_DEFINED:
                    if (peek() != Terms.UNDEFINED) {
                        frame.ip = code[ip + 1];
                    } else {
                        pop();
                    }
                    break;

                // calls
                case CALL: {
                    Object[] args = popArgs(code[ip + 1]);
                    Object fn = pop();
                    Object self = pop();
                    call(fn, self, args, (String) constants[code[ip + 2]]);
                    break;
                }
                case CALL_SPREAD: {
                    Object[] args = ((JsArray) pop()).toList().toArray();
                    Object fn = pop();
                    Object self = pop();
                    call(fn, self, args, (String) constants[code[ip + 1]]);
                    break;
                }
                case NEW: {
                    Object[] args = popArgs(code[ip + 1]);
                    push(construct(pop(), args, (String) constants[code[ip + 2]]));
                    break;
                }
                case NEW_SPREAD: {
                    Object[] args = ((JsArray) pop()).toList().toArray();
                    push(construct(pop(), args, (String) constants[code[ip + 1]]));
                    break;
                }
                case SUPER_CALL: {
                    Object[] args = popArgs(code[ip + 1]);
                    JsClass owner = frame.closure == null ? null : frame.closure.getOwnerClass();
                    if (frame.closure != null && frame.closure.isDerivedConstructor() && !frame.thisPending) {
                        throw realm.referenceError(JsClass.SUPER_CALLED_TWICE);
                    }
                    push(JsClass.superConstruct(realm, owner, frame.thisObject, args));
                    frame.thisPending = false;
                    break;
                }
                case RETURN: {
                    Object value = pop();
                    if (frame.thisPending && !(value instanceof JsObject)) {
                        throw realm.referenceError(JsClass.SUPER_NOT_CALLED);
                    }
                    popFrame(frame);
                    if (frame.promise != null) {
                        frame.promise.resolve(value);
                        value = frame.promise;
                    }
                    if (frames.size() == entryDepth) {
                        return value;
                    }
                    push(value);
                    break;
                }
                case AWAIT: {
                    Object value = pop();
                    suspend(frame, value);
                    if (frames.size() == entryDepth) {
                        return frame.promise;
                    }
                    push(frame.promise);
                    break;
                }

                // literals
                case ARRAY: {
                    Object[] items = popArgs(code[ip + 1]);
                    push(new JsArray(realm.arrayPrototype, new ArrayList<>(Arrays.asList(items))));
                    break;
                }
                case ARRAY_PUSH: {
                    Object value = pop();
                    ((JsArray) peek()).add(value);
                    break;
                }
                case ARRAY_SPREAD: {
                    List<Object> items = PropertyAccess.iterate(realm, pop());
                    JsArray array = (JsArray) peek();
                    for (Object item : items) {
                        array.add(item);
                    }
                    break;
                }
                case OBJECT:
                    push(new JsObject(realm.objectPrototype));
                    break;
                case INIT_PROP: {
                    Object value = pop();
                    ((JsObject) peek()).put((String) constants[code[ip + 1]], value);
                    break;
                }
                case INIT_INDEX: {
                    Object value = pop();
                    String key = Terms.toPropertyKey(realm, pop());
                    JsObject object = (JsObject) peek();
                    int flags = code[ip + 1];
                    if (value instanceof JsClosure closure) {
                        if ((flags & Opcode.METHOD) != 0) {
                            closure.setHomeObject(object);
                        }
                        if (flags != 0) {
                            closure.inferName(key);
                        }
                    }
                    object.put(key, value);
                    break;
                }
                case INIT_METHOD: {
                    JsClosure method = (JsClosure) pop();
                    JsObject object = (JsObject) peek();
                    String key = (String) constants[code[ip + 1]];
                    method.setHomeObject(object);
                    method.inferName(key);
                    object.put(key, method);
                    break;
                }
                case INIT_ACCESSOR: {
                    JsClosure accessor = (JsClosure) pop();
                    JsObject object = (JsObject) peek();
                    String key = (String) constants[code[ip + 1]];
                    accessor.setHomeObject(object);
                    accessor.inferName(key);
                    boolean getter = code[ip + 2] == Opcode.GETTER;
                    object.defineAccessor(key, getter ? accessor : null, getter ? null : accessor, false);
                    break;
                }
                case OBJECT_SPREAD: {
                    Object source = pop();
                    PropertyAccess.copyOwn(realm, (JsObject) peek(), source, null);
                    break;
                }
                case CLOSURE:
                    push(realm.newClosure((Node) constants[code[ip + 1]], frame.env, frame.thisObject, frame.closure, null));
                    break;
                case CLASS: {
                    Object superValue = pop();
                    push(JsClass.define(realm, (Node) constants[code[ip + 1]], superValue, frame.env, null));
                    break;
                }
                case CONCAT: {
                    Object[] parts = popArgs(code[ip + 1]);
                    StringBuilder sb = new StringBuilder();
                    for (Object part : parts) {
                        sb.append((String) part);
                    }
                    push(sb.toString());
                    break;
                }

                // exceptions
                case THROW:
                    throw realm.userThrow(pop());
                case RETHROW:
                    throw (JsException) pop();
                case TRY_BEGIN:
                    frame.pushHandler(code[ip + 1], sp);
                    break;
                case TRY_END:
                    frame.popHandler();
                    break;
                case EXC_VALUE:
                    push(((JsException) pop()).getValue());
                    break;

                // iteration
                case ITER_INIT:
                    push(new Cursor(PropertyAccess.iterator(realm, pop())));
                    break;
                case KEYS_INIT:
                    push(new Cursor(new ArrayList<>(PropertyAccess.forInKeys(pop())).iterator()));
                    break;
                case ITER_NEXT: {
                    Cursor cursor = (Cursor) peek();
                    if (cursor.items.hasNext()) {
                        push(cursor.items.next());
                    } else {
                        frame.ip = code[ip + 1];
                    }
                    break;
                }

                case SET_COMPLETION:
                    frame.completion = pop();
                    break;
                case GET_COMPLETION:
                    push(frame.completion);
                    break;
                default:
                    throw new IllegalStateException("unknown opcode: " + op);
            }
        }
    }

    private Object checkSlot(CallFrame frame, int slot) {
        Object value = frame.slots[slot];
        if (value == HOLE) {
            throw realm.referenceError("Cannot access '" + frame.chunk.slotNames[slot] + "' before initialization");
        }
        return value;
    }

    private static JsObject homeObject(CallFrame frame) {
        return frame.closure == null ? null : frame.closure.getHomeObject();
    }

    private void call(Object fn, Object self, Object[] args, String description) {
        if (!(fn instanceof JsFunction function)) {
            throw realm.typeError(description + " is not a function");
        }
        if (function instanceof JsClosure closure && closure.getBody(realm).kind == FunctionBody.Kind.COMPILED) {
            // stays on this loop
            pushFrame(newFrame(closure, self, args));
            return;
        }
        push(realm.call(function, self, args));
    }

    private Object construct(Object callee, Object[] args, String description) {
        if (!(callee instanceof JsFunction fn) || !fn.isConstructor()) {
            throw realm.typeError(description + " is not a constructor");
        }
        return realm.construct(fn, args);
    }

}
