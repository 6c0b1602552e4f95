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

/**
 * Instruction set of the stack VM. Operands are ints stored inline after the opcode; the
 * count is fixed per opcode. Jump operands are absolute code offsets.
 */
public enum Opcode {

    // constants and stack
    CONST(1),
    UNDEFINED(0),
    NULL(0),
    TRUE(0),
    FALSE(0),
    POP(0),
    DUP(0),
    DUP2(0),
    SWAP(0),

    // locals in frame slots
    LOAD_SLOT(1),
    STORE_SLOT(1),
    INIT_SLOT(1),
    CLEAR_SLOT(1),
    CONST_ERROR(1),

    // names resolved through the scope chain
    LOAD_NAME(1),
    STORE_NAME(1),
    DECLARE_VAR(1),
    DECLARE(2),
    DECLARE_HOLE(2),
    INIT_NAME(2),
    TYPEOF_NAME(1),
    PUSH_SCOPE(0),
    POP_SCOPE(0),
    COPY_SCOPE(0),
    LOAD_THIS(0),
    ARG(1),
    REST_ARGS(1),

    // properties
    GET_PROP(1),
    GET_INDEX(0),
    SET_PROP(1),
    SET_INDEX(0),
    DELETE_PROP(1),
    DELETE_INDEX(0),
    GET_SUPER(1),
    SUPER_INDEX(0),
    UPDATE_PROP(2),
    UPDATE_INDEX(1),

    // operators
    ADD(0),
    SUB(0),
    LT(0),
    BINARY(1),
    UNARY(1),
    NOT(0),
    TO_NUMBER(0),
    TO_STRING(0),
    INC(0),
    DEC(0),

    // control flow
    JUMP(1),
    JUMP_IF_FALSE(1),
    JUMP_IF_TRUE(1),
    JUMP_IF_FALSE_KEEP(1),
    JUMP_IF_TRUE_KEEP(1),
    JUMP_IF_NULLISH(1),
    JUMP_IF_NOT_NULLISH(1),
    JUMP_IF_DEFINED(1),

    // calls
    CALL(2),
    NEW(2),
    CALL_SPREAD(1),
    NEW_SPREAD(1),
    SUPER_CALL(1),
    RETURN(0),
    AWAIT(0),

    // literals
    ARRAY(1),
    ARRAY_PUSH(0),
    ARRAY_SPREAD(0),
    OBJECT(0),
    INIT_PROP(1),
    INIT_INDEX(1),
    INIT_METHOD(1),
    INIT_ACCESSOR(2),
    OBJECT_SPREAD(0),
    CLOSURE(1),
    CLASS(1),
    CONCAT(1),

    // exceptions
    THROW(0),
    RETHROW(0),
    TRY_BEGIN(1),
    TRY_END(0),
    EXC_VALUE(0),

    // iteration
    ITER_INIT(0),
    KEYS_INIT(0),
    ITER_NEXT(1),

    // program completion value
    SET_COMPLETION(0),
    GET_COMPLETION(0);

    public final int operands;

    Opcode(int operands) {
        this.operands = operands;
    }

    // flags of UPDATE_PROP / UPDATE_INDEX
    static final int INCREMENT = 1;
    static final int PREFIX = 2;

    // flags of INIT_INDEX
    static final int NAME_FUNCTION = 1;
    static final int METHOD = 2;

    // kinds of INIT_ACCESSOR
    static final int GETTER = 1;
    static final int SETTER = 2;

}
