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
package io.twinjs.parser;

/**
 * AST node kinds. Child layout per kind is fixed by {@link JsParser}; absent optional
 * parts are represented by an {@link #EMPTY} child so positions stay stable.
 */
public enum NodeType {

    EMPTY,
    PROGRAM,
    BLOCK,
    EXPR_STMT,
    VAR_STMT, // token: var, let or const; children: VAR_DECL...
    VAR_DECL, // target, init
    FN_DECL, // name, PARAMS, body
    FN_EXPR,
    ARROW_FN,
    PARAMS,
    RETURN_STMT,
    IF_STMT, // cond, then, else
    WHILE_STMT, // cond, body
    DO_WHILE_STMT, // body, cond
    FOR_STMT, // init, cond, update, body
    FOR_IN_STMT, // head, object, body
    FOR_OF_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    THROW_STMT,
    TRY_STMT, // block, catch param, catch block, finally block
    SWITCH_STMT, // discriminant, CASE...
    CASE, // test (EMPTY for default), statements...
    CLASS_DECL, // name, superclass, CLASS_BODY, instance field init, static field init
    CLASS_EXPR,
    CLASS_BODY,
    CLASS_METHOD, // key, FN_EXPR
    //====
    LITERAL,
    TEMPLATE,
    IDENT,
    THIS,
    SUPER,
    ARRAY_LIT,
    OBJECT_LIT,
    PROPERTY, // key, value
    UNARY_EXPR,
    UPDATE_EXPR,
    BINARY_EXPR,
    LOGICAL_EXPR,
    CONDITIONAL_EXPR,
    ASSIGN_EXPR,
    SEQUENCE_EXPR,
    CALL_EXPR, // callee, ARGS
    ARGS,
    NEW_EXPR, // callee, ARGS
    MEMBER_EXPR, // object; value is the property name
    INDEX_EXPR, // object, key
    OPTIONAL_CHAIN,
    AWAIT_EXPR,
    YIELD_EXPR, // argument or EMPTY; flagged GENERATOR for 'yield*'
    SPREAD,
    //====
    ARRAY_PATTERN,
    OBJECT_PATTERN,
    PATTERN_PROP, // key, target
    ASSIGN_PATTERN, // target, default
    REST,
    //====
    IMPORT_DECL, // value is the module specifier
    IMPORT_SPEC, // value is the imported name, child is the local IDENT
    IMPORT_DEFAULT,
    IMPORT_NAMESPACE,
    EXPORT_DECL, // declaration
    EXPORT_DEFAULT, // expression or declaration
    EXPORT_NAMED, // EXPORT_SPEC...
    EXPORT_SPEC; // value is the exported name, child is the local IDENT

    public boolean oneOf(NodeType... types) {
        for (NodeType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

    public boolean isFunction() {
        return this == FN_DECL || this == FN_EXPR || this == ARROW_FN;
    }

    public boolean isClass() {
        return this == CLASS_DECL || this == CLASS_EXPR;
    }

    public boolean isPattern() {
        return this == ARRAY_PATTERN || this == OBJECT_PATTERN || this == ASSIGN_PATTERN;
    }

}
