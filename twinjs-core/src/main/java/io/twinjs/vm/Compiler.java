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

import io.twinjs.js.BindingType;
import io.twinjs.js.PropertyAccess;
import io.twinjs.parser.FunctionInfo;
import io.twinjs.parser.Node;
import io.twinjs.parser.NodeType;
import io.twinjs.parser.Token;
import io.twinjs.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers one function or program body to a {@link Chunk}. Nested functions are compiled
 * separately, on first call.
 * <p>
 * Names declared in a function and never referenced from a nested function or class live in
 * frame slots. Everything else, and every top-level name of a program, lives in the scope
 * chain so closures and the tree-walk evaluator see the same bindings.
 * <p>
 * Constructs that are not lowered throw {@link UnsupportedSyntaxException} and the whole
 * function runs in the tree-walk evaluator instead.
 */
public class Compiler {

    static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    private static final class Local {

        final String name;
        final int slot; // -1 when stored in the scope chain
        final BindingType type;

        Local(String name, int slot, BindingType type) {
            this.name = name;
            this.slot = slot;
            this.type = type;
        }

        boolean isSlot() {
            return slot >= 0;
        }

    }

    private static final class Scope {

        final Scope parent;
        final Map<String, Local> locals = new HashMap<>();
        boolean env; // has scope chain bindings, needs a runtime environment

        Scope(Scope parent) {
            this.parent = parent;
        }

    }

    // a loop or switch that break / continue can target
    private static final class Control {

        final boolean loop;
        final int envDepth;
        final int tryDepth;
        final int finallyDepth;
        final int finallyBodies;
        final List<Integer> breaks = new ArrayList<>();
        final List<Integer> continues = new ArrayList<>();

        Control(boolean loop, int envDepth, int tryDepth, int finallyDepth, int finallyBodies) {
            this.loop = loop;
            this.envDepth = envDepth;
            this.tryDepth = tryDepth;
            this.finallyDepth = finallyDepth;
            this.finallyBodies = finallyBodies;
        }

    }

    private final Node root;
    private final boolean program;
    private final Set<String> captured;

    private int[] code = new int[64];
    private Token[] tokens = new Token[64];
    private int size;
    private Token current;

    private final List<Object> constants = new ArrayList<>();
    private final Map<Object, Integer> constantIndex = new HashMap<>();
    private final List<String> slotNames = new ArrayList<>();
    private final List<Boolean> lexicalSlots = new ArrayList<>();

    private Scope scope;
    private final Deque<Control> controls = new ArrayDeque<>();
    private int envDepth;
    private int tryDepth;
    private int finallyDepth;
    private int finallyBodies;

    // optional chain short-circuit jumps, with the stack depth to drop
    private List<int[]> chainExits;

    private Compiler(Node root, boolean program) {
        this.root = root;
        this.program = program;
        this.current = root.token;
        this.captured = program ? Set.of() : capturedNames(root);
    }

    public static Chunk compileProgram(Node program) {
        Compiler compiler = new Compiler(program, true);
        Chunk chunk = compiler.program();
        if (logger.isTraceEnabled()) {
            logger.trace("compiled program:\n{}", chunk.disassemble());
        }
        return chunk;
    }

    public static Chunk compileFunction(Node function) {
        Compiler compiler = new Compiler(function, false);
        Chunk chunk = compiler.function();
        if (logger.isTraceEnabled()) {
            logger.trace("compiled function:\n{}", chunk.disassemble());
        }
        return chunk;
    }

    private UnsupportedSyntaxException unsupported(String reason, Node node) {
        return new UnsupportedSyntaxException(reason, node);
    }

    //==================================================================================================================
    // entry points

    private Chunk program() {
        for (Node stmt : root) {
            if (stmt.type.oneOf(NodeType.IMPORT_DECL, NodeType.EXPORT_DECL, NodeType.EXPORT_DEFAULT, NodeType.EXPORT_NAMED)) {
                throw unsupported("module syntax", stmt);
            }
        }
        scope = new Scope(null);
        for (String name : root.getFunctionInfo().varNames) {
            emit(Opcode.DECLARE_VAR, constant(name));
        }
        predeclare(root, scope);
        hoist(root);
        for (Node stmt : root) {
            statement(stmt);
        }
        emit(Opcode.GET_COMPLETION);
        emit(Opcode.RETURN);
        return chunk("<main>");
    }

    private Chunk function() {
        FunctionInfo info = root.getFunctionInfo();
        if (info.usesArguments && !info.arrow) {
            throw unsupported("uses 'arguments'", root);
        }
        if (info.generator) {
            throw unsupported("generator function", root);
        }
        scope = new Scope(null);
        Node params = root.get(1);
        Set<String> paramNames = new HashSet<>();
        for (Node param : params) {
            Node target = param;
            if (param.type == NodeType.REST || param.type == NodeType.ASSIGN_PATTERN) {
                target = param.get(0);
            }
            if (target.type != NodeType.IDENT) {
                throw unsupported("destructuring parameter", param);
            }
            paramNames.add(target.getName());
            declare(scope, target.getName(), BindingType.LET);
        }
        for (String name : info.varNames) {
            declare(scope, name, BindingType.VAR);
        }
        Node body = root.get(2);
        boolean expressionBody = root.is(Node.EXPRESSION_BODY);
        if (!expressionBody) {
            predeclare(body, scope);
        }
        int i = 0;
        for (Node param : params) {
            if (param.type == NodeType.REST) {
                emit(Opcode.REST_ARGS, i);
                bind(param.get(0).getName(), BindingType.LET);
            } else if (param.type == NodeType.ASSIGN_PATTERN) {
                emit(Opcode.ARG, i);
                int jump = emitJump(Opcode.JUMP_IF_DEFINED);
                expression(param.get(1));
                patch(jump);
                bind(param.get(0).getName(), BindingType.LET);
            } else {
                emit(Opcode.ARG, i);
                bind(param.getName(), BindingType.LET);
            }
            i++;
        }
        for (String name : info.varNames) {
            if (!paramNames.contains(name) && !resolve(name).isSlot()) {
                emit(Opcode.DECLARE_VAR, constant(name));
            }
        }
        if (expressionBody) {
            expression(body);
            emit(Opcode.RETURN);
        } else {
            hoist(body);
            for (Node stmt : body) {
                statement(stmt);
            }
            emit(Opcode.UNDEFINED);
            emit(Opcode.RETURN);
        }
        Node nameNode = root.get(0);
        String name = nameNode.type == NodeType.IDENT ? nameNode.getName() : info.inferredName;
        return chunk(name == null ? "<anonymous>" : name);
    }

    private Chunk chunk(String name) {
        boolean[] lexical = new boolean[lexicalSlots.size()];
        for (int i = 0; i < lexical.length; i++) {
            lexical[i] = lexicalSlots.get(i);
        }
        return new Chunk(name, Arrays.copyOf(code, size), constants.toArray(), Arrays.copyOf(tokens, size),
                slotNames.toArray(new String[0]), lexical, program);
    }

    /**
     * Names referenced anywhere inside nested functions or classes. Those need a binding that
     * outlives the frame.
     */
    static Set<String> capturedNames(Node function) {
        Set<String> names = new HashSet<>();
        for (int i = 1; i < function.size(); i++) {
            scan(function.get(i), names, false);
        }
        return names;
    }

    private static void scan(Node node, Set<String> names, boolean nested) {
        if (nested && node.type == NodeType.IDENT) {
            names.add(node.getName());
        }
        boolean inner = node.type.isFunction() || node.type.isClass();
        // the declared name of a nested function or class is not a reference
        for (int i = inner ? 1 : 0; i < node.size(); i++) {
            scan(node.get(i), names, nested || inner);
        }
    }

    //==================================================================================================================
    // emitting

    private void ensure(int extra) {
        if (size + extra > code.length) {
            int capacity = Math.max(code.length * 2, size + extra);
            code = Arrays.copyOf(code, capacity);
            tokens = Arrays.copyOf(tokens, capacity);
        }
    }

    private int emit(Opcode op, int... operands) {
        if (operands.length != op.operands) {
            throw new IllegalArgumentException(op + " takes " + op.operands + " operands");
        }
        ensure(1 + operands.length);
        int at = size;
        tokens[size] = current;
        code[size++] = op.ordinal();
        for (int operand : operands) {
            tokens[size] = current;
            code[size++] = operand;
        }
        return at;
    }

    // returns the operand offset to patch
    private int emitJump(Opcode op) {
        return emit(op, -1) + 1;
    }

    private void emitJump(Opcode op, int target) {
        emit(op, target);
    }

    private void patch(int operand) {
        code[operand] = size;
    }

    private void patch(List<Integer> operands, int target) {
        for (int operand : operands) {
            code[operand] = target;
        }
    }

    private int constant(Object value) {
        if (value instanceof Node) {
            for (int i = 0; i < constants.size(); i++) {
                if (constants.get(i) == value) {
                    return i;
                }
            }
            constants.add(value);
            return constants.size() - 1;
        }
        // 1 and 1.0 stay distinct
        List<Object> key = List.of(value.getClass(), value);
        Integer index = constantIndex.get(key);
        if (index == null) {
            index = constants.size();
            constants.add(value);
            constantIndex.put(key, index);
        }
        return index;
    }

    private void mark(Node node) {
        current = node.token;
    }

    //==================================================================================================================
    // scopes and names

    private Local declare(Scope target, String name, BindingType type) {
        Local local = target.locals.get(name);
        if (local != null) {
            return local;
        }
        if (program || captured.contains(name)) {
            local = new Local(name, -1, type);
            target.env = true;
        } else {
            local = new Local(name, slotNames.size(), type);
            slotNames.add(name);
            lexicalSlots.add(type != BindingType.VAR);
        }
        target.locals.put(name, local);
        return local;
    }

    private Local resolve(String name) {
        for (Scope s = scope; s != null; s = s.parent) {
            Local local = s.locals.get(name);
            if (local != null) {
                return local;
            }
        }
        return new Local(name, -1, null);
    }

    private static BindingType bindingType(TokenType op) {
        return switch (op) {
            case LET -> BindingType.LET;
            case CONST -> BindingType.CONST;
            default -> BindingType.VAR;
        };
    }

    private void predeclare(Iterable<Node> statements, Scope target) {
        for (Node stmt : statements) {
            switch (stmt.type) {
                case FN_DECL -> declare(target, stmt.get(0).getName(), BindingType.VAR);
                case CLASS_DECL -> declare(target, stmt.get(0).getName(), BindingType.LET);
                case VAR_STMT -> {
                    if (stmt.op != TokenType.VAR) {
                        for (Node decl : stmt) {
                            if (decl.get(0).type != NodeType.IDENT) {
                                throw unsupported("destructuring declaration", decl);
                            }
                            declare(target, decl.get(0).getName(), bindingType(stmt.op));
                        }
                    }
                }
                default -> {
                    // not a declaration
                }
            }
        }
    }

    // dead zones first, then function declarations, in statement order
    private void hoist(Iterable<Node> statements) {
        for (Node stmt : statements) {
            switch (stmt.type) {
                case FN_DECL -> {
                    mark(stmt);
                    emit(Opcode.CLOSURE, constant(stmt));
                    Local local = resolve(stmt.get(0).getName());
                    if (local.isSlot()) {
                        emit(Opcode.INIT_SLOT, local.slot);
                    } else {
                        emit(Opcode.DECLARE, constant(local.name), BindingType.VAR.ordinal());
                    }
                }
                case CLASS_DECL -> deadZone(stmt.get(0).getName());
                case VAR_STMT -> {
                    if (stmt.op != TokenType.VAR) {
                        for (Node decl : stmt) {
                            deadZone(decl.get(0).getName());
                        }
                    }
                }
                default -> {
                    // not a declaration
                }
            }
        }
    }

    private void deadZone(String name) {
        Local local = resolve(name);
        if (local.isSlot()) {
            emit(Opcode.CLEAR_SLOT, local.slot);
        } else {
            emit(Opcode.DECLARE_HOLE, constant(name), local.type.ordinal());
        }
    }

    private void enterScope(Iterable<Node> statements) {
        Scope s = new Scope(scope);
        predeclare(statements, s);
        scope = s;
        if (s.env) {
            emit(Opcode.PUSH_SCOPE);
            envDepth++;
        }
        hoist(statements);
    }

    private void exitScope() {
        if (scope.env) {
            emit(Opcode.POP_SCOPE);
            envDepth--;
        }
        scope = scope.parent;
    }

    // a scope holding exactly one binding, for catch parameters and loop variables
    private Local enterBindingScope(String name, BindingType type) {
        Scope s = new Scope(scope);
        Local local = declare(s, name, type);
        scope = s;
        if (s.env) {
            emit(Opcode.PUSH_SCOPE);
            envDepth++;
        }
        return local;
    }

    private void load(String name) {
        Local local = resolve(name);
        if (local.isSlot()) {
            emit(Opcode.LOAD_SLOT, local.slot);
        } else {
            emit(Opcode.LOAD_NAME, constant(name));
        }
    }

    // assigns the value on top of the stack, leaving it there
    private void store(String name) {
        Local local = resolve(name);
        if (!local.isSlot()) {
            emit(Opcode.STORE_NAME, constant(name));
        } else if (local.type == BindingType.CONST) {
            emit(Opcode.CONST_ERROR, local.slot);
        } else {
            emit(Opcode.STORE_SLOT, local.slot);
        }
    }

    // binds the value on top of the stack in the innermost declaring scope, popping it
    private void bind(String name, BindingType type) {
        if (type == BindingType.VAR) {
            store(name);
            emit(Opcode.POP);
            return;
        }
        Local local = resolve(name);
        if (local.isSlot()) {
            emit(Opcode.INIT_SLOT, local.slot);
        } else {
            emit(Opcode.INIT_NAME, constant(name), type.ordinal());
        }
    }

    //==================================================================================================================
    // statements

    private void statement(Node node) {
        mark(node);
        switch (node.type) {
            case EMPTY, FN_DECL -> {
                // function declarations are hoisted
            }
            case EXPR_STMT -> {
                expression(node.get(0));
                emit(program ? Opcode.SET_COMPLETION : Opcode.POP);
            }
            case VAR_STMT -> varStatement(node);
            case BLOCK -> block(node);
            case RETURN_STMT -> {
                if (finallyDepth > 0) {
                    throw unsupported("return inside try with finally", node);
                }
                if (node.get(0).isEmpty()) {
                    emit(Opcode.UNDEFINED);
                } else {
                    expression(node.get(0));
                }
                emit(Opcode.RETURN);
            }
            case IF_STMT -> ifStatement(node);
            case WHILE_STMT -> whileStatement(node);
            case DO_WHILE_STMT -> doWhileStatement(node);
            case FOR_STMT -> forStatement(node);
            case FOR_IN_STMT -> forEachStatement(node, false);
            case FOR_OF_STMT -> forEachStatement(node, true);
            case BREAK_STMT -> jump(node, false);
            case CONTINUE_STMT -> jump(node, true);
            case THROW_STMT -> {
                expression(node.get(0));
                emit(Opcode.THROW);
            }
            case TRY_STMT -> tryStatement(node);
            case SWITCH_STMT -> switchStatement(node);
            case CLASS_DECL -> {
                classDefinition(node);
                bind(node.get(0).getName(), BindingType.LET);
            }
            default -> throw unsupported(node.type.toString(), node);
        }
    }

    private void block(Node node) {
        enterScope(node);
        for (Node stmt : node) {
            statement(stmt);
        }
        exitScope();
    }

    private void varStatement(Node node) {
        BindingType type = bindingType(node.op);
        for (Node decl : node) {
            Node target = decl.get(0);
            Node init = decl.get(1);
            if (target.type != NodeType.IDENT) {
                throw unsupported("destructuring declaration", decl);
            }
            if (init.isEmpty()) {
                if (type != BindingType.VAR) {
                    emit(Opcode.UNDEFINED);
                    bind(target.getName(), type);
                }
                continue;
            }
            expression(init);
            bind(target.getName(), type);
        }
    }

    private void ifStatement(Node node) {
        expression(node.get(0));
        int otherwise = emitJump(Opcode.JUMP_IF_FALSE);
        statement(node.get(1));
        if (node.get(2).isEmpty()) {
            patch(otherwise);
        } else {
            int end = emitJump(Opcode.JUMP);
            patch(otherwise);
            statement(node.get(2));
            patch(end);
        }
    }

    private Control pushControl(boolean loop) {
        Control control = new Control(loop, envDepth, tryDepth, finallyDepth, finallyBodies);
        controls.push(control);
        return control;
    }

    private void whileStatement(Node node) {
        Control control = pushControl(true);
        int top = size;
        expression(node.get(0));
        int exit = emitJump(Opcode.JUMP_IF_FALSE);
        statement(node.get(1));
        emitJump(Opcode.JUMP, top);
        patch(exit);
        controls.pop();
        patch(control.continues, top);
        patch(control.breaks, size);
    }

    private void doWhileStatement(Node node) {
        Control control = pushControl(true);
        int top = size;
        statement(node.get(0));
        patch(control.continues, size);
        expression(node.get(1));
        emitJump(Opcode.JUMP_IF_TRUE, top);
        controls.pop();
        patch(control.breaks, size);
    }

    private void forStatement(Node node) {
        Node init = node.get(0);
        Node test = node.get(1);
        Node update = node.get(2);
        boolean lexical = init.type == NodeType.VAR_STMT && init.op != TokenType.VAR;
        if (lexical) {
            enterScope(List.of(init));
        }
        if (init.type == NodeType.VAR_STMT) {
            varStatement(init);
        } else if (!init.isEmpty()) {
            expression(init);
            emit(Opcode.POP);
        }
        Control control = pushControl(true);
        int top = size;
        int exit = -1;
        if (!test.isEmpty()) {
            expression(test);
            exit = emitJump(Opcode.JUMP_IF_FALSE);
        }
        statement(node.get(3));
        patch(control.continues, size);
        if (lexical && scope.env) {
            // closures from this iteration keep their own copy
            emit(Opcode.COPY_SCOPE);
        }
        if (!update.isEmpty()) {
            expression(update);
            emit(Opcode.POP);
        }
        emitJump(Opcode.JUMP, top);
        if (exit != -1) {
            patch(exit);
        }
        controls.pop();
        patch(control.breaks, size);
        if (lexical) {
            exitScope();
        }
    }

    private void forEachStatement(Node node, boolean of) {
        Node head = node.get(0);
        String name;
        BindingType type;
        if (head.type == NodeType.VAR_STMT) {
            Node target = head.get(0).get(0);
            if (target.type != NodeType.IDENT) {
                throw unsupported("destructuring loop variable", head);
            }
            name = target.getName();
            type = bindingType(head.op);
        } else if (head.type == NodeType.IDENT) {
            name = head.getName();
            type = BindingType.VAR;
        } else {
            throw unsupported("loop target " + head.type, head);
        }
        expression(node.get(1));
        emit(of ? Opcode.ITER_INIT : Opcode.KEYS_INIT);
        Control control = pushControl(true);
        int top = size;
        int exit = emitJump(Opcode.ITER_NEXT);
        if (type == BindingType.VAR) {
            store(name);
            emit(Opcode.POP);
            statement(node.get(2));
        } else {
            // fresh binding per iteration
            Local local = enterBindingScope(name, type);
            if (local.isSlot()) {
                emit(Opcode.INIT_SLOT, local.slot);
            } else {
                emit(Opcode.DECLARE, constant(name), type.ordinal());
            }
            statement(node.get(2));
            exitScope();
        }
        emitJump(Opcode.JUMP, top);
        controls.pop();
        patch(control.continues, top);
        patch(exit);
        patch(control.breaks, size);
        emit(Opcode.POP);
    }

    private void jump(Node node, boolean isContinue) {
        Control target = null;
        for (Control control : controls) {
            if (control.loop || !isContinue) {
                target = control;
                break;
            }
        }
        if (target == null) {
            throw unsupported((isContinue ? "continue" : "break") + " outside loop", node);
        }
        if (finallyDepth > target.finallyDepth || finallyBodies > target.finallyBodies) {
            throw unsupported("jump across finally", node);
        }
        for (int i = tryDepth; i > target.tryDepth; i--) {
            emit(Opcode.TRY_END);
        }
        for (int i = envDepth; i > target.envDepth; i--) {
            emit(Opcode.POP_SCOPE);
        }
        int operand = emitJump(Opcode.JUMP);
        (isContinue ? target.continues : target.breaks).add(operand);
    }

    private void tryStatement(Node node) {
        Node param = node.get(1);
        Node handler = node.get(2);
        Node finalizer = node.get(3);
        boolean hasCatch = !handler.isEmpty();
        boolean hasFinally = !finalizer.isEmpty();
        int finallyLanding = -1;
        if (hasFinally) {
            finallyLanding = emitJump(Opcode.TRY_BEGIN);
            tryDepth++;
            finallyDepth++;
        }
        if (hasCatch) {
            int catchLanding = emitJump(Opcode.TRY_BEGIN);
            tryDepth++;
            block(node.get(0));
            emit(Opcode.TRY_END);
            tryDepth--;
            int end = emitJump(Opcode.JUMP);
            // the thrown signal is on the stack
            patch(catchLanding);
            mark(handler);
            if (param.isEmpty()) {
                emit(Opcode.POP);
                block(handler);
            } else {
                if (param.type != NodeType.IDENT) {
                    throw unsupported("destructuring catch parameter", param);
                }
                emit(Opcode.EXC_VALUE);
                Local local = enterBindingScope(param.getName(), BindingType.LET);
                if (local.isSlot()) {
                    emit(Opcode.INIT_SLOT, local.slot);
                } else {
                    emit(Opcode.DECLARE, constant(local.name), BindingType.LET.ordinal());
                }
                block(handler);
                exitScope();
            }
            patch(end);
        } else {
            block(node.get(0));
        }
        if (hasFinally) {
            emit(Opcode.TRY_END);
            tryDepth--;
            finallyDepth--;
            finallyBodies++;
            block(finalizer);
            int end = emitJump(Opcode.JUMP);
            patch(finallyLanding);
            mark(finalizer);
            block(finalizer);
            emit(Opcode.RETHROW);
            finallyBodies--;
            patch(end);
        }
    }

    private void switchStatement(Node node) {
        expression(node.get(0));
        List<Node> statements = new ArrayList<>();
        for (int i = 1; i < node.size(); i++) {
            Node caseNode = node.get(i);
            for (int j = 1; j < caseNode.size(); j++) {
                statements.add(caseNode.get(j));
            }
        }
        enterScope(statements);
        Control control = pushControl(false);
        int cases = node.size() - 1;
        int[] matches = new int[cases];
        int defaultCase = -1;
        for (int i = 0; i < cases; i++) {
            Node test = node.get(i + 1).get(0);
            if (test.isEmpty()) {
                defaultCase = i;
                matches[i] = -1;
                continue;
            }
            emit(Opcode.DUP);
            expression(test);
            emit(Opcode.BINARY, TokenType.EQ_EQ_EQ.ordinal());
            matches[i] = emitJump(Opcode.JUMP_IF_TRUE);
        }
        emit(Opcode.POP);
        int noMatch = emitJump(Opcode.JUMP);
        int[] entries = new int[cases];
        for (int i = 0; i < cases; i++) {
            if (matches[i] != -1) {
                patch(matches[i]);
                emit(Opcode.POP);
                entries[i] = emitJump(Opcode.JUMP);
            }
        }
        for (int i = 0; i < cases; i++) {
            if (matches[i] != -1) {
                patch(entries[i]);
            }
            if (i == defaultCase) {
                patch(noMatch);
            }
            Node caseNode = node.get(i + 1);
            for (int j = 1; j < caseNode.size(); j++) {
                statement(caseNode.get(j));
            }
        }
        if (defaultCase == -1) {
            patch(noMatch);
        }
        controls.pop();
        patch(control.breaks, size);
        exitScope();
    }

    private void classDefinition(Node node) {
        for (Node member : node.get(2)) {
            if (member.is(Node.COMPUTED)) {
                throw unsupported("computed class member", member);
            }
        }
        if (node.is(Node.DERIVED)) {
            expression(node.get(1));
        } else {
            emit(Opcode.UNDEFINED);
        }
        emit(Opcode.CLASS, constant(node));
    }

    //==================================================================================================================
    // expressions

    private void expression(Node node) {
        switch (node.type) {
            case LITERAL -> literal(node.value);
            case TEMPLATE -> template(node);
            case IDENT -> load(node.getName());
            case THIS -> emit(Opcode.LOAD_THIS);
            case FN_EXPR, ARROW_FN -> emit(Opcode.CLOSURE, constant(node));
            case CLASS_EXPR -> classDefinition(node);
            case ARRAY_LIT -> arrayLiteral(node);
            case OBJECT_LIT -> objectLiteral(node);
            case UNARY_EXPR -> unary(node);
            case UPDATE_EXPR -> update(node);
            case BINARY_EXPR -> {
                expression(node.get(0));
                expression(node.get(1));
                binary(node.op);
            }
            case LOGICAL_EXPR -> {
                expression(node.get(0));
                int end = emitJump(shortCircuit(node.op));
                expression(node.get(1));
                patch(end);
            }
            case CONDITIONAL_EXPR -> {
                expression(node.get(0));
                int otherwise = emitJump(Opcode.JUMP_IF_FALSE);
                expression(node.get(1));
                int end = emitJump(Opcode.JUMP);
                patch(otherwise);
                expression(node.get(2));
                patch(end);
            }
            case ASSIGN_EXPR -> assignment(node);
            case SEQUENCE_EXPR -> {
                for (int i = 0; i < node.size(); i++) {
                    if (i > 0) {
                        emit(Opcode.POP);
                    }
                    expression(node.get(i));
                }
            }
            case CALL_EXPR -> call(node);
            case NEW_EXPR -> construct(node);
            case MEMBER_EXPR -> member(node);
            case INDEX_EXPR -> index(node);
            case OPTIONAL_CHAIN -> optionalChain(node);
            case AWAIT_EXPR -> {
                if (!root.getFunctionInfo().async) {
                    throw unsupported("await outside async function", node);
                }
                expression(node.get(0));
                emit(Opcode.AWAIT);
            }
            default -> throw unsupported(node.type.toString(), node);
        }
    }

    private void literal(Object value) {
        if (value == null) {
            emit(Opcode.NULL);
        } else if (value == Boolean.TRUE) {
            emit(Opcode.TRUE);
        } else if (value == Boolean.FALSE) {
            emit(Opcode.FALSE);
        } else if (value instanceof String || value instanceof Number) {
            emit(Opcode.CONST, constant(value));
        } else {
            // undefined and any other literal value
            emit(Opcode.CONST, constant(value));
        }
    }

    private void template(Node node) {
        for (int i = 0; i < node.size(); i++) {
            Node part = node.get(i);
            if (i % 2 == 0) {
                emit(Opcode.CONST, constant(part.value));
            } else {
                expression(part);
                emit(Opcode.TO_STRING);
            }
        }
        emit(Opcode.CONCAT, node.size());
    }

    private static boolean hasSpread(Node node) {
        for (Node child : node) {
            if (child.type == NodeType.SPREAD) {
                return true;
            }
        }
        return false;
    }

    private void arrayLiteral(Node node) {
        if (!hasSpread(node)) {
            for (Node element : node) {
                element(element);
            }
            emit(Opcode.ARRAY, node.size());
            return;
        }
        emit(Opcode.ARRAY, 0);
        for (Node element : node) {
            if (element.type == NodeType.SPREAD) {
                expression(element.get(0));
                emit(Opcode.ARRAY_SPREAD);
            } else {
                element(element);
                emit(Opcode.ARRAY_PUSH);
            }
        }
    }

    private void element(Node element) {
        if (element.isEmpty()) {
            emit(Opcode.UNDEFINED);
        } else {
            expression(element);
        }
    }

    private void objectLiteral(Node node) {
        emit(Opcode.OBJECT);
        for (Node prop : node) {
            if (prop.type == NodeType.SPREAD) {
                expression(prop.get(0));
                emit(Opcode.OBJECT_SPREAD);
                continue;
            }
            Node key = prop.get(0);
            Node value = prop.get(1);
            if (value.type == NodeType.ASSIGN_PATTERN) {
                throw unsupported("shorthand property initializer", prop);
            }
            boolean accessor = prop.is(Node.GETTER) || prop.is(Node.SETTER);
            if (accessor && prop.is(Node.COMPUTED)) {
                throw unsupported("computed accessor", prop);
            }
            if (accessor) {
                emit(Opcode.CLOSURE, constant(value));
                emit(Opcode.INIT_ACCESSOR, constant(key.getName()), prop.is(Node.GETTER) ? Opcode.GETTER : Opcode.SETTER);
            } else if (prop.is(Node.COMPUTED)) {
                expression(key);
                if (prop.is(Node.METHOD)) {
                    emit(Opcode.CLOSURE, constant(value));
                    emit(Opcode.INIT_INDEX, Opcode.METHOD);
                } else if (value.type.isFunction() && value.get(0).isEmpty()) {
                    emit(Opcode.CLOSURE, constant(value));
                    emit(Opcode.INIT_INDEX, Opcode.NAME_FUNCTION);
                } else {
                    expression(value);
                    emit(Opcode.INIT_INDEX, 0);
                }
            } else if (prop.is(Node.METHOD)) {
                emit(Opcode.CLOSURE, constant(value));
                emit(Opcode.INIT_METHOD, constant(key.getName()));
            } else {
                expression(value);
                emit(Opcode.INIT_PROP, constant(key.getName()));
            }
        }
    }

    private void binary(TokenType op) {
        switch (op) {
            case PLUS -> emit(Opcode.ADD);
            case MINUS -> emit(Opcode.SUB);
            case LT -> emit(Opcode.LT);
            default -> emit(Opcode.BINARY, op.ordinal());
        }
    }

    // keeps the left value when the right side is skipped
    private static Opcode shortCircuit(TokenType op) {
        return switch (op) {
            case AMP_AMP -> Opcode.JUMP_IF_FALSE_KEEP;
            case PIPE_PIPE -> Opcode.JUMP_IF_TRUE_KEEP;
            default -> Opcode.JUMP_IF_NOT_NULLISH;
        };
    }

    private void unary(Node node) {
        Node arg = node.get(0);
        switch (node.op) {
            case DELETE -> {
                if (arg.type == NodeType.MEMBER_EXPR && arg.get(0).type != NodeType.SUPER) {
                    expression(arg.get(0));
                    emit(Opcode.DELETE_PROP, constant(arg.getName()));
                } else if (arg.type == NodeType.INDEX_EXPR && arg.get(0).type != NodeType.SUPER) {
                    expression(arg.get(0));
                    expression(arg.get(1));
                    emit(Opcode.DELETE_INDEX);
                } else if (arg.type == NodeType.IDENT) {
                    emit(Opcode.FALSE);
                } else if (arg.type.oneOf(NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR)) {
                    throw unsupported("delete of super property", node);
                } else {
                    expression(arg);
                    emit(Opcode.POP);
                    emit(Opcode.TRUE);
                }
            }
            case TYPEOF -> {
                if (arg.type == NodeType.IDENT && !resolve(arg.getName()).isSlot()) {
                    emit(Opcode.TYPEOF_NAME, constant(arg.getName()));
                } else {
                    expression(arg);
                    emit(Opcode.UNARY, TokenType.TYPEOF.ordinal());
                }
            }
            case NOT -> {
                expression(arg);
                emit(Opcode.NOT);
            }
            default -> {
                expression(arg);
                emit(Opcode.UNARY, node.op.ordinal());
            }
        }
    }

    private void update(Node node) {
        Node target = node.get(0);
        boolean increment = node.op == TokenType.PLUS_PLUS;
        boolean prefix = node.is(Node.PREFIX);
        int flags = (increment ? Opcode.INCREMENT : 0) | (prefix ? Opcode.PREFIX : 0);
        if (target.type.oneOf(NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR) && target.get(0).type == NodeType.SUPER) {
            throw unsupported("update of super property", node);
        }
        switch (target.type) {
            case IDENT -> {
                load(target.getName());
                emit(Opcode.TO_NUMBER);
                if (!prefix) {
                    emit(Opcode.DUP);
                }
                emit(increment ? Opcode.INC : Opcode.DEC);
                store(target.getName());
                if (!prefix) {
                    emit(Opcode.POP);
                }
            }
            case MEMBER_EXPR -> {
                expression(target.get(0));
                emit(Opcode.UPDATE_PROP, constant(target.getName()), flags);
            }
            case INDEX_EXPR -> {
                expression(target.get(0));
                expression(target.get(1));
                emit(Opcode.UPDATE_INDEX, flags);
            }
            default -> throw unsupported("update target " + target.type, node);
        }
    }

    private void assignment(Node node) {
        Node target = node.get(0);
        Node value = node.get(1);
        boolean superTarget = target.type.oneOf(NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR) && target.get(0).type == NodeType.SUPER;
        if (node.op == TokenType.EQ) {
            switch (target.type) {
                case IDENT -> {
                    expression(value);
                    store(target.getName());
                }
                case MEMBER_EXPR -> {
                    if (superTarget) {
                        emit(Opcode.LOAD_THIS);
                    } else {
                        expression(target.get(0));
                    }
                    expression(value);
                    emit(Opcode.SET_PROP, constant(target.getName()));
                }
                case INDEX_EXPR -> {
                    if (superTarget) {
                        throw unsupported("super index assignment", node);
                    }
                    expression(target.get(0));
                    expression(target.get(1));
                    expression(value);
                    emit(Opcode.SET_INDEX);
                }
                default -> throw unsupported("destructuring assignment", node);
            }
            return;
        }
        if (superTarget) {
            throw unsupported("compound assignment to super property", node);
        }
        TokenType op = node.op.binaryOf();
        boolean logical = op.oneOf(TokenType.AMP_AMP, TokenType.PIPE_PIPE, TokenType.QUES_QUES);
        switch (target.type) {
            case IDENT -> {
                load(target.getName());
                if (logical) {
                    int end = emitJump(shortCircuit(op));
                    expression(value);
                    store(target.getName());
                    patch(end);
                } else {
                    expression(value);
                    binary(op);
                    store(target.getName());
                }
            }
            case MEMBER_EXPR -> {
                int name = constant(target.getName());
                expression(target.get(0));
                emit(Opcode.DUP);
                emit(Opcode.GET_PROP, name);
                if (logical) {
                    int keep = emitJump(shortCircuit(op));
                    expression(value);
                    emit(Opcode.SET_PROP, name);
                    int end = emitJump(Opcode.JUMP);
                    patch(keep);
                    emit(Opcode.SWAP);
                    emit(Opcode.POP);
                    patch(end);
                } else {
                    expression(value);
                    binary(op);
                    emit(Opcode.SET_PROP, name);
                }
            }
            case INDEX_EXPR -> {
                expression(target.get(0));
                expression(target.get(1));
                emit(Opcode.DUP2);
                emit(Opcode.GET_INDEX);
                if (logical) {
                    int keep = emitJump(shortCircuit(op));
                    expression(value);
                    emit(Opcode.SET_INDEX);
                    int end = emitJump(Opcode.JUMP);
                    patch(keep);
                    emit(Opcode.SWAP);
                    emit(Opcode.POP);
                    emit(Opcode.SWAP);
                    emit(Opcode.POP);
                    patch(end);
                } else {
                    expression(value);
                    binary(op);
                    emit(Opcode.SET_INDEX);
                }
            }
            default -> throw unsupported("compound assignment target " + target.type, node);
        }
    }

    //==================================================================================================================
    // calls and property access

    // jumps out of the enclosing optional chain when the top of the stack is nullish
    private void optionalCheck(Node node, int depth) {
        if (chainExits == null) {
            throw unsupported("optional access outside chain", node);
        }
        chainExits.add(new int[]{emitJump(Opcode.JUMP_IF_NULLISH), depth});
    }

    private void optionalChain(Node node) {
        List<int[]> saved = chainExits;
        chainExits = new ArrayList<>();
        expression(node.get(0));
        List<int[]> exits = chainExits;
        chainExits = saved;
        if (exits.isEmpty()) {
            return;
        }
        int end = emitJump(Opcode.JUMP);
        List<Integer> ends = new ArrayList<>();
        ends.add(end);
        for (int[] exit : exits) {
            patch(exit[0]);
            for (int i = 0; i < exit[1]; i++) {
                emit(Opcode.POP);
            }
            emit(Opcode.UNDEFINED);
            ends.add(emitJump(Opcode.JUMP));
        }
        patch(ends, size);
    }

    private void member(Node node) {
        if (node.get(0).type == NodeType.SUPER) {
            emit(Opcode.GET_SUPER, constant(node.getName()));
            return;
        }
        expression(node.get(0));
        if (node.is(Node.OPTIONAL)) {
            optionalCheck(node, 1);
        }
        emit(Opcode.GET_PROP, constant(node.getName()));
    }

    private void index(Node node) {
        if (node.get(0).type == NodeType.SUPER) {
            expression(node.get(1));
            emit(Opcode.SUPER_INDEX);
            return;
        }
        expression(node.get(0));
        if (node.is(Node.OPTIONAL)) {
            optionalCheck(node, 1);
        }
        expression(node.get(1));
        emit(Opcode.GET_INDEX);
    }

    private void call(Node node) {
        Node callee = node.get(0);
        Node args = node.get(1);
        if (callee.type == NodeType.SUPER) {
            if (hasSpread(args)) {
                throw unsupported("spread in super call", node);
            }
            for (Node arg : args) {
                expression(arg);
            }
            mark(node);
            emit(Opcode.SUPER_CALL, args.size());
            return;
        }
        if (callee.type.oneOf(NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR)) {
            boolean isSuper = callee.get(0).type == NodeType.SUPER;
            if (isSuper) {
                emit(Opcode.LOAD_THIS);
            } else {
                expression(callee.get(0));
                if (callee.is(Node.OPTIONAL)) {
                    optionalCheck(callee, 1);
                }
            }
            if (callee.type == NodeType.MEMBER_EXPR) {
                if (isSuper) {
                    emit(Opcode.GET_SUPER, constant(callee.getName()));
                } else {
                    emit(Opcode.DUP);
                    emit(Opcode.GET_PROP, constant(callee.getName()));
                }
            } else if (isSuper) {
                expression(callee.get(1));
                emit(Opcode.SUPER_INDEX);
            } else {
                emit(Opcode.DUP);
                expression(callee.get(1));
                emit(Opcode.GET_INDEX);
            }
        } else {
            emit(Opcode.UNDEFINED);
            expression(callee);
        }
        if (node.is(Node.OPTIONAL)) {
            optionalCheck(node, 2);
        }
        int description = constant(PropertyAccess.describe(callee));
        if (hasSpread(args)) {
            spreadArguments(args);
            mark(node);
            emit(Opcode.CALL_SPREAD, description);
        } else {
            for (Node arg : args) {
                expression(arg);
            }
            mark(node);
            emit(Opcode.CALL, args.size(), description);
        }
    }

    private void construct(Node node) {
        Node callee = node.get(0);
        Node args = node.get(1);
        expression(callee);
        int description = constant(PropertyAccess.describe(callee));
        if (hasSpread(args)) {
            spreadArguments(args);
            mark(node);
            emit(Opcode.NEW_SPREAD, description);
        } else {
            for (Node arg : args) {
                expression(arg);
            }
            mark(node);
            emit(Opcode.NEW, args.size(), description);
        }
    }

    private void spreadArguments(Node args) {
        emit(Opcode.ARRAY, 0);
        for (Node arg : args) {
            if (arg.type == NodeType.SPREAD) {
                expression(arg.get(0));
                emit(Opcode.ARRAY_SPREAD);
            } else {
                expression(arg);
                emit(Opcode.ARRAY_PUSH);
            }
        }
    }

}
