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

import io.twinjs.parser.FunctionInfo;
import io.twinjs.parser.Node;
import io.twinjs.parser.NodeType;
import io.twinjs.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Tree-walk evaluator. Every node kind is evaluated by one static method against a
 * {@link CoreContext}; break, continue and return are exit states on the context, throws
 * are {@link JsException}s.
 */
class Interpreter {

    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    // result of an optional chain link whose base is null or undefined
    private static final Object SKIP = new Object();

    private static final int TRY = 0;
    private static final int CATCH = 1;
    private static final int FINALLY = 2;

    private static final class TryState {

        int phase = TRY;
        Environment catchEnv;
        JsException caught;
        JsException pending;
        CoreContext.ExitType exitType;
        Object returnValue;

    }

    private static final class ForState {

        Iterator<?> iterator;
        Environment env;

    }

    private Interpreter() {
        // static only
    }

    //==================================================================================================================
    // entry points

    static Object invoke(Realm realm, JsClosure fn, Object thisObject, Object[] args) {
        realm.stats.interpretedCalls++;
        Object self = fn.arrow ? fn.capturedThis : thisObject;
        int depth = realm.getCallDepth();
        Realm.ActiveCall call = realm.enter(fn.displayName(), fn.node.token);
        try {
            if (fn.async) {
                return AsyncActivation.start(realm, fn, self, args, call);
            }
            if (fn.generator) {
                return GeneratorActivation.start(realm, fn, self, args, call);
            }
            CoreContext context = new CoreContext(realm, fn, self, new Environment(fn.env), null, call);
            bindArguments(context, fn, args);
            Object result = evalFunctionBody(context, fn);
            if (context.thisPending && !(result instanceof JsObject)) {
                throw realm.referenceError(JsClass.SUPER_NOT_CALLED);
            }
            return result;
        } catch (StackOverflowError e) {
            realm.unwindTo(depth);
            throw realm.rangeError("Maximum call stack size exceeded");
        } finally {
            realm.unwindTo(depth);
        }
    }

    static void bindArguments(CoreContext context, JsClosure fn, Object[] args) {
        if (fn.info.usesArguments && !fn.arrow) {
            context.env.declare("arguments", BindingType.VAR, new JsArray(context.realm.arrayPrototype, new ArrayList<>(List.of(args))));
        }
        int i = 0;
        for (Node param : fn.getParams()) {
            if (param.type == NodeType.REST) {
                List<Object> rest = new ArrayList<>();
                for (int j = i; j < args.length; j++) {
                    rest.add(args[j]);
                }
                bindPattern(param.get(0), new JsArray(context.realm.arrayPrototype, rest), BindingType.LET, context);
            } else {
                bindPattern(param, i < args.length ? args[i] : Terms.UNDEFINED, BindingType.LET, context);
            }
            i++;
        }
        hoistVars(context.env, fn.info);
        if (!fn.isExpressionBody()) {
            hoistDeclarations(fn.getBodyNode(), context, context.env);
        }
    }

    static Object evalFunctionBody(CoreContext context, JsClosure fn) {
        Node body = fn.getBodyNode();
        if (fn.isExpressionBody()) {
            return eval(body, context);
        }
        evalStatements(body, 0, context);
        return context.getExitType() == CoreContext.ExitType.RETURN ? context.getReturnValue() : Terms.UNDEFINED;
    }

    /**
     * Runs a program or module top level in the given scope.
     *
     * @return the value of the last top-level expression statement
     */
    static Object evalProgram(Realm realm, Node program, Environment env, ModuleRecord module) {
        int depth = realm.getCallDepth();
        Realm.ActiveCall call = realm.enter(module == null ? "<main>" : module.getName(), program.token);
        try {
            CoreContext context = new CoreContext(realm, null, Terms.UNDEFINED, env, null, call);
            context.module = module;
            hoistVars(env, program.getFunctionInfo());
            hoistDeclarations(program, context, env);
            for (Node stmt : program) {
                if (stmt.type == NodeType.IMPORT_DECL) {
                    evalImport(stmt, context);
                }
            }
            evalStatements(program, 0, context);
            return context.completion;
        } catch (StackOverflowError e) {
            realm.unwindTo(depth);
            throw realm.rangeError("Maximum call stack size exceeded");
        } finally {
            realm.unwindTo(depth);
        }
    }

    //==================================================================================================================
    // hoisting

    static void hoistVars(Environment env, FunctionInfo info) {
        for (String name : info.varNames) {
            if (!env.hasOwn(name)) {
                env.declare(name, BindingType.VAR, Terms.UNDEFINED);
            }
        }
    }

    /**
     * Function declarations become initialized bindings, let / const / class bindings start
     * out in their dead zone.
     */
    static void hoistDeclarations(Iterable<Node> statements, CoreContext context, Environment env) {
        for (Node stmt : statements) {
            hoistDeclaration(stmt, context, env);
        }
    }

    private static void hoistDeclaration(Node stmt, CoreContext context, Environment env) {
        switch (stmt.type) {
            case FN_DECL -> {
                String name = stmt.get(0).getName();
                JsClosure fn = context.realm.newClosure(stmt, env, context.thisObject, context.function, null);
                env.declare(name, BindingType.VAR, fn);
            }
            case VAR_STMT -> {
                if (stmt.op != TokenType.VAR) {
                    BindingType type = stmt.op == TokenType.CONST ? BindingType.CONST : BindingType.LET;
                    for (Node decl : stmt) {
                        for (String name : boundNames(decl.get(0))) {
                            env.declare(name, type, Terms.UNDEFINED, false);
                        }
                    }
                }
            }
            case CLASS_DECL -> env.declare(stmt.get(0).getName(), BindingType.LET, Terms.UNDEFINED, false);
            case EXPORT_DECL, EXPORT_DEFAULT -> {
                Node decl = stmt.get(0);
                hoistDeclaration(decl, context, env);
                if (decl.type == NodeType.FN_DECL && context.module != null) {
                    Object fn = env.getOwn(decl.get(0).getName()).value;
                    context.module.export(stmt.type == NodeType.EXPORT_DEFAULT ? "default" : decl.get(0).getName(), fn);
                }
            }
            default -> {
                // not a declaration
            }
        }
    }

    static List<String> boundNames(Node target) {
        List<String> names = new ArrayList<>();
        collectNames(target, names);
        return names;
    }

    private static void collectNames(Node target, List<String> names) {
        switch (target.type) {
            case IDENT -> names.add(target.getName());
            case ARRAY_PATTERN, OBJECT_PATTERN -> {
                for (Node child : target) {
                    collectNames(child, names);
                }
            }
            case PATTERN_PROP -> collectNames(target.get(1), names);
            case ASSIGN_PATTERN, REST -> collectNames(target.get(0), names);
            default -> {
                // holes
            }
        }
    }

    //==================================================================================================================
    // dispatch

    /**
     * Evaluates a node. Inside a suspendable activation, completed values are recorded so that
     * a resumed activation can replay up to the pending {@code await} or {@code yield}.
     */
    static Object eval(Node node, CoreContext context) {
        Activation activation = context.activation;
        if (activation == null) {
            return evalNode(node, context);
        }
        if (activation.replaying) {
            if (activation.values.containsKey(node)) {
                return activation.values.get(node);
            }
        } else {
            activation.values.remove(node);
        }
        Object result = evalNode(node, context);
        activation.values.put(node, result);
        return result;
    }

    private static Object evalNode(Node node, CoreContext context) {
        return switch (node.type) {
            case EMPTY, FN_DECL, IMPORT_DECL -> Terms.UNDEFINED;
            case BLOCK -> evalBlock(node, context);
            case EXPR_STMT -> evalExprStmt(node, context);
            case VAR_STMT -> evalVarStmt(node, context);
            case RETURN_STMT -> context.stopAndReturn(node.get(0).isEmpty() ? Terms.UNDEFINED : eval(node.get(0), context));
            case IF_STMT -> evalIf(node, context);
            case WHILE_STMT -> evalWhile(node, context);
            case DO_WHILE_STMT -> evalDoWhile(node, context);
            case FOR_STMT -> evalFor(node, context);
            case FOR_IN_STMT -> evalForEach(node, context, false);
            case FOR_OF_STMT -> evalForEach(node, context, true);
            case BREAK_STMT -> context.stopAndBreak();
            case CONTINUE_STMT -> context.stopAndContinue();
            case THROW_STMT -> throw context.realm.userThrow(eval(node.get(0), context));
            case TRY_STMT -> evalTry(node, context);
            case SWITCH_STMT -> evalSwitch(node, context);
            case CLASS_DECL -> evalClassDecl(node, context);
            case EXPORT_DECL -> evalExportDecl(node, context);
            case EXPORT_DEFAULT -> evalExportDefault(node, context);
            case EXPORT_NAMED -> evalExportNamed(node, context);
            case LITERAL -> node.value;
            case TEMPLATE -> evalTemplate(node, context);
            case IDENT -> context.env.get(context.realm, node.getName());
            case THIS -> context.thisValue();
            case FN_EXPR, ARROW_FN -> context.realm.newClosure(node, context.env, context.thisObject, context.function, null);
            case CLASS_EXPR -> evalClass(node, context);
            case ARRAY_LIT -> evalArrayLit(node, context);
            case OBJECT_LIT -> evalObjectLit(node, context);
            case UNARY_EXPR -> evalUnary(node, context);
            case UPDATE_EXPR -> evalUpdate(node, context);
            case BINARY_EXPR -> Terms.binary(context.realm, node.op, eval(node.get(0), context), eval(node.get(1), context));
            case LOGICAL_EXPR -> evalLogical(node, context);
            case CONDITIONAL_EXPR -> Terms.isTruthy(eval(node.get(0), context)) ? eval(node.get(1), context) : eval(node.get(2), context);
            case ASSIGN_EXPR -> evalAssign(node, context);
            case SEQUENCE_EXPR -> evalSequence(node, context);
            case CALL_EXPR -> evalCall(node, context);
            case NEW_EXPR -> evalNew(node, context);
            case MEMBER_EXPR -> evalMember(node, context);
            case INDEX_EXPR -> evalIndex(node, context);
            case OPTIONAL_CHAIN -> {
                Object value = eval(node.get(0), context);
                yield value == SKIP ? Terms.UNDEFINED : value;
            }
            case AWAIT_EXPR -> {
                if (!(context.activation instanceof AsyncActivation)) {
                    throw context.realm.syntaxError("await is only valid in async functions");
                }
                yield context.activation.suspendAt(node, context);
            }
            case YIELD_EXPR -> {
                if (!(context.activation instanceof GeneratorActivation generator)) {
                    throw context.realm.syntaxError("yield is only valid in generator functions");
                }
                yield node.is(Node.GENERATOR) ? generator.delegate(node, context) : generator.suspendAt(node, context);
            }
            case SPREAD -> throw context.realm.syntaxError("Unexpected token '...'");
            case SUPER -> throw context.realm.syntaxError("'super' keyword unexpected here");
            default -> throw context.realm.syntaxError("Unexpected " + node.type);
        };
    }

    //==================================================================================================================
    // statements

    private static void statement(Node node, CoreContext context) {
        context.mark(node);
        if (logger.isTraceEnabled()) {
            logger.trace("{} {}", node.type, node.getPosition());
        }
        try {
            eval(node, context);
        } catch (JsException | Activation.Suspend e) {
            throw e;
        } catch (RuntimeException e) {
            // engine faults surface as a catchable Error, as they do in the VM
            throw context.realm.wrap(e);
        }
    }

    private static void evalStatements(Node parent, int from, CoreContext context) {
        for (int i = from; i < parent.size(); i++) {
            statement(parent.get(i), context);
            if (context.isStopped()) {
                break;
            }
        }
    }

    private static Environment blockScope(Node node, CoreContext context, Iterable<Node> declarations) {
        Environment outer = context.env;
        return context.state(node, () -> {
            Environment env = new Environment(outer);
            hoistDeclarations(declarations, context, env);
            return env;
        });
    }

    private static Object evalBlock(Node node, CoreContext context) {
        Environment saved = context.env;
        context.env = blockScope(node, context, node);
        try {
            evalStatements(node, 0, context);
        } finally {
            context.env = saved;
        }
        return Terms.UNDEFINED;
    }

    private static Object evalExprStmt(Node node, CoreContext context) {
        Object value = eval(node.get(0), context);
        if (context.function == null) {
            context.completion = value;
        }
        return value;
    }

    private static Object evalVarStmt(Node node, CoreContext context) {
        BindingType type = switch (node.op) {
            case LET -> BindingType.LET;
            case CONST -> BindingType.CONST;
            default -> BindingType.VAR;
        };
        for (Node decl : node) {
            Node target = decl.get(0);
            Node init = decl.get(1);
            if (init.isEmpty()) {
                if (type != BindingType.VAR) {
                    bindPattern(target, Terms.UNDEFINED, type, context);
                }
                continue;
            }
            bindPattern(target, eval(init, context), type, context);
        }
        return Terms.UNDEFINED;
    }

    private static Object evalIf(Node node, CoreContext context) {
        if (Terms.isTruthy(eval(node.get(0), context))) {
            statement(node.get(1), context);
        } else if (!node.get(2).isEmpty()) {
            statement(node.get(2), context);
        }
        return Terms.UNDEFINED;
    }

    // true when the loop has to stop
    private static boolean exitLoop(CoreContext context) {
        switch (context.getExitType()) {
            case BREAK:
                context.reset();
                return true;
            case CONTINUE:
                context.reset();
                return false;
            default:
                return true;
        }
    }

    private static Object evalWhile(Node node, CoreContext context) {
        while (Terms.isTruthy(eval(node.get(0), context))) {
            statement(node.get(1), context);
            if (context.isStopped() && exitLoop(context)) {
                break;
            }
        }
        return Terms.UNDEFINED;
    }

    private static Object evalDoWhile(Node node, CoreContext context) {
        do {
            statement(node.get(0), context);
            if (context.isStopped() && exitLoop(context)) {
                break;
            }
        } while (Terms.isTruthy(eval(node.get(1), context)));
        return Terms.UNDEFINED;
    }

    private static Object evalFor(Node node, CoreContext context) {
        Node init = node.get(0);
        Node test = node.get(1);
        Node update = node.get(2);
        Environment saved = context.env;
        // let / const loop variables get a fresh copy per iteration
        boolean lexical = init.type == NodeType.VAR_STMT && init.op != TokenType.VAR;
        if (lexical) {
            context.env = context.state(node, () -> {
                Environment env = new Environment(saved);
                hoistDeclaration(init, context, env);
                return env;
            });
        }
        try {
            eval(init, context);
            while (test.isEmpty() || Terms.isTruthy(eval(test, context))) {
                statement(node.get(3), context);
                if (context.isStopped() && exitLoop(context)) {
                    break;
                }
                if (lexical) {
                    context.env = context.env.copy();
                    context.saveState(node, context.env);
                }
                eval(update, context);
            }
        } finally {
            context.env = saved;
        }
        return Terms.UNDEFINED;
    }

    private static Object evalForEach(Node node, CoreContext context, boolean of) {
        Realm realm = context.realm;
        Node head = node.get(0);
        Environment saved = context.env;
        ForState state = context.state(node, ForState::new);
        boolean resuming = state.iterator != null && context.isReplaying();
        if (!resuming) {
            Object source = eval(node.get(1), context);
            state.iterator = of ? PropertyAccess.iterator(realm, source) : new ArrayList<>(PropertyAccess.forInKeys(source)).iterator();
        }
        try {
            while (resuming || state.iterator.hasNext()) {
                if (resuming) {
                    context.env = state.env;
                    resuming = false;
                } else {
                    bindLoopVariable(head, state.iterator.next(), saved, context);
                    state.env = context.env;
                }
                statement(node.get(2), context);
                if (context.isStopped() && exitLoop(context)) {
                    break;
                }
            }
        } finally {
            context.env = saved;
        }
        return Terms.UNDEFINED;
    }

    private static void bindLoopVariable(Node head, Object item, Environment outer, CoreContext context) {
        context.env = outer;
        if (head.type != NodeType.VAR_STMT) {
            bindPattern(head, item, null, context);
        } else if (head.op == TokenType.VAR) {
            bindPattern(head.get(0).get(0), item, BindingType.VAR, context);
        } else {
            context.env = new Environment(outer);
            bindPattern(head.get(0).get(0), item, head.op == TokenType.CONST ? BindingType.CONST : BindingType.LET, context);
        }
    }

    private static Object evalTry(Node node, CoreContext context) {
        Node handler = node.get(2);
        Node finalizer = node.get(3);
        TryState state = context.state(node, TryState::new);
        if (state.phase == TRY) {
            try {
                evalBlock(node.get(0), context);
            } catch (JsException e) {
                if (handler.isEmpty()) {
                    state.pending = e;
                } else {
                    state.phase = CATCH;
                    state.caught = e;
                }
            }
        }
        if (state.phase == CATCH) {
            Environment saved = context.env;
            try {
                if (state.catchEnv == null) {
                    state.catchEnv = new Environment(saved);
                    context.env = state.catchEnv;
                    if (!node.get(1).isEmpty()) {
                        bindPattern(node.get(1), state.caught.getValue(), BindingType.LET, context);
                    }
                }
                context.env = state.catchEnv;
                evalBlock(handler, context);
            } catch (JsException e) {
                state.pending = e;
            } finally {
                context.env = saved;
            }
        }
        if (!finalizer.isEmpty()) {
            if (state.phase != FINALLY) {
                state.phase = FINALLY;
                state.exitType = context.getExitType();
                state.returnValue = context.getReturnValue();
            }
            context.reset();
            evalBlock(finalizer, context);
            if (context.isStopped()) {
                // an exit from finally replaces the pending completion
                return Terms.UNDEFINED;
            }
            context.restore(state.exitType, state.returnValue);
        }
        if (state.pending != null) {
            throw state.pending;
        }
        return Terms.UNDEFINED;
    }

    private static Object evalSwitch(Node node, CoreContext context) {
        Object value = eval(node.get(0), context);
        List<Node> statements = new ArrayList<>();
        for (int i = 1; i < node.size(); i++) {
            Node caseNode = node.get(i);
            for (int j = 1; j < caseNode.size(); j++) {
                statements.add(caseNode.get(j));
            }
        }
        Environment saved = context.env;
        context.env = blockScope(node, context, statements);
        try {
            int start = -1;
            int defaultIndex = -1;
            for (int i = 1; i < node.size(); i++) {
                Node test = node.get(i).get(0);
                if (test.isEmpty()) {
                    defaultIndex = i;
                } else if (Terms.strictEquals(value, eval(test, context))) {
                    start = i;
                    break;
                }
            }
            if (start == -1) {
                start = defaultIndex;
            }
            if (start == -1) {
                return Terms.UNDEFINED;
            }
            for (int i = start; i < node.size(); i++) {
                evalStatements(node.get(i), 1, context);
                if (context.isStopped()) {
                    if (context.getExitType() == CoreContext.ExitType.BREAK) {
                        context.reset();
                    }
                    break;
                }
            }
        } finally {
            context.env = saved;
        }
        return Terms.UNDEFINED;
    }

    private static Object evalClassDecl(Node node, CoreContext context) {
        JsClass cls = evalClass(node, context);
        context.env.initialize(node.get(0).getName(), cls);
        return Terms.UNDEFINED;
    }

    private static JsClass evalClass(Node node, CoreContext context) {
        Object superValue = node.is(Node.DERIVED) ? eval(node.get(1), context) : null;
        return JsClass.define(context.realm, node, superValue, context.env, key -> eval(key, context));
    }

    //==================================================================================================================
    // modules

    private static ModuleRecord module(Node node, CoreContext context) {
        if (context.module == null) {
            throw context.realm.syntaxError("Unexpected token '" + node.token.text + "'");
        }
        return context.module;
    }

    private static void evalImport(Node node, CoreContext context) {
        Realm realm = context.realm;
        ModuleRecord importer = module(node, context);
        String specifier = node.getName();
        if (realm.moduleLoader == null) {
            throw realm.error(ErrorKind.ERROR, "Cannot load module '" + specifier + "': no module loader");
        }
        ModuleRecord target;
        context.mark(node);
        try {
            target = realm.moduleLoader.load(realm, specifier, importer);
        } catch (ModuleException e) {
            throw realm.error(e.getKind() == ModuleException.Kind.PARSE_ERROR ? ErrorKind.SYNTAX_ERROR : ErrorKind.ERROR, e.getMessage());
        }
        JsObject namespace = target.getNamespace();
        for (Node spec : node) {
            switch (spec.type) {
                case IMPORT_DEFAULT -> context.env.declare(spec.get(0).getName(), BindingType.CONST, imported(realm, target, "default", specifier));
                case IMPORT_NAMESPACE -> context.env.declare(spec.get(0).getName(), BindingType.CONST, namespace);
                default -> context.env.declare(spec.get(0).getName(), BindingType.CONST, imported(realm, target, spec.getName(), specifier));
            }
        }
    }

    private static Object imported(Realm realm, ModuleRecord target, String name, String specifier) {
        JsObject namespace = target.getNamespace();
        if (!namespace.hasOwnProperty(name) && target.isLoaded()) {
            throw realm.syntaxError("The requested module '" + specifier + "' does not provide an export named '" + name + "'");
        }
        return namespace.getOwn(name);
    }

    private static Object evalExportDecl(Node node, CoreContext context) {
        ModuleRecord module = module(node, context);
        Node decl = node.get(0);
        statement(decl, context);
        switch (decl.type) {
            case VAR_STMT -> {
                for (Node d : decl) {
                    for (String name : boundNames(d.get(0))) {
                        module.export(name, context.env.get(context.realm, name));
                    }
                }
            }
            case CLASS_DECL -> module.export(decl.get(0).getName(), context.env.get(context.realm, decl.get(0).getName()));
            default -> {
                // functions are exported when hoisted
            }
        }
        return Terms.UNDEFINED;
    }

    private static Object evalExportDefault(Node node, CoreContext context) {
        ModuleRecord module = module(node, context);
        Node value = node.get(0);
        if (value.type == NodeType.FN_DECL) {
            return Terms.UNDEFINED;
        }
        if (value.type == NodeType.CLASS_DECL) {
            statement(value, context);
            module.export("default", context.env.get(context.realm, value.get(0).getName()));
        } else {
            module.export("default", eval(value, context));
        }
        return Terms.UNDEFINED;
    }

    private static Object evalExportNamed(Node node, CoreContext context) {
        ModuleRecord module = module(node, context);
        for (Node spec : node) {
            module.export(spec.getName(), context.env.get(context.realm, spec.get(0).getName()));
        }
        return Terms.UNDEFINED;
    }

    //==================================================================================================================
    // bindings and patterns

    /**
     * Binds a declaration target or assigns an assignment target.
     *
     * @param type null for plain assignment, VAR to assign the hoisted binding, LET / CONST to
     *             initialize a lexical binding in the current scope
     */
    static void bindPattern(Node target, Object value, BindingType type, CoreContext context) {
        Realm realm = context.realm;
        switch (target.type) {
            case IDENT -> bindName(target.getName(), value, type, context);
            case MEMBER_EXPR -> {
                Object object = target.get(0).type == NodeType.SUPER ? context.thisObject : eval(target.get(0), context);
                PropertyAccess.set(realm, object, target.getName(), value);
            }
            case INDEX_EXPR -> {
                Object object = eval(target.get(0), context);
                PropertyAccess.setIndex(realm, object, eval(target.get(1), context), value);
            }
            case ASSIGN_PATTERN -> {
                Object actual = value == Terms.UNDEFINED ? eval(target.get(1), context) : value;
                bindPattern(target.get(0), actual, type, context);
            }
            case ARRAY_PATTERN -> {
                if (Terms.isNullish(value)) {
                    throw realm.typeError(Terms.toStr(realm, value) + " is not iterable");
                }
                List<Object> items = PropertyAccess.iterate(realm, value);
                int i = 0;
                for (Node element : target) {
                    if (element.type == NodeType.REST) {
                        List<Object> rest = new ArrayList<>(items.subList(Math.min(i, items.size()), items.size()));
                        bindPattern(element.get(0), new JsArray(realm.arrayPrototype, rest), type, context);
                    } else if (!element.isEmpty()) {
                        bindPattern(element, i < items.size() ? items.get(i) : Terms.UNDEFINED, type, context);
                    }
                    i++;
                }
            }
            case OBJECT_PATTERN -> {
                if (Terms.isNullish(value)) {
                    throw realm.typeError("Cannot destructure '" + Terms.toStr(realm, value) + "' as it is " + Terms.toStr(realm, value) + ".");
                }
                Set<String> used = new HashSet<>();
                for (Node prop : target) {
                    if (prop.type == NodeType.REST) {
                        JsObject rest = new JsObject(realm.objectPrototype);
                        PropertyAccess.copyOwn(realm, rest, value, used);
                        bindPattern(prop.get(0), rest, type, context);
                        continue;
                    }
                    Node keyNode = prop.get(0);
                    String key = prop.is(Node.COMPUTED) ? Terms.toPropertyKey(realm, eval(keyNode, context)) : keyNode.getName();
                    used.add(key);
                    bindPattern(prop.get(1), PropertyAccess.get(realm, value, key), type, context);
                }
            }
            default -> throw realm.syntaxError("Invalid destructuring assignment target");
        }
    }

    private static void bindName(String name, Object value, BindingType type, CoreContext context) {
        if (type == null || type == BindingType.VAR) {
            context.env.assign(context.realm, name, value);
            return;
        }
        Binding binding = context.env.getOwn(name);
        if (binding != null && !binding.initialized) {
            context.env.initialize(name, value);
        } else {
            context.env.declare(name, type, value);
        }
    }

    //==================================================================================================================
    // expressions

    private static Object evalTemplate(Node node, CoreContext context) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < node.size(); i++) {
            Node part = node.get(i);
            if (i % 2 == 0) {
                sb.append((String) part.value);
            } else {
                sb.append(Terms.toStr(context.realm, eval(part, context)));
            }
        }
        return sb.toString();
    }

    private static Object evalArrayLit(Node node, CoreContext context) {
        List<Object> list = new ArrayList<>(node.size());
        for (Node element : node) {
            if (element.isEmpty()) {
                list.add(Terms.UNDEFINED);
            } else if (element.type == NodeType.SPREAD) {
                list.addAll(PropertyAccess.iterate(context.realm, eval(element.get(0), context)));
            } else {
                list.add(eval(element, context));
            }
        }
        return new JsArray(context.realm.arrayPrototype, list);
    }

    private static Object evalObjectLit(Node node, CoreContext context) {
        Realm realm = context.realm;
        JsObject object = new JsObject(realm.objectPrototype);
        for (Node prop : node) {
            if (prop.type == NodeType.SPREAD) {
                PropertyAccess.copyOwn(realm, object, eval(prop.get(0), context), null);
                continue;
            }
            Node keyNode = prop.get(0);
            Node valueNode = prop.get(1);
            String key = prop.is(Node.COMPUTED) ? Terms.toPropertyKey(realm, eval(keyNode, context)) : keyNode.getName();
            Object value;
            if (valueNode.type == NodeType.ASSIGN_PATTERN) {
                throw realm.syntaxError("Invalid shorthand property initializer");
            }
            if (prop.is(Node.GETTER) || prop.is(Node.SETTER)) {
                JsClosure accessor = realm.newClosure(valueNode, context.env, context.thisObject, context.function, key);
                accessor.setHomeObject(object);
                object.defineAccessor(key, prop.is(Node.GETTER) ? accessor : null, prop.is(Node.SETTER) ? accessor : null, false);
                continue;
            }
            if (prop.is(Node.METHOD)) {
                JsClosure method = realm.newClosure(valueNode, context.env, context.thisObject, context.function, key);
                method.method = true;
                method.homeObject = object;
                value = method;
            } else if (prop.is(Node.COMPUTED) && valueNode.type.isFunction() && valueNode.get(0).isEmpty()) {
                value = realm.newClosure(valueNode, context.env, context.thisObject, context.function, key);
            } else {
                value = eval(valueNode, context);
            }
            object.put(key, value);
        }
        return object;
    }

    private static Object evalUnary(Node node, CoreContext context) {
        Realm realm = context.realm;
        Node arg = node.get(0);
        switch (node.op) {
            case DELETE:
                return evalDelete(arg, context);
            case TYPEOF:
                if (arg.type == NodeType.IDENT && context.env.find(realm, arg.getName()) == null) {
                    return "undefined";
                }
                return Terms.typeOf(eval(arg, context));
            default:
                return Terms.unary(realm, node.op, eval(arg, context));
        }
    }

    private static Object evalDelete(Node arg, CoreContext context) {
        Realm realm = context.realm;
        switch (arg.type) {
            case MEMBER_EXPR:
                return PropertyAccess.delete(realm, eval(arg.get(0), context), arg.getName());
            case INDEX_EXPR: {
                Object object = eval(arg.get(0), context);
                return PropertyAccess.delete(realm, object, eval(arg.get(1), context));
            }
            case IDENT:
                return false;
            default:
                eval(arg, context);
                return true;
        }
    }

    private static Object evalUpdate(Node node, CoreContext context) {
        Realm realm = context.realm;
        Node target = node.get(0);
        double delta = node.op == TokenType.PLUS_PLUS ? 1 : -1;
        double old;
        switch (target.type) {
            case IDENT: {
                String name = target.getName();
                old = Terms.toNumber(realm, context.env.get(realm, name));
                context.env.assign(realm, name, Terms.narrow(old + delta));
                break;
            }
            case MEMBER_EXPR: {
                Object object = eval(target.get(0), context);
                old = Terms.toNumber(realm, PropertyAccess.get(realm, object, target.getName()));
                PropertyAccess.set(realm, object, target.getName(), Terms.narrow(old + delta));
                break;
            }
            default: {
                Object object = eval(target.get(0), context);
                Object key = eval(target.get(1), context);
                old = Terms.toNumber(realm, PropertyAccess.getIndex(realm, object, key));
                PropertyAccess.setIndex(realm, object, key, Terms.narrow(old + delta));
            }
        }
        return Terms.narrow(node.is(Node.PREFIX) ? old + delta : old);
    }

    private static Object evalLogical(Node node, CoreContext context) {
        Object left = eval(node.get(0), context);
        return switch (node.op) {
            case AMP_AMP -> Terms.isTruthy(left) ? eval(node.get(1), context) : left;
            case PIPE_PIPE -> Terms.isTruthy(left) ? left : eval(node.get(1), context);
            default -> Terms.isNullish(left) ? eval(node.get(1), context) : left;
        };
    }

    private static Object evalSequence(Node node, CoreContext context) {
        Object result = Terms.UNDEFINED;
        for (Node child : node) {
            result = eval(child, context);
        }
        return result;
    }

    private static Object evalAssign(Node node, CoreContext context) {
        Realm realm = context.realm;
        Node target = node.get(0);
        Node valueNode = node.get(1);
        if (node.op == TokenType.EQ) {
            switch (target.type) {
                case IDENT: {
                    Object value = eval(valueNode, context);
                    context.env.assign(realm, target.getName(), value);
                    return value;
                }
                case MEMBER_EXPR: {
                    Object object = target.get(0).type == NodeType.SUPER ? context.thisObject : eval(target.get(0), context);
                    Object value = eval(valueNode, context);
                    PropertyAccess.set(realm, object, target.getName(), value);
                    return value;
                }
                case INDEX_EXPR: {
                    Object object = eval(target.get(0), context);
                    Object key = eval(target.get(1), context);
                    Object value = eval(valueNode, context);
                    PropertyAccess.setIndex(realm, object, key, value);
                    return value;
                }
                default: {
                    Object value = eval(valueNode, context);
                    bindPattern(target, value, null, context);
                    return value;
                }
            }
        }
        TokenType op = node.op.binaryOf();
        Object object = null;
        Object key = null;
        if (target.type == NodeType.MEMBER_EXPR) {
            object = eval(target.get(0), context);
            key = target.getName();
        } else if (target.type == NodeType.INDEX_EXPR) {
            object = eval(target.get(0), context);
            key = eval(target.get(1), context);
        }
        Object base = object;
        Object index = key;
        Object old = context.remember(target, () -> base == null && index == null
                ? context.env.get(realm, target.getName()) : PropertyAccess.getIndex(realm, base, index));
        Object value;
        switch (op) {
            case AMP_AMP:
                if (!Terms.isTruthy(old)) {
                    return old;
                }
                value = eval(valueNode, context);
                break;
            case PIPE_PIPE:
                if (Terms.isTruthy(old)) {
                    return old;
                }
                value = eval(valueNode, context);
                break;
            case QUES_QUES:
                if (!Terms.isNullish(old)) {
                    return old;
                }
                value = eval(valueNode, context);
                break;
            default:
                value = Terms.binary(realm, op, old, eval(valueNode, context));
        }
        if (target.type == NodeType.IDENT) {
            context.env.assign(realm, target.getName(), value);
        } else {
            PropertyAccess.setIndex(realm, object, key, value);
        }
        return value;
    }

    private static Object[] evalArgs(Node argsNode, CoreContext context) {
        List<Object> args = new ArrayList<>(argsNode.size());
        for (Node arg : argsNode) {
            if (arg.type == NodeType.SPREAD) {
                args.addAll(PropertyAccess.iterate(context.realm, eval(arg.get(0), context)));
            } else {
                args.add(eval(arg, context));
            }
        }
        return args.toArray();
    }

    private static JsObject homeObject(CoreContext context) {
        return context.function == null ? null : context.function.homeObject;
    }

    private static Object evalCall(Node node, CoreContext context) {
        Realm realm = context.realm;
        Node callee = node.get(0);
        if (callee.type == NodeType.SUPER) {
            Object[] args = evalArgs(node.get(1), context);
            context.mark(node);
            JsClass owner = context.function == null ? null : context.function.ownerClass;
            if (context.function != null && context.function.isDerivedConstructor() && !context.thisPending) {
                throw realm.referenceError(JsClass.SUPER_CALLED_TWICE);
            }
            Object result = JsClass.superConstruct(realm, owner, context.thisObject, args);
            context.thisPending = false;
            return result;
        }
        Object thisValue = Terms.UNDEFINED;
        Object fn;
        if (callee.type == NodeType.MEMBER_EXPR || callee.type == NodeType.INDEX_EXPR) {
            boolean isSuper = callee.get(0).type == NodeType.SUPER;
            Object object = isSuper ? context.thisValue() : eval(callee.get(0), context);
            if (object == SKIP || (callee.is(Node.OPTIONAL) && Terms.isNullish(object))) {
                return SKIP;
            }
            Object key = callee.type == NodeType.MEMBER_EXPR ? callee.getName() : eval(callee.get(1), context);
            thisValue = object;
            fn = context.remember(callee, () -> isSuper
                    ? JsClass.superGet(realm, homeObject(context), Terms.toPropertyKey(realm, key), context.thisValue())
                    : PropertyAccess.getIndex(realm, object, key));
        } else {
            fn = eval(callee, context);
            if (fn == SKIP) {
                return SKIP;
            }
        }
        if (node.is(Node.OPTIONAL) && Terms.isNullish(fn)) {
            return SKIP;
        }
        Object[] args = evalArgs(node.get(1), context);
        context.mark(node);
        if (!(fn instanceof JsFunction function)) {
            throw realm.typeError(PropertyAccess.describe(callee) + " is not a function");
        }
        return realm.call(function, thisValue, args);
    }

    private static Object evalNew(Node node, CoreContext context) {
        Realm realm = context.realm;
        Object callee = eval(node.get(0), context);
        Object[] args = evalArgs(node.get(1), context);
        context.mark(node);
        if (!(callee instanceof JsFunction fn) || !fn.isConstructor()) {
            throw realm.typeError(PropertyAccess.describe(node.get(0)) + " is not a constructor");
        }
        return realm.construct(fn, args);
    }

    private static Object evalMember(Node node, CoreContext context) {
        Realm realm = context.realm;
        if (node.get(0).type == NodeType.SUPER) {
            return JsClass.superGet(realm, homeObject(context), node.getName(), context.thisValue());
        }
        Object object = eval(node.get(0), context);
        if (object == SKIP || (node.is(Node.OPTIONAL) && Terms.isNullish(object))) {
            return SKIP;
        }
        return PropertyAccess.get(realm, object, node.getName());
    }

    private static Object evalIndex(Node node, CoreContext context) {
        Realm realm = context.realm;
        if (node.get(0).type == NodeType.SUPER) {
            return JsClass.superGet(realm, homeObject(context), Terms.toPropertyKey(realm, eval(node.get(1), context)), context.thisValue());
        }
        Object object = eval(node.get(0), context);
        if (object == SKIP || (node.is(Node.OPTIONAL) && Terms.isNullish(object))) {
            return SKIP;
        }
        return PropertyAccess.getIndex(realm, object, eval(node.get(1), context));
    }

}
