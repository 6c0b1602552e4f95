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

import io.twinjs.common.Resource;

import java.util.ArrayDeque;
import java.util.Deque;

import static io.twinjs.parser.TokenType.*;

/**
 * Recursive-descent parser producing one {@link NodeType#PROGRAM} per source unit.
 * Precedence, low to high: assignment, conditional, nullish / logical or, logical and,
 * bitwise or / xor / and, equality, relational, shift, additive, multiplicative,
 * exponent, unary, postfix / call / member.
 */
public class JsParser extends BaseParser {

    private static class FunctionScope {

        final FunctionInfo info;
        int loopDepth;
        int breakableDepth;

        FunctionScope(FunctionInfo info) {
            this.info = info;
        }

    }

    private final Deque<FunctionScope> scopes = new ArrayDeque<>();

    private boolean noIn;

    public JsParser(Resource resource) {
        super(resource);
    }

    public static Node parse(String text) {
        return new JsParser(Resource.text(text)).parse();
    }

    public Node parse() {
        Token first = peekToken();
        Node program = new Node(NodeType.PROGRAM, first);
        FunctionInfo info = new FunctionInfo(false, false);
        program.value = info;
        scopes.push(new FunctionScope(info));
        while (peek() != EOF) {
            program.add(statement(true));
        }
        scopes.pop();
        return program;
    }

    // ========== Scope Tracking ==========

    private FunctionScope scope() {
        return scopes.peek();
    }

    private boolean inFunction() {
        return scopes.size() > 1;
    }

    private boolean inAsync() {
        return scope().info.async;
    }

    // the function that owns 'this' and 'arguments'
    private FunctionInfo nonArrowInfo() {
        for (FunctionScope fs : scopes) {
            if (!fs.info.arrow) {
                return fs.info;
            }
        }
        return scopes.getLast().info;
    }

    // ========== Statements ==========

    private Node statement(boolean topLevel) {
        Token token = peekToken();
        switch (token.type) {
            case L_CURLY:
                return block();
            case SEMI:
                next();
                return Node.empty(token);
            case VAR:
            case LET:
            case CONST: {
                Node node = varStatement();
                eos();
                return node;
            }
            case FUNCTION:
                return functionDeclaration(false);
            case CLASS:
                return classDefinition(true);
            case IF:
                return ifStatement();
            case WHILE:
                return whileStatement();
            case DO:
                return doWhileStatement();
            case FOR:
                return forStatement();
            case RETURN:
                return returnStatement();
            case BREAK:
            case CONTINUE:
                return breakOrContinue();
            case THROW:
                return throwStatement();
            case TRY:
                return tryStatement();
            case SWITCH:
                return switchStatement();
            case IMPORT:
                if (peek(1) == L_PAREN || peek(1) == DOT) {
                    throw error("dynamic import is not supported");
                }
                if (!topLevel) {
                    throw error("import declarations only at top level");
                }
                return importDeclaration();
            case EXPORT:
                if (!topLevel) {
                    throw error("export declarations only at top level");
                }
                return exportDeclaration();
            default:
                if (isAsyncFunction()) {
                    next();
                    return functionDeclaration(true);
                }
                return expressionStatement();
        }
    }

    private boolean isAsyncFunction() {
        return isIdent("async") && peek(1) == FUNCTION && !peekToken(1).isNewlineBefore();
    }

    private Node expressionStatement() {
        Node node = new Node(NodeType.EXPR_STMT, peekToken());
        node.add(expression());
        eos();
        return node;
    }

    private Node block() {
        Node node = new Node(NodeType.BLOCK, consume(L_CURLY, "expected '{'"));
        while (peek() != R_CURLY) {
            if (peek() == EOF) {
                throw error("expected '}'");
            }
            node.add(statement(false));
        }
        next();
        return node;
    }

    private Node varStatement() {
        Token token = next();
        Node node = new Node(NodeType.VAR_STMT, token);
        node.op = token.type;
        do {
            Node decl = new Node(NodeType.VAR_DECL, peekToken());
            Node target = bindingTarget();
            decl.add(target);
            if (consumeIf(EQ)) {
                Node init = assignment();
                inferName(init, target);
                decl.add(init);
            } else {
                if (token.type == CONST && !isForHead()) {
                    throw error("missing initializer in const declaration");
                }
                if (target.type != NodeType.IDENT && !isForHead()) {
                    throw error("missing initializer in destructuring declaration");
                }
                decl.add(Node.empty(peekToken()));
            }
            if (token.type == VAR) {
                collectNames(target, scope().info);
            }
            node.add(decl);
        } while (consumeIf(COMMA));
        return node;
    }

    private boolean isForHead() {
        return peek() == OF || peek() == IN;
    }

    private static void inferName(Node value, Node target) {
        if (target.type == NodeType.IDENT) {
            inferName(value, target.getName());
        }
    }

    private static void inferName(Node value, String name) {
        if (value.type.isFunction() && value.getFirst().isEmpty()) {
            FunctionInfo info = value.getFunctionInfo();
            if (info.inferredName == null) {
                info.inferredName = name;
            }
        } else if (value.type == NodeType.CLASS_EXPR && value.getFirst().isEmpty() && value.value == null) {
            value.value = name;
        }
    }

    private static void collectNames(Node target, FunctionInfo info) {
        switch (target.type) {
            case IDENT -> info.varNames.add(target.getName());
            case ARRAY_PATTERN, OBJECT_PATTERN -> {
                for (Node child : target) {
                    collectNames(child, info);
                }
            }
            case PATTERN_PROP -> collectNames(target.get(1), info);
            case ASSIGN_PATTERN, REST -> collectNames(target.getFirst(), info);
            default -> {
                // holes
            }
        }
    }

    private Node ifStatement() {
        Node node = new Node(NodeType.IF_STMT, next());
        consume(L_PAREN, "expected '('");
        node.add(expression());
        consume(R_PAREN, "expected ')'");
        node.add(statement(false));
        if (consumeIf(ELSE)) {
            node.add(statement(false));
        } else {
            node.add(Node.empty(peekToken()));
        }
        return node;
    }

    private Node loopBody() {
        FunctionScope fs = scope();
        fs.loopDepth++;
        fs.breakableDepth++;
        try {
            return statement(false);
        } finally {
            fs.loopDepth--;
            fs.breakableDepth--;
        }
    }

    private Node whileStatement() {
        Node node = new Node(NodeType.WHILE_STMT, next());
        consume(L_PAREN, "expected '('");
        node.add(expression());
        consume(R_PAREN, "expected ')'");
        node.add(loopBody());
        return node;
    }

    private Node doWhileStatement() {
        Node node = new Node(NodeType.DO_WHILE_STMT, next());
        node.add(loopBody());
        consume(WHILE, "expected 'while'");
        consume(L_PAREN, "expected '('");
        node.add(expression());
        consume(R_PAREN, "expected ')'");
        consumeIf(SEMI);
        return node;
    }

    private Node forStatement() {
        Token forToken = next();
        if (isIdent("await")) {
            throw error("for await is not supported");
        }
        consume(L_PAREN, "expected '('");
        Node init;
        if (peek() == SEMI) {
            init = Node.empty(peekToken());
        } else {
            noIn = true;
            try {
                if (peek().oneOf(VAR, LET, CONST)) {
                    init = varStatement();
                } else {
                    Node expr = expression();
                    if (isForHead()) {
                        expr = toPattern(expr);
                    }
                    init = expr;
                }
            } finally {
                noIn = false;
            }
            if (isForHead()) {
                boolean of = next().type == OF;
                if (init.type == NodeType.VAR_STMT && (init.size() != 1 || !init.getFirst().get(1).isEmpty())) {
                    throw error("invalid left-hand side in for-" + (of ? "of" : "in") + " loop");
                }
                Node node = new Node(of ? NodeType.FOR_OF_STMT : NodeType.FOR_IN_STMT, forToken);
                node.add(init);
                node.add(of ? assignment() : expression());
                consume(R_PAREN, "expected ')'");
                node.add(loopBody());
                return node;
            }
        }
        Node node = new Node(NodeType.FOR_STMT, forToken);
        node.add(init);
        consume(SEMI, "expected ';'");
        node.add(peek() == SEMI ? Node.empty(peekToken()) : expression());
        consume(SEMI, "expected ';'");
        node.add(peek() == R_PAREN ? Node.empty(peekToken()) : expression());
        consume(R_PAREN, "expected ')'");
        node.add(loopBody());
        return node;
    }

    private Node returnStatement() {
        Token token = next();
        if (!inFunction()) {
            throw new ParserException("'return' outside a function", token);
        }
        Node node = new Node(NodeType.RETURN_STMT, token);
        Token la = peekToken();
        if (la.type == SEMI || la.type == R_CURLY || la.type == EOF || la.isNewlineBefore()) {
            node.add(Node.empty(la));
        } else {
            node.add(expression());
        }
        eos();
        return node;
    }

    private Node breakOrContinue() {
        Token token = next();
        boolean isBreak = token.type == BREAK;
        FunctionScope fs = scope();
        if (isBreak ? fs.breakableDepth == 0 : fs.loopDepth == 0) {
            throw new ParserException("'" + token.text + "' outside a loop" + (isBreak ? " or switch" : ""), token);
        }
        if (peek() == IDENT && !peekToken().isNewlineBefore()) {
            throw error("labels are not supported");
        }
        eos();
        return new Node(isBreak ? NodeType.BREAK_STMT : NodeType.CONTINUE_STMT, token);
    }

    private Node throwStatement() {
        Node node = new Node(NodeType.THROW_STMT, next());
        if (peekToken().isNewlineBefore()) {
            throw error("expression after 'throw' on the same line");
        }
        node.add(expression());
        eos();
        return node;
    }

    private Node tryStatement() {
        Node node = new Node(NodeType.TRY_STMT, next());
        node.add(block());
        if (consumeIf(CATCH)) {
            if (consumeIf(L_PAREN)) {
                node.add(bindingTarget());
                consume(R_PAREN, "expected ')'");
            } else {
                node.add(Node.empty(peekToken()));
            }
            node.add(block());
        } else {
            node.add(Node.empty(peekToken()));
            node.add(Node.empty(peekToken()));
        }
        if (consumeIf(FINALLY)) {
            node.add(block());
        } else {
            if (node.get(2).isEmpty()) {
                throw error("expected 'catch' or 'finally'");
            }
            node.add(Node.empty(peekToken()));
        }
        return node;
    }

    private Node switchStatement() {
        Node node = new Node(NodeType.SWITCH_STMT, next());
        consume(L_PAREN, "expected '('");
        node.add(expression());
        consume(R_PAREN, "expected ')'");
        consume(L_CURLY, "expected '{'");
        FunctionScope fs = scope();
        fs.breakableDepth++;
        boolean hasDefault = false;
        try {
            while (!consumeIf(R_CURLY)) {
                Node caseNode = new Node(NodeType.CASE, peekToken());
                if (consumeIf(CASE)) {
                    caseNode.add(expression());
                } else if (peek() == DEFAULT) {
                    if (hasDefault) {
                        throw error("only one default clause");
                    }
                    next();
                    hasDefault = true;
                    caseNode.add(Node.empty(peekToken()));
                } else {
                    throw error("expected 'case', 'default' or '}'");
                }
                consume(COLON, "expected ':'");
                while (!peek().oneOf(CASE, DEFAULT, R_CURLY)) {
                    if (peek() == EOF) {
                        throw error("expected '}'");
                    }
                    caseNode.add(statement(false));
                }
                node.add(caseNode);
            }
        } finally {
            fs.breakableDepth--;
        }
        return node;
    }

    // ========== Modules ==========

    private String moduleSpecifier() {
        Token token = peekToken();
        if (!token.type.oneOf(S_STRING, D_STRING)) {
            throw error("expected module specifier string");
        }
        next();
        return stringValue(token);
    }

    private Node importDeclaration() {
        Node node = new Node(NodeType.IMPORT_DECL, next());
        if (peek().oneOf(S_STRING, D_STRING)) {
            node.value = moduleSpecifier();
            eos();
            return node;
        }
        if (peek() == IDENT) {
            Node def = new Node(NodeType.IMPORT_DEFAULT, peekToken());
            def.add(identifier());
            node.add(def);
            if (!consumeIf(COMMA)) {
                fromClause(node);
                return node;
            }
        }
        if (consumeIf(STAR)) {
            Node ns = new Node(NodeType.IMPORT_NAMESPACE, peekToken());
            if (!isIdent("as")) {
                throw error("expected 'as'");
            }
            next();
            ns.add(identifier());
            node.add(ns);
        } else if (consumeIf(L_CURLY)) {
            while (!consumeIf(R_CURLY)) {
                Token nameToken = peekToken();
                String imported = propertyName();
                Node spec = new Node(NodeType.IMPORT_SPEC, nameToken);
                spec.value = imported;
                if (isIdent("as")) {
                    next();
                    spec.add(identifier());
                } else {
                    if (nameToken.type != IDENT) {
                        throw new ParserException("expected 'as' after keyword import name", nameToken);
                    }
                    Node local = new Node(NodeType.IDENT, nameToken);
                    local.value = imported;
                    spec.add(local);
                }
                node.add(spec);
                if (!consumeIf(COMMA) && peek() != R_CURLY) {
                    throw error("expected ',' or '}'");
                }
            }
        } else {
            throw error("expected import bindings");
        }
        fromClause(node);
        return node;
    }

    private void fromClause(Node node) {
        if (!isIdent("from")) {
            throw error("expected 'from'");
        }
        next();
        node.value = moduleSpecifier();
        eos();
    }

    private Node exportDeclaration() {
        Token token = next();
        if (consumeIf(DEFAULT)) {
            Node node = new Node(NodeType.EXPORT_DEFAULT, token);
            if (peek() == FUNCTION || isAsyncFunction()) {
                boolean async = isAsyncFunction();
                if (async) {
                    next();
                }
                if (peek(1) == IDENT) {
                    node.add(functionDeclaration(async));
                } else {
                    Node fn = functionExpression(async);
                    node.add(fn);
                    inferName(fn, "default");
                }
                return node;
            }
            if (peek() == CLASS) {
                node.add(classDefinition(peek(1) == IDENT));
                return node;
            }
            Node expr = assignment();
            inferName(expr, "default");
            node.add(expr);
            eos();
            return node;
        }
        if (peek() == L_CURLY) {
            next();
            Node node = new Node(NodeType.EXPORT_NAMED, token);
            while (!consumeIf(R_CURLY)) {
                Node spec = new Node(NodeType.EXPORT_SPEC, peekToken());
                Node local = identifier();
                spec.add(local);
                if (isIdent("as")) {
                    next();
                    spec.value = propertyName();
                } else {
                    spec.value = local.getName();
                }
                node.add(spec);
                if (!consumeIf(COMMA) && peek() != R_CURLY) {
                    throw error("expected ',' or '}'");
                }
            }
            if (isIdent("from")) {
                throw error("re-exports are not supported");
            }
            eos();
            return node;
        }
        Node node = new Node(NodeType.EXPORT_DECL, token);
        if (peek().oneOf(VAR, LET, CONST)) {
            node.add(varStatement());
            eos();
        } else if (peek() == FUNCTION) {
            node.add(functionDeclaration(false));
        } else if (isAsyncFunction()) {
            next();
            node.add(functionDeclaration(true));
        } else if (peek() == CLASS) {
            node.add(classDefinition(true));
        } else {
            throw error("expected declaration after 'export'");
        }
        return node;
    }

    // ========== Functions ==========

    private Node functionDeclaration(boolean async) {
        Token token = consume(FUNCTION, "expected 'function'");
        boolean generator = generatorStar(async);
        Node node = new Node(NodeType.FN_DECL, token);
        node.add(identifier());
        functionRest(node, async, generator);
        return node;
    }

    private Node functionExpression(boolean async) {
        Token token = consume(FUNCTION, "expected 'function'");
        boolean generator = generatorStar(async);
        Node node = new Node(NodeType.FN_EXPR, token);
        node.add(peek() == IDENT ? identifier() : Node.empty(peekToken()));
        functionRest(node, async, generator);
        return node;
    }

    private boolean generatorStar(boolean async) {
        if (!consumeIf(STAR)) {
            return false;
        }
        if (async) {
            throw error("async generators are not supported");
        }
        return true;
    }

    // 'get' or 'set' before a member key, unless it is the key itself
    private int accessorPrefix(boolean async, TokenType... notKey) {
        if (!(isIdent("get") || isIdent("set")) || peek(1).oneOf(notKey)) {
            return 0;
        }
        if (async) {
            throw error("accessors cannot be async");
        }
        return "get".equals(next().text) ? Node.GETTER : Node.SETTER;
    }

    private void checkAccessor(int accessor, Node fn, Token token) {
        Node params = fn.get(1);
        if (accessor == Node.GETTER && !params.isEmpty()) {
            throw new ParserException("getter must not have parameters", token);
        }
        if (accessor == Node.SETTER && (params.size() != 1 || params.get(0).type == NodeType.REST)) {
            throw new ParserException("setter must have exactly one parameter", token);
        }
    }

    // parameters and body of a non-arrow function
    private Node functionRest(Node node, boolean async, boolean generator) {
        FunctionInfo info = new FunctionInfo(false, async);
        info.generator = generator;
        node.value = info;
        if (async) {
            node.with(Node.ASYNC);
        }
        if (generator) {
            node.with(Node.GENERATOR);
        }
        scopes.push(new FunctionScope(info));
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            consume(L_PAREN, "expected '('");
            node.add(parameters(R_PAREN));
            node.add(functionBody());
        } finally {
            noIn = savedNoIn;
            scopes.pop();
        }
        return node;
    }

    private Node parameters(TokenType end) {
        Node params = new Node(NodeType.PARAMS, peekToken());
        while (!consumeIf(end)) {
            if (peek() == DOT_DOT_DOT) {
                Node rest = new Node(NodeType.REST, next());
                rest.add(bindingTarget());
                params.add(rest);
                if (peek() != end) {
                    throw error("rest parameter must be last");
                }
                continue;
            }
            params.add(bindingElement());
            if (!consumeIf(COMMA) && peek() != end) {
                throw error("expected ',' or '" + end.symbol() + "'");
            }
        }
        return params;
    }

    private Node functionBody() {
        Node body = new Node(NodeType.BLOCK, consume(L_CURLY, "expected '{'"));
        while (peek() != R_CURLY) {
            if (peek() == EOF) {
                throw error("expected '}'");
            }
            body.add(statement(false));
        }
        next();
        return body;
    }

    private boolean isArrowAhead() {
        // from '(' find the matching ')' and check for '=>'
        int depth = 0;
        int i = 0;
        while (true) {
            TokenType type = peek(i);
            if (type == EOF) {
                return false;
            }
            if (type.oneOf(L_PAREN, L_BRACKET, L_CURLY, DOLLAR_L_CURLY)) {
                depth++;
            } else if (type.oneOf(R_PAREN, R_BRACKET, R_CURLY)) {
                depth--;
                if (depth == 0) {
                    return peek(i + 1) == EQ_GT && !peekToken(i + 1).isNewlineBefore();
                }
            }
            i++;
        }
    }

    private Node arrowFunction(boolean async) {
        Token token = peekToken();
        Node node = new Node(NodeType.ARROW_FN, token);
        node.add(Node.empty(token));
        FunctionInfo info = new FunctionInfo(true, async);
        node.value = info;
        if (async) {
            node.with(Node.ASYNC);
        }
        scopes.push(new FunctionScope(info));
        try {
            if (peek() == IDENT) {
                Node params = new Node(NodeType.PARAMS, token);
                params.add(identifier());
                node.add(params);
            } else {
                consume(L_PAREN, "expected '('");
                node.add(parameters(R_PAREN));
            }
            consume(EQ_GT, "expected '=>'");
            if (peek() == L_CURLY) {
                boolean savedNoIn = noIn;
                noIn = false;
                try {
                    node.add(functionBody());
                } finally {
                    noIn = savedNoIn;
                }
            } else {
                node.add(assignment());
                node.with(Node.EXPRESSION_BODY);
            }
        } finally {
            scopes.pop();
        }
        return node;
    }

    // ========== Classes ==========

    private Node classDefinition(boolean declaration) {
        Token token = consume(CLASS, "expected 'class'");
        Node node = new Node(declaration ? NodeType.CLASS_DECL : NodeType.CLASS_EXPR, token);
        if (declaration) {
            node.add(identifier());
        } else {
            node.add(peek() == IDENT ? identifier() : Node.empty(peekToken()));
        }
        if (consumeIf(EXTENDS)) {
            node.add(leftHandSide());
            node.with(Node.DERIVED);
        } else {
            node.add(Node.empty(peekToken()));
        }
        Node body = new Node(NodeType.CLASS_BODY, consume(L_CURLY, "expected '{'"));
        Node instanceInit = syntheticInitializer(token);
        Node staticInit = syntheticInitializer(token);
        boolean hasConstructor = false;
        while (!consumeIf(R_CURLY)) {
            if (consumeIf(SEMI)) {
                continue;
            }
            Token memberToken = peekToken();
            boolean isStatic = false;
            if (isIdent("static") && !peek(1).oneOf(L_PAREN, EQ, SEMI)) {
                next();
                isStatic = true;
            }
            boolean async = false;
            if (isIdent("async") && !peek(1).oneOf(L_PAREN, EQ, SEMI) && !peekToken(1).isNewlineBefore()) {
                next();
                async = true;
            }
            int accessor = accessorPrefix(async, L_PAREN, EQ, SEMI, R_CURLY);
            boolean generator = accessor == 0 && generatorStar(async);
            boolean computed = peek() == L_BRACKET;
            Node key = propertyKey();
            if (peek() == L_PAREN) {
                Node method = new Node(NodeType.CLASS_METHOD, memberToken);
                method.add(key);
                Node fn = new Node(NodeType.FN_EXPR, memberToken);
                fn.add(Node.empty(memberToken));
                functionRest(fn, async, generator);
                method.add(fn);
                checkAccessor(accessor, fn, memberToken);
                if (accessor != 0) {
                    method.with(accessor);
                }
                if (!computed) {
                    fn.getFunctionInfo().inferredName = key.getName();
                }
                if (!isStatic && !computed && "constructor".equals(key.value)) {
                    if (async) {
                        throw new ParserException("class constructor cannot be async", memberToken);
                    }
                    if (accessor != 0 || generator) {
                        throw new ParserException("class constructor cannot be an accessor or a generator", memberToken);
                    }
                    if (hasConstructor) {
                        throw new ParserException("duplicate constructor", memberToken);
                    }
                    hasConstructor = true;
                    method.with(Node.CONSTRUCTOR);
                    fn.with(Node.CONSTRUCTOR);
                    if (node.is(Node.DERIVED)) {
                        fn.with(Node.DERIVED);
                    }
                }
                if (isStatic) {
                    method.with(Node.STATIC);
                }
                if (computed) {
                    method.with(Node.COMPUTED);
                }
                body.add(method);
            } else {
                if (async || accessor != 0 || generator) {
                    throw error("expected '('");
                }
                Node init = isStatic ? staticInit : instanceInit;
                fieldInitializer(init, key, computed, memberToken);
            }
        }
        node.add(body);
        node.add(instanceInit.getLast().size() == 0 ? Node.empty(token) : instanceInit);
        node.add(staticInit.getLast().size() == 0 ? Node.empty(token) : staticInit);
        return node;
    }

    private static Node syntheticInitializer(Token token) {
        Node fn = new Node(NodeType.FN_EXPR, token);
        fn.value = new FunctionInfo(false, false);
        fn.add(Node.empty(token));
        fn.add(new Node(NodeType.PARAMS, token));
        fn.add(new Node(NodeType.BLOCK, token));
        return fn;
    }

    // field 'x = expr' becomes 'this.x = expr' inside the synthetic initializer
    private void fieldInitializer(Node init, Node key, boolean computed, Token token) {
        Node target;
        if (computed) {
            target = new Node(NodeType.INDEX_EXPR, token);
            target.add(new Node(NodeType.THIS, token));
            target.add(key);
        } else {
            target = new Node(NodeType.MEMBER_EXPR, token);
            target.add(new Node(NodeType.THIS, token));
            target.value = key.getName();
        }
        Node value;
        if (consumeIf(EQ)) {
            scopes.push(new FunctionScope(init.getFunctionInfo()));
            try {
                value = assignment();
            } finally {
                scopes.pop();
            }
            if (!computed) {
                inferName(value, key.getName());
            }
        } else {
            value = new Node(NodeType.IDENT, token);
            value.value = "undefined";
        }
        eos();
        Node assign = new Node(NodeType.ASSIGN_EXPR, token);
        assign.op = EQ;
        assign.add(target);
        assign.add(value);
        Node stmt = new Node(NodeType.EXPR_STMT, token);
        stmt.add(assign);
        init.getLast().add(stmt);
    }

    // ========== Binding Patterns ==========

    private Node bindingTarget() {
        return switch (peek()) {
            case L_BRACKET -> arrayPattern();
            case L_CURLY -> objectPattern();
            default -> identifier();
        };
    }

    // target with an optional default value
    private Node bindingElement() {
        Node target = bindingTarget();
        if (peek() == EQ) {
            Node node = new Node(NodeType.ASSIGN_PATTERN, next());
            node.add(target);
            Node value = assignment();
            inferName(value, target);
            node.add(value);
            return node;
        }
        return target;
    }

    private Node arrayPattern() {
        Node node = new Node(NodeType.ARRAY_PATTERN, next());
        while (!consumeIf(R_BRACKET)) {
            if (peek() == COMMA) {
                node.add(Node.empty(next()));
                continue;
            }
            if (peek() == DOT_DOT_DOT) {
                Node rest = new Node(NodeType.REST, next());
                rest.add(bindingTarget());
                node.add(rest);
                if (peek() != R_BRACKET) {
                    throw error("rest element must be last");
                }
                continue;
            }
            node.add(bindingElement());
            if (!consumeIf(COMMA) && peek() != R_BRACKET) {
                throw error("expected ',' or ']'");
            }
        }
        return node;
    }

    private Node objectPattern() {
        Node node = new Node(NodeType.OBJECT_PATTERN, next());
        while (!consumeIf(R_CURLY)) {
            if (peek() == DOT_DOT_DOT) {
                Node rest = new Node(NodeType.REST, next());
                rest.add(identifier());
                node.add(rest);
                if (peek() != R_CURLY) {
                    throw error("rest element must be last");
                }
                continue;
            }
            Token token = peekToken();
            boolean computed = peek() == L_BRACKET;
            Node key = propertyKey();
            Node prop = new Node(NodeType.PATTERN_PROP, token);
            prop.add(key);
            if (computed) {
                prop.with(Node.COMPUTED);
            }
            if (consumeIf(COLON)) {
                prop.add(bindingElement());
            } else {
                if (computed || token.type != IDENT) {
                    throw error("expected ':'");
                }
                Node ident = new Node(NodeType.IDENT, token);
                ident.value = token.text;
                prop.with(Node.SHORTHAND);
                if (peek() == EQ) {
                    Node def = new Node(NodeType.ASSIGN_PATTERN, next());
                    def.add(ident);
                    Node value = assignment();
                    inferName(value, token.text);
                    def.add(value);
                    prop.add(def);
                } else {
                    prop.add(ident);
                }
            }
            node.add(prop);
            if (!consumeIf(COMMA) && peek() != R_CURLY) {
                throw error("expected ',' or '}'");
            }
        }
        return node;
    }

    // converts an array / object literal parsed as an expression into an assignment pattern
    private Node toPattern(Node expr) {
        switch (expr.type) {
            case IDENT:
            case MEMBER_EXPR:
            case INDEX_EXPR:
            case EMPTY:
                return expr;
            case ARRAY_LIT: {
                Node node = new Node(NodeType.ARRAY_PATTERN, expr.token);
                for (Node element : expr) {
                    node.add(toPatternElement(element));
                }
                return node;
            }
            case OBJECT_LIT: {
                Node node = new Node(NodeType.OBJECT_PATTERN, expr.token);
                for (Node prop : expr) {
                    if (prop.type == NodeType.SPREAD) {
                        Node rest = new Node(NodeType.REST, prop.token);
                        rest.add(toPattern(prop.getFirst()));
                        node.add(rest);
                    } else {
                        if (prop.is(Node.METHOD)) {
                            throw new ParserException("invalid destructuring target", prop.token);
                        }
                        Node pp = new Node(NodeType.PATTERN_PROP, prop.token);
                        pp.flags = prop.flags;
                        pp.add(prop.getFirst());
                        pp.add(toPatternElement(prop.getLast()));
                        node.add(pp);
                    }
                }
                return node;
            }
            case ARRAY_PATTERN:
            case OBJECT_PATTERN:
            case ASSIGN_PATTERN:
                return expr;
            default:
                throw new ParserException("invalid assignment target", expr.token);
        }
    }

    private Node toPatternElement(Node element) {
        if (element.type == NodeType.SPREAD) {
            Node rest = new Node(NodeType.REST, element.token);
            rest.add(toPattern(element.getFirst()));
            return rest;
        }
        if (element.type == NodeType.ASSIGN_EXPR && element.op == EQ) {
            Node node = new Node(NodeType.ASSIGN_PATTERN, element.token);
            node.add(toPattern(element.getFirst()));
            node.add(element.getLast());
            return node;
        }
        return toPattern(element);
    }

    // ========== Expressions ==========

    private Node expression() {
        Node first = assignment();
        if (peek() != COMMA) {
            return first;
        }
        Node node = new Node(NodeType.SEQUENCE_EXPR, first.token);
        node.add(first);
        while (consumeIf(COMMA)) {
            node.add(assignment());
        }
        return node;
    }

    private Node yieldExpression() {
        Node node = new Node(NodeType.YIELD_EXPR, next());
        Token la = peekToken();
        if (la.type == STAR && !la.isNewlineBefore()) {
            next();
            node.with(Node.GENERATOR);
            node.add(assignment());
        } else if (la.isNewlineBefore() || la.type.oneOf(R_PAREN, R_BRACKET, R_CURLY, COMMA, SEMI, COLON, EOF)) {
            node.add(Node.empty(la));
        } else {
            node.add(assignment());
        }
        return node;
    }

    private Node assignment() {
        if (isIdent("yield") && scope().info.generator) {
            return yieldExpression();
        }
        if (peek() == IDENT && peek(1) == EQ_GT && !peekToken(1).isNewlineBefore()) {
            return arrowFunction(false);
        }
        if (isIdent("async") && !peekToken(1).isNewlineBefore()) {
            if (peek(1) == IDENT && peek(2) == EQ_GT) {
                next();
                return arrowFunction(true);
            }
            if (peek(1) == L_PAREN) {
                int save = position();
                next();
                if (isArrowAhead()) {
                    return arrowFunction(true);
                }
                reset(save);
            }
        }
        if (peek() == L_PAREN && isArrowAhead()) {
            return arrowFunction(false);
        }
        Node left = conditional();
        TokenType type = peek();
        if (type == EQ || type.binaryOf() != null) {
            Token opToken = next();
            Node node = new Node(NodeType.ASSIGN_EXPR, left.token);
            node.op = opToken.type;
            if (type == EQ) {
                left = toPattern(left);
            } else if (!left.type.oneOf(NodeType.IDENT, NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR)) {
                throw new ParserException("invalid assignment target", left.token);
            }
            node.add(left);
            Node right = assignment();
            if (type == EQ) {
                inferName(right, left);
            }
            node.add(right);
            return node;
        }
        return left;
    }

    private Node conditional() {
        Node test = logicalOr();
        if (peek() != QUES) {
            return test;
        }
        Node node = new Node(NodeType.CONDITIONAL_EXPR, test.token);
        next();
        node.add(test);
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            node.add(assignment());
        } finally {
            noIn = savedNoIn;
        }
        consume(COLON, "expected ':'");
        node.add(assignment());
        return node;
    }

    private Node logicalOr() {
        Node left = logicalAnd();
        while (peek().oneOf(PIPE_PIPE, QUES_QUES)) {
            left = binary(NodeType.LOGICAL_EXPR, left, next().type, logicalAnd());
        }
        return left;
    }

    private Node logicalAnd() {
        Node left = bitOr();
        while (peek() == AMP_AMP) {
            left = binary(NodeType.LOGICAL_EXPR, left, next().type, bitOr());
        }
        return left;
    }

    private Node bitOr() {
        Node left = bitXor();
        while (peek() == PIPE) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, bitXor());
        }
        return left;
    }

    private Node bitXor() {
        Node left = bitAnd();
        while (peek() == CARET) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, bitAnd());
        }
        return left;
    }

    private Node bitAnd() {
        Node left = equality();
        while (peek() == AMP) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, equality());
        }
        return left;
    }

    private Node equality() {
        Node left = relational();
        while (peek().oneOf(EQ_EQ, EQ_EQ_EQ, NOT_EQ, NOT_EQ_EQ)) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, relational());
        }
        return left;
    }

    private Node relational() {
        Node left = shift();
        while (peek().oneOf(LT, GT, LT_EQ, GT_EQ, INSTANCEOF) || (peek() == IN && !noIn)) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, shift());
        }
        return left;
    }

    private Node shift() {
        Node left = additive();
        while (peek().oneOf(LT_LT, GT_GT, GT_GT_GT)) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, additive());
        }
        return left;
    }

    private Node additive() {
        Node left = multiplicative();
        while (peek().oneOf(PLUS, MINUS)) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, multiplicative());
        }
        return left;
    }

    private Node multiplicative() {
        Node left = exponent();
        while (peek().oneOf(STAR, SLASH, PERCENT)) {
            left = binary(NodeType.BINARY_EXPR, left, next().type, exponent());
        }
        return left;
    }

    private Node exponent() {
        Node left = unary();
        if (peek() == STAR_STAR) {
            if (left.type == NodeType.UNARY_EXPR && !left.is(Node.PARENTHESIZED)) {
                throw error("unparenthesized unary expression before '**'");
            }
            return binary(NodeType.BINARY_EXPR, left, next().type, exponent());
        }
        return left;
    }

    private static Node binary(NodeType type, Node left, TokenType op, Node right) {
        Node node = new Node(type, left.token);
        node.op = op;
        node.add(left);
        node.add(right);
        return node;
    }

    private Node unary() {
        Token token = peekToken();
        switch (token.type) {
            case NOT:
            case TILDE:
            case PLUS:
            case MINUS:
            case TYPEOF:
            case VOID:
            case DELETE: {
                next();
                Node node = new Node(NodeType.UNARY_EXPR, token);
                node.op = token.type;
                node.add(unary());
                return node;
            }
            case PLUS_PLUS:
            case MINUS_MINUS: {
                next();
                Node node = new Node(NodeType.UPDATE_EXPR, token);
                node.op = token.type;
                node.with(Node.PREFIX);
                node.add(simpleTarget(unary()));
                return node;
            }
            case AWAIT: {
                if (!inAsync()) {
                    throw new ParserException("'await' outside an async function", token);
                }
                next();
                scope().info.hasAwait = true;
                Node node = new Node(NodeType.AWAIT_EXPR, token);
                node.add(unary());
                return node;
            }
            default:
                return postfix();
        }
    }

    private static Node simpleTarget(Node node) {
        if (!node.type.oneOf(NodeType.IDENT, NodeType.MEMBER_EXPR, NodeType.INDEX_EXPR)) {
            throw new ParserException("invalid update target", node.token);
        }
        return node;
    }

    private Node postfix() {
        Node expr = leftHandSide();
        Token token = peekToken();
        if (token.type.oneOf(PLUS_PLUS, MINUS_MINUS) && !token.isNewlineBefore()) {
            next();
            Node node = new Node(NodeType.UPDATE_EXPR, expr.token);
            node.op = token.type;
            node.add(simpleTarget(expr));
            return node;
        }
        return expr;
    }

    private Node leftHandSide() {
        Node expr;
        if (peek() == NEW) {
            expr = newExpression();
        } else if (peek() == SUPER) {
            Token token = next();
            expr = new Node(NodeType.SUPER, token);
            if (!peek().oneOf(L_PAREN, DOT, L_BRACKET)) {
                throw error("expected '(', '.' or '[' after 'super'");
            }
        } else {
            expr = primary();
        }
        return callTail(expr, true);
    }

    private Node newExpression() {
        Token token = next();
        if (peek() == DOT) {
            throw error("new.target is not supported");
        }
        Node callee = peek() == NEW ? newExpression() : primary();
        callee = callTail(callee, false);
        Node node = new Node(NodeType.NEW_EXPR, token);
        node.add(callee);
        if (peek() == L_PAREN) {
            node.add(arguments());
        } else {
            node.add(new Node(NodeType.ARGS, peekToken()));
        }
        return node;
    }

    private Node callTail(Node expr, boolean allowCalls) {
        boolean optional = false;
        while (true) {
            Token token = peekToken();
            if (token.type == DOT) {
                next();
                expr = member(expr, token, false);
            } else if (token.type == QUES_DOT) {
                if (!allowCalls) {
                    throw error("optional chain in 'new' callee");
                }
                next();
                optional = true;
                if (peek() == L_PAREN) {
                    Node call = new Node(NodeType.CALL_EXPR, expr.token);
                    call.add(expr);
                    call.add(arguments());
                    call.with(Node.OPTIONAL);
                    expr = call;
                } else if (peek() == L_BRACKET) {
                    next();
                    expr = index(expr).with(Node.OPTIONAL);
                } else {
                    expr = member(expr, token, true);
                }
            } else if (token.type == L_BRACKET) {
                next();
                expr = index(expr);
            } else if (token.type == L_PAREN && allowCalls) {
                Node call = new Node(NodeType.CALL_EXPR, expr.token);
                call.add(expr);
                call.add(arguments());
                expr = call;
            } else if (token.type == BACKTICK) {
                throw error("tagged templates are not supported");
            } else {
                break;
            }
        }
        if (optional) {
            Node chain = new Node(NodeType.OPTIONAL_CHAIN, expr.token);
            chain.add(expr);
            return chain;
        }
        return expr;
    }

    private Node member(Node object, Token dot, boolean optional) {
        Token name = peekToken();
        if (name.type != IDENT && !name.type.keyword) {
            throw error("expected property name after '" + dot.text + "'");
        }
        next();
        Node node = new Node(NodeType.MEMBER_EXPR, object.token);
        node.add(object);
        node.value = name.text;
        if (optional) {
            node.with(Node.OPTIONAL);
        }
        return node;
    }

    private Node index(Node object) {
        Node node = new Node(NodeType.INDEX_EXPR, object.token);
        node.add(object);
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            node.add(expression());
        } finally {
            noIn = savedNoIn;
        }
        consume(R_BRACKET, "expected ']'");
        return node;
    }

    private Node arguments() {
        Node args = new Node(NodeType.ARGS, consume(L_PAREN, "expected '('"));
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            while (!consumeIf(R_PAREN)) {
                if (peek() == DOT_DOT_DOT) {
                    Node spread = new Node(NodeType.SPREAD, next());
                    spread.add(assignment());
                    args.add(spread);
                } else {
                    args.add(assignment());
                }
                if (!consumeIf(COMMA) && peek() != R_PAREN) {
                    throw error("expected ',' or ')'");
                }
            }
        } finally {
            noIn = savedNoIn;
        }
        return args;
    }

    private Node primary() {
        Token token = peekToken();
        switch (token.type) {
            case NUMBER: {
                next();
                Node node = new Node(NodeType.LITERAL, token);
                node.value = numberValue(token.text);
                return node;
            }
            case S_STRING:
            case D_STRING: {
                next();
                Node node = new Node(NodeType.LITERAL, token);
                node.value = stringValue(token);
                return node;
            }
            case TRUE:
            case FALSE: {
                next();
                Node node = new Node(NodeType.LITERAL, token);
                node.value = token.type == TRUE;
                return node;
            }
            case NULL:
                next();
                return new Node(NodeType.LITERAL, token);
            case BACKTICK:
                return template();
            case THIS:
                next();
                return new Node(NodeType.THIS, token);
            case IDENT:
                if (isAsyncFunction()) {
                    next();
                    return functionExpression(true);
                }
                return identifier();
            case L_PAREN: {
                next();
                boolean savedNoIn = noIn;
                noIn = false;
                try {
                    Node expr = expression();
                    consume(R_PAREN, "expected ')'");
                    return expr.with(Node.PARENTHESIZED);
                } finally {
                    noIn = savedNoIn;
                }
            }
            case L_BRACKET:
                return arrayLiteral();
            case L_CURLY:
                return objectLiteral();
            case FUNCTION:
                return functionExpression(false);
            case CLASS:
                return classDefinition(false);
            case SLASH:
            case SLASH_EQ:
                throw error("regular expression literals are not supported");
            default:
                throw error("expected expression");
        }
    }

    private Node identifier() {
        Token token = peekToken();
        if (token.type != IDENT) {
            throw error("expected identifier");
        }
        next();
        Node node = new Node(NodeType.IDENT, token);
        node.value = token.text;
        if ("arguments".equals(token.text)) {
            nonArrowInfo().usesArguments = true;
        }
        return node;
    }

    private Node template() {
        Node node = new Node(NodeType.TEMPLATE, next());
        StringBuilder text = new StringBuilder();
        Token fragment = peekToken();
        while (true) {
            Token token = next();
            switch (token.type) {
                case T_STRING:
                    text.append(JsLexer.unescape(token.text));
                    break;
                case DOLLAR_L_CURLY: {
                    Node literal = new Node(NodeType.LITERAL, fragment);
                    literal.value = text.toString();
                    node.add(literal);
                    text.setLength(0);
                    node.add(expression());
                    consume(R_CURLY, "expected '}'");
                    fragment = peekToken();
                    break;
                }
                case BACKTICK: {
                    Node literal = new Node(NodeType.LITERAL, fragment);
                    literal.value = text.toString();
                    node.add(literal);
                    return node;
                }
                default:
                    throw new ParserException("expected '`'", token);
            }
        }
    }

    private Node arrayLiteral() {
        Node node = new Node(NodeType.ARRAY_LIT, next());
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            while (!consumeIf(R_BRACKET)) {
                if (peek() == COMMA) {
                    node.add(Node.empty(next()));
                    continue;
                }
                if (peek() == DOT_DOT_DOT) {
                    Node spread = new Node(NodeType.SPREAD, next());
                    spread.add(assignment());
                    node.add(spread);
                } else {
                    node.add(assignment());
                }
                if (!consumeIf(COMMA) && peek() != R_BRACKET) {
                    throw error("expected ',' or ']'");
                }
            }
        } finally {
            noIn = savedNoIn;
        }
        return node;
    }

    private Node objectLiteral() {
        Node node = new Node(NodeType.OBJECT_LIT, next());
        boolean savedNoIn = noIn;
        noIn = false;
        try {
            while (!consumeIf(R_CURLY)) {
                node.add(objectProperty());
                if (!consumeIf(COMMA) && peek() != R_CURLY) {
                    throw error("expected ',' or '}'");
                }
            }
        } finally {
            noIn = savedNoIn;
        }
        return node;
    }

    private Node objectProperty() {
        Token token = peekToken();
        if (token.type == DOT_DOT_DOT) {
            next();
            Node spread = new Node(NodeType.SPREAD, token);
            spread.add(assignment());
            return spread;
        }
        boolean async = false;
        if (isIdent("async") && !peek(1).oneOf(COLON, L_PAREN, COMMA, R_CURLY, EQ) && !peekToken(1).isNewlineBefore()) {
            next();
            async = true;
        }
        int accessor = accessorPrefix(async, COLON, L_PAREN, COMMA, R_CURLY, EQ);
        boolean generator = accessor == 0 && generatorStar(async);
        Node prop = new Node(NodeType.PROPERTY, token);
        boolean computed = peek() == L_BRACKET;
        Token keyToken = peekToken();
        Node key = propertyKey();
        prop.add(key);
        if (computed) {
            prop.with(Node.COMPUTED);
        }
        if (peek() == L_PAREN) {
            Node fn = new Node(NodeType.FN_EXPR, keyToken);
            fn.add(Node.empty(keyToken));
            functionRest(fn, async, generator);
            if (!computed) {
                fn.getFunctionInfo().inferredName = key.getName();
            }
            checkAccessor(accessor, fn, keyToken);
            prop.add(fn);
            prop.with(Node.METHOD);
            if (accessor != 0) {
                prop.with(accessor);
            }
            return prop;
        }
        if (async || accessor != 0 || generator) {
            throw error("expected '('");
        }
        if (consumeIf(COLON)) {
            Node value = assignment();
            if (!computed) {
                inferName(value, key.getName());
            }
            prop.add(value);
            return prop;
        }
        if (computed || keyToken.type != IDENT) {
            throw error("expected ':'");
        }
        Node ident = new Node(NodeType.IDENT, keyToken);
        ident.value = keyToken.text;
        if ("arguments".equals(keyToken.text)) {
            nonArrowInfo().usesArguments = true;
        }
        prop.with(Node.SHORTHAND);
        if (peek() == EQ) {
            // only valid once the literal turns out to be a destructuring target
            Node def = new Node(NodeType.ASSIGN_PATTERN, next());
            def.add(ident);
            def.add(assignment());
            prop.add(def);
        } else {
            prop.add(ident);
        }
        return prop;
    }

    private String propertyName() {
        Token token = peekToken();
        if (token.type == IDENT || token.type.keyword) {
            next();
            return token.text;
        }
        if (token.type.oneOf(S_STRING, D_STRING)) {
            next();
            return stringValue(token);
        }
        throw error("expected property name");
    }

    // literal key holding the property name, or the computed key expression
    private Node propertyKey() {
        Token token = peekToken();
        if (token.type == L_BRACKET) {
            next();
            Node expr = assignment();
            consume(R_BRACKET, "expected ']'");
            return expr;
        }
        Node key = new Node(NodeType.LITERAL, token);
        if (token.type == NUMBER) {
            next();
            Object number = numberValue(token.text);
            key.value = number instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)
                    ? Long.toString(d.longValue()) : number.toString();
            return key;
        }
        key.value = propertyName();
        return key;
    }

    // ========== Literal Values ==========

    private static String stringValue(Token token) {
        String text = token.text;
        return JsLexer.unescape(text.substring(1, text.length() - 1));
    }

    /**
     * Numeric literal value, narrowed to {@link Integer} when integral and in range.
     */
    public static Number numberValue(String text) {
        text = text.replace("_", "");
        double value;
        if (text.length() > 2 && text.charAt(0) == '0') {
            char radixChar = Character.toLowerCase(text.charAt(1));
            int radix = switch (radixChar) {
                case 'x' -> 16;
                case 'b' -> 2;
                case 'o' -> 8;
                default -> 10;
            };
            if (radix != 10) {
                value = new java.math.BigInteger(text.substring(2), radix).doubleValue();
                return narrow(value);
            }
        }
        value = Double.parseDouble(text);
        return narrow(value);
    }

    private static Number narrow(double value) {
        if (value == (int) value && !(value == 0 && 1 / value < 0)) {
            return (int) value;
        }
        return value;
    }

}
