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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public class Node implements Iterable<Node> {

    public static final int ASYNC = 1;
    public static final int STATIC = 1 << 1;
    public static final int OPTIONAL = 1 << 2;
    public static final int PREFIX = 1 << 3;
    public static final int COMPUTED = 1 << 4;
    public static final int SHORTHAND = 1 << 5;
    public static final int EXPRESSION_BODY = 1 << 6;
    public static final int CONSTRUCTOR = 1 << 7;
    public static final int DERIVED = 1 << 8;
    public static final int METHOD = 1 << 9;
    public static final int PARENTHESIZED = 1 << 10;
    public static final int GENERATOR = 1 << 11;
    public static final int GETTER = 1 << 12;
    public static final int SETTER = 1 << 13;

    private static final int INITIAL_CAPACITY = 4;
    private static final Node[] EMPTY_ARRAY = new Node[0];

    public final NodeType type;
    // first token of the construct, used for source positions
    public final Token token;
    // operator for unary, update, binary, logical and assignment nodes and the var / let / const keyword
    public TokenType op;
    // literal value, identifier or member name, module specifier, or FunctionInfo for function nodes
    public Object value;
    public int flags;

    private Node[] children = EMPTY_ARRAY;
    private int childCount;

    public Node(NodeType type, Token token) {
        this.type = type;
        this.token = token;
    }

    public static Node empty(Token token) {
        return new Node(NodeType.EMPTY, token);
    }

    public Node add(Node child) {
        if (childCount == children.length) {
            children = Arrays.copyOf(children, Math.max(INITIAL_CAPACITY, childCount * 2));
        }
        children[childCount++] = child;
        return this;
    }

    public Node get(int index) {
        if (index < 0 || index >= childCount) {
            throw new IndexOutOfBoundsException(index + " out of " + childCount + " for " + type);
        }
        return children[index];
    }

    public Node getFirst() {
        return get(0);
    }

    public Node getLast() {
        return get(childCount - 1);
    }

    public int size() {
        return childCount;
    }

    public boolean isEmpty() {
        return type == NodeType.EMPTY;
    }

    public boolean is(int flag) {
        return (flags & flag) != 0;
    }

    public Node with(int flag) {
        flags |= flag;
        return this;
    }

    public String getName() {
        return value instanceof String s ? s : null;
    }

    public FunctionInfo getFunctionInfo() {
        return (FunctionInfo) value;
    }

    public SourcePosition getPosition() {
        return token.getPosition();
    }

    public List<Node> getChildren() {
        List<Node> list = new ArrayList<>(childCount);
        for (int i = 0; i < childCount; i++) {
            list.add(children[i]);
        }
        return list;
    }

    public List<Node> findAll(NodeType type) {
        List<Node> results = new ArrayList<>();
        findAll(type, results);
        return results;
    }

    private void findAll(NodeType type, List<Node> results) {
        for (int i = 0; i < childCount; i++) {
            Node child = children[i];
            if (child.type == type) {
                results.add(child);
            }
            child.findAll(type, results);
        }
    }

    @Override
    public Iterator<Node> iterator() {
        return new Iterator<>() {
            int index = 0;

            @Override
            public boolean hasNext() {
                return index < childCount;
            }

            @Override
            public Node next() {
                if (index >= childCount) {
                    throw new NoSuchElementException();
                }
                return children[index++];
            }
        };
    }

    /**
     * S-expression dump, e.g. {@code (BINARY_EXPR + (LITERAL 1) (IDENT a))}.
     */
    public String toSexpr() {
        StringBuilder sb = new StringBuilder();
        toSexpr(sb);
        return sb.toString();
    }

    private void toSexpr(StringBuilder sb) {
        if (type == NodeType.EMPTY) {
            sb.append("()");
            return;
        }
        sb.append('(').append(type);
        if (op != null) {
            sb.append(' ').append(opText());
        }
        if (value instanceof String s) {
            sb.append(' ');
            if (type == NodeType.LITERAL || type == NodeType.IMPORT_DECL) {
                sb.append('"').append(s.replace("\"", "\\\"").replace("\n", "\\n")).append('"');
            } else {
                sb.append(s);
            }
        } else if (type == NodeType.LITERAL || (value != null && !(value instanceof FunctionInfo))) {
            sb.append(' ').append(value);
        }
        if (is(ASYNC)) {
            sb.append(" async");
        }
        if (is(STATIC)) {
            sb.append(" static");
        }
        if (is(OPTIONAL)) {
            sb.append(" ?.");
        }
        if (is(PREFIX)) {
            sb.append(" prefix");
        }
        if (is(COMPUTED)) {
            sb.append(" computed");
        }
        if (is(GENERATOR)) {
            sb.append(" *");
        }
        if (is(GETTER)) {
            sb.append(" get");
        }
        if (is(SETTER)) {
            sb.append(" set");
        }
        for (int i = 0; i < childCount; i++) {
            sb.append(' ');
            children[i].toSexpr(sb);
        }
        sb.append(')');
    }

    private String opText() {
        return switch (op) {
            case VAR -> "var";
            case LET -> "let";
            case CONST -> "const";
            default -> op.symbol();
        };
    }

    @Override
    public String toString() {
        return toSexpr();
    }

}
