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

import io.twinjs.js.Display;
import io.twinjs.parser.Node;
import io.twinjs.parser.SourcePosition;
import io.twinjs.parser.Token;
import io.twinjs.parser.TokenType;

/**
 * Compiled body of one function or program: code with inline operands, the constant pool,
 * the token each instruction was compiled from, and the slot layout.
 */
public class Chunk {

    final String name;
    final int[] code;
    final Object[] constants;
    final Token[] tokens;
    final String[] slotNames;
    // let / const / class / parameter slots start out in their dead zone
    final boolean[] lexicalSlots;
    final boolean program;

    Chunk(String name, int[] code, Object[] constants, Token[] tokens, String[] slotNames, boolean[] lexicalSlots, boolean program) {
        this.name = name;
        this.code = code;
        this.constants = constants;
        this.tokens = tokens;
        this.slotNames = slotNames;
        this.lexicalSlots = lexicalSlots;
        this.program = program;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return code.length;
    }

    public int getSlotCount() {
        return slotNames.length;
    }

    public Object getConstant(int index) {
        return constants[index];
    }

    public Opcode getOpcode(int offset) {
        return Opcode.values()[code[offset]];
    }

    /**
     * 1-indexed source line of the instruction at an offset.
     */
    public int getLine(int offset) {
        return getPosition(offset).line;
    }

    public SourcePosition getPosition(int offset) {
        if (offset < 0 || offset >= tokens.length || tokens[offset] == null) {
            return SourcePosition.UNKNOWN;
        }
        return tokens[offset].getPosition();
    }

    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        sb.append("== ").append(name).append(" ==\n");
        if (slotNames.length > 0) {
            sb.append("slots:");
            for (int i = 0; i < slotNames.length; i++) {
                sb.append(' ').append(i).append('=').append(slotNames[i]);
            }
            sb.append('\n');
        }
        Opcode[] opcodes = Opcode.values();
        int previousLine = -1;
        int offset = 0;
        while (offset < code.length) {
            Opcode op = opcodes[code[offset]];
            int line = getLine(offset);
            sb.append(String.format("%04d ", offset));
            sb.append(line == previousLine ? "   | " : String.format("%4d ", line));
            previousLine = line;
            sb.append(op.name());
            for (int i = 1; i <= op.operands; i++) {
                sb.append(' ').append(code[offset + i]);
            }
            String comment = comment(op, offset);
            if (comment != null) {
                sb.append("    ; ").append(comment);
            }
            sb.append('\n');
            offset += 1 + op.operands;
        }
        return sb.toString();
    }

    private String comment(Opcode op, int offset) {
        int operand = op.operands > 0 ? code[offset + 1] : 0;
        switch (op) {
            case CONST:
                return describe(constants[operand]);
            case LOAD_NAME:
            case STORE_NAME:
            case DECLARE_VAR:
            case DECLARE:
            case DECLARE_HOLE:
            case INIT_NAME:
            case TYPEOF_NAME:
            case GET_PROP:
            case SET_PROP:
            case DELETE_PROP:
            case GET_SUPER:
            case UPDATE_PROP:
            case INIT_PROP:
            case INIT_METHOD:
            case INIT_ACCESSOR:
            case CALL_SPREAD:
            case NEW_SPREAD:
                return String.valueOf(constants[operand]);
            case CALL:
            case NEW:
                return String.valueOf(constants[code[offset + 2]]);
            case LOAD_SLOT:
            case STORE_SLOT:
            case INIT_SLOT:
            case CLEAR_SLOT:
                return slotNames[operand];
            case BINARY:
            case UNARY:
                return TokenType.values()[operand].name();
            case CLOSURE:
            case CLASS:
                return describe(constants[operand]);
            default:
                return null;
        }
    }

    private static String describe(Object constant) {
        if (constant instanceof Node node) {
            return "<" + node.type + " " + node.getPosition() + ">";
        }
        return Display.inspect(constant);
    }

    @Override
    public String toString() {
        return name + "[" + code.length + "]";
    }

}
