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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvalTest extends EvalBase {

    @Test
    void testExpressions() {
        assertEquals(3, eval("1 + 2"));
        assertEquals("12", eval("'1' + 2"));
        assertEquals(0.5, eval("1 / 2"));
        assertEquals(8, eval("2 ** 3"));
        assertEquals(true, eval("1 < 2 && 'a' < 'b'"));
        assertEquals(false, eval("1 === '1'"));
        assertEquals(true, eval("1 == '1'"));
        assertEquals("b", eval("0 ? 'a' : 'b'"));
        assertEquals(3, eval("(1, 2, 3)"));
        assertNull(eval("undefined"));
        assertNull(eval("void 0"));
    }

    @Test
    void testFibonacci() {
        assertEquals(List.of("55"), print("function fib(n){ if (n<=1) return n; return fib(n-1)+fib(n-2); } console.log(fib(10));"));
    }

    @Test
    void testObjectDestructuring() {
        Object result = eval("const {name, age: years = 0, ...rest} = {name:'Alice', age:30, city:'Paris'}; [name, years, rest]");
        assertEquals(List.of("Alice", 30, Map.of("city", "Paris")), result);
    }

    @Test
    void testArrayDestructuringInParameters() {
        assertEquals(List.of(1, List.of(3, 4), 9), eval("function f([a, , ...rest], {z = 9} = {}) { return [a, rest, z]; } f([1, 2, 3, 4])"));
    }

    @Test
    void testClassInheritance() {
        assertEquals(List.of("bark true"), print("class Animal{speak(){return \"noise\";}} class Dog extends Animal{speak(){return \"bark\";}} "
                + "const d=new Dog(); console.log(d.speak(), d instanceof Animal);"));
    }

    @Test
    void testSuperCallsAndStatics() {
        String js = "class Animal { constructor(name) { this.name = name; } speak() { return this.name + ' makes a sound'; } "
                + "static create(n) { return new this(n); } }\n"
                + "class Dog extends Animal { constructor(name) { super(name); this.kind = 'dog'; } "
                + "speak() { return super.speak() + ' (woof)'; } }\n"
                + "const d = Dog.create('Rex'); [d.speak(), d.kind, d instanceof Animal]";
        assertEquals(List.of("Rex makes a sound (woof)", "dog", true), eval(js));
    }

    @Test
    void testPrototypeShadowing() {
        String js = "const a = { greet: 'hello', kind: 'a' };\n"
                + "const b = Object.create(a); b.kind = 'b';\n"
                + "const c = Object.create(b); c.greet = 'hi';\n"
                + "[c.greet, b.greet, a.greet, c.kind, a.kind, c.hasOwnProperty('kind')]";
        assertEquals(List.of("hi", "hello", "hello", "b", "a", false), eval(js));
    }

    @Test
    void testClosuresShareVariables() {
        assertEquals(2, eval("function counter() { let n = 0; return { inc: () => ++n, get: () => n }; } "
                + "const c = counter(); c.inc(); c.inc(); c.get()"));
    }

    @Test
    void testLoopBindings() {
        assertEquals(List.of(0, 1, 2), eval("const fs = []; for (let i = 0; i < 3; i++) { fs.push(() => i); } fs.map(f => f())"));
        assertEquals(List.of(0, 1, 2), eval("function make() { const fs = []; for (let i = 0; i < 3; i++) fs.push(() => i); "
                + "return fs.map(f => f()); } make()"));
        assertEquals(List.of(3, 3, 3), eval("var fs = []; for (var i = 0; i < 3; i++) fs.push(() => i); fs.map(f => f())"));
        assertEquals(List.of("a", "b", "c"), eval("function f() { const fs = []; for (const x of ['a', 'b', 'c']) fs.push(() => x); "
                + "return fs.map(g => g()); } f()"));
    }

    @Test
    void testLoops() {
        assertEquals(30, eval("function f() { let s = 0; let i = 0; while (i < 10) { i++; if (i % 2) continue; s += i; } return s; } f()"));
        assertEquals(5, eval("let n = 0; do { n++; } while (n < 5); n"));
        assertEquals(List.of("a", "b"), eval("const o = {a: 1, b: 2}; const keys = []; for (const k in o) keys.push(k); keys"));
        assertEquals(6, eval("function f() { let t = 0; for (const x of [1, 2, 3, 4]) { if (x > 3) break; t += x; } return t; } f()"));
    }

    @Test
    void testSwitch() {
        assertEquals(List.of("one", "few", "many"), eval("function name(n) { switch (n) { case 1: return 'one'; case 2: case 3: return 'few'; "
                + "default: return 'many'; } } [name(1), name(3), name(9)]"));
        assertEquals(List.of("a", "b", "b", "c"), eval("let out = []; for (const x of [1, 2, 3]) { switch (x) { case 1: out.push('a'); "
                + "case 2: out.push('b'); break; default: out.push('c'); } } out"));
    }

    @Test
    void testTryCatchFinally() {
        String js = "function f() { try { console.log('try'); throw new Error('boom'); } "
                + "catch (e) { console.log('catch ' + e.message); } finally { console.log('finally'); } return 'done'; }\n"
                + "console.log(f());";
        assertEquals(List.of("try", "catch boom", "finally", "done"), print(js));
    }

    @Test
    void testFinallyRunsOnReturn() {
        assertEquals(List.of("cleanup", "1"), print("function g() { try { return 1; } finally { console.log('cleanup'); } } console.log(g())"));
    }

    @Test
    void testCatchReceivesThrownValue() {
        assertEquals(42, eval("function f() { try { throw {code: 42}; } catch (e) { return e.code; } } f()"));
        assertEquals("inner", eval("let r; try { try { throw 'inner'; } finally { r = 'x'; } } catch (e) { r = e; } r"));
    }

    @Test
    void testTemplateAndStrings() {
        assertEquals("a2b4", eval("const x = 2; `a${x}b${x * 2}`"));
        assertEquals("HELLO-world", eval("'hello'.toUpperCase() + '-' + 'WORLD'.toLowerCase()"));
        assertEquals(List.of("a", "b", "c"), eval("'a,b,c'.split(',')"));
    }

    @Test
    void testOptionalChaining() {
        assertEquals(java.util.Arrays.asList(1, null, null, 1), eval("const o = {a: {b: 1}}; [o?.a?.b, o.x?.y, o.f?.(), o.a?.['b']]"));
        assertEquals("default", eval("const o = null; o?.foo ?? 'default'"));
    }

    @Test
    void testAssignmentOperators() {
        assertEquals(List.of(5, 7, 9), eval("let a = null; a ??= 5; let b = 0; b ||= 7; let c = 1; c &&= 9; [a, b, c]"));
        assertEquals(11, eval("const o = {n: 1}; o.n += 2; o['n'] *= 3; o.n++; ++o.n; o.n"));
        assertEquals(List.of(5, 1), eval("function f() { const o = {a: 0, b: 1}; o.a ||= 5; o.b ||= 6; return [o.a, o.b]; } f()"));
        assertEquals(List.of(1, 2), eval("function f() { let i = 1; const j = i++; return [j, i]; } f()"));
    }

    @Test
    void testSpreadAndRest() {
        assertEquals(List.of(10, 4, Map.of("x", 1, "y", 2)), eval("function sum(...xs) { return xs.reduce((a, b) => a + b, 0); } "
                + "const arr = [1, 2, 3]; [sum(...arr, 4), [...arr, 0].length, {...{x: 1}, y: 2}]"));
    }

    @Test
    void testDefaultParameters() {
        assertEquals(List.of(3, 2), eval("function f(a, b = a * 2) { return a + b; } [f(1), f(1, 1)]"));
    }

    @Test
    void testArrowKeepsThis() {
        assertEquals(42, eval("const obj = { v: 42, get() { return [1].map(() => this.v)[0]; } }; obj.get()"));
    }

    @Test
    void testTypeofAndDelete() {
        assertEquals(List.of("undefined", "number", "string", "object", "object", "function"),
                eval("[typeof nope, typeof 1, typeof 'a', typeof {}, typeof null, typeof (() => 1)]"));
        assertEquals(List.of("b"), eval("const o = {a: 1, b: 2}; delete o.a; Object.keys(o)"));
    }

    @Test
    void testJson() {
        assertEquals("{\"a\":[1,\"x\",null],\"b\":true}", eval("JSON.stringify({a: [1, 'x', null], b: true})"));
        assertEquals(2, eval("JSON.parse('{\"x\": [1, 2]}').x[1]"));
    }

    @Test
    void testBuiltins() {
        assertEquals(List.of(2, 4, 6), eval("[1, 2, 3].map(x => x * 2)"));
        assertEquals(List.of(2), eval("[1, 2, 3].filter(x => x % 2 === 0)"));
        assertEquals("1-2-3", eval("[1, 2, 3].join('-')"));
        assertEquals(3, eval("Math.max(1, 3, 2)"));
        assertEquals(List.of("a", "b"), eval("Object.keys({a: 1, b: 2})"));
        assertEquals(42, eval("parseInt('42px')"));
    }

    @Test
    void testReferenceError() {
        ErrorReport report = error("let q = 1; undefinedThing + q");
        assertEquals(ErrorKind.REFERENCE_ERROR, report.kind());
        assertEquals("undefinedThing is not defined", report.message());
    }

    @Test
    void testTemporalDeadZone() {
        ErrorReport report = error("function f() { let v = w; let w = 1; return v; } f()");
        assertEquals(ErrorKind.REFERENCE_ERROR, report.kind());
        assertEquals("Cannot access 'w' before initialization", report.message());
    }

    @Test
    void testConstAssignment() {
        assertEquals("Assignment to constant variable.", error("const k = 1; k = 2").message());
        assertEquals("Assignment to constant variable.", error("function f() { const k = 1; k = 2; } f()").message());
    }

    @Test
    void testNotAFunction() {
        ErrorReport report = error("const o = {};\no.missing()");
        assertEquals(ErrorKind.TYPE_ERROR, report.kind());
        assertEquals("o.missing is not a function", report.message());
        assertEquals(2, report.position().line);
    }

    @Test
    void testUncaughtThrowIsReported() {
        ErrorReport report = error("function f() { throw new RangeError('too far'); }\nf()");
        assertEquals("too far", report.message());
        assertFalse(report.stack().isEmpty());
    }

    @Test
    void testUnboundedRecursion() {
        ErrorReport report = error("function r(n) { return r(n + 1); } r(0)");
        assertEquals(ErrorKind.RANGE_ERROR, report.kind());
        assertEquals("Maximum call stack size exceeded", report.message());
    }

    @Test
    void testParenthesizedUnaryExponent() {
        assertEquals(List.of(512, 4, -4), eval("[2 ** 3 ** 2, (-2) ** 2, -(2 ** 2)]"));
    }

    @Test
    void testClassAccessors() {
        String js = "class Temp { constructor(c) { this.c = c; } get f() { return this.c * 9 / 5 + 32; } set f(v) { this.c = (v - 32) * 5 / 9; }\n"
                + "static get unit() { return 'C'; } }\n"
                + "const t = new Temp(100); const before = t.f; t.f = 32;\n"
                + "[before, t.c, Temp.unit, Object.keys(t)]";
        assertEquals(List.of(212, 0, "C", List.of("c")), eval(js));
    }

    @Test
    void testInheritedAccessorsAndSuper() {
        String js = "class Shape { constructor(n) { this.n = n; } get label() { return 'shape ' + this.n; } }\n"
                + "class Square extends Shape { get label() { return super.label + ' (square)'; } }\n"
                + "new Square(4).label";
        assertEquals("shape 4 (square)", eval(js));
        String readOnly = "class P { get x() { return 1; } } const p = new P(); p.x = 5; [p.x, Object.keys(p).length]";
        assertEquals(List.of(1, 0), eval(readOnly));
    }

    @Test
    void testObjectLiteralAccessors() {
        String js = "const o = { items: [], get count() { return this.items.length; }, set last(v) { this.items.push(v); } };\n"
                + "o.last = 'a'; o.last = 'b';\n"
                + "[o.count, o.items, o.last, Object.keys(o)]";
        List<?> result = (List<?>) eval(js);
        assertEquals(2, result.get(0));
        assertEquals(List.of("a", "b"), result.get(1));
        assertNull(result.get(2));
        assertEquals(List.of("items", "count", "last"), result.get(3));
        assertEquals(List.of("{ a: 1, b: [Getter], c: [Getter/Setter] }"),
                print("console.log({ a: 1, get b() { return 2; }, get c() { return 3; }, set c(v) {} })"));
        assertEquals(List.of(2, 2), eval("const o = { get b() { return 2; } }; const c = Object.assign({}, o); [c.b, JSON.parse(JSON.stringify(o)).b]"));
    }

    @Test
    void testArrayIndexBeyondIntRange() {
        // indices past the int range are stored as plain properties
        assertEquals(List.of(0, 1, true), eval("const a = []; a[4294967294] = 1; [a.length, a[4294967294], Object.keys(a).includes('4294967294')]"));
    }

    @Test
    void testThisBeforeSuperCall() {
        String js = "class A { constructor() { this.a = 1; } }\n"
                + "class B extends A { constructor() { this.b = 2; super(); } }\n"
                + "let r; try { new B(); } catch (e) { r = [e instanceof ReferenceError, e.message]; } r";
        assertEquals(List.of(true, JsClass.SUPER_NOT_CALLED), eval(js));
        String missing = "class A {} class B extends A { constructor() {} }\n"
                + "let r; try { new B(); } catch (e) { r = e instanceof ReferenceError; } r";
        assertEquals(true, eval(missing));
        String twice = "class A {} class B extends A { constructor() { super(); super(); } }\n"
                + "let r; try { new B(); } catch (e) { r = e.message; } r";
        assertEquals(JsClass.SUPER_CALLED_TWICE, eval(twice));
        String ok = "class A {} class B extends A { constructor() { super(); this.b = 2; } }\n"
                + "class C extends A { constructor() { return { c: 3 }; } }\n"
                + "[new B().b, new C().c]";
        assertEquals(List.of(2, 3), eval(ok));
    }

}
