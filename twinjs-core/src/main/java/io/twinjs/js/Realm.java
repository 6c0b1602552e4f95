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

import io.twinjs.parser.Node;
import io.twinjs.parser.NodeType;
import io.twinjs.parser.SourcePosition;
import io.twinjs.parser.Token;
import io.twinjs.vm.CallFrame;
import io.twinjs.vm.Compiler;
import io.twinjs.vm.UnsupportedSyntaxException;
import io.twinjs.vm.VirtualMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Everything one engine instance shares between the two evaluators: the global scope, the
 * built-in prototypes, the event loop, the JS call stack, and the per-function decision of
 * how a body executes.
 */
public class Realm {

    static final Logger logger = LoggerFactory.getLogger(Realm.class);

    /**
     * One active JS invocation. The tree-walk evaluator keeps {@link #token} current, VM frames
     * report the position of the instruction being executed.
     */
    public static final class ActiveCall {

        final String name;
        Token token;
        final CallFrame frame;

        ActiveCall(String name, Token token, CallFrame frame) {
            this.name = name;
            this.token = token;
            this.frame = frame;
        }

        public void setToken(Token token) {
            this.token = token;
        }

        SourcePosition position() {
            if (frame != null) {
                return frame.getPosition();
            }
            return token == null ? SourcePosition.UNKNOWN : token.getPosition();
        }

    }

    final EngineConfig config;
    final EngineStats stats = new EngineStats();
    final Environment globals = new Environment(null);
    final EventLoop eventLoop;

    public final JsObject objectPrototype;
    public final JsObject functionPrototype;
    public final JsObject arrayPrototype;
    public final JsObject stringPrototype;
    public final JsObject numberPrototype;
    public final JsObject booleanPrototype;
    public final JsObject promisePrototype;
    public final JsObject iteratorPrototype;
    public final JsObject generatorPrototype;
    public final JsObject mapPrototype;
    public final JsObject setPrototype;
    private final Map<ErrorKind, JsObject> errorPrototypes = new EnumMap<>(ErrorKind.class);
    private final Map<ErrorKind, JsFunction> errorConstructors = new EnumMap<>(ErrorKind.class);
    final JsFunction objectConstructor;
    final JsFunction arrayConstructor;
    final JsFunction promiseConstructor;
    private JsObject globalObject;

    private final VirtualMachine vm;
    private final Map<Node, FunctionBody> bodies = new IdentityHashMap<>();
    private final List<ActiveCall> callStack = new ArrayList<>();
    private final Set<JsPromise> pendingRejections = new LinkedHashSet<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    Consumer<String> onConsoleLog;
    Consumer<Diagnostic> diagnosticListener;
    ModuleLoader moduleLoader;

    public Realm(EngineConfig config) {
        this.config = config;
        objectPrototype = new JsObjectPrototype(this);
        functionPrototype = new JsFunctionPrototype(this, objectPrototype);
        arrayPrototype = new JsArrayPrototype(this, objectPrototype);
        stringPrototype = new JsStringPrototype(this, objectPrototype);
        numberPrototype = new JsNumberPrototype(this, objectPrototype);
        booleanPrototype = new JsBooleanPrototype(this, objectPrototype);
        promisePrototype = new JsPromisePrototype(this, objectPrototype);
        iteratorPrototype = new JsIteratorPrototype(this, objectPrototype);
        generatorPrototype = new JsGeneratorPrototype(this, iteratorPrototype);
        mapPrototype = new JsMapPrototype(this, objectPrototype);
        setPrototype = new JsSetPrototype(this, objectPrototype);
        objectConstructor = new JsObjectConstructor(this);
        arrayConstructor = new JsArrayConstructor(this);
        promiseConstructor = new JsPromiseConstructor(this);
        JsObject errorPrototype = new JsErrorPrototype(this, objectPrototype, "Error");
        JsFunction errorConstructor = errorConstructor(ErrorKind.ERROR, errorPrototype, functionPrototype);
        errorPrototypes.put(ErrorKind.ERROR, errorPrototype);
        errorConstructors.put(ErrorKind.ERROR, errorConstructor);
        for (ErrorKind kind : new ErrorKind[]{ErrorKind.TYPE_ERROR, ErrorKind.REFERENCE_ERROR, ErrorKind.RANGE_ERROR, ErrorKind.SYNTAX_ERROR}) {
            JsObject prototype = new JsErrorPrototype(this, errorPrototype, kind.jsName);
            errorPrototypes.put(kind, prototype);
            errorConstructors.put(kind, errorConstructor(kind, prototype, errorConstructor));
        }
        eventLoop = new EventLoop(this);
        vm = new VirtualMachine(this);
    }

    private JsFunction errorConstructor(ErrorKind kind, JsObject prototype, JsObject proto) {
        JsNativeFunction[] holder = new JsNativeFunction[1];
        holder[0] = new JsNativeFunction(proto, kind.jsName, (realm, thisObject, args) -> holder[0].construct(realm, args));
        holder[0].constructor(JsError::new, (realm, thisObject, args) -> {
            JsError error = (JsError) thisObject;
            if (Args.has(args, 0)) {
                error.putHidden("message", Args.str(realm, args, 0));
            }
            error.putHidden("stack", formatStack(error.toString(), snapshot()));
            return Terms.UNDEFINED;
        }, prototype);
        return holder[0];
    }

    public void setOnConsoleLog(Consumer<String> onConsoleLog) {
        this.onConsoleLog = onConsoleLog;
    }

    public void setDiagnosticListener(Consumer<Diagnostic> diagnosticListener) {
        this.diagnosticListener = diagnosticListener;
    }

    public ModuleLoader getModuleLoader() {
        return moduleLoader;
    }

    public void setModuleLoader(ModuleLoader moduleLoader) {
        this.moduleLoader = moduleLoader;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public EngineStats getStats() {
        return stats;
    }

    public Environment getGlobals() {
        return globals;
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    public VirtualMachine getVirtualMachine() {
        return vm;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    //==================================================================================================================
    // globals

    /**
     * Built-in global for a name that has no binding yet, or null. Globals are created on
     * first use and then bound in the global scope like any other variable.
     */
    Object initGlobal(String name) {
        return switch (name) {
            case "undefined" -> Terms.UNDEFINED;
            case "NaN" -> Double.NaN;
            case "Infinity" -> Double.POSITIVE_INFINITY;
            case "globalThis" -> globalObject();
            case "Object" -> objectConstructor;
            case "Array" -> arrayConstructor;
            case "Promise" -> promiseConstructor;
            case "String" -> new JsStringConstructor(this);
            case "Number" -> new JsNumberConstructor(this);
            case "Boolean" -> new JsBooleanConstructor(this);
            case "Map" -> new JsMapConstructor(this);
            case "Set" -> new JsSetConstructor(this);
            case "Error" -> errorConstructors.get(ErrorKind.ERROR);
            case "TypeError" -> errorConstructors.get(ErrorKind.TYPE_ERROR);
            case "ReferenceError" -> errorConstructors.get(ErrorKind.REFERENCE_ERROR);
            case "RangeError" -> errorConstructors.get(ErrorKind.RANGE_ERROR);
            case "SyntaxError" -> errorConstructors.get(ErrorKind.SYNTAX_ERROR);
            case "Math" -> new JsMath(this);
            case "JSON" -> new JsJson(this);
            case "console" -> new JsConsole(this);
            case "print" -> function("print", (realm, thisObject, args) -> {
                realm.print(JsConsole.format(realm, args));
                return Terms.UNDEFINED;
            });
            case "parseInt" -> function("parseInt", JsNumberConstructor::parseInt);
            case "parseFloat" -> function("parseFloat", JsNumberConstructor::parseFloat);
            case "isNaN" -> function("isNaN", (realm, thisObject, args) -> Double.isNaN(Args.num(realm, args, 0)));
            case "isFinite" -> function("isFinite", (realm, thisObject, args) -> {
                double d = Args.num(realm, args, 0);
                return !Double.isNaN(d) && !Double.isInfinite(d);
            });
            case "setTimeout" -> function("setTimeout", (realm, thisObject, args) -> timer(args, false));
            case "setInterval" -> function("setInterval", (realm, thisObject, args) -> timer(args, true));
            case "clearTimeout", "clearInterval" -> function(name, (realm, thisObject, args) -> {
                Object id = Args.get(args, 0);
                if (id instanceof Number n) {
                    eventLoop.clearTimer(n.intValue());
                }
                return Terms.UNDEFINED;
            });
            case "queueMicrotask" -> function("queueMicrotask", (realm, thisObject, args) -> {
                JsFunction fn = Args.function(realm, args, 0);
                eventLoop.queueMicrotask(() -> eventLoop.runCallback(fn, new Object[0]));
                return Terms.UNDEFINED;
            });
            default -> null;
        };
    }

    private Object timer(Object[] args, boolean repeat) {
        JsFunction fn = Args.function(this, args, 0);
        double delay = Args.has(args, 1) ? Args.num(this, args, 1) : 0;
        return eventLoop.setTimer(fn, Double.isNaN(delay) ? 0 : (long) Math.max(0, delay), Args.rest(args, 2), repeat);
    }

    private JsObject globalObject() {
        if (globalObject == null) {
            globalObject = new JsObject(objectPrototype);
        }
        return globalObject;
    }

    public JsNativeFunction function(String name, JsCallable callable) {
        return new JsNativeFunction(functionPrototype, name, callable);
    }

    JsObject errorPrototype(ErrorKind kind) {
        JsObject prototype = errorPrototypes.get(kind);
        return prototype == null ? errorPrototypes.get(ErrorKind.ERROR) : prototype;
    }

    //==================================================================================================================
    // function bodies

    /**
     * Execution strategy for a function node, decided once and cached.
     */
    public FunctionBody functionBody(Node node) {
        FunctionBody body = bodies.get(node);
        if (body != null) {
            return body;
        }
        if (config.getMode() == ExecutionMode.TREE_WALK) {
            body = FunctionBody.INTERPRETED;
        } else {
            String name = functionName(node);
            try {
                body = FunctionBody.compiled(node.type == NodeType.PROGRAM ? Compiler.compileProgram(node) : Compiler.compileFunction(node));
                stats.compiledFunctions++;
                logger.debug("compiled: {}", name);
            } catch (UnsupportedSyntaxException e) {
                body = FunctionBody.bridged(e.getMessage());
                stats.bridgedFunctions++;
                logger.debug("bridged: {} - {}", name, e.getMessage());
            }
        }
        bodies.put(node, body);
        return body;
    }

    static String functionName(Node node) {
        if (node.type == NodeType.PROGRAM) {
            return "<main>";
        }
        Node nameNode = node.get(0);
        if (nameNode.type == NodeType.IDENT) {
            return nameNode.getName();
        }
        String inferred = node.getFunctionInfo().inferredName;
        return inferred == null ? "<anonymous>" : inferred;
    }

    /**
     * Closure for a function literal evaluated in the given scope.
     *
     * @param thisObject the 'this' of the creating code, kept by arrow functions
     * @param enclosing the function whose code creates the closure, arrows inherit its 'super'
     */
    public JsClosure newClosure(Node node, Environment env, Object thisObject, JsClosure enclosing, String name) {
        Node nameNode = node.get(0);
        if (name == null) {
            name = nameNode.type == NodeType.IDENT ? nameNode.getName() : node.getFunctionInfo().inferredName;
        }
        Environment scope = env;
        if (node.type == NodeType.FN_EXPR && nameNode.type == NodeType.IDENT) {
            scope = new Environment(env);
        }
        boolean arrow = node.getFunctionInfo().arrow;
        JsClosure closure = new JsClosure(this, node, scope, arrow ? thisObject : null, name);
        if (arrow && enclosing != null) {
            closure.homeObject = enclosing.homeObject;
            closure.ownerClass = enclosing.ownerClass;
        }
        if (scope != env) {
            scope.declare(nameNode.getName(), BindingType.LET, closure);
        }
        return closure;
    }

    //==================================================================================================================
    // call stack and errors

    public ActiveCall enter(String name, Token token) {
        return push(new ActiveCall(name, token, null));
    }

    public ActiveCall enter(String name, CallFrame frame) {
        return push(new ActiveCall(name, null, frame));
    }

    private ActiveCall push(ActiveCall call) {
        if (callStack.size() >= config.getMaxCallDepth()) {
            throw rangeError("Maximum call stack size exceeded");
        }
        callStack.add(call);
        return call;
    }

    public void exit() {
        callStack.remove(callStack.size() - 1);
    }

    public int getCallDepth() {
        return callStack.size();
    }

    public void unwindTo(int depth) {
        while (callStack.size() > depth) {
            callStack.remove(callStack.size() - 1);
        }
    }

    public List<StackEntry> snapshot() {
        List<StackEntry> list = new ArrayList<>(callStack.size());
        for (int i = callStack.size() - 1; i >= 0; i--) {
            ActiveCall call = callStack.get(i);
            list.add(new StackEntry(call.name, call.position()));
        }
        return list;
    }

    public SourcePosition currentPosition() {
        return callStack.isEmpty() ? SourcePosition.UNKNOWN : callStack.get(callStack.size() - 1).position();
    }

    static String formatStack(String header, List<StackEntry> stack) {
        StringBuilder sb = new StringBuilder(header);
        for (StackEntry entry : stack) {
            sb.append("\n    ").append(entry);
        }
        return sb.toString();
    }

    /**
     * Creates a JS error object of the given kind and the signal that throws it.
     */
    public JsException error(ErrorKind kind, String message) {
        JsError error = new JsError(errorPrototype(kind));
        error.putHidden("message", message);
        List<StackEntry> stack = snapshot();
        error.putHidden("stack", formatStack(error.toString(), stack));
        return new JsException(error, kind, currentPosition(), stack);
    }

    public JsException typeError(String message) {
        return error(ErrorKind.TYPE_ERROR, message);
    }

    public JsException referenceError(String message) {
        return error(ErrorKind.REFERENCE_ERROR, message);
    }

    public JsException rangeError(String message) {
        return error(ErrorKind.RANGE_ERROR, message);
    }

    public JsException syntaxError(String message) {
        return error(ErrorKind.SYNTAX_ERROR, message);
    }

    /**
     * Signal for an explicit {@code throw} of any value.
     */
    public JsException userThrow(Object value) {
        return new JsException(value, ErrorKind.USER_THROW, currentPosition(), snapshot());
    }

    /**
     * Java exceptions escaping built-ins surface as a JS {@code Error}.
     */
    public JsException wrap(RuntimeException e) {
        if (e instanceof JsException je) {
            return je;
        }
        if (e instanceof IllegalArgumentException && "Invalid array length".equals(e.getMessage())) {
            return rangeError(e.getMessage());
        }
        logger.debug("host exception: {}", e.toString());
        return error(ErrorKind.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }

    /**
     * Calls a function from evaluator code, Java exceptions thrown by built-ins become JS errors.
     */
    public Object call(JsFunction fn, Object thisObject, Object[] args) {
        try {
            return fn.call(this, thisObject, args);
        } catch (JsException | Activation.Suspend e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    public Object construct(JsFunction fn, Object[] args) {
        try {
            return fn.construct(this, args);
        } catch (JsException | Activation.Suspend e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(e);
        }
    }

    //==================================================================================================================
    // output and diagnostics

    public void print(String line) {
        if (onConsoleLog != null) {
            onConsoleLog.accept(line);
        } else {
            System.out.println(line);
        }
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        logger.warn("{}", diagnostic);
        if (diagnosticListener != null) {
            diagnosticListener.accept(diagnostic);
        }
    }

    void trackRejection(JsPromise promise) {
        pendingRejections.add(promise);
    }

    void untrackRejection(JsPromise promise) {
        pendingRejections.remove(promise);
    }

    /**
     * Reports promises still rejected without a handler, called once the microtask queue is empty.
     */
    void flushRejections() {
        if (pendingRejections.isEmpty()) {
            return;
        }
        List<JsPromise> list = new ArrayList<>(pendingRejections);
        pendingRejections.clear();
        for (JsPromise promise : list) {
            Object reason = promise.getResult();
            ErrorReport report = new JsException(reason, ErrorKind.USER_THROW, SourcePosition.UNKNOWN, null).toReport();
            report(new Diagnostic(Diagnostic.Kind.UNHANDLED_REJECTION, "Unhandled promise rejection: " + Display.inspect(reason), report));
        }
    }

}
