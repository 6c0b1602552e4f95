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

import io.twinjs.common.Resource;
import io.twinjs.parser.JsParser;
import io.twinjs.parser.LexerException;
import io.twinjs.parser.Node;
import io.twinjs.parser.ParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Host entry point. One engine owns one realm: globals and module cache persist across
 * {@code eval} calls, so a host can evaluate a script in several steps.
 */
public class Engine {

    static final Logger logger = LoggerFactory.getLogger(Engine.class);

    private final EngineConfig config;
    private final Realm realm;
    private Consumer<String> onConsoleLog;

    public Engine() {
        this(EngineConfig.defaults());
    }

    public Engine(EngineConfig config) {
        this.config = config;
        realm = new Realm(config);
        realm.setModuleLoader(new FileModuleLoader(config.getModuleRoot()));
    }

    public EngineConfig getConfig() {
        return config;
    }

    public Realm getRealm() {
        return realm;
    }

    public EngineStats getStats() {
        return realm.getStats();
    }

    public List<Diagnostic> getDiagnostics() {
        return realm.getDiagnostics();
    }

    public void setOnConsoleLog(Consumer<String> onConsoleLog) {
        this.onConsoleLog = onConsoleLog;
        realm.setOnConsoleLog(onConsoleLog);
    }

    public void setDiagnosticListener(Consumer<Diagnostic> listener) {
        realm.setDiagnosticListener(listener);
    }

    public void setModuleLoader(ModuleLoader moduleLoader) {
        realm.setModuleLoader(moduleLoader);
    }

    /**
     * Declares a global variable visible to subsequently evaluated code.
     */
    public void put(String name, Object value) {
        realm.getGlobals().declare(name, BindingType.VAR, value, true);
    }

    public Object get(String name) {
        Binding binding = realm.getGlobals().getOwn(name);
        return binding == null ? null : toJava(binding.getValue());
    }

    public Object eval(String text) {
        return eval(Resource.text(text));
    }

    public Object eval(File file) {
        return eval(Resource.from(file.toPath()));
    }

    /**
     * Parses and runs a script, then drains the event loop when configured to.
     *
     * @return the completion value converted with {@link #toJava}
     * @throws LexerException or ParserException if the source does not parse, nothing runs then
     * @throws JsException if the script throws and nothing catches it
     */
    public Object eval(Resource resource) {
        return toJava(evalRaw(resource));
    }

    /**
     * Like {@link #eval(Resource)} but returns the JS value as is.
     */
    public Object evalRaw(Resource resource) {
        Node program = new JsParser(resource).parse();
        Object result = execute(program);
        if (config.isRunEventLoop()) {
            realm.getEventLoop().run();
        }
        return result;
    }

    /**
     * Evaluates without throwing: parse errors and uncaught throws come back as an {@link ErrorReport}.
     */
    public EvalResult run(String text) {
        return run(Resource.text(text));
    }

    public EvalResult run(Resource resource) {
        List<String> output = new ArrayList<>();
        Consumer<String> previous = onConsoleLog;
        realm.setOnConsoleLog(line -> {
            output.add(line);
            if (previous != null) {
                previous.accept(line);
            }
        });
        try {
            return new EvalResult(evalRaw(resource), null, output);
        } catch (LexerException e) {
            return new EvalResult(null, ErrorReport.of(e), output);
        } catch (ParserException e) {
            return new EvalResult(null, ErrorReport.of(e), output);
        } catch (JsException e) {
            logger.debug("uncaught: {}", e.getMessage());
            return new EvalResult(null, e.toReport(), output);
        } catch (RuntimeException e) {
            logger.warn("host exception outside script code: {}", e.toString());
            return new EvalResult(null, realm.wrap(e).toReport(), output);
        } finally {
            realm.setOnConsoleLog(previous);
        }
    }

    private Object execute(Node program) {
        if (isModule(program)) {
            Resource resource = program.token.resource;
            ModuleRecord module = new ModuleRecord(realm, resource.getRelativePath().isEmpty() ? "<main>" : resource.getRelativePath(), resource);
            Object result = Interpreter.evalProgram(realm, program, realm.getGlobals(), module);
            module.setLoaded();
            return result;
        }
        FunctionBody body = realm.functionBody(program);
        if (body.kind == FunctionBody.Kind.COMPILED) {
            return realm.getVirtualMachine().runProgram(body.chunk, realm.getGlobals());
        }
        return Interpreter.evalProgram(realm, program, realm.getGlobals(), null);
    }

    private static boolean isModule(Node program) {
        for (Node stmt : program) {
            switch (stmt.type) {
                case IMPORT_DECL, EXPORT_DECL, EXPORT_DEFAULT, EXPORT_NAMED:
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    /**
     * Converts a JS value for Java callers: undefined becomes null, arrays and sets become lists,
     * plain objects and maps become maps, recursively. Functions, accessors and other objects
     * are returned as is.
     */
    public static Object toJava(Object value) {
        return toJava(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Object toJava(Object value, Set<Object> seen) {
        if (value == Terms.UNDEFINED) {
            return null;
        }
        if (value instanceof JsFunction || value instanceof JsPromise || value instanceof JsError) {
            return value;
        }
        if (!(value instanceof JsObject object) || !seen.add(object)) {
            return value;
        }
        if (object instanceof JsMap map) {
            Map<Object, Object> entries = new LinkedHashMap<>();
            for (Object key : map.keyList()) {
                entries.put(toJava(key, seen), toJava(map.getEntry(key), seen));
            }
            return entries;
        }
        if (object instanceof JsSet set) {
            List<Object> list = new ArrayList<>(set.size());
            for (Object item : set.values()) {
                list.add(toJava(item, seen));
            }
            return list;
        }
        if (object instanceof JsArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (Object item : array.toList()) {
                list.add(toJava(item, seen));
            }
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : object.keys()) {
            map.put(key, toJava(object.getOwn(key), seen));
        }
        return map;
    }

}
