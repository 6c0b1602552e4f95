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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads modules from the file system. Relative specifiers resolve against the importing file,
 * everything else against the root directory. Records are cached by normalized path, so every
 * importer sees the same namespace.
 */
public class FileModuleLoader implements ModuleLoader {

    static final Logger logger = LoggerFactory.getLogger(FileModuleLoader.class);

    private final Path root;
    private final Map<Path, ModuleRecord> modules = new HashMap<>();

    public FileModuleLoader(Path root) {
        this.root = root == null ? Path.of("").toAbsolutePath() : root.toAbsolutePath();
    }

    public Path resolve(String specifier, ModuleRecord importer) {
        String name = specifier.endsWith(".js") ? specifier : specifier + ".js";
        Path base = root;
        if ((specifier.startsWith("./") || specifier.startsWith("../")) && importer != null) {
            Resource resource = importer.getResource();
            if (resource != null && resource.isFile() && resource.getPath().toAbsolutePath().getParent() != null) {
                base = resource.getPath().toAbsolutePath().getParent();
            }
        }
        return base.resolve(name).normalize();
    }

    @Override
    public ModuleRecord load(Realm realm, String specifier, ModuleRecord importer) {
        Path path = resolve(specifier, importer);
        ModuleRecord module = modules.get(path);
        if (module != null) {
            if (!module.isLoaded()) {
                String message = "circular import of '" + specifier + "' from " + (importer == null ? "<main>" : importer.getName());
                realm.report(new Diagnostic(Diagnostic.Kind.CIRCULAR_IMPORT, message, null));
            }
            return module;
        }
        if (!Files.isRegularFile(path)) {
            throw new ModuleException(ModuleException.Kind.FILE_NOT_FOUND, specifier, "Cannot find module '" + specifier + "' (" + path + ")");
        }
        Resource resource = Resource.from(path);
        Node program;
        try {
            program = new JsParser(resource).parse();
        } catch (LexerException | ParserException e) {
            throw new ModuleException(ModuleException.Kind.PARSE_ERROR, specifier, e.getMessage());
        }
        module = new ModuleRecord(realm, resource.getRelativePath(), resource);
        modules.put(path, module);
        logger.debug("loading module: {}", path);
        Environment scope = new Environment(realm.getGlobals());
        try {
            Interpreter.evalProgram(realm, program, scope, module);
        } catch (RuntimeException e) {
            modules.remove(path);
            throw e;
        }
        module.setLoaded();
        return module;
    }

}
