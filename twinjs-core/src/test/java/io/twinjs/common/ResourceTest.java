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
package io.twinjs.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testTextResource() {
        Resource resource = Resource.text("one\r\ntwo\nthree");
        assertFalse(resource.isFile());
        assertNull(resource.getPath());
        assertEquals("", resource.getRelativePath());
        assertEquals("two", resource.getLine(1));
        assertEquals("three", resource.getLine(2));
        assertEquals("", resource.getLine(3));
        assertEquals("", resource.getLine(-1));
    }

    @Test
    void testNamedTextResource() {
        Resource resource = Resource.text("x", "snippet.js");
        assertEquals("snippet.js", resource.getRelativePath());
        assertEquals("snippet.js", resource.toString());
    }

    @Test
    void testFileResource() throws IOException {
        Path file = tempDir.resolve("main.js");
        Files.writeString(file, "let a = 1;\nconsole.log(a);\n");
        Resource resource = Resource.from(file);
        assertTrue(resource.isFile());
        assertEquals(file.toAbsolutePath().normalize(), resource.getPath());
        assertEquals("console.log(a);", resource.getLine(1));
        assertTrue(resource.getRelativePath().endsWith("main.js"));
        assertFalse(resource.getRelativePath().contains("\\"));
    }

    @Test
    void testMissingFile() {
        Resource resource = Resource.from(tempDir.resolve("nope.js"));
        assertThrows(UncheckedIOException.class, resource::getText);
    }

}
