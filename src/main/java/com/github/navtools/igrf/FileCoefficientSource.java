/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.navtools.igrf;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Coefficient table read from the filesystem. */
public final class FileCoefficientSource implements CoefficientSource {
    private static final Logger log = LoggerFactory.getLogger(FileCoefficientSource.class);

    private final Path path;

    public FileCoefficientSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Pick the first candidate that exists as a regular file. Typical use is
     * the configured name, then the same file name next to the application,
     * then one directory up.
     *
     * @throws SourceUnavailableException if none of the candidates exists
     */
    public static FileCoefficientSource locate(Path... candidates) {
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return new FileCoefficientSource(candidate);
            }
            log.debug("Coefficient table not found at {}", candidate);
        }
        String tried = Arrays.stream(candidates).map(Path::toString).collect(Collectors.joining(", "));
        log.error("Coefficient table not found; tried {}", tried);
        throw new SourceUnavailableException(tried, "Coefficient table not found; tried " + tried);
    }

    public Path path() {
        return path;
    }

    @Override
    public InputStream open() {
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            log.error("Cannot open coefficient table {}", path, e);
            throw new SourceUnavailableException(description(), "Cannot open coefficient table " + path, e);
        }
    }

    @Override
    public String description() {
        return path.toString();
    }

    @Override
    public String toString() {
        return description();
    }
}
