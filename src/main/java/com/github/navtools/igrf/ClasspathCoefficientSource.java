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

import java.io.InputStream;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Coefficient table bundled as a classpath resource. */
public final class ClasspathCoefficientSource implements CoefficientSource {
    private static final Logger log = LoggerFactory.getLogger(ClasspathCoefficientSource.class);

    private final String resourceName;
    private final ClassLoader classLoader;

    public ClasspathCoefficientSource(String resourceName) {
        this(resourceName, ClasspathCoefficientSource.class.getClassLoader());
    }

    public ClasspathCoefficientSource(String resourceName, ClassLoader classLoader) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public InputStream open() {
        InputStream in = classLoader.getResourceAsStream(resourceName);
        if (in == null) {
            log.error("Coefficient table '{}' not found on classpath", resourceName);
            throw new SourceUnavailableException(
                    description(), "Coefficient table '" + resourceName + "' not found on classpath");
        }
        return in;
    }

    @Override
    public String description() {
        return "classpath:" + resourceName;
    }

    @Override
    public String toString() {
        return description();
    }
}
