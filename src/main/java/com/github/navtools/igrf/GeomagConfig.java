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
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for the default {@link MagneticDeclination} instance.
 *
 * <p>Read from JVM system properties:</p>
 * <ul>
 *   <li>{@code igrf.coefficients.path} - coefficient table on the filesystem; wins when set</li>
 *   <li>{@code igrf.coefficients.resource} - classpath resource, default {@value #DEFAULT_RESOURCE}</li>
 *   <li>{@code igrf.sv.window.years} - secular-variation validity window, default 5</li>
 * </ul>
 */
public final class GeomagConfig {
    private static final Logger log = LoggerFactory.getLogger(GeomagConfig.class);

    public static final String PATH_PROPERTY = "igrf.coefficients.path";
    public static final String RESOURCE_PROPERTY = "igrf.coefficients.resource";
    public static final String SV_WINDOW_PROPERTY = "igrf.sv.window.years";
    public static final String DEFAULT_RESOURCE = "wmm2010coeffs.txt";

    private final Path coefficientsPath;
    private final String resourceName;
    private final double svWindowYears;

    private GeomagConfig(Builder b) {
        this.coefficientsPath = b.coefficientsPath;
        this.resourceName = b.resourceName;
        this.svWindowYears = b.svWindowYears;
    }

    public static GeomagConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * @throws IllegalArgumentException if a numeric property cannot be parsed or is out of range
     */
    public static GeomagConfig fromProperties(Properties props) {
        Builder b = builder();
        String path = trimToNull(props.getProperty(PATH_PROPERTY));
        if (path != null) {
            b.coefficientsPath(Paths.get(path));
        }
        String resource = trimToNull(props.getProperty(RESOURCE_PROPERTY));
        if (resource != null) {
            b.resourceName(resource);
        }
        String window = trimToNull(props.getProperty(SV_WINDOW_PROPERTY));
        if (window != null) {
            try {
                b.svWindowYears(Double.parseDouble(window));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(SV_WINDOW_PROPERTY + " is not a number: '" + window + "'", e);
            }
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Path> coefficientsPath() {
        return Optional.ofNullable(coefficientsPath);
    }

    public String resourceName() {
        return resourceName;
    }

    public double svWindowYears() {
        return svWindowYears;
    }

    /**
     * The source these settings point at. A configured path is looked up as
     * given, then by file name in the directory the library was installed to
     * (the jar's directory, or the classes directory) and in that directory's
     * parent. Nothing is opened here.
     */
    public CoefficientSource source() {
        if (coefficientsPath == null) {
            return new ClasspathCoefficientSource(resourceName);
        }
        return new LocatingSource(coefficientsPath);
    }

    @Override
    public String toString() {
        return "GeomagConfig[path=" + coefficientsPath + ", resource=" + resourceName
                + ", svWindowYears=" + svWindowYears + "]";
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /** The configured path, then its file name under {@code installDir} and under its parent. */
    static Path[] searchPath(Path configured, Path installDir) {
        Path name = configured.getFileName();
        if (name == null) {
            return new Path[] {configured};
        }
        Path parent = installDir.getParent() != null ? installDir.getParent() : installDir;
        return new Path[] {configured, installDir.resolve(name), parent.resolve(name)};
    }

    /**
     * Directory holding this library: the directory of its jar, or the classes
     * directory when running unpacked. The working directory when the code
     * location is unknown.
     */
    static Path installDirectory() {
        Path cwd = Paths.get("").toAbsolutePath();
        CodeSource codeSource = GeomagConfig.class.getProtectionDomain().getCodeSource();
        URL location = codeSource != null ? codeSource.getLocation() : null;
        if (location == null) {
            log.debug("Code location unknown; searching from {}", cwd);
            return cwd;
        }
        try {
            Path code = Paths.get(location.toURI()).toAbsolutePath();
            if (Files.isDirectory(code) || code.getParent() == null) {
                return code;
            }
            return code.getParent();
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Code location {} is not a file path; searching from {}", location, cwd, e);
            return cwd;
        }
    }

    // Defers the filesystem search to open() so building a config never touches the disk
    private static final class LocatingSource implements CoefficientSource {
        private final Path path;

        LocatingSource(Path path) {
            this.path = path;
        }

        @Override
        public InputStream open() {
            return FileCoefficientSource.locate(searchPath(path, installDirectory())).open();
        }

        @Override
        public String description() {
            return path.toString();
        }
    }

    public static final class Builder {
        private Path coefficientsPath;
        private String resourceName = DEFAULT_RESOURCE;
        private double svWindowYears = CoefficientTable.DEFAULT_SV_WINDOW_YEARS;

        private Builder() {}

        public Builder coefficientsPath(Path path) {
            this.coefficientsPath = path;
            return this;
        }

        public Builder resourceName(String resourceName) {
            this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
            return this;
        }

        public Builder svWindowYears(double years) {
            if (!(years >= 0.0) || Double.isInfinite(years)) {
                throw new IllegalArgumentException(SV_WINDOW_PROPERTY + " must be a finite, non-negative number of years: " + years);
            }
            this.svWindowYears = years;
            return this;
        }

        public GeomagConfig build() {
            return new GeomagConfig(this);
        }
    }
}
