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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeomagConfigTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) {
            p.setProperty(kv[i], kv[i + 1]);
        }
        return p;
    }

    @Test
    @DisplayName("Defaults point at the bundled table")
    void defaults() {
        GeomagConfig config = GeomagConfig.fromProperties(new Properties());

        assertTrue(config.coefficientsPath().isEmpty());
        assertEquals(GeomagConfig.DEFAULT_RESOURCE, config.resourceName());
        assertEquals(CoefficientTable.DEFAULT_SV_WINDOW_YEARS, config.svWindowYears());
        assertInstanceOf(ClasspathCoefficientSource.class, config.source());
        assertEquals("classpath:" + GeomagConfig.DEFAULT_RESOURCE, config.source().description());
    }

    @Test
    @DisplayName("Properties override the defaults")
    void overrides() {
        GeomagConfig config = GeomagConfig.fromProperties(props(
                GeomagConfig.PATH_PROPERTY, " /data/igrf13coeffs.txt ",
                GeomagConfig.RESOURCE_PROPERTY, "other.txt",
                GeomagConfig.SV_WINDOW_PROPERTY, "2.5"));

        assertEquals(Paths.get("/data/igrf13coeffs.txt"), config.coefficientsPath().orElseThrow());
        assertEquals("other.txt", config.resourceName());
        assertEquals(2.5, config.svWindowYears());
        assertEquals(Paths.get("/data/igrf13coeffs.txt").toString(), config.source().description());
    }

    @Test
    @DisplayName("Blank values count as unset")
    void blankValues() {
        GeomagConfig config = GeomagConfig.fromProperties(props(
                GeomagConfig.PATH_PROPERTY, "  ", GeomagConfig.SV_WINDOW_PROPERTY, ""));

        assertTrue(config.coefficientsPath().isEmpty());
        assertEquals(CoefficientTable.DEFAULT_SV_WINDOW_YEARS, config.svWindowYears());
    }

    @Test
    @DisplayName("Bad window values are rejected")
    void badWindow() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GeomagConfig.fromProperties(props(GeomagConfig.SV_WINDOW_PROPERTY, "five")));
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertThrows(IllegalArgumentException.class,
                () -> GeomagConfig.fromProperties(props(GeomagConfig.SV_WINDOW_PROPERTY, "-1")));
        assertThrows(IllegalArgumentException.class, () -> GeomagConfig.builder().svWindowYears(Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> GeomagConfig.builder().svWindowYears(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("A configured path is opened lazily")
    void configuredPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("coeffs.txt");
        Files.writeString(file, "g/h n m 2020.0 SV\ng 1 0 -29404.8 5.7\n");
        GeomagConfig config = GeomagConfig.builder().coefficientsPath(file).svWindowYears(1.0).build();

        MagneticDeclination model = new MagneticDeclination(config);
        assertEquals(LoadState.UNINITIALIZED, model.state());

        CoefficientTable table = model.coefficientTable();
        assertEquals(2020.0, table.firstEpoch());
        assertEquals(file.toString(), table.source());
    }

    @Test
    @DisplayName("Search order is the path, the install directory, then its parent")
    void searchOrder(@TempDir Path dir) {
        Path install = dir.resolve("lib");
        Path configured = Paths.get("conf", "igrf13coeffs.txt");

        Path[] candidates = GeomagConfig.searchPath(configured, install);

        assertArrayEquals(new Path[] {
                    configured, install.resolve("igrf13coeffs.txt"), dir.resolve("igrf13coeffs.txt")
                },
                candidates);
    }

    @Test
    @DisplayName("A table next to the install directory is found by file name")
    void foundBesideInstall(@TempDir Path dir) throws Exception {
        Path install = Files.createDirectory(dir.resolve("lib"));
        Path table = Files.writeString(dir.resolve("coeffs.txt"), "g/h n m 2020.0 SV\ng 1 0 -29404.8 5.7\n");

        FileCoefficientSource found = FileCoefficientSource.locate(
                GeomagConfig.searchPath(dir.resolve("missing").resolve("coeffs.txt"), install));

        assertEquals(table, found.path());
        assertEquals(-29404.8, CoefficientTable.load(found).entry(0, 1, 0).g());
    }

    @Test
    @DisplayName("Install directory is where the classes were loaded from")
    void installDirectory() {
        Path install = GeomagConfig.installDirectory();

        assertTrue(install.isAbsolute(), install.toString());
        assertTrue(Files.isDirectory(install), install.toString());
    }

    @Test
    @DisplayName("A missing configured path fails on first use")
    void missingPath(@TempDir Path dir) {
        GeomagConfig config = GeomagConfig.builder()
                .coefficientsPath(dir.resolve("nowhere").resolve("absent-table.txt"))
                .build();
        MagneticDeclination model = new MagneticDeclination(config);

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, model::preload);
        assertTrue(e.getMessage().contains("absent-table.txt"), e.getMessage());
        assertEquals(LoadState.FAILED, model.state());
    }
}
