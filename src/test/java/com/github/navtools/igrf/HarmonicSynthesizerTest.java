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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HarmonicSynthesizerTest {
    private static final double A = CoordinateAdapter.REFERENCE_RADIUS_KM;
    private static final double G10 = -30000.0;

    private static Coefficients coefficients(int maxDegree, double g10, double g11, double h11) {
        double[][] g = CoefficientTable.newTriangle(maxDegree);
        double[][] h = CoefficientTable.newTriangle(maxDegree);
        g[1][0] = g10;
        g[1][1] = g11;
        h[1][1] = h11;
        return new Coefficients(2020.0, ModelValidity.INTERPOLATED, maxDegree, g, h);
    }

    private static Point geocentric(double colatitude, double longitude, double radiusKm) {
        return new Point(radiusKm, colatitude, longitude, 1.0, 0.0);
    }

    @Nested
    @DisplayName("Axial dipole")
    class DipoleTests {

        @Test
        @DisplayName("Horizontal and northward at the equator")
        void equator() {
            FieldVector f = HarmonicSynthesizer.synthesize(geocentric(Math.PI / 2, 0.3, A), coefficients(1, G10, 0, 0));

            assertEquals(-G10, f.xNorthNt, 1e-9);
            assertEquals(0.0, f.yEastNt, 1e-9);
            assertEquals(0.0, f.zDownNt, 1e-9);
            assertEquals(0.0, f.declinationDeg, 1e-12);
            assertEquals(0.0, f.inclinationDeg, 1e-9);
        }

        @Test
        @DisplayName("Vertical with twice the strength at the north pole")
        void northPole() {
            FieldVector f = HarmonicSynthesizer.synthesize(geocentric(0.0, 0.0, A), coefficients(1, G10, 0, 0));

            assertEquals(0.0, f.xNorthNt, 1e-9);
            assertEquals(-2 * G10, f.zDownNt, 1e-9);
            assertEquals(90.0, f.inclinationDeg, 1e-9);
        }

        @Test
        @DisplayName("Falls off with the cube of the radius")
        void radialFalloff() {
            Coefficients c = coefficients(1, G10, 0, 0);
            FieldVector surface = HarmonicSynthesizer.synthesize(geocentric(1.0, 0.0, A), c);
            FieldVector twice = HarmonicSynthesizer.synthesize(geocentric(1.0, 0.0, 2 * A), c);

            assertEquals(surface.fTotalNt / 8.0, twice.fTotalNt, 1e-9);
        }
    }

    @Nested
    @DisplayName("Poles")
    class PoleTests {

        @Test
        @DisplayName("East component uses the pole limit without dividing by zero")
        void eastComponentLimit() {
            double lon = 0.4;
            Coefficients c = coefficients(1, 0.0, 1000.0, 0.0);

            FieldVector atPole = HarmonicSynthesizer.synthesize(geocentric(0.0, lon, A), c);
            FieldVector nearPole = HarmonicSynthesizer.synthesize(geocentric(1e-6, lon, A), c);

            assertEquals(1000.0 * Math.sin(lon), atPole.yEastNt, 1e-9);
            assertEquals(1000.0 * Math.cos(lon), atPole.xNorthNt, 1e-9);
            assertEquals(nearPole.yEastNt, atPole.yEastNt, 1e-6);
            assertEquals(nearPole.xNorthNt, atPole.xNorthNt, 1e-6);
        }

        @Test
        @DisplayName("South pole limit matches its neighbourhood")
        void southPole() {
            double lon = -2.0;
            Coefficients c = coefficients(1, G10, 1000.0, -500.0);

            FieldVector atPole = HarmonicSynthesizer.synthesize(geocentric(Math.PI, lon, A), c);
            FieldVector nearPole = HarmonicSynthesizer.synthesize(geocentric(Math.PI - 1e-6, lon, A), c);

            assertEquals(nearPole.yEastNt, atPole.yEastNt, 0.1);
            assertEquals(nearPole.xNorthNt, atPole.xNorthNt, 0.1);
            assertEquals(nearPole.zDownNt, atPole.zDownNt, 0.1);
        }

        @Test
        @DisplayName("Full model stays finite within epsilon of both poles")
        void fullModelNearPoles() {
            Coefficients c = CoefficientTable.load(new ClasspathCoefficientSource(GeomagConfig.DEFAULT_RESOURCE))
                    .coefficientsAt(2012.0);
            double[] colatitudes = {0.0, 1e-15, 1e-12, 1e-9, Math.PI - 1e-12, Math.PI};
            for (double theta : colatitudes) {
                FieldVector f = HarmonicSynthesizer.synthesize(geocentric(theta, 1.0, A), c);
                assertTrue(Double.isFinite(f.xNorthNt) && Double.isFinite(f.yEastNt) && Double.isFinite(f.zDownNt),
                        "finite at colatitude " + theta + ": " + f);
                assertTrue(f.fTotalNt > 40000 && f.fTotalNt < 80000, "bounded at colatitude " + theta + ": " + f);
            }
            FieldVector exact = HarmonicSynthesizer.synthesize(geocentric(0.0, 1.0, A), c);
            FieldVector near = HarmonicSynthesizer.synthesize(geocentric(1e-9, 1.0, A), c);
            assertEquals(near.declinationDeg, exact.declinationDeg, 1e-4);
        }
    }

    @Test
    @DisplayName("Degree truncation drops the higher terms")
    void truncation() {
        double[][] g = CoefficientTable.newTriangle(2);
        double[][] h = CoefficientTable.newTriangle(2);
        g[1][0] = G10;
        g[2][0] = -2000.0;
        Coefficients c = new Coefficients(2020.0, ModelValidity.INTERPOLATED, 2, g, h);
        Point p = geocentric(0.9, 0.0, A);

        FieldVector dipoleOnly = HarmonicSynthesizer.synthesize(p, c, 1);
        FieldVector expected = HarmonicSynthesizer.synthesize(p, coefficients(1, G10, 0, 0));
        FieldVector full = HarmonicSynthesizer.synthesize(p, c);

        assertEquals(expected.xNorthNt, dipoleOnly.xNorthNt, 1e-9);
        assertEquals(expected.zDownNt, dipoleOnly.zDownNt, 1e-9);
        assertNotEquals(expected.zDownNt, full.zDownNt, 1.0);
    }

    @Test
    @DisplayName("Geodetic rotation mixes X and Z and preserves intensity")
    void frameRotation() {
        Coefficients c = coefficients(1, G10, -1500.0, 4800.0);
        double delta = Math.toRadians(0.19);
        Point gc = new Point(A, 0.8, 0.2, 1.0, 0.0);
        Point gd = new Point(A, 0.8, 0.2, Math.cos(delta), Math.sin(delta));

        FieldVector a = HarmonicSynthesizer.synthesize(gc, c);
        FieldVector b = HarmonicSynthesizer.synthesize(gd, c);

        assertEquals(a.fTotalNt, b.fTotalNt, 1e-6);
        assertEquals(a.yEastNt, b.yEastNt, 0.0);
        assertEquals(a.xNorthNt * Math.cos(delta) + a.zDownNt * Math.sin(delta), b.xNorthNt, 1e-6);
    }

    @Test
    @DisplayName("Declination is reported in (-180, 180]")
    void declinationRange() {
        FieldVector south = new FieldVector(-100.0, -0.0, 10.0);
        assertEquals(180.0, south.declinationDeg);
        assertEquals(-90.0, new FieldVector(0.0, -5.0, 0.0).declinationDeg, 1e-12);
    }
}
