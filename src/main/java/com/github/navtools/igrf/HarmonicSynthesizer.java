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

/**
 * Spherical harmonic synthesis of the main field from resolved Gauss
 * coefficients.
 *
 * <pre>
 * X += (a/r)^(n+2) (g cos m phi + h sin m phi) dP_n^m/d theta
 * Y += (a/r)^(n+2) m (g sin m phi - h cos m phi) P_n^m / sin theta
 * Z -= (n+1) (a/r)^(n+2) (g cos m phi + h sin m phi) P_n^m
 * </pre>
 *
 * <p>At the poles P_n^m / sin theta is replaced by its limit
 * dP_n^m/d theta / cos theta, which only the m = 1 terms contribute to.
 * The geocentric X/Z pair is then rotated into the caller's frame.</p>
 */
public final class HarmonicSynthesizer {
    /** Below this |sin theta| the pole limit is used instead of dividing. */
    static final double POLE_EPSILON = 1e-10;

    // Colatitude is often repeated across calls (track legs, grids); keep the last table per thread.
    @SuppressWarnings("squid:S5164")
    private static final ThreadLocal<LegendreFunctions> LAST_LEGENDRE = new ThreadLocal<>();

    private HarmonicSynthesizer() {}

    /** Synthesize with every degree the coefficients carry. */
    public static FieldVector synthesize(Point point, Coefficients coefficients) {
        return synthesize(point, coefficients, coefficients.maxDegree());
    }

    /**
     * Evaluate the field at a point.
     *
     * @param maxDegree highest degree to sum; terms above the coefficients' degree are zero
     */
    public static FieldVector synthesize(Point point, Coefficients coefficients, int maxDegree) {
        int nMax = Math.min(maxDegree, coefficients.maxDegree());
        LegendreFunctions legendre = legendreAt(point.colatitude(), nMax);
        double st = legendre.sinTheta();
        double ct = legendre.cosTheta();
        boolean atPole = Math.abs(st) < POLE_EPSILON;

        // sin(m*phi) and cos(m*phi) by angle addition
        double[] sinM = new double[nMax + 1];
        double[] cosM = new double[nMax + 1];
        cosM[0] = 1.0;
        if (nMax >= 1) {
            sinM[1] = Math.sin(point.longitude());
            cosM[1] = Math.cos(point.longitude());
        }
        for (int m = 2; m <= nMax; m++) {
            sinM[m] = sinM[m - 1] * cosM[1] + cosM[m - 1] * sinM[1];
            cosM[m] = cosM[m - 1] * cosM[1] - sinM[m - 1] * sinM[1];
        }

        double ratio = CoordinateAdapter.REFERENCE_RADIUS_KM / point.radiusKm();
        double radial = ratio * ratio; // (a/r)^(n+2), advanced once per degree
        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        for (int n = 1; n <= nMax; n++) {
            radial *= ratio;
            for (int m = 0; m <= n; m++) {
                double g = coefficients.g(n, m);
                double h = coefficients.h(n, m);
                double a = g * cosM[m] + h * sinM[m];
                x += radial * a * legendre.dp(n, m);
                z -= (n + 1) * radial * a * legendre.p(n, m);
                if (m != 0) {
                    double b = g * sinM[m] - h * cosM[m];
                    if (atPole) {
                        y += radial * b * legendre.dp(n, m) * ct;
                    } else {
                        y += radial * m * b * legendre.p(n, m) / st;
                    }
                }
            }
        }

        // Rotate from geocentric to the caller's frame
        double cd = point.cosDelta();
        double sd = point.sinDelta();
        return new FieldVector(x * cd + z * sd, y, z * cd - x * sd);
    }

    private static LegendreFunctions legendreAt(double theta, int maxDegree) {
        LegendreFunctions last = LAST_LEGENDRE.get();
        if (last != null && last.theta() == theta && last.maxDegree() == maxDegree) {
            return last;
        }
        LegendreFunctions fresh = LegendreRecurrence.functionsAt(theta, maxDegree);
        LAST_LEGENDRE.set(fresh);
        return fresh;
    }
}
