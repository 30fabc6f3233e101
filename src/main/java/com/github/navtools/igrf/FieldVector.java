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
 * Magnetic field vector at a point, in the caller's frame. All linear
 * quantities are in nanoteslas (nT); angles are degrees.
 */
public final class FieldVector {
    /** X component (north) in nanoteslas (nT). */
    public final double xNorthNt;

    /** Y component (east) in nanoteslas (nT). */
    public final double yEastNt;

    /** Z component (down) in nanoteslas (nT). Positive downward. */
    public final double zDownNt;

    /** Horizontal intensity H = sqrt(X^2 + Y^2) in nanoteslas (nT). */
    public final double hHorizontalNt;

    /** Total intensity F = sqrt(X^2 + Y^2 + Z^2) in nanoteslas (nT). */
    public final double fTotalNt;

    /** Declination D = atan2(Y, X) in degrees east of true north, in (-180, 180]. */
    public final double declinationDeg;

    /** Inclination I (dip) = atan2(Z, H) in degrees, positive downward. */
    public final double inclinationDeg;

    public FieldVector(double x, double y, double z) {
        this.xNorthNt = x;
        this.yEastNt = y;
        this.zDownNt = z;
        this.hHorizontalNt = Math.hypot(x, y);
        this.fTotalNt = Math.sqrt(x * x + y * y + z * z);
        this.declinationDeg = normalizeAngle(Math.toDegrees(Math.atan2(y, x)));
        this.inclinationDeg = Math.toDegrees(Math.atan2(z, this.hHorizontalNt));
    }

    // atan2 can return -180; the convention here is (-180, 180]
    private static double normalizeAngle(double deg) {
        return deg <= -180.0 ? deg + 360.0 : deg;
    }

    @Override
    public String toString() {
        return String.format(
                "FieldVector[X=%.1f Y=%.1f Z=%.1f F=%.1f nT, D=%.4f I=%.4f deg]",
                xNorthNt, yEastNt, zDownNt, fTotalNt, declinationDeg, inclinationDeg);
    }
}
