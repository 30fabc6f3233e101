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
 * An angle rounded to whole degrees and minutes, the precision compass
 * corrections and published declination tables use. Both parts carry the
 * sign of the angle, except that a zero degree part moves the sign to the
 * minutes: -0.3 degrees is (0, -18).
 */
public record DegreesMinutes(int degrees, int minutes) {

    public static DegreesMinutes of(double angleDeg) {
        int sign = angleDeg < 0 ? -1 : 1;
        double abs = Math.abs(angleDeg);
        int whole = (int) abs;
        int d = sign * whole;
        int m = (int) (60.0 * (abs - whole) + 0.5) * (d == 0 ? sign : 1);
        return new DegreesMinutes(d, m);
    }

    @Override
    public String toString() {
        return degrees + "d " + minutes + "m";
    }
}
