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
 * A position in geocentric spherical coordinates, as the synthesis needs it.
 *
 * <p>{@code cosDelta}/{@code sinDelta} describe the rotation between the
 * geocentric and the caller's frame; they are (1, 0) for geocentric input.</p>
 *
 * @param radiusKm   distance from the Earth's centre in km
 * @param colatitude geocentric colatitude in radians, 0 at the north pole
 * @param longitude  east longitude in radians, in (-pi, pi]
 * @param cosDelta   cosine of the geodetic minus geocentric latitude
 * @param sinDelta   sine of the geodetic minus geocentric latitude
 */
public record Point(double radiusKm, double colatitude, double longitude, double cosDelta, double sinDelta) {

    /** Radius relative to the magnetic reference radius {@link CoordinateAdapter#REFERENCE_RADIUS_KM}. */
    public double radiusRatio() {
        return radiusKm / CoordinateAdapter.REFERENCE_RADIUS_KM;
    }
}
