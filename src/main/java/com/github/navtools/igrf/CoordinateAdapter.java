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
 * Converts caller coordinates into the geocentric spherical {@link Point}
 * the harmonic synthesis works in.
 */
public final class CoordinateAdapter {
    // WGS-84 ellipsoid
    public static final double SEMI_MAJOR_AXIS_KM = 6378.137;
    public static final double FLATTENING = 1.0 / 298.257223563;
    public static final double ECCENTRICITY_SQUARED = FLATTENING * (2.0 - FLATTENING);
    /** Magnetic reference radius. Not the mean radius; the value the coefficients are fitted for. */
    public static final double REFERENCE_RADIUS_KM = 6371.2;

    // longitudes are resolved to 1e-9 degree, about 0.1 mm on the ground
    private static final double LONGITUDE_STEPS_PER_DEGREE = 1e9;

    private static final double A2 = SEMI_MAJOR_AXIS_KM * SEMI_MAJOR_AXIS_KM;
    private static final double B2 = A2 * (1.0 - ECCENTRICITY_SQUARED);

    private CoordinateAdapter() {}

    /**
     * Convert a latitude/longitude/altitude to geocentric spherical coordinates.
     *
     * <p>Latitude is clipped to [-90, 90] and longitude normalized to
     * (-180, 180] before conversion.</p>
     *
     * @param latitudeDeg  latitude in degrees, north positive
     * @param longitudeDeg longitude in degrees, east positive
     * @param altitudeKm   height above the ellipsoid (geodetic) or distance
     *                     from the Earth's centre (geocentric), in km
     * @throws IllegalArgumentException for non-finite input or a
     *                                  non-positive geocentric radius
     */
    public static Point toGeocentric(
            double latitudeDeg, double longitudeDeg, double altitudeKm, CoordinateFrame frame) {
        requireFinite(latitudeDeg, "latitude");
        requireFinite(longitudeDeg, "longitude");
        requireFinite(altitudeKm, "altitude");
        double lat = clipLatitude(latitudeDeg);
        double lon = Math.toRadians(normalizeLongitude(longitudeDeg));
        double theta = Math.toRadians(90.0 - lat);

        if (frame == CoordinateFrame.GEOCENTRIC) {
            if (altitudeKm <= 0.0) {
                throw new IllegalArgumentException(
                        "geocentric radius must be positive, got " + altitudeKm + " km");
            }
            return new Point(altitudeKm, theta, lon, 1.0, 0.0);
        }

        // Geodetic colatitude to geocentric colatitude and radius
        double st = Math.sin(theta);
        double ct = Math.cos(theta);
        double one = A2 * st * st;
        double two = B2 * ct * ct;
        double three = one + two;
        double rho = Math.sqrt(three);
        double r = Math.sqrt(altitudeKm * (altitudeKm + 2.0 * rho) + (A2 * one + B2 * two) / three);
        if (!(r > 0.0)) {
            throw new IllegalArgumentException("altitude " + altitudeKm + " km places the point at or below the centre");
        }
        double cd = (altitudeKm + rho) / r;
        double sd = (A2 - B2) / rho * ct * st / r;
        double gcTheta = Math.atan2(st * cd + ct * sd, ct * cd - st * sd);
        return new Point(r, gcTheta, lon, cd, sd);
    }

    /**
     * Normalize a longitude in degrees to (-180, 180], snapped to a 1e-9
     * degree grid so that {@code lon} and {@code lon + 360} give the same value.
     */
    public static double normalizeLongitude(double longitudeDeg) {
        double lon = longitudeDeg % 360.0;
        if (lon > 180.0) lon -= 360.0;
        else if (lon <= -180.0) lon += 360.0;
        lon = Math.rint(lon * LONGITUDE_STEPS_PER_DEGREE) / LONGITUDE_STEPS_PER_DEGREE;
        return lon <= -180.0 ? lon + 360.0 : lon;
    }

    /** Clip a latitude in degrees to [-90, 90]. */
    public static double clipLatitude(double latitudeDeg) {
        return Math.max(-90.0, Math.min(90.0, latitudeDeg));
    }

    private static void requireFinite(double v, String what) {
        if (!Double.isFinite(v)) {
            throw new IllegalArgumentException(what + " must be finite, got " + v);
        }
    }
}
