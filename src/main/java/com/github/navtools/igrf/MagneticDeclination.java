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
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Magnetic declination for compass correction.
 *
 * <p>The main entry point is {@link #declination(double, double, LocalDate)}:
 * WGS-84 geodetic latitude/longitude in degrees and a calendar date in,
 * declination in degrees east of true north out. {@link #compute} returns
 * the whole field vector with a {@link ModelValidity} so callers can tell
 * interpolated values from extrapolated ones.</p>
 *
 * <p>The coefficient table is loaded on first use, once. Concurrent first
 * callers wait for the same load. If the load fails, that failure is
 * rethrown on every later call; the source is not read again. There is no
 * fallback value: an unavailable model never turns into a zero declination.</p>
 *
 * <p>Adding the declination to a true bearing to get a magnetic bearing is
 * the caller's job.</p>
 */
public final class MagneticDeclination {
    private static final Logger log = LoggerFactory.getLogger(MagneticDeclination.class);

    private static MagneticDeclination defaultModel; // guarded by MagneticDeclination.class

    private final CoefficientSource source;
    private final double svWindowYears;
    private final Clock clock;

    private final Object loadLock = new Object();
    private volatile LoadState state = LoadState.UNINITIALIZED;
    private volatile CoefficientTable table;
    private volatile CoefficientLoadException failure;

    private final AtomicBoolean warnedStale = new AtomicBoolean();
    private final AtomicBoolean warnedBeforeFirstEpoch = new AtomicBoolean();

    public MagneticDeclination(GeomagConfig config) {
        this(config.source(), config.svWindowYears(), Clock.systemDefaultZone());
    }

    public MagneticDeclination(CoefficientSource source) {
        this(source, CoefficientTable.DEFAULT_SV_WINDOW_YEARS, Clock.systemDefaultZone());
    }

    public MagneticDeclination(CoefficientSource source, double svWindowYears, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.svWindowYears = svWindowYears;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** A model over an already loaded table. */
    public static MagneticDeclination of(CoefficientTable table) {
        Objects.requireNonNull(table, "table");
        MagneticDeclination model = new MagneticDeclination(new LoadedSource(table));
        model.table = table;
        model.state = LoadState.LOADED;
        return model;
    }

    /**
     * The process-wide instance, configured from system properties on the
     * first call (see {@link GeomagConfig}). Creating it does not load the
     * table.
     */
    public static synchronized MagneticDeclination defaultModel() {
        if (defaultModel == null) {
            GeomagConfig config = GeomagConfig.fromSystemProperties();
            log.debug("Default model configured with {}", config);
            defaultModel = new MagneticDeclination(config);
        }
        return defaultModel;
    }

    /** Declination at sea level for today's date in the clock's zone. */
    public double declination(double latitudeDeg, double longitudeDeg) {
        return declination(latitudeDeg, longitudeDeg, LocalDate.now(clock));
    }

    /** Declination at sea level. */
    public double declination(double latitudeDeg, double longitudeDeg, LocalDate date) {
        return declination(latitudeDeg, longitudeDeg, date, 0.0);
    }

    /**
     * Declination in degrees, positive east, in (-180, 180].
     *
     * @param latitudeDeg  WGS-84 geodetic latitude, clipped to [-90, 90]
     * @param longitudeDeg east longitude, any value; normalized to (-180, 180]
     * @param date         calendar date
     * @param altitudeKm   height above the ellipsoid in km
     * @throws CoefficientLoadException if the coefficient table cannot be loaded
     */
    public double declination(double latitudeDeg, double longitudeDeg, LocalDate date, double altitudeKm) {
        return compute(latitudeDeg, longitudeDeg, altitudeKm, date).declinationDeg();
    }

    /** Full field at a geodetic position on a calendar date. */
    public FieldEstimate compute(double latitudeDeg, double longitudeDeg, double altitudeKm, LocalDate date) {
        return compute(latitudeDeg, longitudeDeg, altitudeKm, CoordinateFrame.GEODETIC, DecimalYear.of(date));
    }

    /**
     * Evaluate the field.
     *
     * @param altitudeKm  height above the ellipsoid for {@link CoordinateFrame#GEODETIC},
     *                    distance from the Earth's centre for {@link CoordinateFrame#GEOCENTRIC}
     * @param decimalYear time as a decimal year, see {@link DecimalYear}
     * @throws CoefficientLoadException if the coefficient table cannot be loaded
     * @throws IllegalArgumentException for non-finite input
     */
    public FieldEstimate compute(
            double latitudeDeg, double longitudeDeg, double altitudeKm, CoordinateFrame frame, double decimalYear) {
        Objects.requireNonNull(frame, "frame");
        if (!Double.isFinite(decimalYear)) {
            throw new IllegalArgumentException("decimal year must be finite: " + decimalYear);
        }
        Point point = CoordinateAdapter.toGeocentric(latitudeDeg, longitudeDeg, altitudeKm, frame);
        CoefficientTable t = coefficientTable();
        Coefficients coefficients = t.coefficientsAt(decimalYear, svWindowYears);
        FieldVector field = HarmonicSynthesizer.synthesize(point, coefficients);
        advise(t, coefficients);
        return new FieldEstimate(field, coefficients.validity(), decimalYear);
    }

    /**
     * Load the table now, so a missing or broken table shows up at startup
     * rather than on the first bearing. Also warns if today is already past
     * the secular-variation window.
     *
     * @throws CoefficientLoadException if the coefficient table cannot be loaded
     */
    public void preload() {
        CoefficientTable t = coefficientTable();
        double now = DecimalYear.of(LocalDate.now(clock));
        double yearsAhead = now - t.lastEpoch();
        if (yearsAhead > svWindowYears && warnedStale.compareAndSet(false, true)) {
            log.warn(
                    "Current date is {} years beyond latest epoch {} of {}; declinations are "
                            + "best-effort extrapolations. Consider a newer coefficient table",
                    String.format("%.2f", yearsAhead),
                    String.format("%.1f", t.lastEpoch()),
                    t.source());
        }
    }

    public LoadState state() {
        return state;
    }

    /**
     * The loaded table, loading it on first use.
     *
     * @throws CoefficientLoadException if the load fails now or failed before
     */
    public CoefficientTable coefficientTable() {
        CoefficientTable t = table;
        if (t != null) return t;
        CoefficientLoadException failed = failure;
        if (failed != null) throw failed;
        synchronized (loadLock) {
            if (table != null) return table;
            if (failure != null) throw failure;
            state = LoadState.LOADING;
            try {
                CoefficientTable loaded = CoefficientTable.load(source);
                table = loaded;
                state = LoadState.LOADED;
                return loaded;
            } catch (CoefficientLoadException e) {
                failure = e;
                state = LoadState.FAILED;
                throw e;
            } catch (RuntimeException e) {
                CoefficientLoadException wrapped = new CoefficientLoadException(
                        source.description(), "Failed to load coefficient table " + source.description(), e);
                log.error("Failed to load coefficient table {}", source.description(), e);
                failure = wrapped;
                state = LoadState.FAILED;
                throw wrapped;
            }
        }
    }

    private void advise(CoefficientTable t, Coefficients c) {
        switch (c.validity()) {
            case STALE:
                if (warnedStale.compareAndSet(false, true)) {
                    log.warn(
                            "Requested time {} is {} years beyond latest epoch {}; the secular-variation "
                                    + "window is {} years, so results are best-effort. Consider a newer "
                                    + "coefficient table than {}",
                            String.format("%.2f", c.decimalYear()),
                            String.format("%.2f", c.decimalYear() - t.lastEpoch()),
                            String.format("%.1f", t.lastEpoch()),
                            svWindowYears,
                            t.source());
                }
                break;
            case BEFORE_FIRST_EPOCH:
                if (warnedBeforeFirstEpoch.compareAndSet(false, true)) {
                    log.warn(
                            "Requested time {} precedes the first epoch {} of {}; results are best-effort",
                            String.format("%.2f", c.decimalYear()),
                            String.format("%.1f", t.firstEpoch()),
                            t.source());
                }
                break;
            default:
                break;
        }
        if (c.validity().isDegraded() && log.isDebugEnabled()) {
            log.debug("Degraded coefficients for {}: {}", String.format("%.3f", c.decimalYear()), c.validity());
        }
    }

    private static final class LoadedSource implements CoefficientSource {
        private final CoefficientTable table;

        LoadedSource(CoefficientTable table) {
            this.table = table;
        }

        @Override
        public InputStream open() {
            throw new SourceUnavailableException(description(), "table is already loaded");
        }

        @Override
        public String description() {
            return table.source();
        }
    }
}
