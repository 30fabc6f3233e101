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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main-field Gauss coefficients by epoch, plus the secular-variation rates
 * used past the last epoch.
 *
 * <p>The table is read once from a text source in the layout published with
 * the IGRF (<code>igrfNNcoeffs.txt</code>) and is never mutated afterwards,
 * so one instance can be shared between threads without locking. Terms that
 * an epoch does not carry (early epochs stop at degree 10) are zero.</p>
 */
public final class CoefficientTable {
    private static final Logger log = LoggerFactory.getLogger(CoefficientTable.class);

    /** Highest spherical harmonic degree any table may carry. */
    public static final int MAX_DEGREE = 13;

    /** Default secular-variation validity window in years. */
    public static final double DEFAULT_SV_WINDOW_YEARS = 5.0;

    private final String source;
    private final double[] epochs; // strictly increasing decimal years
    private final double[][][] g; // g[epochIndex][n][m]
    private final double[][][] h; // h[epochIndex][n][m]
    private final double[][] svG; // nT/year after the last epoch
    private final double[][] svH;
    private final int[] epochDegree;
    private final int maxDegree;
    private final boolean secularVariation;

    CoefficientTable(
            String source,
            double[] epochs,
            double[][][] g,
            double[][][] h,
            double[][] svG,
            double[][] svH,
            boolean secularVariation) {
        this.source = source;
        this.epochs = epochs;
        this.g = g;
        this.h = h;
        this.svG = svG;
        this.svH = svH;
        this.secularVariation = secularVariation;
        this.epochDegree = new int[epochs.length];
        int max = 0;
        for (int e = 0; e < epochs.length; e++) {
            epochDegree[e] = highestDegree(g[e], h[e]);
            max = Math.max(max, epochDegree[e]);
        }
        this.maxDegree = Math.max(max, highestDegree(svG, svH));
    }

    /**
     * Read a table from the given source.
     *
     * @throws SourceUnavailableException if the source cannot be opened or read
     * @throws CoefficientFormatException if the content is malformed
     */
    public static CoefficientTable load(CoefficientSource source) {
        try (InputStream in = source.open()) {
            return load(in, source.description());
        } catch (IOException e) {
            log.error("Failed to read coefficient table {}", source.description(), e);
            throw new SourceUnavailableException(
                    source.description(), "Failed to read coefficient table " + source.description(), e);
        }
    }

    /**
     * Read a table from an open stream. The stream is not closed.
     *
     * @param name used in log lines and exception messages
     */
    public static CoefficientTable load(InputStream in, String name) {
        BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        CoefficientTable table;
        try {
            table = new CoefficientTableReader(name).read(br);
        } catch (IOException e) {
            log.error("Failed to read coefficient table {}", name, e);
            throw new SourceUnavailableException(name, "Failed to read coefficient table " + name, e);
        } catch (CoefficientFormatException e) {
            log.error("Failed to parse coefficient table: {}", e.getMessage());
            throw e;
        }
        log.info(
                "Loaded coefficient table {}: {} epoch(s) {} to {}, degree {}{}",
                name,
                table.epochs.length,
                table.firstEpoch(),
                table.lastEpoch(),
                table.maxDegree,
                table.secularVariation ? ", with secular variation" : "");
        return table;
    }

    public String source() {
        return source;
    }

    public double[] epochs() {
        return epochs.clone();
    }

    public int epochCount() {
        return epochs.length;
    }

    public double firstEpoch() {
        return epochs[0];
    }

    public double lastEpoch() {
        return epochs[epochs.length - 1];
    }

    /** Highest degree carried by any epoch or by the secular variation. */
    public int maxDegree() {
        return maxDegree;
    }

    /** Highest degree with a non-zero coefficient at the given epoch. */
    public int degreeAt(int epochIndex) {
        return epochDegree[epochIndex];
    }

    public boolean hasSecularVariation() {
        return secularVariation;
    }

    /** Tabulated coefficients of one epoch. */
    public CoefficientEntry entry(int epochIndex, int n, int m) {
        checkDegreeOrder(n, m);
        return new CoefficientEntry(n, m, g[epochIndex][n][m], h[epochIndex][n][m]);
    }

    /** Secular-variation rates (nT/year) for one term, as an entry. */
    public CoefficientEntry secularVariation(int n, int m) {
        checkDegreeOrder(n, m);
        return new CoefficientEntry(n, m, svG[n][m], svH[n][m]);
    }

    /** Same as {@link #coefficientsAt(double, double)} with the default 5-year window. */
    public Coefficients coefficientsAt(double decimalYear) {
        return coefficientsAt(decimalYear, DEFAULT_SV_WINDOW_YEARS);
    }

    /**
     * Resolve the coefficients for a decimal year.
     *
     * <ul>
     *   <li>At a tabulated epoch: the tabulated values, unchanged.</li>
     *   <li>Between two epochs: linear interpolation, term by term, for the
     *       degrees both epochs carry. Higher degrees are zero.</li>
     *   <li>After the last epoch: last epoch plus secular variation times the
     *       years elapsed. Never clamped; beyond {@code svWindowYears} the
     *       result is marked {@link ModelValidity#STALE}.</li>
     *   <li>Before the first epoch: first epoch plus secular variation times
     *       the (negative) years elapsed, up to the first epoch's degree,
     *       marked {@link ModelValidity#BEFORE_FIRST_EPOCH}.</li>
     * </ul>
     */
    public Coefficients coefficientsAt(double decimalYear, double svWindowYears) {
        if (!Double.isFinite(decimalYear)) {
            throw new IllegalArgumentException("decimal year must be finite: " + decimalYear);
        }
        final int last = epochs.length - 1;
        double[][] gOut = newTriangle(maxDegree);
        double[][] hOut = newTriangle(maxDegree);

        if (decimalYear < epochs[0]) {
            applyRate(0, decimalYear - epochs[0], epochDegree[0], gOut, hOut);
            return new Coefficients(decimalYear, ModelValidity.BEFORE_FIRST_EPOCH, maxDegree, gOut, hOut);
        }

        if (decimalYear > epochs[last]) {
            double dt = decimalYear - epochs[last];
            applyRate(last, dt, maxDegree, gOut, hOut);
            ModelValidity validity = dt > svWindowYears ? ModelValidity.STALE : ModelValidity.EXTRAPOLATED;
            return new Coefficients(decimalYear, validity, maxDegree, gOut, hOut);
        }

        int hi = upperBound(epochs, decimalYear);
        if (epochs[hi] == decimalYear) {
            for (int n = 1; n <= maxDegree; n++) {
                System.arraycopy(g[hi][n], 0, gOut[n], 0, n + 1);
                System.arraycopy(h[hi][n], 0, hOut[n], 0, n + 1);
            }
            return new Coefficients(decimalYear, ModelValidity.INTERPOLATED, maxDegree, gOut, hOut);
        }
        int lo = hi - 1;
        double t = (decimalYear - epochs[lo]) / (epochs[hi] - epochs[lo]);
        // a degree missing from either epoch stays zero instead of ramping in
        int degree = Math.min(epochDegree[lo], epochDegree[hi]);
        for (int n = 1; n <= degree; n++) {
            for (int m = 0; m <= n; m++) {
                gOut[n][m] = g[lo][n][m] + t * (g[hi][n][m] - g[lo][n][m]);
                hOut[n][m] = h[lo][n][m] + t * (h[hi][n][m] - h[lo][n][m]);
            }
        }
        return new Coefficients(decimalYear, ModelValidity.INTERPOLATED, maxDegree, gOut, hOut);
    }

    private void applyRate(int epochIndex, double dt, int degree, double[][] gOut, double[][] hOut) {
        for (int n = 1; n <= degree; n++) {
            for (int m = 0; m <= n; m++) {
                gOut[n][m] = g[epochIndex][n][m] + dt * svG[n][m];
                hOut[n][m] = h[epochIndex][n][m] + dt * svH[n][m];
            }
        }
    }

    static void checkDegreeOrder(int n, int m) {
        if (n < 1 || n > MAX_DEGREE || m < 0 || m > n) {
            throw new IllegalArgumentException("invalid degree/order (" + n + ", " + m + ")");
        }
    }

    static double[][] newTriangle(int maxDegree) {
        double[][] t = new double[maxDegree + 1][];
        for (int n = 0; n <= maxDegree; n++) {
            t[n] = new double[n + 1];
        }
        return t;
    }

    private static int highestDegree(double[][] gs, double[][] hs) {
        for (int n = gs.length - 1; n >= 1; n--) {
            for (int m = 0; m <= n; m++) {
                if (gs[n][m] != 0.0 || hs[n][m] != 0.0) {
                    return n;
                }
            }
        }
        return 0;
    }

    /**
     * Find the first index in a sorted array where arr[index] >= x.
     * If x is larger than all entries, returns the last index.
     */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    @Override
    public String toString() {
        return "CoefficientTable[" + source + ", epochs=" + Arrays.toString(epochs) + ", degree=" + maxDegree + "]";
    }
}
