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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gauss coefficients resolved for a single decimal year. Produced by
 * {@link CoefficientTable#coefficientsAt}; immutable.
 */
public final class Coefficients {
    private final double decimalYear;
    private final ModelValidity validity;
    private final int maxDegree;
    private final double[][] g; // g[n][m]
    private final double[][] h; // h[n][m]

    Coefficients(double decimalYear, ModelValidity validity, int maxDegree, double[][] g, double[][] h) {
        this.decimalYear = decimalYear;
        this.validity = validity;
        this.maxDegree = maxDegree;
        this.g = g;
        this.h = h;
    }

    public double decimalYear() {
        return decimalYear;
    }

    public ModelValidity validity() {
        return validity;
    }

    public int maxDegree() {
        return maxDegree;
    }

    /**
     * g coefficient for degree n, order m; zero for terms the table does not carry.
     *
     * @throws IllegalArgumentException unless 1 &lt;= n &lt;= {@link CoefficientTable#MAX_DEGREE} and 0 &lt;= m &lt;= n
     */
    public double g(int n, int m) {
        CoefficientTable.checkDegreeOrder(n, m);
        return n <= maxDegree ? g[n][m] : 0.0;
    }

    /** h coefficient for degree n, order m; zero for m = 0 and for terms the table does not carry. */
    public double h(int n, int m) {
        CoefficientTable.checkDegreeOrder(n, m);
        return n <= maxDegree ? h[n][m] : 0.0;
    }

    public CoefficientEntry entry(int n, int m) {
        return new CoefficientEntry(n, m, g(n, m), h(n, m));
    }

    /** All (n, m) pairs up to {@link #maxDegree()}, ordered by degree then order. */
    public List<CoefficientEntry> entries() {
        List<CoefficientEntry> out = new ArrayList<>();
        for (int n = 1; n <= maxDegree; n++) {
            for (int m = 0; m <= n; m++) {
                out.add(entry(n, m));
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return String.format("Coefficients[%.4f, %s, degree %d]", decimalYear, validity, maxDegree);
    }
}
