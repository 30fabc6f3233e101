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
 * Schmidt quasi-normalized associated Legendre functions by recurrence.
 *
 * <p>The sectoral terms P_m^m come from P_(m-1)^(m-1) by the recurrence in m;
 * every other term comes from the three-term recurrence in n at fixed m.
 * Derivatives use the differentiated recurrences, not finite differences,
 * so they stay accurate near the poles.</p>
 *
 * <pre>
 * P_n^n  = sqrt(1 - 1/(2n)) sin(t) P_(n-1)^(n-1)                       (n &gt;= 2)
 * P_n^m  = ((2n-1) cos(t) P_(n-1)^m - sqrt((n-1)^2 - m^2) P_(n-2)^m) / sqrt(n^2 - m^2)
 * </pre>
 */
public final class LegendreRecurrence {

    private LegendreRecurrence() {}

    /**
     * Evaluate all P_n^m and dP_n^m/d theta for 0 &lt;= m &lt;= n &lt;= maxDegree.
     *
     * @param theta     colatitude in radians
     * @param maxDegree highest degree, at most {@link CoefficientTable#MAX_DEGREE}
     */
    public static LegendreFunctions functionsAt(double theta, int maxDegree) {
        if (maxDegree < 0 || maxDegree > CoefficientTable.MAX_DEGREE) {
            throw new IllegalArgumentException("maxDegree out of range: " + maxDegree);
        }
        double st = Math.sin(theta);
        double ct = Math.cos(theta);
        double[][] p = CoefficientTable.newTriangle(maxDegree);
        double[][] dp = CoefficientTable.newTriangle(maxDegree);
        p[0][0] = 1.0;
        dp[0][0] = 0.0;
        for (int n = 1; n <= maxDegree; n++) {
            // Sectoral term, recurrence in m. The factor is 1 for n = 1.
            double k = n == 1 ? 1.0 : Math.sqrt(1.0 - 0.5 / n);
            p[n][n] = k * st * p[n - 1][n - 1];
            dp[n][n] = k * (st * dp[n - 1][n - 1] + ct * p[n - 1][n - 1]);

            for (int m = 0; m < n; m++) {
                double norm = Math.sqrt((double) n * n - (double) m * m);
                double a = (2.0 * n - 1.0) / norm;
                double b = n - 1 > m ? Math.sqrt((n - 1.0) * (n - 1.0) - (double) m * m) / norm : 0.0;
                double pPrev2 = n >= 2 && m <= n - 2 ? p[n - 2][m] : 0.0;
                double dpPrev2 = n >= 2 && m <= n - 2 ? dp[n - 2][m] : 0.0;
                p[n][m] = a * ct * p[n - 1][m] - b * pPrev2;
                dp[n][m] = a * (ct * dp[n - 1][m] - st * p[n - 1][m]) - b * dpPrev2;
            }
        }
        return new LegendreFunctions(theta, st, ct, maxDegree, p, dp);
    }
}
