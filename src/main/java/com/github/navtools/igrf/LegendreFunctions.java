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
 * Schmidt quasi-normalized associated Legendre functions P_n^m(cos theta)
 * and their derivatives with respect to colatitude, for one colatitude.
 * Immutable. {@link #sinTheta()} is exposed so callers can detect the poles,
 * where P_n^m / sin(theta) has to be taken as a limit.
 */
public final class LegendreFunctions {
    private final double theta;
    private final double sinTheta;
    private final double cosTheta;
    private final int maxDegree;
    private final double[][] p;
    private final double[][] dp;

    LegendreFunctions(double theta, double sinTheta, double cosTheta, int maxDegree, double[][] p, double[][] dp) {
        this.theta = theta;
        this.sinTheta = sinTheta;
        this.cosTheta = cosTheta;
        this.maxDegree = maxDegree;
        this.p = p;
        this.dp = dp;
    }

    public double theta() {
        return theta;
    }

    public double sinTheta() {
        return sinTheta;
    }

    public double cosTheta() {
        return cosTheta;
    }

    public int maxDegree() {
        return maxDegree;
    }

    /** P_n^m(cos theta), Schmidt quasi-normalized. */
    public double p(int n, int m) {
        return p[n][m];
    }

    /** dP_n^m / d theta. */
    public double dp(int n, int m) {
        return dp[n][m];
    }
}
