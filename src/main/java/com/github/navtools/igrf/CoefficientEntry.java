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
 * One (degree, order) pair of Gauss coefficients in nanoteslas. For
 * zonal terms (order 0) there is no h coefficient and it is always zero.
 */
public record CoefficientEntry(int degree, int order, double g, double h) {

    public CoefficientEntry {
        if (degree < 1 || degree > CoefficientTable.MAX_DEGREE) {
            throw new IllegalArgumentException("degree out of range: " + degree);
        }
        if (order < 0 || order > degree) {
            throw new IllegalArgumentException("order " + order + " invalid for degree " + degree);
        }
        if (order == 0 && h != 0.0) {
            throw new IllegalArgumentException("h must be zero for order 0, got " + h);
        }
    }
}
