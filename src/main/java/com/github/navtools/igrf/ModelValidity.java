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

/** How the coefficients for a requested date were obtained. */
public enum ModelValidity {
    /** Inside the tabulated span: an exact epoch or linear interpolation between two. */
    INTERPOLATED(false),
    /** After the last epoch, inside the secular-variation window. */
    EXTRAPOLATED(false),
    /** After the last epoch and beyond the secular-variation window. Accuracy unknown. */
    STALE(true),
    /** Before the first tabulated epoch. Accuracy unknown. */
    BEFORE_FIRST_EPOCH(true);

    private final boolean degraded;

    ModelValidity(boolean degraded) {
        this.degraded = degraded;
    }

    /** True when the value is a best-effort extrapolation callers should treat with care. */
    public boolean isDegraded() {
        return degraded;
    }
}
