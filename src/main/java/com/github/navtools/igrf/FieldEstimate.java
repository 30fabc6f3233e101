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
 * A synthesized field together with how trustworthy its coefficients were.
 *
 * @param field       the field vector in the caller's frame
 * @param validity    how the coefficients were obtained for {@code decimalYear}
 * @param decimalYear the time the field was evaluated for
 */
public record FieldEstimate(FieldVector field, ModelValidity validity, double decimalYear) {

    public double declinationDeg() {
        return field.declinationDeg;
    }

    public double inclinationDeg() {
        return field.inclinationDeg;
    }

    public double totalIntensityNt() {
        return field.fTotalNt;
    }

    /** True for stale or pre-model dates; see {@link ModelValidity#isDegraded()}. */
    public boolean isDegraded() {
        return validity.isDegraded();
    }
}
