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
 * The coefficient source was readable but malformed: missing header, bad
 * column counts, non-numeric values, out-of-order epochs and the like.
 */
public class CoefficientFormatException extends CoefficientLoadException {
    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public CoefficientFormatException(String source, int lineNumber, String message) {
        super(source, lineNumber > 0 ? source + ":" + lineNumber + ": " + message : source + ": " + message);
        this.lineNumber = lineNumber;
    }

    public CoefficientFormatException(String source, int lineNumber, String message, Throwable cause) {
        super(source, source + ":" + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number of the offending line, or 0 when the problem is not tied to a line. */
    public int getLineNumber() {
        return lineNumber;
    }
}
