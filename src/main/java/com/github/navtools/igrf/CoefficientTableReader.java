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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parser for the IGRF coefficient table layout:
 *
 * <pre>
 * # comment lines
 * c/s   main   main  ...  SV
 * g/h n m 1900.0 1905.0 ... 2020.0 2020-25
 * g 1 0 -31543 -31464 ... -29404.8 5.7
 * h 1 1   5922   5909 ...   4652.5 -29.6
 * </pre>
 *
 * <p>The last header column is the secular-variation column when it reads
 * {@code SV} or has the {@code YYYY-YY} form. Rows for terms an epoch never
 * carried may be absent; those terms are zero.</p>
 */
final class CoefficientTableReader {
    private static final Pattern SV_RANGE = Pattern.compile("\\d{4}-\\d{2,4}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String source;
    private final List<Double> epochs = new ArrayList<>();
    private final Set<String> seenRows = new HashSet<>();
    private boolean headerParsed;
    private boolean secularVariation;
    private boolean dipolePresent;
    private int lineNumber;

    private double[][][] g;
    private double[][][] h;
    private double[][] svG;
    private double[][] svH;

    CoefficientTableReader(String source) {
        this.source = source;
    }

    CoefficientTable read(BufferedReader br) throws IOException {
        String line;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("c/s")) continue;
            if (line.startsWith("g/h")) {
                parseHeader(line);
            } else {
                parseRow(line);
            }
        }
        if (!headerParsed) {
            throw new CoefficientFormatException(source, 0, "missing g/h header line");
        }
        if (seenRows.isEmpty()) {
            throw new CoefficientFormatException(source, 0, "no coefficient rows (truncated table?)");
        }
        if (!dipolePresent) {
            throw new CoefficientFormatException(source, 0, "missing non-zero dipole term g 1 0");
        }
        double[] epochArray = epochs.stream().mapToDouble(Double::doubleValue).toArray();
        return new CoefficientTable(source, epochArray, g, h, svG, svH, secularVariation);
    }

    private void parseHeader(String line) {
        if (headerParsed) {
            throw format("duplicate g/h header line");
        }
        String[] toks = WHITESPACE.split(line);
        if (toks.length < 4 || !toks[1].equalsIgnoreCase("n") || !toks[2].equalsIgnoreCase("m")) {
            throw format("header must start with 'g/h n m' followed by epoch columns");
        }
        for (int i = 3; i < toks.length; i++) {
            String tok = toks[i];
            if (tok.equalsIgnoreCase("SV") || SV_RANGE.matcher(tok).matches()) {
                if (i != toks.length - 1) {
                    throw format("secular-variation column '" + tok + "' must be the last column");
                }
                secularVariation = true;
                continue;
            }
            double year;
            try {
                year = Double.parseDouble(tok);
            } catch (NumberFormatException e) {
                throw new CoefficientFormatException(source, lineNumber, "bad epoch column '" + tok + "'", e);
            }
            if (!epochs.isEmpty() && year <= epochs.get(epochs.size() - 1)) {
                throw format("epochs out of order or duplicated: " + tok + " after " + epochs.get(epochs.size() - 1));
            }
            epochs.add(year);
        }
        if (epochs.isEmpty()) {
            throw format("header names no epoch columns");
        }
        int e = epochs.size();
        g = new double[e][][];
        h = new double[e][][];
        for (int i = 0; i < e; i++) {
            g[i] = CoefficientTable.newTriangle(CoefficientTable.MAX_DEGREE);
            h[i] = CoefficientTable.newTriangle(CoefficientTable.MAX_DEGREE);
        }
        svG = CoefficientTable.newTriangle(CoefficientTable.MAX_DEGREE);
        svH = CoefficientTable.newTriangle(CoefficientTable.MAX_DEGREE);
        headerParsed = true;
    }

    private void parseRow(String line) {
        String[] toks = WHITESPACE.split(line);
        String kind = toks[0];
        if (!kind.equals("g") && !kind.equals("h")) {
            throw format("unexpected line '" + line + "'");
        }
        if (!headerParsed) {
            throw format("coefficient row before the g/h header");
        }
        int expected = 3 + epochs.size() + (secularVariation ? 1 : 0);
        if (toks.length != expected) {
            throw format("expected " + expected + " columns, found " + toks.length);
        }
        int n = parseInt(toks[1], "degree");
        int m = parseInt(toks[2], "order");
        if (n < 1 || n > CoefficientTable.MAX_DEGREE) {
            throw format("degree " + n + " outside 1.." + CoefficientTable.MAX_DEGREE);
        }
        if (m < 0 || m > n) {
            throw format("order " + m + " invalid for degree " + n);
        }
        if (kind.equals("h") && m == 0) {
            throw format("h row with order 0");
        }
        if (!seenRows.add(kind + n + "," + m)) {
            throw format("duplicate row " + kind + " " + n + " " + m);
        }
        double[][][] target = kind.equals("g") ? g : h;
        for (int e = 0; e < epochs.size(); e++) {
            target[e][n][m] = parseValue(toks[3 + e]);
        }
        if (secularVariation) {
            double rate = parseValue(toks[toks.length - 1]);
            if (kind.equals("g")) svG[n][m] = rate;
            else svH[n][m] = rate;
        }
        if (kind.equals("g") && n == 1 && m == 0) {
            for (int e = 0; e < epochs.size(); e++) {
                if (g[e][1][0] == 0.0) {
                    throw format("zero dipole term g 1 0 at epoch " + epochs.get(e));
                }
            }
            dipolePresent = true;
        }
    }

    private int parseInt(String tok, String what) {
        try {
            return Integer.parseInt(tok);
        } catch (NumberFormatException e) {
            throw new CoefficientFormatException(source, lineNumber, "bad " + what + " '" + tok + "'", e);
        }
    }

    private double parseValue(String tok) {
        double v;
        try {
            v = Double.parseDouble(tok);
        } catch (NumberFormatException e) {
            throw new CoefficientFormatException(source, lineNumber, "non-numeric value '" + tok + "'", e);
        }
        if (!Double.isFinite(v)) {
            throw format("non-finite value '" + tok + "'");
        }
        return v;
    }

    private CoefficientFormatException format(String message) {
        return new CoefficientFormatException(source, lineNumber, message);
    }
}
