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

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/** Calendar dates to decimal years, the time axis of the coefficient tables. */
public final class DecimalYear {
    /** Mean tropical year length used for the fractional part. */
    static final double DAYS_PER_YEAR = 365.242;
    private static final double MS_PER_DAY = 86_400_000.0;

    private DecimalYear() {}

    /** {@code year + (dayOfYear - 1) / 365.242}, so 1 January is the whole year. */
    public static double of(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return date.getYear() + (date.getDayOfYear() - 1) / DAYS_PER_YEAR;
    }

    /** Decimal year of a UTC instant given as epoch milliseconds. */
    public static double ofEpochMillis(long epochMillis) {
        LocalDate day = Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
        long jan1 = LocalDate.of(day.getYear(), 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return day.getYear() + (epochMillis - jan1) / MS_PER_DAY / DAYS_PER_YEAR;
    }
}
