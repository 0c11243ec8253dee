package com.event.resolution.export;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A coordinate pair rounded to a fixed number of decimal places, used to match events to
 * registry entries. Rounding works on the exact binary value with half-even ties.
 */
record CoordinateKey(BigDecimal lat, BigDecimal lng) {

    static CoordinateKey of(double lat, double lng, int scale) {
        return new CoordinateKey(round(lat, scale), round(lng, scale));
    }

    private static BigDecimal round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN);
    }
}
