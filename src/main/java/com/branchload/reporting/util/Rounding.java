package com.branchload.reporting.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two-decimal half-up rounding applied where percentages and report values are produced.
 */
@UtilityClass
public class Rounding {

    public double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public Double round2(Double value) {
        return value == null ? null : round2(value.doubleValue());
    }
}
