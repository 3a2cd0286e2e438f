package com.bondyield.domain.enums;

import com.bondyield.exception.InvalidBondInputException;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How often a bond pays its coupon. The wire format is the number of payments per year
 * (1 or 2), which is also the divisor applied to the annual coupon and the multiplier used to
 * annualize a per-period yield.
 */
@Getter
@RequiredArgsConstructor
public enum CouponFrequency {
    ANNUAL(1),
    SEMI_ANNUAL(2);

    private final int paymentsPerYear;

    public int getMonthsPerPeriod() {
        return 12 / paymentsPerYear;
    }

    /**
     * Resolves the frequency for a payments-per-year count.
     *
     * @throws InvalidBondInputException if the count is null or not 1 or 2
     */
    public static CouponFrequency fromPaymentsPerYear(Integer paymentsPerYear) {
        if (paymentsPerYear != null) {
            for (CouponFrequency frequency : values()) {
                if (frequency.paymentsPerYear == paymentsPerYear) {
                    return frequency;
                }
            }
        }
        throw new InvalidBondInputException(
                "Coupon frequency must be 1 (annual) or 2 (semi-annual)",
                Map.of("couponFrequency", String.valueOf(paymentsPerYear)));
    }
}
