package com.bondyield.valuation;

import com.bondyield.domain.model.BondInput;
import org.springframework.stereotype.Component;

/**
 * Closed-form coupon income measures: current yield and straight-line total interest.
 * Neither accounts for time value, reinvestment, or the gain/loss at maturity.
 */
@Component
public class CurrentYieldCalculator {

    /**
     * Annual coupon divided by market price.
     *
     * @return current yield as a decimal (e.g., 0.05 = 5%)
     */
    public double currentYield(BondInput input) {
        return annualCoupon(input) / input.getMarketPrice();
    }

    /** Annual coupon times years to maturity. Ignores period rounding of the schedule. */
    public double totalInterest(BondInput input) {
        return annualCoupon(input) * input.getYearsToMaturity();
    }

    private static double annualCoupon(BondInput input) {
        return input.getFaceValue() * (input.getAnnualCouponRate() / 100);
    }
}
