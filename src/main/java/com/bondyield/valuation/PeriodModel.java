package com.bondyield.valuation;

import com.bondyield.domain.model.BondInput;
import lombok.Value;

/**
 * Per-period view of a bond shared by the YTM solver and the schedule generator.
 * Derived once per calculation and discarded afterwards.
 */
@Value
public class PeriodModel {

    int totalPeriods;
    double couponPerPeriod;
    double faceValue;
    int paymentsPerYear;
    int monthsPerPeriod;

    /**
     * Derives the period model for a bond. The period count is rounded to the nearest whole
     * period and never drops below one, so a bond always has a maturity payment.
     */
    public static PeriodModel from(BondInput input) {
        int paymentsPerYear = input.getCouponFrequency().getPaymentsPerYear();
        int totalPeriods = (int) Math.max(1, Math.round(input.getYearsToMaturity() * paymentsPerYear));
        double couponPerPeriod = input.getFaceValue() * (input.getAnnualCouponRate() / 100) / paymentsPerYear;
        return new PeriodModel(
                totalPeriods,
                couponPerPeriod,
                input.getFaceValue(),
                paymentsPerYear,
                input.getCouponFrequency().getMonthsPerPeriod());
    }
}
