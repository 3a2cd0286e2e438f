package com.bondyield.valuation;

import com.bondyield.domain.model.CashFlowEntry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

/**
 * Builds the coupon-by-coupon payment timeline of a bullet bond.
 *
 * <p>Payment dates are offsets from the reference date (the day the calculation runs), since no
 * issue date is modelled. Month arithmetic follows {@link LocalDate#plusMonths}, which clamps to
 * the last day of shorter months.
 *
 * <p>Amounts are rounded to cents here and not earlier. Cumulative interest is the running sum of
 * the already-rounded coupons, rounded again; consumers compare against that exact sequence, so it
 * must not be replaced by rounding an unrounded running total.
 */
@Component
public class CashFlowScheduleGenerator {

    private static final int CENTS = 2;

    public List<CashFlowEntry> generate(PeriodModel model, LocalDate referenceDate) {
        int totalPeriods = model.getTotalPeriods();
        double couponPayment = Precision.round(model.getCouponPerPeriod(), CENTS);

        List<CashFlowEntry> schedule = new ArrayList<>(totalPeriods);
        double cumulativeInterest = 0;

        for (int period = 1; period <= totalPeriods; period++) {
            cumulativeInterest = Precision.round(cumulativeInterest + couponPayment, CENTS);

            schedule.add(CashFlowEntry.builder()
                    .period(period)
                    .paymentDate(referenceDate.plusMonths((long) period * model.getMonthsPerPeriod()))
                    .couponPayment(couponPayment)
                    .cumulativeInterest(cumulativeInterest)
                    // Bullet repayment: principal is outstanding until the maturity coupon
                    .remainingPrincipal(period == totalPeriods ? 0 : model.getFaceValue())
                    .build());
        }

        return schedule;
    }
}
