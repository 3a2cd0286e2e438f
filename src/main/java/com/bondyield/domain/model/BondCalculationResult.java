package com.bondyield.domain.model;

import com.bondyield.domain.enums.PremiumDiscount;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Yield metrics and payment schedule for one bond. Always fully populated.
 *
 * <p>Yields are decimals (0.0566 = 5.66%). Amounts are in the bond's currency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BondCalculationResult {

    /** Annual coupon divided by market price. Ignores time value and capital gain/loss. */
    private double currentYield;

    /** Annualized internal rate of return of all cash flows at the market price. */
    private double yieldToMaturity;

    /** Annual coupon times years to maturity, straight-line. */
    private double totalInterestEarned;

    private PremiumDiscount premiumDiscount;

    /** Absolute distance between market price and face value; 0 at par. */
    private double premiumDiscountAmount;

    private List<CashFlowEntry> cashFlowSchedule;
}
