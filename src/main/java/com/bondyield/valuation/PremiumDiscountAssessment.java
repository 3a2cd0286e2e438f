package com.bondyield.valuation;

import com.bondyield.domain.enums.PremiumDiscount;
import lombok.Value;

@Value
public class PremiumDiscountAssessment {

    PremiumDiscount status;

    /** Non-negative; zero when the bond trades at par. */
    double amount;
}
