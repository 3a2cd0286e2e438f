package com.bondyield.valuation;

import com.bondyield.domain.enums.PremiumDiscount;
import com.bondyield.domain.model.BondInput;
import org.springframework.stereotype.Component;

/**
 * Classifies a bond as trading at a premium, discount or par.
 *
 * <p>Prices within one cent of face value count as par so that floating-point noise around an
 * exact par price does not flip the classification.
 */
@Component
public class PremiumDiscountClassifier {

    static final double PAR_TOLERANCE = 0.01;

    public PremiumDiscountAssessment classify(BondInput input) {
        double difference = input.getMarketPrice() - input.getFaceValue();

        if (Math.abs(difference) < PAR_TOLERANCE) {
            return new PremiumDiscountAssessment(PremiumDiscount.PAR, 0);
        }
        if (difference > 0) {
            return new PremiumDiscountAssessment(PremiumDiscount.PREMIUM, difference);
        }
        return new PremiumDiscountAssessment(PremiumDiscount.DISCOUNT, Math.abs(difference));
    }
}
