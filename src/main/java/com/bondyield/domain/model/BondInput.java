package com.bondyield.domain.model;

import com.bondyield.domain.enums.CouponFrequency;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable parameters of a fixed-coupon bond, already validated by the caller.
 *
 * <p>The valuation engine assumes faceValue, marketPrice and yearsToMaturity are positive and
 * annualCouponRate is within [0, 100]. It does not re-check them.
 */
@Value
@Builder
public class BondInput {

    /** Par amount repaid at maturity. */
    double faceValue;

    /** Annual coupon rate as a percentage (5 = 5%). */
    double annualCouponRate;

    /** Current trading price. */
    double marketPrice;

    /** Years until maturity, at most 100. */
    double yearsToMaturity;

    CouponFrequency couponFrequency;
}
