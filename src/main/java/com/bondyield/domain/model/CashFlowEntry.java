package com.bondyield.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One coupon period in a bond's cash flow schedule. Monetary fields are rounded to cents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashFlowEntry {

    /** 1-based period number. */
    private int period;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate paymentDate;

    private double couponPayment;

    /** Running total of the rounded coupons paid through this period. */
    private double cumulativeInterest;

    /** Face value until the final period, where the principal is repaid and this drops to 0. */
    private double remainingPrincipal;
}
