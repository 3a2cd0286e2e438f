package com.bondyield.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /api/bonds/calculate}.
 *
 * <p>All range checks happen here; the valuation engine trusts its input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculateBondRequest {

    @NotNull(message = "Face value is required")
    @Positive(message = "Face value must be positive")
    private Double faceValue;

    /** Percentage, e.g. 5 for a 5% coupon. */
    @NotNull(message = "Coupon rate is required")
    @DecimalMin(value = "0", message = "Coupon rate cannot be negative")
    @DecimalMax(value = "100", message = "Coupon rate cannot exceed 100%")
    private Double annualCouponRate;

    @NotNull(message = "Market price is required")
    @Positive(message = "Market price must be positive")
    private Double marketPrice;

    @NotNull(message = "Years to maturity is required")
    @Positive(message = "Years to maturity must be positive")
    @DecimalMax(value = "100", message = "Years to maturity cannot exceed 100")
    private Double yearsToMaturity;

    /** 1 = annual, 2 = semi-annual. */
    @NotNull(message = "Coupon frequency is required")
    @Min(value = 1, message = "Coupon frequency must be 1 (annual) or 2 (semi-annual)")
    @Max(value = 2, message = "Coupon frequency must be 1 (annual) or 2 (semi-annual)")
    private Integer couponFrequency;
}
