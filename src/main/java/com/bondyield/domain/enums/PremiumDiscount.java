package com.bondyield.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a bond trades above (premium), below (discount) or at its face value.
 * Serialized in lower case to match what existing API consumers expect.
 */
public enum PremiumDiscount {
    PREMIUM,
    DISCOUNT,
    PAR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
