package com.bondyield.exception;

import java.util.Map;

/**
 * Bond parameters that cannot be turned into a {@link com.bondyield.domain.model.BondInput},
 * e.g. a coupon frequency other than 1 or 2.
 */
public class InvalidBondInputException extends BaseException {

    public InvalidBondInputException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidBondInputException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
