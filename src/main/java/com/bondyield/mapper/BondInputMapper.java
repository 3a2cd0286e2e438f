package com.bondyield.mapper;

import com.bondyield.api.dto.request.CalculateBondRequest;
import com.bondyield.domain.enums.CouponFrequency;
import com.bondyield.domain.model.BondInput;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from the validated request body to the engine's {@link BondInput}.
 * Field names match 1:1; the integer frequency is resolved to {@link CouponFrequency}.
 */
@Mapper
public interface BondInputMapper {

    BondInput toBondInput(CalculateBondRequest request);

    default CouponFrequency toCouponFrequency(Integer paymentsPerYear) {
        return CouponFrequency.fromPaymentsPerYear(paymentsPerYear);
    }
}
