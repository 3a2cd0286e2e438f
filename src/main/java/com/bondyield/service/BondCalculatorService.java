package com.bondyield.service;

import com.bondyield.api.dto.request.CalculateBondRequest;
import com.bondyield.domain.model.BondCalculationResult;
import com.bondyield.domain.model.BondInput;
import com.bondyield.mapper.BondInputMapper;
import com.bondyield.observability.CalculationMetricsService;
import com.bondyield.valuation.BondValuationEngine;
import lombok.extern.slf4j.Slf4j;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Service;

/**
 * Application-facing entry point for bond calculations: converts the request into a
 * {@link BondInput}, runs the valuation engine, and records calculation metrics.
 */
@Slf4j
@Service
public class BondCalculatorService {

    private final BondValuationEngine bondValuationEngine;
    private final CalculationMetricsService calculationMetricsService;
    private final BondInputMapper bondInputMapper = Mappers.getMapper(BondInputMapper.class);

    public BondCalculatorService(
            BondValuationEngine bondValuationEngine, CalculationMetricsService calculationMetricsService) {
        this.bondValuationEngine = bondValuationEngine;
        this.calculationMetricsService = calculationMetricsService;
    }

    public BondCalculationResult calculate(CalculateBondRequest request) {
        BondInput input = bondInputMapper.toBondInput(request);
        log.info(
                "Calculating bond: face={}, coupon={}%, price={}, years={}, frequency={}",
                input.getFaceValue(),
                input.getAnnualCouponRate(),
                input.getMarketPrice(),
                input.getYearsToMaturity(),
                input.getCouponFrequency());
        return calculationMetricsService.recordCalculation(() -> bondValuationEngine.calculate(input));
    }
}
