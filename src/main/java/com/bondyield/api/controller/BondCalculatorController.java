package com.bondyield.api.controller;

import com.bondyield.api.dto.request.CalculateBondRequest;
import com.bondyield.api.dto.response.ApiInfoResponse;
import com.bondyield.domain.model.BondCalculationResult;
import com.bondyield.service.BondCalculatorService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for bond yield calculations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/bonds} -- API info with an example request body</li>
 *   <li>{@code POST /api/bonds/calculate} -- current yield, YTM, premium/discount and cash flow schedule</li>
 * </ul>
 *
 * <p>Request validation happens here via Bean Validation; the service receives only valid input.
 */
@RestController
@RequestMapping("/api/bonds")
public class BondCalculatorController {

    private final BondCalculatorService bondCalculatorService;

    @Value("${bondyield.api.version:1.0.0}")
    private String apiVersion;

    public BondCalculatorController(BondCalculatorService bondCalculatorService) {
        this.bondCalculatorService = bondCalculatorService;
    }

    @GetMapping
    public ApiInfoResponse getInfo() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /api/bonds", "API information");
        endpoints.put("POST /api/bonds/calculate", "Calculate bond yields and cash flow schedule");
        endpoints.put("GET /api/health", "Health check");

        return ApiInfoResponse.builder()
                .name("Bond Yield Calculator API")
                .version(apiVersion)
                .endpoints(endpoints)
                .example(CalculateBondRequest.builder()
                        .faceValue(1000.0)
                        .annualCouponRate(5.0)
                        .marketPrice(950.0)
                        .yearsToMaturity(10.0)
                        .couponFrequency(2)
                        .build())
                .build();
    }

    @PostMapping("/calculate")
    public BondCalculationResult calculate(@RequestBody @Valid CalculateBondRequest request) {
        return bondCalculatorService.calculate(request);
    }
}
