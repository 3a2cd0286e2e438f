package com.bondyield.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.bondyield.api.controller.BondCalculatorController;
import com.bondyield.api.dto.request.CalculateBondRequest;
import com.bondyield.config.ApiResponseAdvice;
import com.bondyield.config.JacksonConfig;
import com.bondyield.domain.enums.PremiumDiscount;
import com.bondyield.domain.model.BondCalculationResult;
import com.bondyield.domain.model.CashFlowEntry;
import com.bondyield.exception.GlobalExceptionHandler;
import com.bondyield.exception.InvalidBondInputException;
import com.bondyield.service.BondCalculatorService;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the BondCalculatorController, with the response envelope and
 * the global exception handler installed.
 */
@ExtendWith(MockitoExtension.class)
class BondCalculatorControllerTest {

    private static final String VALID_BODY =
            """
            {
              "faceValue": 1000,
              "annualCouponRate": 5,
              "marketPrice": 950,
              "yearsToMaturity": 10,
              "couponFrequency": 2
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private BondCalculatorService bondCalculatorService;

    @BeforeEach
    void setUp() {
        BondCalculatorController controller = new BondCalculatorController(bondCalculatorService);
        // Set @Value field that would normally be injected by Spring
        ReflectionTestUtils.setField(controller, "apiVersion", "1.0.0");

        // Same binding rules as the application's ObjectMapper
        Jackson2ObjectMapperBuilder objectMapperBuilder = Jackson2ObjectMapperBuilder.json();
        new JacksonConfig().strictRequestBinding().customize(objectMapperBuilder);

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapperBuilder.build()))
                .build();
    }

    @Test
    @DisplayName("GET /api/bonds describes the API with an example body")
    void getInfo() throws Exception {
        mockMvc.perform(get("/api/bonds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Bond Yield Calculator API"))
                .andExpect(jsonPath("$.data.version").value("1.0.0"))
                .andExpect(jsonPath("$.data.endpoints['POST /api/bonds/calculate']").exists())
                .andExpect(jsonPath("$.data.example.faceValue").value(1000.0))
                .andExpect(jsonPath("$.data.example.couponFrequency").value(2));
    }

    @Test
    @DisplayName("GET on the calculate route is 405")
    void calculateRequiresPost() throws Exception {
        mockMvc.perform(get("/api/bonds/calculate"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));
    }

    @Test
    @DisplayName("Unknown route is 404 in the error envelope")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/api/bonds/price"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.path").value("/api/bonds/price"));
    }

    @Nested
    @DisplayName("POST /api/bonds/calculate")
    class Calculate {

        @Test
        @DisplayName("Valid body returns the calculation wrapped in the envelope")
        void validRequest() throws Exception {
            BondCalculationResult result = BondCalculationResult.builder()
                    .currentYield(0.0526)
                    .yieldToMaturity(0.0566)
                    .totalInterestEarned(500)
                    .premiumDiscount(PremiumDiscount.DISCOUNT)
                    .premiumDiscountAmount(50)
                    .cashFlowSchedule(List.of(CashFlowEntry.builder()
                            .period(1)
                            .paymentDate(LocalDate.of(2025, 7, 15))
                            .couponPayment(25)
                            .cumulativeInterest(25)
                            .remainingPrincipal(1000)
                            .build()))
                    .build();
            when(bondCalculatorService.calculate(any(CalculateBondRequest.class)))
                    .thenReturn(result);

            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.yieldToMaturity").value(0.0566))
                    .andExpect(jsonPath("$.data.premiumDiscount").value("discount"))
                    .andExpect(jsonPath("$.data.premiumDiscountAmount").value(50.0))
                    .andExpect(jsonPath("$.data.cashFlowSchedule[0].paymentDate").value("2025-07-15"))
                    .andExpect(jsonPath("$.data.cashFlowSchedule[0].couponPayment").value(25.0));
        }

        @Test
        @DisplayName("Unsupported coupon frequency is a validation error")
        void invalidFrequency() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"couponFrequency\": 2", "\"couponFrequency\": 4")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.couponFrequency")
                            .value("Coupon frequency must be 1 (annual) or 2 (semi-annual)"))
                    .andExpect(jsonPath("$.error.path").value("/api/bonds/calculate"));

            verify(bondCalculatorService, never()).calculate(any());
        }

        @Test
        @DisplayName("Non-positive face value is rejected")
        void negativeFaceValue() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"faceValue\": 1000", "\"faceValue\": -5")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.faceValue").value("Face value must be positive"));
        }

        @Test
        @DisplayName("Coupon rate above 100% is rejected")
        void couponRateTooHigh() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"annualCouponRate\": 5", "\"annualCouponRate\": 150")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.annualCouponRate").value("Coupon rate cannot exceed 100%"));
        }

        @Test
        @DisplayName("Maturity beyond 100 years is rejected")
        void maturityTooLong() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"yearsToMaturity\": 10", "\"yearsToMaturity\": 101")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.yearsToMaturity")
                            .value("Years to maturity cannot exceed 100"));
        }

        @Test
        @DisplayName("Missing market price is rejected")
        void missingMarketPrice() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"marketPrice\": 950,", "")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.marketPrice").value("Market price is required"));
        }

        @Test
        @DisplayName("Malformed JSON is a bad request")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"faceValue\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                    .andExpect(jsonPath("$.error.message").value("Malformed request body"))
                    .andExpect(jsonPath("$.error.details").doesNotExist());
        }

        @Test
        @DisplayName("Fractional coupon frequency is rejected, not truncated to annual")
        void fractionalFrequency() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"couponFrequency\": 2", "\"couponFrequency\": 1.5")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                    .andExpect(jsonPath("$.error.details.couponFrequency").exists());

            verify(bondCalculatorService, never()).calculate(any());
        }

        @Test
        @DisplayName("Unknown body field is rejected and named in details")
        void unknownField() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY.replace("\"faceValue\": 1000,", "\"faceValue\": 1000, \"foo\": 1,")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                    .andExpect(jsonPath("$.error.details.foo")
                            .value("Field is not part of a bond calculation request"));

            verify(bondCalculatorService, never()).calculate(any());
        }

        @Test
        @DisplayName("Non-JSON content type is 415")
        void unsupportedMediaType() throws Exception {
            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.TEXT_PLAIN)
                            .content("faceValue=1000"))
                    .andExpect(status().isUnsupportedMediaType())
                    .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));
        }

        @Test
        @DisplayName("InvalidBondInputException from the service maps to 400")
        void serviceRejectsInput() throws Exception {
            when(bondCalculatorService.calculate(any(CalculateBondRequest.class)))
                    .thenThrow(new InvalidBondInputException("Coupon frequency must be 1 (annual) or 2 (semi-annual)"));

            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Unexpected failure is a 500 without internal detail")
        void unexpectedFailure() throws Exception {
            when(bondCalculatorService.calculate(any(CalculateBondRequest.class)))
                    .thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(post("/api/bonds/calculate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(VALID_BODY))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                    .andExpect(jsonPath("$.error.message").value("An unexpected error occurred"));
        }
    }
}
