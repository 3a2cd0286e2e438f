package com.bondyield.valuation;

import com.bondyield.domain.model.BondCalculationResult;
import com.bondyield.domain.model.BondInput;
import com.bondyield.domain.model.CashFlowEntry;
import com.bondyield.observability.CalculationMetricsService;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes all yield metrics and the payment schedule for one bond.
 *
 * <p>The period model is derived once and handed to each calculator; the calculators do not
 * depend on each other's output. Input is assumed to be validated by the caller, and the engine
 * is a total function over that domain: it always returns a fully populated result.
 *
 * <p>Stateless and safe for concurrent callers.
 */
@Service
public class BondValuationEngine {

    private static final Logger log = LoggerFactory.getLogger(BondValuationEngine.class);

    private final CurrentYieldCalculator currentYieldCalculator;
    private final YtmSolver ytmSolver;
    private final PremiumDiscountClassifier premiumDiscountClassifier;
    private final CashFlowScheduleGenerator cashFlowScheduleGenerator;
    private final CalculationMetricsService calculationMetricsService;

    public BondValuationEngine(
            CurrentYieldCalculator currentYieldCalculator,
            YtmSolver ytmSolver,
            PremiumDiscountClassifier premiumDiscountClassifier,
            CashFlowScheduleGenerator cashFlowScheduleGenerator,
            CalculationMetricsService calculationMetricsService) {
        this.currentYieldCalculator = currentYieldCalculator;
        this.ytmSolver = ytmSolver;
        this.premiumDiscountClassifier = premiumDiscountClassifier;
        this.cashFlowScheduleGenerator = cashFlowScheduleGenerator;
        this.calculationMetricsService = calculationMetricsService;
    }

    /** Calculates with payment dates counted from today. */
    public BondCalculationResult calculate(BondInput input) {
        return calculate(input, LocalDate.now());
    }

    /**
     * Calculates with payment dates counted from {@code referenceDate}.
     *
     * @param input         validated bond parameters
     * @param referenceDate date the schedule is relative to
     * @return yields, premium/discount and the full schedule
     */
    public BondCalculationResult calculate(BondInput input, LocalDate referenceDate) {
        PeriodModel model = PeriodModel.from(input);

        double currentYield = currentYieldCalculator.currentYield(input);
        YtmSolution ytm = ytmSolver.solve(model, input.getMarketPrice());
        if (!ytm.isConverged()) {
            calculationMetricsService.recordYtmNonConvergence();
        }
        double totalInterest = currentYieldCalculator.totalInterest(input);
        PremiumDiscountAssessment premiumDiscount = premiumDiscountClassifier.classify(input);
        List<CashFlowEntry> schedule = cashFlowScheduleGenerator.generate(model, referenceDate);

        log.debug(
                "Bond valued: face={}, price={}, periods={}, currentYield={}, ytm={} ({} iterations), {}",
                input.getFaceValue(),
                input.getMarketPrice(),
                model.getTotalPeriods(),
                currentYield,
                ytm.getAnnualYield(),
                ytm.getIterations(),
                premiumDiscount.getStatus());

        return BondCalculationResult.builder()
                .currentYield(currentYield)
                .yieldToMaturity(ytm.getAnnualYield())
                .totalInterestEarned(totalInterest)
                .premiumDiscount(premiumDiscount.getStatus())
                .premiumDiscountAmount(premiumDiscount.getAmount())
                .cashFlowSchedule(schedule)
                .build();
    }
}
