package com.bondyield.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the calculator's custom Micrometer metrics:
 * <ul>
 *   <li><b>bond.calculations.count</b> (counter): completed bond calculations</li>
 *   <li><b>bond.calculation.latency</b> (timer): time spent in the valuation engine</li>
 *   <li><b>bond.ytm.nonconverged.count</b> (counter): YTM solves that hit the iteration cap</li>
 * </ul>
 */
@Service
public class CalculationMetricsService {

    private final Counter calculationsCounter;
    private final Counter ytmNonConvergedCounter;
    private final Timer calculationTimer;

    public CalculationMetricsService(MeterRegistry meterRegistry) {
        this.calculationsCounter = Counter.builder("bond.calculations.count")
                .description("Total bond calculations completed")
                .register(meterRegistry);

        this.ytmNonConvergedCounter = Counter.builder("bond.ytm.nonconverged.count")
                .description("YTM solves that returned the last guess after exhausting iterations")
                .register(meterRegistry);

        this.calculationTimer = Timer.builder("bond.calculation.latency")
                .description("Time spent computing yields and the cash flow schedule")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    /** Times a calculation and counts it once it completes. */
    public <T> T recordCalculation(Supplier<T> calculation) {
        T result = calculationTimer.record(calculation);
        calculationsCounter.increment();
        return result;
    }

    public void recordYtmNonConvergence() {
        ytmNonConvergedCounter.increment();
    }
}
