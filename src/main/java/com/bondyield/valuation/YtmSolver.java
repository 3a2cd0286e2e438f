package com.bondyield.valuation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson yield-to-maturity solver for fixed-coupon bullet bonds.
 *
 * <p>Finds the per-period rate r at which the discounted coupons plus the discounted face value
 * equal the market price:
 * <pre>
 *   P(r)  =  sum(t=1..n) C / (1+r)^t  +  FV / (1+r)^n
 *   P'(r) = -sum(t=1..n) t*C / (1+r)^(t+1)  -  n*FV / (1+r)^(n+1)
 * </pre>
 * P is smooth and strictly decreasing in r, so the Newton step is well defined and typically
 * converges in under 10 iterations starting from the period-equivalent current yield.
 *
 * <p>A step that lands below zero is reset to {@link YtmSolverConfig#getNegativeRateFloor()}.
 * For prices above the undiscounted cash flows no non-negative root exists and the guess keeps
 * returning to the floor; the iteration cap bounds that case and the last guess is returned.
 * The solver never throws.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class YtmSolver {

    private final YtmSolverConfig config;

    public YtmSolver(YtmSolverConfig config) {
        this.config = config;
    }

    /**
     * Solves the yield to maturity for a bond trading at {@code marketPrice}.
     *
     * @param model       period model of the bond
     * @param marketPrice observed price, positive
     * @return the annualized yield with convergence diagnostics
     */
    public YtmSolution solve(PeriodModel model, double marketPrice) {
        double rate = initialGuess(model, marketPrice);

        for (int i = 0; i < config.getMaxIterations(); i++) {
            PriceAndDerivative pd = priceAndDerivative(model, rate);
            double diff = pd.price - marketPrice;

            if (Math.abs(diff) < config.getTolerance()) {
                return new YtmSolution(rate * model.getPaymentsPerYear(), rate, i + 1, true);
            }

            rate = rate - diff / pd.derivative;
            if (rate < 0) {
                rate = config.getNegativeRateFloor();
            }
        }

        log.warn(
                "YTM did not converge after {} iterations (periods={}, coupon={}, face={}, price={}), using last guess {}",
                config.getMaxIterations(),
                model.getTotalPeriods(),
                model.getCouponPerPeriod(),
                model.getFaceValue(),
                marketPrice,
                rate);
        return new YtmSolution(rate * model.getPaymentsPerYear(), rate, config.getMaxIterations(), false);
    }

    /**
     * Present value of the bond's remaining cash flows discounted at a per-period rate.
     */
    public double price(PeriodModel model, double periodRate) {
        return priceAndDerivative(model, periodRate).price;
    }

    /** Current yield expressed per period: annual coupon / price / payments per year. */
    double initialGuess(PeriodModel model, double marketPrice) {
        double currentYield = model.getCouponPerPeriod() * model.getPaymentsPerYear() / marketPrice;
        return currentYield / model.getPaymentsPerYear();
    }

    private static PriceAndDerivative priceAndDerivative(PeriodModel model, double rate) {
        double coupon = model.getCouponPerPeriod();
        int n = model.getTotalPeriods();
        double price = 0;
        double derivative = 0;

        for (int t = 1; t <= n; t++) {
            double discountFactor = Math.pow(1 + rate, t);
            price += coupon / discountFactor;
            derivative -= t * coupon / (discountFactor * (1 + rate));
        }

        double finalDiscountFactor = Math.pow(1 + rate, n);
        price += model.getFaceValue() / finalDiscountFactor;
        derivative -= n * model.getFaceValue() / (finalDiscountFactor * (1 + rate));

        return new PriceAndDerivative(price, derivative);
    }

    private static final class PriceAndDerivative {
        private final double price;
        private final double derivative;

        private PriceAndDerivative(double price, double derivative) {
            this.price = price;
            this.derivative = derivative;
        }
    }
}
