package com.bondyield.valuation;

import lombok.Value;

/**
 * Outcome of a YTM solve. When {@code converged} is false the yield is the solver's last
 * guess, which callers still use as the best available estimate.
 */
@Value
public class YtmSolution {

    /** Annualized yield (per-period rate times payments per year). */
    double annualYield;

    double periodRate;

    /** Pricing-function evaluations performed. */
    int iterations;

    boolean converged;
}
