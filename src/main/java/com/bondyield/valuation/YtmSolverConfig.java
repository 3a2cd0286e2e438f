package com.bondyield.valuation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson settings for {@link YtmSolver}, loaded from application.properties.
 *
 * <p>Properties prefix: {@code bondyield.ytm.*}. Defaults:
 * <ul>
 *   <li>maxIterations: 100</li>
 *   <li>tolerance: 1e-10 (absolute price error that counts as converged)</li>
 *   <li>negativeRateFloor: 0.0001 (per-period rate used when a step lands below zero)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "bondyield.ytm")
public class YtmSolverConfig {

    private int maxIterations = 100;
    private double tolerance = 1e-10;
    private double negativeRateFloor = 0.0001;
}
