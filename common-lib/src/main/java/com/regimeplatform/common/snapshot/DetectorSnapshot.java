package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run-length posterior plus alarm bookkeeping. Arrays are indexed by run length.
 */
public record DetectorSnapshot(
    @JsonProperty("observations") long observations,
    @JsonProperty("logProbabilities") double[] logProbabilities,
    @JsonProperty("mu") double[] mu,
    @JsonProperty("kappa") double[] kappa,
    @JsonProperty("alpha") double[] alpha,
    @JsonProperty("beta") double[] beta,
    @JsonProperty("cooldownRemaining") int cooldownRemaining
) {}
