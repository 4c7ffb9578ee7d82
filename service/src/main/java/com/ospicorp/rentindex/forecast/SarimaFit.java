package com.ospicorp.rentindex.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SarimaFit(
    @JsonProperty("ar_l1") double ar,
    @JsonProperty("ma_l1") double ma,
    @JsonProperty("ma_s_l12") double seasonalMa,
    double sigma2,
    @JsonProperty("residual_count") int residualCount,
    int iterations
) {}
