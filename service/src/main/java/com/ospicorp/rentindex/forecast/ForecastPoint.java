package com.ospicorp.rentindex.forecast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

// lower <= mean <= upper is expected but not enforced; degenerate fits may break it
@JsonPropertyOrder({"date", "mean", "ci95_lo", "ci95_hi"})
public record ForecastPoint(
    LocalDate date,
    double mean,
    @JsonProperty("ci95_lo") double lower,
    @JsonProperty("ci95_hi") double upper
) {}
