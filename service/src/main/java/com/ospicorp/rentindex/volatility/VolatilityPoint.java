package com.ospicorp.rentindex.volatility;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

@JsonPropertyOrder({"date", "volatility_index"})
public record VolatilityPoint(LocalDate date, @JsonProperty("volatility_index") Double index) {}
