package com.ospicorp.rentindex.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegionOutcome(
    String region,
    @JsonProperty("forecast_status") StepStatus forecastStatus,
    @JsonProperty("forecast_path") String forecastPath,
    @JsonProperty("volatility_status") StepStatus volatilityStatus,
    @JsonProperty("volatility_path") String volatilityPath,
    @JsonProperty("failure_kind") String failureKind,
    @JsonProperty("failure_message") String failureMessage
) {

  @JsonIgnore
  public boolean failed() {
    return forecastStatus == StepStatus.FAILED || volatilityStatus == StepStatus.FAILED;
  }
}
