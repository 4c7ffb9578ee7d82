package com.ospicorp.rentindex.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record BatchReport(
    @JsonProperty("geo") String geoLevel,
    String mode,
    int regions,
    int succeeded,
    int failed,
    @JsonProperty("elapsed_ms") long elapsedMillis,
    List<RegionOutcome> outcomes
) {

  public BatchReport {
    outcomes = List.copyOf(outcomes);
  }

  public List<RegionOutcome> failures() {
    return outcomes.stream().filter(RegionOutcome::failed).toList();
  }

  public RegionOutcome outcome(String region) {
    return outcomes.stream()
        .filter(o -> o.region().equals(region))
        .findFirst()
        .orElse(null);
  }
}
