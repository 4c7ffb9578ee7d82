package com.ospicorp.rentindex.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.rentindex.ApiTestSupport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class BatchControllerTest extends ApiTestSupport {

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void batchReportsEachRegion() {
    Map<String, Object> body = Map.of(
        "geo", "zip",
        "regions", List.of("00501", "75001"),
        "mode", "residual");

    ResponseEntity<Map<String, Object>> response = post(body);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> report = response.getBody();
    assertThat(report).containsEntry("geo", "zip");
    assertThat(report).containsEntry("mode", "residual");
    assertThat(report).containsEntry("regions", 2);
    assertThat(report).containsEntry("succeeded", 1);
    assertThat(report).containsEntry("failed", 1);

    List<?> outcomes = (List<?>) report.get("outcomes");
    Map<?, ?> small = (Map<?, ?>) outcomes.get(0);
    assertThat(small.get("region")).isEqualTo("00501");
    assertThat(small.get("forecast_status")).isEqualTo("FAILED");
    assertThat(small.get("volatility_status")).isEqualTo("SUCCEEDED");
    assertThat(small.get("failure_kind")).isEqualTo("insufficient-history");
    Map<?, ?> large = (Map<?, ?>) outcomes.get(1);
    assertThat(large.get("forecast_path").toString()).endsWith("forecast.csv");
    assertThat(large.containsKey("failure_kind")).isFalse();
  }

  @Test
  void invalidOverridesAreRejected() {
    ResponseEntity<Map<String, Object>> response = post(Map.of("window", 2));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail");
  }

  private ResponseEntity<Map<String, Object>> post(Map<String, Object> body) {
    return restTemplate.exchange("/v1/batch", HttpMethod.POST, new HttpEntity<>(body),
        new ParameterizedTypeReference<>() {});
  }
}
