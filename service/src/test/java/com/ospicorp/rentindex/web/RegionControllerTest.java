package com.ospicorp.rentindex.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.rentindex.ApiTestSupport;
import com.ospicorp.rentindex.artifact.ForecastArtifacts;
import com.ospicorp.rentindex.batch.BatchDefaults;
import com.ospicorp.rentindex.forecast.ForecastPoint;
import com.ospicorp.rentindex.forecast.ForecastResult;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class RegionControllerTest extends ApiTestSupport {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate restTemplate;

  @Autowired
  private ForecastArtifacts forecastArtifacts;

  @Autowired
  private BatchDefaults defaults;

  @Test
  void listsRegionsOfTheConfiguredLevel() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("geo", "state");
    assertThat(response.getBody()).containsEntry("regions", List.of("NY", "TX"));
  }

  @Test
  void listsZipRegionsAsCsv() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/v1/regions?geo=zip&format=csv", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody().split("\n")).containsExactly("zip", "00501", "10001", "75001");
  }

  @Test
  void seriesIsMonthlyFromFirstToLastObservation() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/series");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("region", "TX");
    assertThat(response.getBody()).containsEntry("value_col", "zori_smoothed_seasonal");
    List<?> points = (List<?>) response.getBody().get("points");
    assertThat(points).hasSize(60);
    assertThat(((Map<?, ?>) points.get(0)).get("date")).isEqualTo("2019-01-01");
  }

  @Test
  void forecastIncludesBandsAndModel() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/forecast?horizon=3");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("horizon", 3);
    List<?> points = (List<?>) response.getBody().get("points");
    assertThat(points).hasSize(3);
    assertThat(points.get(0)).asInstanceOf(InstanceOfAssertFactories.MAP)
        .containsKeys("date", "mean", "ci95_lo", "ci95_hi");
    assertThat(response.getBody().get("model")).asInstanceOf(InstanceOfAssertFactories.MAP)
        .containsKeys("ar_l1", "ma_l1", "ma_s_l12", "sigma2");
  }

  @Test
  void forecastAsCsvWhenAcceptAsksForIt() {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT, "text/csv");

    ResponseEntity<String> response = restTemplate.exchange(
        "/v1/regions/TX/forecast", HttpMethod.GET, new HttpEntity<>(headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    String[] lines = response.getBody().split("\n");
    assertThat(lines[0]).isEqualTo("date,mean,ci95_lo,ci95_hi");
    assertThat(lines).hasSize(10);
    assertThat(lines[1]).startsWith("2024-01-01,");
  }

  @Test
  void residualVolatilityForAZip() {
    ResponseEntity<Map<String, Object>> response =
        get("/v1/regions/75001/volatility?geo=zip&mode=residual&window=12");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("mode", "residual");
    assertThat((List<?>) response.getBody().get("points")).hasSize(50);
  }

  @Test
  void forecastVolatilityReadsThePersistedForecast() {
    forecastArtifacts.write(defaults.defaults().forecastRoot(), "state",
        new ForecastResult("TX", 2, List.of(
            new ForecastPoint(LocalDate.of(2024, 1, 1), 2000.0, 1900.0, 2100.0),
            new ForecastPoint(LocalDate.of(2024, 2, 1), 2000.0, 1800.0, 2200.0)), null));

    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/volatility");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("mode", "forecast");
    List<?> points = (List<?>) response.getBody().get("points");
    assertThat(points).hasSize(2);
    assertThat(((Map<?, ?>) points.get(0)).get("volatility_index")).isEqualTo(0.1);
    assertThat(((Map<?, ?>) points.get(1)).get("volatility_index")).isEqualTo(0.2);
  }

  @Test
  void forecastVolatilityWithoutPersistedForecastIsNotFound() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/NY/volatility");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("kind", "forecast-missing");
    assertThat(response.getBody()).containsEntry("region", "NY");
  }

  @Test
  void trendUsesTheRequestedWindow() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/trend?window=6");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("window", 6);
    List<?> points = (List<?>) response.getBody().get("points");
    assertThat(((Map<?, ?>) points.get(1)).get("value")).isNull();
    assertThat(((Map<?, ?>) points.get(2)).get("value")).isNotNull();
  }

  @Test
  void shortZipHistoryCannotBeForecast() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/00501/forecast?geo=zip");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody()).containsEntry("kind", "insufficient-history");
  }

  @Test
  void horizonOutOfRangeIsInvalid() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/forecast?horizon=0");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1002);
  }

  @Test
  void unknownFormatIsInvalid() {
    ResponseEntity<Map<String, Object>> response = get("/v1/regions/TX/series?format=xml");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1007);
  }

  private ResponseEntity<Map<String, Object>> get(String path) {
    return restTemplate.exchange(path, HttpMethod.GET, null, JSON_MAP);
  }
}
