package com.ospicorp.rentindex.web;

import com.ospicorp.rentindex.batch.BatchDefaults;
import com.ospicorp.rentindex.batch.BatchRequest;
import io.swagger.v3.oas.annotations.Hidden;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class RootController {
  private final BatchDefaults defaults;

  public RootController(BatchDefaults defaults) {
    this.defaults = defaults;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    BatchRequest config = defaults.defaults();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "rent-index");
    body.put("status", "ok");
    body.put("geo", config.geoLevel());
    body.put("value_col", config.valueColumn());
    body.put("horizon", config.horizon());
    body.put("mode", config.volatilityMode().tag());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
