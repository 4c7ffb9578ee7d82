package com.ospicorp.rentindex.web;

import com.ospicorp.rentindex.batch.BatchDefaults;
import com.ospicorp.rentindex.batch.BatchOrchestrator;
import com.ospicorp.rentindex.batch.BatchOverrides;
import com.ospicorp.rentindex.batch.BatchReport;
import com.ospicorp.rentindex.batch.BatchRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Batch")
public class BatchController {
  private final BatchOrchestrator orchestrator;
  private final BatchDefaults defaults;

  public BatchController(BatchOrchestrator orchestrator, BatchDefaults defaults) {
    this.orchestrator = orchestrator;
    this.defaults = defaults;
  }

  @PostMapping(path = "/v1/batch", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Run a batch",
      description = "Forecasts and volatility for many regions. Fields left out of the body keep "
          + "their configured values. Region failures are reported per region and never fail "
          + "the call.")
  @SecurityRequirement(name = "bearer-jwt")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Batch report",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = BatchReport.class))),
      @ApiResponse(responseCode = "400", description = "Invalid batch parameters",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "Dataset not readable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public BatchReport run(@Valid @RequestBody(required = false) BatchOverrides overrides) {
    BatchRequest request = defaults.merge(overrides);
    return orchestrator.run(request);
  }
}
