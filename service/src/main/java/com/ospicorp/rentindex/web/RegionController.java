package com.ospicorp.rentindex.web;

import com.ospicorp.rentindex.artifact.ForecastArtifacts;
import com.ospicorp.rentindex.batch.BatchDefaults;
import com.ospicorp.rentindex.batch.BatchRequest;
import com.ospicorp.rentindex.dataset.GeoCatalog;
import com.ospicorp.rentindex.dataset.GeoLevels;
import com.ospicorp.rentindex.forecast.ForecastEngine;
import com.ospicorp.rentindex.forecast.ForecastResult;
import com.ospicorp.rentindex.series.model.DataPoint;
import com.ospicorp.rentindex.series.model.RegionSeries;
import com.ospicorp.rentindex.series.service.FillPolicy;
import com.ospicorp.rentindex.series.service.Filler;
import com.ospicorp.rentindex.series.service.SeriesExtractor;
import com.ospicorp.rentindex.volatility.VolatilityEstimator;
import com.ospicorp.rentindex.volatility.VolatilityMode;
import com.ospicorp.rentindex.volatility.VolatilityRequest;
import com.ospicorp.rentindex.volatility.VolatilityResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/regions")
@Tag(name = "Regions")
public class RegionController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;
  static final int MAX_HORIZON = 60;

  private final GeoCatalog catalog;
  private final SeriesExtractor extractor;
  private final ForecastEngine forecastEngine;
  private final VolatilityEstimator volatilityEstimator;
  private final ForecastArtifacts forecastArtifacts;
  private final BatchDefaults defaults;

  public RegionController(GeoCatalog catalog, SeriesExtractor extractor,
      ForecastEngine forecastEngine, VolatilityEstimator volatilityEstimator,
      ForecastArtifacts forecastArtifacts, BatchDefaults defaults) {
    this.catalog = catalog;
    this.extractor = extractor;
    this.forecastEngine = forecastEngine;
    this.volatilityEstimator = volatilityEstimator;
    this.forecastArtifacts = forecastArtifacts;
    this.defaults = defaults;
  }

  @GetMapping
  @Operation(summary = "List regions",
      description = "Sorted distinct identifiers of a geography level in the configured dataset.")
  public ResponseEntity<?> regions(
      @RequestParam(required = false) @Parameter(description = "Geography level", example = "state") String geo,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    BatchRequest config = defaults.defaults();
    String level = geoLevel(geo);
    String column = GeoLevels.column(level);
    List<String> regions = catalog.listRegions(config.datasetLocation(), level);

    MediaType contentType = selectMediaType(format, accept);
    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      List<Map<String, String>> rows = regions.stream()
          .map(region -> Map.of(column, region))
          .toList();
      return ResponseEntity.ok().contentType(contentType).body(rows);
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("geo", level);
    body.put("column", column);
    body.put("count", regions.size());
    body.put("regions", regions);
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/{region}/series")
  @Tag(name = "Data")
  @Operation(summary = "Get monthly series",
      description = "One row per calendar month between the first and last observation; gaps are "
          + "missing unless a fill policy is given.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Monthly series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = RegionSeries.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "404", description = "Region not in dataset",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Malformed region data",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> series(
      @PathVariable @Parameter(description = "Region identifier", example = "TX") String region,
      @RequestParam(required = false) String geo,
      @RequestParam(name = "value_col", required = false) String valueColumn,
      @RequestParam(defaultValue = "none") String fill,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    FillPolicy fillPolicy = parseFill(fill);
    RegionSeries series = load(region, geo, valueColumn);
    if (fillPolicy != FillPolicy.NONE) {
      series = new RegionSeries(series.region(), series.valueColumn(),
          Filler.fill(series.points(), fillPolicy));
    }
    return respond(selectMediaType(format, accept), series, series.points());
  }

  @GetMapping("/{region}/forecast")
  @Tag(name = "Data")
  @Operation(summary = "Forecast a region",
      description = "Fits SARIMA(1,1,1)x(0,1,1,12) and returns point forecasts with 95% bands.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast rows",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResult.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "422", description = "Too little history or fit failure",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> forecast(
      @PathVariable String region,
      @RequestParam(required = false) String geo,
      @RequestParam(name = "value_col", required = false) String valueColumn,
      @RequestParam(required = false) Integer horizon,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    int steps = parseHorizon(horizon);
    MediaType contentType = selectMediaType(format, accept);
    ForecastResult forecast = forecastEngine.forecast(load(region, geo, valueColumn), steps);
    return respond(contentType, forecast, forecast.points());
  }

  @GetMapping("/{region}/volatility")
  @Tag(name = "Data")
  @Operation(summary = "Volatility index",
      description = "Forecast mode divides the 95% band width of the forecast persisted by the last "
          + "batch run by its point forecast; residual mode divides the rolling dispersion of "
          + "residuals by the rolling trend.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Volatility rows"),
      @ApiResponse(responseCode = "404", description = "No persisted forecast for the region",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> volatility(
      @PathVariable String region,
      @RequestParam(required = false) String geo,
      @RequestParam(name = "value_col", required = false) String valueColumn,
      @RequestParam(required = false) @Parameter(description = "forecast or residual") String mode,
      @RequestParam(required = false) Integer window,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    VolatilityMode volatilityMode = parseMode(mode);
    int rollingWindow = parseWindow(window);
    MediaType contentType = selectMediaType(format, accept);

    VolatilityRequest request;
    if (volatilityMode == VolatilityMode.RESIDUAL) {
      request = new VolatilityRequest.FromResidual(load(region, geo, valueColumn), rollingWindow);
    } else {
      String column = GeoLevels.column(geoLevel(geo));
      request = new VolatilityRequest.FromForecast(
          forecastArtifacts.read(defaults.defaults().forecastRoot(), column, region.trim()));
    }
    VolatilityResult result = volatilityEstimator.estimate(request);
    return respond(contentType, result, result.points());
  }

  @GetMapping("/{region}/trend")
  @Tag(name = "Data")
  @Operation(summary = "Rolling trend",
      description = "Trailing rolling mean used as the residual-mode trend.")
  public ResponseEntity<?> trend(
      @PathVariable String region,
      @RequestParam(required = false) String geo,
      @RequestParam(name = "value_col", required = false) String valueColumn,
      @RequestParam(required = false) Integer window,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    int rollingWindow = parseWindow(window);
    MediaType contentType = selectMediaType(format, accept);
    RegionSeries series = load(region, geo, valueColumn);
    List<DataPoint> points = volatilityEstimator.trend(series, rollingWindow);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("region", series.region());
    body.put("window", rollingWindow);
    body.put("points", points);
    return respond(contentType, body, points);
  }

  private RegionSeries load(String region, String geo, String valueColumn) {
    BatchRequest config = defaults.defaults();
    String column = StringUtils.hasText(valueColumn) ? valueColumn.trim() : config.valueColumn();
    return extractor.extract(config.datasetLocation(), geoLevel(geo), region, column);
  }

  private ResponseEntity<?> respond(MediaType contentType, Object json, List<?> rows) {
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? rows : json;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private String geoLevel(String geo) {
    if (geo == null) {
      return defaults.defaults().geoLevel();
    }
    if (!StringUtils.hasText(geo)) {
      throw new InvalidParameterException("geo",
          "Invalid geo parameter. Must not be blank.", 1001);
    }
    return geo.trim();
  }

  private int parseHorizon(Integer horizon) {
    if (horizon == null) {
      return defaults.defaults().horizon();
    }
    if (horizon < 1 || horizon > MAX_HORIZON) {
      throw new InvalidParameterException("horizon",
          "Invalid horizon parameter. Supported range: 1-" + MAX_HORIZON + ".", 1002);
    }
    return horizon;
  }

  private VolatilityMode parseMode(String mode) {
    if (mode == null) {
      return defaults.defaults().volatilityMode();
    }
    try {
      return VolatilityMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException("mode",
          "Invalid mode. Supported values: forecast,residual.", 1003);
    }
  }

  private static FillPolicy parseFill(String value) {
    try {
      return FillPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException("fill",
          "Invalid fill policy. Supported values: none,ffill,bfill,linear.", 1004);
    }
  }

  private int parseWindow(Integer window) {
    if (window == null) {
      return defaults.defaults().window();
    }
    if (window < 3) {
      throw new InvalidParameterException("window",
          "Invalid window parameter. Must be at least 3.", 1005);
    }
    return window;
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("format",
          "Invalid format value. Supported values: json,csv.", 1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
