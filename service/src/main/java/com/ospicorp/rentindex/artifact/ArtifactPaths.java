package com.ospicorp.rentindex.artifact;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ospicorp.rentindex.dataset.DatasetStore;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

// <root>/<geo column>=<percent-encoded region>/<file>
public final class ArtifactPaths {
  static final String FORECAST_FILE = "forecast.csv";
  static final String VOLATILITY_FILE = "volatility.csv";

  private ArtifactPaths() {
  }

  public static String regionDirectory(DatasetStore store, String root, String geoColumn,
      String region) {
    return store.resolve(root, geoColumn + "=" + encode(region));
  }

  static String encode(String region) {
    return URLEncoder.encode(region, StandardCharsets.UTF_8).replace("*", "%2A");
  }

  public static String forecast(DatasetStore store, String root, String geoColumn,
      String region) {
    return store.resolve(regionDirectory(store, root, geoColumn, region), FORECAST_FILE);
  }

  public static String volatility(DatasetStore store, String root, String geoColumn,
      String region) {
    return store.resolve(regionDirectory(store, root, geoColumn, region), VOLATILITY_FILE);
  }

  static CsvMapper csvMapper() {
    CsvMapper mapper = new CsvMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
    return mapper;
  }
}
