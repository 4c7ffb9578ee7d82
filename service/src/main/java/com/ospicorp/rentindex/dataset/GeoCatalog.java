package com.ospicorp.rentindex.dataset;

import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class GeoCatalog {
  private static final Logger log = LoggerFactory.getLogger(GeoCatalog.class);

  private final CsvDatasetReader reader;

  public GeoCatalog(CsvDatasetReader reader) {
    this.reader = reader;
  }

  public List<String> listRegions(String location, String geoLevel) {
    String column = GeoLevels.column(geoLevel);
    TreeSet<String> regions = new TreeSet<>();
    reader.scan(location, List.of(column), row -> {
      if (!CsvValues.isMissing(row[0])) {
        regions.add(row[0].trim());
      }
    });
    log.debug("Found {} distinct {} values in {}", regions.size(), column, location);
    return List.copyOf(regions);
  }
}
