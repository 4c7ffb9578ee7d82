package com.ospicorp.rentindex.artifact;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.rentindex.dataset.DatasetStore;
import com.ospicorp.rentindex.volatility.VolatilityPoint;
import com.ospicorp.rentindex.volatility.VolatilityResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.springframework.stereotype.Component;

@Component
public class VolatilityArtifacts {
  private static final CsvSchema SCHEMA = CsvSchema.builder()
      .addColumn("date")
      .addNumberColumn("volatility_index")
      .setUseHeader(true)
      .build();

  private final DatasetStore store;
  private final CsvMapper mapper = ArtifactPaths.csvMapper();

  public VolatilityArtifacts(DatasetStore store) {
    this.store = store;
  }

  public String write(String root, String geoColumn, VolatilityResult result) {
    String path = ArtifactPaths.volatility(store, root, geoColumn, result.region());
    try (Writer writer = store.openWriter(path);
        SequenceWriter out = mapper.writerFor(VolatilityPoint.class).with(SCHEMA)
            .writeValues(writer)) {
      out.writeAll(result.points());
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to write volatility artifact " + path, ex);
    }
    return path;
  }
}
