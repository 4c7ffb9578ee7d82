package com.ospicorp.rentindex.dataset;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Storage access for datasets and artifacts. Paths are plain strings so that implementations
 * can back them with local disk or an object store.
 */
public interface DatasetStore {

  List<String> listFiles(String location) throws IOException;

  Reader openReader(String path) throws IOException;

  Writer openWriter(String path) throws IOException;

  boolean exists(String path);

  String resolve(String base, String... segments);

  String relativize(String base, String path);

  /**
   * Whether several threads may read from this store at once. Stores that return false are
   * read under a lock by the batch.
   */
  default boolean supportsConcurrentReads() {
    return true;
  }
}
