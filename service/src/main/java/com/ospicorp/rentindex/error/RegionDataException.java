package com.ospicorp.rentindex.error;

/**
 * Base type for faults that are fatal to a single region only. The batch records them and
 * moves on to the next region.
 */
public abstract class RegionDataException extends RuntimeException {
  private final String region;

  protected RegionDataException(String region, String message) {
    super(message);
    this.region = region;
  }

  protected RegionDataException(String region, String message, Throwable cause) {
    super(message, cause);
    this.region = region;
  }

  public String region() {
    return region;
  }

  public abstract String kind();
}
