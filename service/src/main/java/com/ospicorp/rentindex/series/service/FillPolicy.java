package com.ospicorp.rentindex.series.service;

public enum FillPolicy {
  NONE,
  FFILL,
  BFILL,
  LINEAR
}
