package com.ospicorp.rentindex.batch;

public enum StepStatus {
  SUCCEEDED,
  FAILED,
  SKIPPED
}
