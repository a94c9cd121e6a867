package com.gnovoa.gridiron.encode;

public enum EncodingStatus {
  /** Every field read was present and convertible. */
  COMPLETE,
  /** At least one field was missing or unconvertible and was replaced by its default. */
  DEFAULTED,
  /** The record could not be encoded; the vector is all zeros. */
  STRUCTURAL_FAILURE
}
