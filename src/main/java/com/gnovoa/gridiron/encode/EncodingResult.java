package com.gnovoa.gridiron.encode;

import com.gnovoa.gridiron.coerce.FieldReader;

/**
 * Outcome of encoding one record: the vector plus how it was obtained.
 *
 * <p>The vector always has the full width for its kind, whatever the status.
 *
 * @param vector encoded values; owned by the caller
 * @param status how the vector was produced
 * @param missingFields fields that were absent and defaulted
 * @param unconvertibleFields fields that were present but could not be coerced
 * @param detail failure description for {@link EncodingStatus#STRUCTURAL_FAILURE}, else null
 */
public record EncodingResult(
    float[] vector,
    EncodingStatus status,
    int missingFields,
    int unconvertibleFields,
    String detail) {

  static EncodingResult from(float[] vector, FieldReader reader) {
    int missing = reader.missing();
    int unconvertible = reader.unconvertible();
    EncodingStatus status =
        (missing == 0 && unconvertible == 0) ? EncodingStatus.COMPLETE : EncodingStatus.DEFAULTED;
    return new EncodingResult(vector, status, missing, unconvertible, null);
  }

  static EncodingResult failure(int width, String detail) {
    return new EncodingResult(new float[width], EncodingStatus.STRUCTURAL_FAILURE, 0, 0, detail);
  }

  public boolean isStructuralFailure() {
    return status == EncodingStatus.STRUCTURAL_FAILURE;
  }
}
