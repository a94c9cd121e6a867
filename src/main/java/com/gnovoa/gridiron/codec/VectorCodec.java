package com.gnovoa.gridiron.codec;

import com.gnovoa.gridiron.encode.TensorShapeException;

/** Storage encoding for feature vectors. Implementations are stateless and thread-safe. */
public interface VectorCodec {

  /**
   * @throws VectorCodecException if the vector cannot be written
   */
  byte[] encode(float[] vector);

  /**
   * @throws VectorCodecException if {@code bytes} is not a valid encoding
   */
  float[] decode(byte[] bytes);

  /**
   * Decodes and checks the length.
   *
   * @param kind vector kind used in the error message, e.g. {@code "play"}
   * @throws TensorShapeException if the decoded vector does not have {@code expectedLength}
   */
  default float[] decode(byte[] bytes, String kind, int expectedLength) {
    float[] v = decode(bytes);
    TensorShapeException.check(kind, v, expectedLength);
    return v;
  }
}
