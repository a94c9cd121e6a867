package com.gnovoa.gridiron.codec;

public class VectorCodecException extends RuntimeException {

  public VectorCodecException(String message) {
    super(message);
  }

  public VectorCodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
