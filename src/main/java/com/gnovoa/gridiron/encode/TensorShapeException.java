package com.gnovoa.gridiron.encode;

/** A vector handed to a compositor, assembler or decoder does not have the length its kind requires. */
public class TensorShapeException extends IllegalArgumentException {

  private final int expected;
  private final int actual;

  public TensorShapeException(String kind, int expected, int actual) {
    super(kind + " vector must have length " + expected + " but had " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * @throws TensorShapeException if {@code vector} is null or its length is not {@code expected}
   */
  public static void check(String kind, float[] vector, int expected) {
    int actual = vector == null ? -1 : vector.length;
    if (actual != expected) throw new TensorShapeException(kind, expected, actual);
  }

  public int expected() {
    return expected;
  }

  /** @return length received, or -1 for a null vector */
  public int actual() {
    return actual;
  }
}
