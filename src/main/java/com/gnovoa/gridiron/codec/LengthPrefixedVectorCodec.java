package com.gnovoa.gridiron.codec;

import java.nio.ByteBuffer;

/**
 * Binary frame: a 4-byte big-endian element count followed by that many IEEE-754 big-endian
 * floats.
 */
public final class LengthPrefixedVectorCodec implements VectorCodec {

  @Override
  public byte[] encode(float[] vector) {
    if (vector == null) throw new VectorCodecException("Cannot encode a null vector");
    ByteBuffer buf = ByteBuffer.allocate(Integer.BYTES + vector.length * Float.BYTES);
    buf.putInt(vector.length);
    buf.asFloatBuffer().put(vector);
    return buf.array();
  }

  @Override
  public float[] decode(byte[] bytes) {
    if (bytes == null || bytes.length < Integer.BYTES) {
      throw new VectorCodecException("Frame too short for a length prefix");
    }
    ByteBuffer buf = ByteBuffer.wrap(bytes);
    int count = buf.getInt();
    if (count < 0) throw new VectorCodecException("Negative element count " + count);
    if (buf.remaining() != (long) count * Float.BYTES) {
      throw new VectorCodecException(
          "Frame declares " + count + " floats but carries " + buf.remaining() + " bytes");
    }
    float[] out = new float[count];
    buf.asFloatBuffer().get(out);
    return out;
  }
}
