package com.gnovoa.gridiron.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/** JSON array of numbers, e.g. {@code [72.0,1.0,0.0]}. */
public final class JsonArrayVectorCodec implements VectorCodec {

  private final ObjectMapper mapper;

  public JsonArrayVectorCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public byte[] encode(float[] vector) {
    if (vector == null) throw new VectorCodecException("Cannot encode a null vector");
    try {
      return mapper.writeValueAsBytes(vector);
    } catch (JsonProcessingException e) {
      throw new VectorCodecException("Failed to write vector as JSON", e);
    }
  }

  @Override
  public float[] decode(byte[] bytes) {
    if (bytes == null) throw new VectorCodecException("Cannot decode null bytes");
    try {
      float[] v = mapper.readValue(bytes, float[].class);
      if (v == null) throw new VectorCodecException("JSON null is not a vector");
      return v;
    } catch (IOException e) {
      throw new VectorCodecException("Malformed JSON vector", e);
    }
  }
}
