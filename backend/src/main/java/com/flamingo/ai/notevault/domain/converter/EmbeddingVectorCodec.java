package com.flamingo.ai.notevault.domain.converter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Encodes embedding vectors as packed little-endian float32 bytes for BLOB storage. */
public final class EmbeddingVectorCodec {

  private EmbeddingVectorCodec() {}

  public static byte[] encode(float[] vector) {
    if (vector == null) {
      return null;
    }
    ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES);
    buffer.order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().put(vector);
    return buffer.array();
  }

  public static float[] decode(byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    if (bytes.length % Float.BYTES != 0) {
      throw new IllegalArgumentException(
          "Embedding blob length " + bytes.length + " is not a multiple of " + Float.BYTES);
    }
    float[] vector = new float[bytes.length / Float.BYTES];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
    return vector;
  }
}
