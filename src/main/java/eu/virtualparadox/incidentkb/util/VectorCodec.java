package eu.virtualparadox.incidentkb.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes float vectors as little-endian bytes for Lucene stored fields, and computes cosine similarity.
 */
public final class VectorCodec {

    private VectorCodec() {
        // prevent instantiation
    }

    public static byte[] toBytes(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (final float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static float[] fromBytes(final byte[] bytes, final int offset, final int length) {
        if (length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Byte length " + length + " is not a multiple of " + Float.BYTES);
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        final float[] out = new float[length / Float.BYTES];
        for (int i = 0; i < out.length; i++) {
            out[i] = buffer.getFloat();
        }
        return out;
    }

    /**
     * Cosine similarity in {@code [-1, 1]}; zero when either vector has zero norm.
     */
    public static double cosine(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
