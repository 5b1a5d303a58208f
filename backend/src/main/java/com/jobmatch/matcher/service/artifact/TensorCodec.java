package com.jobmatch.matcher.service.artifact;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Binary tensor format: a {@code JMT1} magic number, a dtype byte, the rank, each dimension, then
 * big-endian values. Doubles are written from their raw IEEE-754 bits so a round trip is
 * bit-exact.
 */
public final class TensorCodec {

  static final int MAGIC = 0x4A4D5431;
  static final byte FLOAT64 = 1;
  static final byte INT32 = 2;

  private TensorCodec() {}

  public static byte[] encodeMatrix(double[][] matrix) {
    int rows = matrix.length;
    int cols = rows == 0 ? 0 : matrix[0].length;
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(16 + rows * cols * 8);
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      writeHeader(out, FLOAT64, rows, cols);
      for (double[] row : matrix) {
        if (row.length != cols) {
          throw new IllegalArgumentException("Ragged matrix: expected " + cols + " columns");
        }
        for (double value : row) {
          out.writeLong(Double.doubleToRawLongBits(value));
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  public static byte[] encodeLabels(int[] labels) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(12 + labels.length * 4);
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      writeHeader(out, INT32, labels.length);
      for (int label : labels) {
        out.writeInt(label);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  public static double[][] decodeMatrix(byte[] data) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      int[] shape = readHeader(in, FLOAT64, 2);
      double[][] matrix = new double[shape[0]][shape[1]];
      for (int r = 0; r < shape[0]; r++) {
        for (int c = 0; c < shape[1]; c++) {
          matrix[r][c] = Double.longBitsToDouble(in.readLong());
        }
      }
      return matrix;
    } catch (IOException e) {
      throw new IllegalStateException("Truncated float64 tensor", e);
    }
  }

  public static int[] decodeLabels(byte[] data) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      int[] shape = readHeader(in, INT32, 1);
      int[] labels = new int[shape[0]];
      for (int i = 0; i < labels.length; i++) {
        labels[i] = in.readInt();
      }
      return labels;
    } catch (IOException e) {
      throw new IllegalStateException("Truncated int32 tensor", e);
    }
  }

  private static void writeHeader(DataOutputStream out, byte dtype, int... shape)
      throws IOException {
    out.writeInt(MAGIC);
    out.writeByte(dtype);
    out.writeInt(shape.length);
    for (int dimension : shape) {
      out.writeInt(dimension);
    }
  }

  private static int[] readHeader(DataInputStream in, byte dtype, int rank) throws IOException {
    if (in.readInt() != MAGIC) {
      throw new IllegalStateException("Not a tensor file");
    }
    byte actualType = in.readByte();
    if (actualType != dtype) {
      throw new IllegalStateException("Expected dtype " + dtype + " but found " + actualType);
    }
    int actualRank = in.readInt();
    if (actualRank != rank) {
      throw new IllegalStateException("Expected rank " + rank + " but found " + actualRank);
    }
    int[] shape = new int[rank];
    for (int i = 0; i < rank; i++) {
      shape[i] = in.readInt();
      if (shape[i] < 0) {
        throw new IllegalStateException("Negative tensor dimension " + shape[i]);
      }
    }
    return shape;
  }
}
