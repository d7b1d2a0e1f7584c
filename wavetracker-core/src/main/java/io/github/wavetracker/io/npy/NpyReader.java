/*
 * Copyright (c) 2025 The wavetracker Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.wavetracker.io.npy;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Reads NumPy {@code .npy} files of format version 1, 2 and 3 with boolean, unsigned byte,
 * signed integer and floating point data of one or two dimensions.
 */
public class NpyReader {

  private static final Logger logger = Logger.getLogger(NpyReader.class.getName());

  private NpyReader() {
  }

  public static @NotNull NpyArray read(@NotNull Path file) throws IOException {
    final ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(file));
    try {
      final NpyArray array = read(buffer);
      logger.fine(() -> "Read " + array + " from " + file);
      return array;
    } catch (IOException e) {
      throw new IOException("Cannot read " + file + ": " + e.getMessage(), e);
    }
  }

  static @NotNull NpyArray read(@NotNull ByteBuffer buffer) throws IOException {
    try {
      final NpyHeader header = readHeader(buffer);
      return readData(buffer, header);
    } catch (BufferUnderflowException e) {
      throw new IOException("Unexpected end of file", e);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed shape in header: " + e.getMessage(), e);
    }
  }

  private static NpyHeader readHeader(ByteBuffer buffer) throws IOException {
    final byte[] magic = new byte[NpyHeader.MAGIC.length];
    buffer.get(magic);
    if (!Arrays.equals(magic, NpyHeader.MAGIC)) {
      throw new IOException("Not a npy file");
    }
    final int major = Byte.toUnsignedInt(buffer.get());
    buffer.get(); // minor version

    buffer.order(ByteOrder.LITTLE_ENDIAN);
    final long headerLength;
    final Charset charset;
    switch (major) {
      case 1 -> {
        headerLength = Short.toUnsignedInt(buffer.getShort());
        charset = StandardCharsets.ISO_8859_1;
      }
      case 2 -> {
        headerLength = Integer.toUnsignedLong(buffer.getInt());
        charset = StandardCharsets.ISO_8859_1;
      }
      case 3 -> {
        headerLength = Integer.toUnsignedLong(buffer.getInt());
        charset = StandardCharsets.UTF_8;
      }
      default -> throw new IOException("Unsupported npy format version " + major);
    }
    if (headerLength > buffer.remaining()) {
      throw new IOException("Header length %d exceeds file size".formatted(headerLength));
    }

    final byte[] dictionary = new byte[(int) headerLength];
    buffer.get(dictionary);
    return NpyHeader.parse(new String(dictionary, charset));
  }

  private static NpyArray readData(ByteBuffer buffer, NpyHeader header) throws IOException {
    if (header.shape().length > 2) {
      throw new IOException("Only one and two dimensional arrays are supported, shape is "
          + Arrays.toString(header.shape()));
    }
    final long size = header.size();
    final String type = header.typeCode();
    final int itemSize = itemSize(type);
    if (size * itemSize > buffer.remaining()) {
      throw new IOException("Expected %d values of type %s but file holds %d bytes of data"
          .formatted(size, header.descr(), buffer.remaining()));
    }

    buffer.order(header.byteOrder());
    final double[] values = new double[(int) size];
    for (int i = 0; i < values.length; i++) {
      values[i] = switch (type) {
        case "f8" -> buffer.getDouble();
        case "f4" -> buffer.getFloat();
        case "i8" -> buffer.getLong();
        case "i4" -> buffer.getInt();
        case "i2" -> buffer.getShort();
        case "u1" -> Byte.toUnsignedInt(buffer.get());
        case "b1" -> buffer.get() != 0 ? 1d : 0d;
        default -> throw new IllegalStateException("Unexpected type " + type);
      };
    }

    final int[] shape = header.shape();
    if (header.fortranOrder() && shape.length == 2) {
      return new NpyArray(shape, transpose(values, shape[1], shape[0]));
    }
    return new NpyArray(shape, values);
  }

  private static int itemSize(String type) throws IOException {
    return switch (type) {
      case "f8", "i8" -> 8;
      case "f4", "i4" -> 4;
      case "i2" -> 2;
      case "u1", "b1" -> 1;
      default -> throw new IOException("Unsupported data type " + type);
    };
  }

  /**
   * @param rows    rows of the stored matrix
   * @param columns columns of the stored matrix
   */
  private static double[] transpose(double[] values, int rows, int columns) {
    final double[] transposed = new double[values.length];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        transposed[c * rows + r] = values[r * columns + c];
      }
    }
    return transposed;
  }
}
