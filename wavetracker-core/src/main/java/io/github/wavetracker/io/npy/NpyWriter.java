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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Writes NumPy {@code .npy} files of format version 1.0. Doubles are written as {@code <f8},
 * boolean arrays as {@code |b1}.
 */
public class NpyWriter {

  private static final Logger logger = Logger.getLogger(NpyWriter.class.getName());

  // magic, version and header length field
  private static final int PREAMBLE = NpyHeader.MAGIC.length + 2 + 2;

  private NpyWriter() {
  }

  public static void write(@NotNull Path file, @NotNull NpyArray array) throws IOException {
    final double[] data = array.data();
    final ByteBuffer buffer = allocate(new NpyHeader("<f8", false, array.shape()),
        (long) data.length * Double.BYTES);
    for (double v : data) {
      buffer.putDouble(v);
    }
    write(file, buffer, array);
  }

  public static void write(@NotNull Path file, boolean @NotNull [] values) throws IOException {
    final ByteBuffer buffer = allocate(new NpyHeader("|b1", false, new int[]{values.length}),
        values.length);
    for (boolean v : values) {
      buffer.put(v ? (byte) 1 : (byte) 0);
    }
    write(file, buffer, NpyArray.of(values));
  }

  private static void write(Path file, ByteBuffer buffer, NpyArray array) throws IOException {
    Files.write(file, buffer.array());
    logger.fine(() -> "Wrote " + array + " to " + file);
  }

  /**
   * @return buffer holding the header, positioned at the start of the data
   */
  private static ByteBuffer allocate(NpyHeader header, long dataBytes) throws IOException {
    final String dictionary = header.toDictionary();
    // dictionary, padding and the terminating newline end on the alignment boundary
    final int unpadded = PREAMBLE + dictionary.length() + 1;
    final int padding = (NpyHeader.ALIGNMENT - unpadded % NpyHeader.ALIGNMENT)
        % NpyHeader.ALIGNMENT;
    final int headerLength = dictionary.length() + padding + 1;
    if (headerLength > 0xFFFF) {
      throw new IOException("Header too long for npy format version 1.0");
    }
    final long total = PREAMBLE + headerLength + dataBytes;
    if (total > Integer.MAX_VALUE) {
      throw new IOException("Array too large: %d bytes".formatted(total));
    }

    final ByteBuffer buffer = ByteBuffer.allocate((int) total).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(NpyHeader.MAGIC);
    buffer.put((byte) 1).put((byte) 0);
    buffer.putShort((short) headerLength);
    buffer.put(dictionary.getBytes(StandardCharsets.ISO_8859_1));
    for (int i = 0; i < padding; i++) {
      buffer.put((byte) ' ');
    }
    buffer.put((byte) '\n');
    return buffer;
  }
}
