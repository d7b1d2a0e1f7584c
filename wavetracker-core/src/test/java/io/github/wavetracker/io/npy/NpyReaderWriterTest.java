/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.io.npy;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NpyReaderWriterTest {

  @TempDir
  Path tempDir;

  @Test
  void testWrittenHeaderIsAligned() throws Exception {
    final Path file = tempDir.resolve("ident_v.npy");
    NpyWriter.write(file, NpyArray.of(new double[]{0, 1, Double.NaN}));

    final byte[] bytes = Files.readAllBytes(file);
    assertEquals((byte) 0x93, bytes[0]);
    assertEquals("NUMPY", new String(bytes, 1, 5, StandardCharsets.ISO_8859_1));
    assertEquals(1, bytes[6]);
    assertEquals(0, bytes[7]);

    final int headerLength = ByteBuffer.wrap(bytes, 8, 2).order(ByteOrder.LITTLE_ENDIAN)
        .getShort();
    assertEquals(0, (10 + headerLength) % 64);
    assertEquals('\n', bytes[10 + headerLength - 1]);
    final String header = new String(bytes, 10, headerLength, StandardCharsets.ISO_8859_1);
    assertTrue(header.startsWith("{'descr': '<f8', 'fortran_order': False, 'shape': (3,), }"));
    assertEquals(10 + headerLength + 3 * 8, bytes.length);
  }

  @Test
  void testReadWhatWasWritten() throws Exception {
    final Path file = tempDir.resolve("matrix.npy");
    final NpyArray matrix = new NpyArray(new int[]{2, 3}, new double[]{1, 2, 3, 4, 5, 6});
    NpyWriter.write(file, matrix);

    final NpyArray read = NpyReader.read(file);
    assertEquals(matrix, read);
    assertArrayEquals(new double[]{4, 5, 6}, read.toMatrix()[1]);
  }

  @Test
  void testBooleanMask() throws Exception {
    final Path file = tempDir.resolve("valid_v.npy");
    NpyWriter.write(file, new boolean[]{true, false, true});

    final NpyArray read = NpyReader.read(file);
    assertArrayEquals(new int[]{3}, read.shape());
    assertArrayEquals(new int[]{1, 0, 1}, read.toIntArray());
  }

  @Test
  void testBigEndianIntegers() throws Exception {
    final ByteBuffer data = ByteBuffer.allocate(3 * 4).order(ByteOrder.BIG_ENDIAN);
    data.putInt(7).putInt(-2).putInt(100_000);
    final Path file = tempDir.resolve("idx_v.npy");
    Files.write(file, npy(1, "{'descr': '>i4', 'fortran_order': False, 'shape': (3,), }",
        data.array()));

    assertArrayEquals(new int[]{7, -2, 100_000}, NpyReader.read(file).toIntArray());
  }

  @Test
  void testVersionTwoFloatsInFortranOrder() throws Exception {
    final ByteBuffer data = ByteBuffer.allocate(4 * 4).order(ByteOrder.LITTLE_ENDIAN);
    // columns of [[1, 2], [3, 4]]
    data.putFloat(1).putFloat(3).putFloat(2).putFloat(4);
    final Path file = tempDir.resolve("sign_v.npy");
    Files.write(file, npy(2, "{'descr': '<f4', 'fortran_order': True, 'shape': (2, 2), }",
        data.array()));

    final double[][] matrix = NpyReader.read(file).toMatrix();
    assertArrayEquals(new double[]{1, 2}, matrix[0]);
    assertArrayEquals(new double[]{3, 4}, matrix[1]);
  }

  @Test
  void testInvalidFilesAreRejected() throws Exception {
    final Path notNpy = tempDir.resolve("text.npy");
    Files.writeString(notNpy, "not an array");
    assertThrows(IOException.class, () -> NpyReader.read(notNpy));

    final Path truncated = tempDir.resolve("truncated.npy");
    Files.write(truncated, npy(1, "{'descr': '<f8', 'fortran_order': False, 'shape': (4,), }",
        new byte[8]));
    assertThrows(IOException.class, () -> NpyReader.read(truncated));

    final Path unsupported = tempDir.resolve("complex.npy");
    Files.write(unsupported, npy(1, "{'descr': '<c16', 'fortran_order': False, 'shape': (1,), }",
        new byte[16]));
    assertThrows(IOException.class, () -> NpyReader.read(unsupported));
  }

  @Test
  void testNonIntegralValuesAreNoIndices() {
    final NpyArray array = NpyArray.of(new double[]{1, 2.5});
    assertThrows(RuntimeException.class, array::toIntArray);
  }

  private static byte[] npy(int version, String dictionary, byte[] data) {
    final int lengthField = version == 1 ? 2 : 4;
    final String header = dictionary + "\n";
    final ByteBuffer buffer = ByteBuffer.allocate(8 + lengthField + header.length() + data.length)
        .order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', (byte) version, 0});
    if (version == 1) {
      buffer.putShort((short) header.length());
    } else {
      buffer.putInt(header.length());
    }
    buffer.put(header.getBytes(StandardCharsets.ISO_8859_1));
    buffer.put(data);
    return buffer.array();
  }
}
