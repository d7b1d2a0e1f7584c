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
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * Header dictionary of a {@code .npy} file.
 *
 * @param descr        data type, for example {@code <f8}
 * @param fortranOrder true if the data is stored in column major order
 */
record NpyHeader(@NotNull String descr, boolean fortranOrder, int @NotNull [] shape) {

  static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  static final int ALIGNMENT = 64;

  private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
  private static final Pattern FORTRAN_ORDER = Pattern.compile(
      "'fortran_order'\\s*:\\s*(True|False)");
  private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

  static @NotNull NpyHeader parse(@NotNull String header) throws IOException {
    final Matcher descr = DESCR.matcher(header);
    final Matcher fortranOrder = FORTRAN_ORDER.matcher(header);
    final Matcher shape = SHAPE.matcher(header);
    if (!descr.find() || !fortranOrder.find() || !shape.find()) {
      throw new IOException("Malformed npy header: " + header.strip());
    }

    final String[] dims = shape.group(1).split(",");
    final int[] parsedShape = Arrays.stream(dims).map(String::strip).filter(s -> !s.isEmpty())
        .mapToInt(s -> {
          // python 2 files may write long dimensions as 3L
          final String digits = s.endsWith("L") ? s.substring(0, s.length() - 1) : s;
          return Integer.parseInt(digits);
        }).toArray();
    return new NpyHeader(descr.group(1), fortranOrder.group(1).equals("True"), parsedShape);
  }

  /**
   * @return byte order of the data, native order for single byte types
   */
  @NotNull ByteOrder byteOrder() {
    return switch (descr.charAt(0)) {
      case '<' -> ByteOrder.LITTLE_ENDIAN;
      case '>' -> ByteOrder.BIG_ENDIAN;
      default -> ByteOrder.nativeOrder();
    };
  }

  /**
   * @return type code without byte order, for example {@code f8}
   */
  @NotNull String typeCode() {
    final char first = descr.charAt(0);
    return first == '<' || first == '>' || first == '|' || first == '=' ? descr.substring(1)
        : descr;
  }

  long size() {
    long size = 1;
    for (int dim : shape) {
      size *= dim;
    }
    return size;
  }

  @NotNull String toDictionary() {
    final String dims = Arrays.stream(shape).mapToObj(Integer::toString)
        .collect(Collectors.joining(", "));
    final String shapeTuple = shape.length == 1 ? "(" + dims + ",)" : "(" + dims + ")";
    return "{'descr': '%s', 'fortran_order': %s, 'shape': %s, }".formatted(descr,
        fortranOrder ? "True" : "False", shapeTuple);
  }
}
