// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.dex.code.Constants;
import com.android.tools.resourceremap.errors.MalformedFillArrayDataPayloadException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encoding and decoding of {@code fill-array-data-payload} blocks holding 32-bit elements.
 *
 * <p>The payload is laid out in little endian byte order as:
 *
 * <pre>
 *   ushort ident = 0x0300
 *   ushort element_width
 *   uint   size
 *   ubyte  data[size * element_width]
 *   ubyte  padding (0 or 1 byte of value 0, keeping the block a whole number of code units)
 * </pre>
 *
 * <p>Only payloads with an element width of 4 are handled, which is what the int[] fields of R
 * classes are compiled to.
 */
public class FillArrayDataPayloadCodec {

  public static final int HEADER_SIZE = 8;
  public static final int ELEMENT_WIDTH = 4;

  private FillArrayDataPayloadCodec() {}

  public static IntList decode(byte[] payload) {
    if (payload.length < HEADER_SIZE) {
      throw new MalformedFillArrayDataPayloadException(
          "Payload of " + payload.length + " bytes is shorter than its header");
    }
    ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
    int ident = Short.toUnsignedInt(buffer.getShort());
    if (ident != Constants.FILL_ARRAY_DATA_PAYLOAD_IDENT) {
      throw new MalformedFillArrayDataPayloadException(
          "Unexpected payload identifier 0x" + Integer.toHexString(ident));
    }
    int elementWidth = Short.toUnsignedInt(buffer.getShort());
    if (elementWidth != ELEMENT_WIDTH) {
      throw new MalformedFillArrayDataPayloadException(
          "Unsupported payload element width " + elementWidth + ", expected " + ELEMENT_WIDTH);
    }
    long size = Integer.toUnsignedLong(buffer.getInt());
    long dataSize = size * elementWidth;
    if (dataSize > buffer.remaining()) {
      throw new MalformedFillArrayDataPayloadException(
          "Payload declares "
              + size
              + " elements but only holds "
              + buffer.remaining()
              + " bytes of data");
    }
    IntList elements = new IntArrayList((int) size);
    for (int i = 0; i < size; i++) {
      elements.add(buffer.getInt());
    }
    return elements;
  }

  public static byte[] encode(IntList elements) {
    int dataSize = elements.size() * ELEMENT_WIDTH;
    int paddedSize = HEADER_SIZE + dataSize + (dataSize & 1);
    ByteBuffer buffer = ByteBuffer.allocate(paddedSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putShort((short) Constants.FILL_ARRAY_DATA_PAYLOAD_IDENT);
    buffer.putShort((short) ELEMENT_WIDTH);
    buffer.putInt(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      buffer.putInt(elements.getInt(i));
    }
    // A padding byte, if any, is left zero.
    return buffer.array();
  }

  /** Number of 16-bit code units of the encoded payload of {@code elementCount} elements. */
  public static int getPayloadSizeInCodeUnits(int elementCount) {
    return (HEADER_SIZE + elementCount * ELEMENT_WIDTH + 1) / 2;
  }
}
