/* Copyright 2011 Google Inc. All Rights Reserved.
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.belay.authz.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Sequential, bounds-checked reader over a byte array. Reading past the end
 * raises a {@link DecodeException} instead of an index error.
 */
public class ByteReader {

  private final byte[] data;
  private final int limit;
  private int offset;

  public ByteReader(byte[] data) {
    this(data, 0, data.length);
  }

  public ByteReader(byte[] data, int offset, int limit) {
    this.data = data;
    this.offset = offset;
    this.limit = limit;
  }

  public int readUint8() throws DecodeException {
    require(1);
    return data[offset++] & 0xFF;
  }

  public int readUint16() throws DecodeException {
    require(2);
    int value = ByteCodec.readUint16(data, offset);
    offset += 2;
    return value;
  }

  public int readUint24() throws DecodeException {
    require(3);
    int value = ByteCodec.readUint24(data, offset);
    offset += 3;
    return value;
  }

  public long readUint32() throws DecodeException {
    require(4);
    long value = ByteCodec.readUint32(data, offset);
    offset += 4;
    return value;
  }

  public byte[] readBytes(int length) throws DecodeException {
    require(length);
    byte[] out = Arrays.copyOfRange(data, offset, offset + length);
    offset += length;
    return out;
  }

  public String readUtf8(int length) throws DecodeException {
    return new String(readBytes(length), StandardCharsets.UTF_8);
  }

  public String readShortString() throws DecodeException {
    return readUtf8(readUint8());
  }

  public String readLongString() throws DecodeException {
    return readUtf8(readUint16());
  }

  public boolean hasRemaining() {
    return offset < limit;
  }

  public int remaining() {
    return limit - offset;
  }

  private void require(int count) throws DecodeException {
    if (count < 0 || offset + count > limit) {
      throw new DecodeException(String.format(
          "need %d bytes at offset %d but only %d remain", count, offset,
          limit - offset));
    }
  }
}
