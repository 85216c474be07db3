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

import java.io.ByteArrayOutputStream;

/**
 * Appends big-endian fields and length-prefixed UTF-8 strings to a growing
 * buffer. Values that do not fit their field are rejected rather than
 * truncated.
 */
public class ByteWriter {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  public ByteWriter writeUint8(int value) {
    checkRange("uint8", value, 0xFF);
    out.write(value);
    return this;
  }

  public ByteWriter writeUint16(int value) {
    checkRange("uint16", value, 0xFFFF);
    out.write(value >>> 8);
    out.write(value);
    return this;
  }

  public ByteWriter writeUint24(int value) {
    checkRange("uint24", value, 0xFFFFFF);
    out.write(value >>> 16);
    out.write(value >>> 8);
    out.write(value);
    return this;
  }

  public ByteWriter writeUint32(long value) {
    checkRange("uint32", value, 0xFFFFFFFFL);
    byte[] buf = new byte[4];
    ByteCodec.writeUint32(buf, 0, value);
    out.write(buf, 0, 4);
    return this;
  }

  public ByteWriter writeBytes(byte[] data) {
    out.write(data, 0, data.length);
    return this;
  }

  /**
   * Writes a one byte length followed by the UTF-8 bytes of {@code value}.
   */
  public ByteWriter writeShortString(String value) {
    byte[] bytes = ByteCodec.utf8(value);
    if (bytes.length > 0xFF) {
      throw new IllegalArgumentException(String.format(
          "'%s' is longer than 255 bytes of UTF-8", value));
    }
    writeUint8(bytes.length);
    return writeBytes(bytes);
  }

  /**
   * Writes a two byte length followed by the UTF-8 bytes of {@code value}.
   */
  public ByteWriter writeLongString(String value) {
    byte[] bytes = ByteCodec.utf8(value);
    if (bytes.length > 0xFFFF) {
      throw new IllegalArgumentException(
          "string is longer than 65535 bytes of UTF-8");
    }
    writeUint16(bytes.length);
    return writeBytes(bytes);
  }

  public int size() {
    return out.size();
  }

  public byte[] toByteArray() {
    return out.toByteArray();
  }

  private static void checkRange(String field, long value, long max) {
    if (value < 0 || value > max) {
      throw new IllegalArgumentException(String.format(
          "value %d does not fit in a %s field", value, field));
    }
  }
}
