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
import java.util.Base64;

/**
 * Low level encoding helpers shared by the token formats: base64url without
 * padding, lowercase hex, and big-endian unsigned integers of 16, 24 and 32
 * bits.
 */
public final class ByteCodec {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private ByteCodec() {
    // purely static class
  }

  public static String base64UrlEncode(byte[] data) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
  }

  /**
   * Decodes base64url text. Padding is optional; characters from the
   * standard (non URL-safe) alphabet are rejected.
   */
  public static byte[] base64UrlDecode(String text) throws DecodeException {
    if (text == null) {
      throw new DecodeException("no input");
    }
    String unpadded = text;
    while (unpadded.endsWith("=")) {
      unpadded = unpadded.substring(0, unpadded.length() - 1);
    }
    if (unpadded.length() % 4 == 1) {
      throw new DecodeException("truncated base64url input");
    }
    try {
      return Base64.getUrlDecoder().decode(unpadded);
    } catch (IllegalArgumentException e) {
      throw new DecodeException("malformed base64url input", e);
    }
  }

  public static String base64UrlDecodeToString(String text)
      throws DecodeException {
    return new String(base64UrlDecode(text), StandardCharsets.UTF_8);
  }

  public static String toHex(byte[] data) {
    return toHex(data, 0, data.length);
  }

  public static String toHex(byte[] data, int offset, int length) {
    char[] out = new char[length * 2];
    for (int i = 0; i < length; i++) {
      int b = data[offset + i] & 0xFF;
      out[i * 2] = HEX[b >>> 4];
      out[i * 2 + 1] = HEX[b & 0x0F];
    }
    return new String(out);
  }

  /**
   * Packs a hex identifier into exactly {@code byteLength} bytes. Dashes are
   * removed, then the string is truncated or right-padded with '0' to fit.
   *
   * @throws IllegalArgumentException
   *           if the identifier contains non-hex characters
   */
  public static byte[] packHexId(String id, int byteLength) {
    if (id == null) {
      throw new IllegalArgumentException("id is required");
    }
    StringBuilder hex = new StringBuilder(id.replace("-", ""));
    if (hex.length() > byteLength * 2) {
      hex.setLength(byteLength * 2);
    }
    while (hex.length() < byteLength * 2) {
      hex.append('0');
    }

    byte[] out = new byte[byteLength];
    for (int i = 0; i < byteLength; i++) {
      int hi = Character.digit(hex.charAt(i * 2), 16);
      int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException(String.format(
            "id '%s' is not a hex string", id));
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return out;
  }

  public static boolean isHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.digit(s.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }

  public static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  public static void writeUint16(byte[] buf, int offset, int value) {
    buf[offset] = (byte) (value >>> 8);
    buf[offset + 1] = (byte) value;
  }

  public static void writeUint24(byte[] buf, int offset, int value) {
    buf[offset] = (byte) (value >>> 16);
    buf[offset + 1] = (byte) (value >>> 8);
    buf[offset + 2] = (byte) value;
  }

  public static void writeUint32(byte[] buf, int offset, long value) {
    buf[offset] = (byte) (value >>> 24);
    buf[offset + 1] = (byte) (value >>> 16);
    buf[offset + 2] = (byte) (value >>> 8);
    buf[offset + 3] = (byte) value;
  }

  public static int readUint16(byte[] buf, int offset) {
    return ((buf[offset] & 0xFF) << 8) | (buf[offset + 1] & 0xFF);
  }

  public static int readUint24(byte[] buf, int offset) {
    return ((buf[offset] & 0xFF) << 16) | ((buf[offset + 1] & 0xFF) << 8)
        | (buf[offset + 2] & 0xFF);
  }

  public static long readUint32(byte[] buf, int offset) {
    return ((long) (buf[offset] & 0xFF) << 24)
        | ((buf[offset + 1] & 0xFF) << 16) | ((buf[offset + 2] & 0xFF) << 8)
        | (buf[offset + 3] & 0xFF);
  }
}
