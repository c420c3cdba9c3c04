package lumen.trace.core.propagation;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** XOR with a repeating key, then base64. Used by the legacy cross application headers. */
public final class Obfuscator {
  private Obfuscator() {}

  public static String obfuscate(String value, String key) {
    byte[] bytes = xor(value.getBytes(StandardCharsets.UTF_8), key);
    return Base64.getEncoder().encodeToString(bytes);
  }

  /** @return the clear text, or {@code null} when {@code value} is not valid base64 */
  public static String deobfuscate(String value, String key) {
    if (value == null) {
      return null;
    }
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(value.trim());
    } catch (IllegalArgumentException e) {
      return null;
    }
    return new String(xor(decoded, key), StandardCharsets.UTF_8);
  }

  private static byte[] xor(byte[] data, String key) {
    byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
    if (keyBytes.length == 0) {
      return data;
    }
    byte[] out = new byte[data.length];
    for (int i = 0; i < data.length; i++) {
      out[i] = (byte) (data[i] ^ keyBytes[i % keyBytes.length]);
    }
    return out;
  }
}
