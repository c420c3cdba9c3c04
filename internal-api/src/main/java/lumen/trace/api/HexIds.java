package lumen.trace.api;

public final class HexIds {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private HexIds() {}

  public static String toHexStringPadded(long id, int size) {
    char[] chars = new char[size];
    for (int i = size - 1; i >= 0; i--) {
      if (i >= size - 16) {
        chars[i] = HEX[(int) (id & 0xF)];
        id >>>= 4;
      } else {
        chars[i] = '0';
      }
    }
    return new String(chars);
  }

  /** True when {@code value} is exactly {@code length} lower or upper case hex characters. */
  public static boolean isHex(CharSequence value, int length) {
    if (value == null || value.length() != length) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (Character.digit(value.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }

  /** True when every character is '0'. */
  public static boolean isAllZeros(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) != '0') {
        return false;
      }
    }
    return true;
  }
}
