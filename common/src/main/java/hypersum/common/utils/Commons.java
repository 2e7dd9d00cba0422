package hypersum.common.utils;

public interface Commons {
  static int parseIntProperty(String key, int defaultValue) {
    final String value = System.getProperty(key);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("property " + key + " is not an integer: " + value, ex);
    }
  }
}
