package com.onthegomap.tilestate.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings handed over by the host application, read through typed getters that fall back to a default.
 * <p>
 * Keys are matched ignoring case and separators, so {@code "FADE_DURATION"}, {@code "fade-duration"} and
 * {@code "fade.duration"} all name the same setting.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  private final Map<String, String> values;

  private Arguments(Map<String, String> values) {
    this.values = values;
  }

  private static String normalize(String key) {
    return key.replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    for (var entry : map.entrySet()) {
      normalized.put(normalize(entry.getKey()), entry.getValue());
    }
    return new Arguments(normalized);
  }

  /** Shorthand for {@link #of(Map)} which constructs the map from a list of key/value pairs. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private String getArg(String key, String defaultValue) {
    String value = values.get(normalize(key));
    return value == null ? defaultValue : value.trim();
  }

  private static void logArgValue(String key, String description, Object result) {
    LOGGER.debug("argument: {}={} ({})", key, result, description);
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns an argument as integer.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int parsed = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as an integer or {@code null} if it is not set.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public Integer getIntegerObject(String key, String description) {
    String value = getArg(key, null);
    Integer parsed = value == null ? null : Integer.valueOf(value);
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument as a {@link Duration} (i.e. "300ms", "10s", "1m30s").
   *
   * @throws DateTimeParseException if the argument cannot be parsed as a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    Duration parsed = parseDuration(getArg(key, defaultValue));
    logArgValue(key, description, parsed.toMillis() + "ms");
    return parsed;
  }

  private static Duration parseDuration(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    if (lower.endsWith("ms")) {
      return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2).strip()));
    }
    return Duration.parse("PT" + lower);
  }
}
