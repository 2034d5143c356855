package org.hypertrace.core.metricquery.service;

import com.typesafe.config.Config;
import java.util.Optional;
import java.util.function.Supplier;

public class ConfigUtils {

  public static <T> Optional<T> optionallyGet(Supplier<T> strictGet) {
    try {
      return Optional.ofNullable(strictGet.get());
    } catch (Throwable t) {
      return Optional.empty();
    }
  }

  /** Falls back to the default when the path is missing or does not hold a number. */
  public static double getDoubleOrDefault(Config config, String path, double defaultValue) {
    return optionallyGet(() -> config.getDouble(path)).orElse(defaultValue);
  }
}
