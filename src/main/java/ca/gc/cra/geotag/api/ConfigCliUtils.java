package ca.gc.cra.geotag.api;

import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} path argument.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null} when absent or blank
   */
  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Folds boolean CLI flags into the key space, e.g. {@code --dry-run} becomes {@code dryRun=true}.
   *
   * @param input parsed CLI input
   * @param args mutable CLI map
   */
  static void applyFlags(CliInput input, Map<String, String> args) {
    if (input.hasFlag("--dry-run")) {
      args.put("dryRun", "true");
    }
    if (input.hasFlag("--overwrite")) {
      args.put("overwrite", "true");
    }
    if (input.hasFlag("--geocode")) {
      args.put("geocode", "true");
    }
  }
}
