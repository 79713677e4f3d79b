package ca.gc.cra.flapline.api;

import ca.gc.cra.flapline.config.ConfigMerger;
import ca.gc.cra.flapline.config.DefaultsForMode;
import ca.gc.cra.flapline.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared CLI plumbing: {@code config=PATH} extraction and the defaults, YAML, CLI merge.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Parses {@code key=value} arguments, loads the optional YAML file and merges both over the mode defaults.
   * Failures are logged and printed with the usage line.
   */
  static Resolved resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolved.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath;
      try {
        yamlPath = Path.of(configPath);
      } catch (InvalidPathException ex) {
        log.error("Invalid configuration path: {}", configPath);
        CliPrinter.println(usage);
        return Resolved.failed(ExitCode.INVALID_ARGS);
      }
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolved.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolved.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolved.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Resolved(new LinkedHashMap<>(effective), null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolved.failed(ExitCode.INVALID_ARGS);
    }
  }

  /** Mutable effective settings, or the exit code to return when resolution failed. */
  record Resolved(Map<String, String> config, ExitCode failure) {
    static Resolved failed(ExitCode code) {
      return new Resolved(Map.of(), code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
