package org.cellpainting.loaddata.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.cellpainting.loaddata.config.ConfigMerger;
import org.cellpainting.loaddata.config.DefaultsForMode;
import org.cellpainting.loaddata.config.YamlConfigLoader;

/**
 * Command line of a {@code bind} or {@code combine} run: known flags plus {@code key=value} options.
 *
 * <p>Options are checked against the keys the command understands, so a misspelt key such as
 * {@code groupkeys=plate} is a usage error rather than a silently ignored setting. {@link #resolve} lays the
 * options over the YAML file named by {@code config=} and over the command's defaults.</p>
 *
 * @since 0.1.0
 */
final class CommandLine {
  static final String CONFIG_KEY = "config";

  /** Flags shared by every command; matching ignores case. */
  enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run"),
    ALLOW_OVERWRITE("--allow-overwrite");

    private final List<String> spellings;

    Flag(String... spellings) {
      this.spellings = List.of(spellings);
    }

    static Optional<Flag> lookup(String token) {
      String lower = token.trim().toLowerCase(Locale.ROOT);
      for (Flag flag : values()) {
        if (flag.spellings.contains(lower)) {
          return Optional.of(flag);
        }
      }
      return Optional.empty();
    }
  }

  /** Raised for arguments the command does not accept; maps to exit code 2. */
  static final class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }

    UsageException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Settings after merging, plus the run switches that may come from either a flag or the settings.
   *
   * @param settings mutable effective settings; telemetry keys are stripped from it later
   * @param dryRun whether to print the plan only
   * @param allowOverwrite whether a directory holding foreign files may receive output
   */
  record Resolved(Map<String, String> settings, boolean dryRun, boolean allowOverwrite) {
  }

  private final String mode;
  private final Set<Flag> flags;
  private final Map<String, String> options;

  private CommandLine(String mode, Set<Flag> flags, Map<String, String> options) {
    this.mode = mode;
    this.flags = flags;
    this.options = options;
  }

  /**
   * Splits arguments into flags and options.
   *
   * @param mode command name, {@code bind} or {@code combine}
   * @param inputKeys keys naming the command's inputs and output, accepted besides its defaults
   * @param args raw arguments; {@code null} and blank entries are skipped
   * @return parsed command line; later duplicates of an option win
   * @throws UsageException for an unknown flag or key, or a token that is neither flag nor {@code key=value}
   */
  static CommandLine parse(String mode, Set<String> inputKeys, String[] args) throws UsageException {
    Set<String> known = new LinkedHashSet<>(DefaultsForMode.asFlatMap(mode).keySet());
    known.addAll(inputKeys);
    known.add(CONFIG_KEY);

    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    Map<String, String> options = new LinkedHashMap<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        Optional<Flag> flag = Flag.lookup(arg);
        if (flag.isPresent()) {
          flags.add(flag.get());
          continue;
        }
        int idx = arg.indexOf('=');
        if (idx <= 0) {
          throw new UsageException(arg.startsWith("-")
              ? "unknown flag " + arg
              : "argument must be key=value (was '" + arg + "')");
        }
        String key = arg.substring(0, idx).trim();
        String value = arg.substring(idx + 1).trim();
        if (!known.contains(key)) {
          throw new UsageException("unknown " + mode + " option " + key + "; expected one of " + known);
        }
        if (value.indexOf('\0') >= 0) {
          throw new UsageException("option " + key + " must not contain null bytes");
        }
        options.put(key, value);
      }
    }
    return new CommandLine(mode, flags, options);
  }

  /** Whether a token is handed to a command rather than naming one. */
  static boolean isArgument(String token) {
    String arg = token.trim();
    return arg.isEmpty() || arg.startsWith("-") || arg.contains("=") || Flag.lookup(arg).isPresent();
  }

  boolean has(Flag flag) {
    return flags.contains(flag);
  }

  Map<String, String> options() {
    return Map.copyOf(options);
  }

  /**
   * Merges the options over the YAML configuration and the command's defaults.
   *
   * @param warn receives a message for each option overriding a YAML value
   * @return effective settings and run switches
   * @throws UsageException when the YAML file is missing or malformed, or the merged settings are invalid
   * @throws IOException when the YAML file exists but cannot be read
   */
  Resolved resolve(Consumer<String> warn) throws UsageException, IOException {
    Map<String, String> cli = new LinkedHashMap<>(options);
    String configPath = cli.remove(CONFIG_KEY);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path path = Path.of(configPath);
      if (!Files.exists(path)) {
        throw new UsageException("configuration file does not exist: " + path);
      }
      try {
        yaml = YamlConfigLoader.load(path, mode);
      } catch (IllegalArgumentException ex) {
        throw new UsageException("invalid YAML configuration " + path + ": " + ex.getMessage(), ex);
      }
    }

    Map<String, String> settings;
    try {
      settings = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn));
    } catch (IllegalArgumentException ex) {
      throw new UsageException(ex.getMessage(), ex);
    }
    boolean dryRun = has(Flag.DRY_RUN) || switchValue(settings, "dryRun");
    boolean allowOverwrite = has(Flag.ALLOW_OVERWRITE) || switchValue(settings, "allowOverwrite");
    return new Resolved(settings, dryRun, allowOverwrite);
  }

  private static boolean switchValue(Map<String, String> settings, String key) throws UsageException {
    String value = settings.getOrDefault(key, "").trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "", "false" -> false;
      case "true" -> true;
      default -> throw new UsageException(key + " must be true or false (was '" + value + "')");
    };
  }
}
