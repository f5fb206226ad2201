package org.cellpainting.loaddata.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.cellpainting.loaddata.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code loaddata} CLI dispatcher that routes to subcommands.
 *
 * <p>The first token that is neither a flag nor a {@code key=value} pair names the command; every other
 * token, flags included, is passed to that command, so {@code loaddata bind --help} shows bind's help.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: loaddata <bind|combine> [options]";
  private static final String HELP_TEXT = """
      LoadData manifest tool

      Usage:
        loaddata <command> [options]

      Commands:
        bind        Join images with illumination corrections and write per-group manifests
        combine     Concatenate per-group manifests from a bind handoff

      Global flags:
        --help      Show this message (or a command's help after the command name)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null) {
          continue;
        }
        if (command == null && !CommandLine.isArgument(raw)) {
          command = raw.trim().toLowerCase(Locale.ROOT);
        } else {
          delegate.add(raw);
        }
      }
    }

    if (command == null) {
      List<CommandLine.Flag> flags = new ArrayList<>();
      delegate.forEach(arg -> CommandLine.Flag.lookup(arg).ifPresent(flags::add));
      if (flags.contains(CommandLine.Flag.HELP)) {
        Console.text(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      if (flags.contains(CommandLine.Flag.VERBOSE)) {
        LoggingConfigurator.enableVerboseLogging();
      }
      log.error("Missing command");
      Console.text(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "bind" -> BindCli.run(delegateArgs);
      case "combine" -> CombineCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        Console.text(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
