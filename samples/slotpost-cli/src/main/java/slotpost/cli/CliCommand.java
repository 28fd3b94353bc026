package slotpost.cli;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A parsed command line.
 *
 * @param mode    what to do
 * @param count   slot limit for {@link Mode#CATCH_UP}, row limit for {@link Mode#FAILED}
 * @param entryId target of {@link Mode#REPLAY} and {@link Mode#SKIP}
 */
public record CliCommand(Mode mode, int count, String entryId) {
  static final int DEFAULT_FAILED_LIMIT = 20;

  public enum Mode {
    RUN("run"),
    STATUS("status"),
    CATCH_UP("catch-up"),
    RECOVER("recover"),
    DISCOVER("discover"),
    FAILED("failed"),
    REPLAY("replay"),
    SKIP("skip"),
    HEALTH("health"),
    PURGE("purge");

    private final String word;

    Mode(String word) {
      this.word = word;
    }

    public String word() {
      return word;
    }

    static Mode of(String word) {
      String normalized = word.toLowerCase(Locale.ROOT);
      for (Mode mode : values()) {
        if (mode.word.equals(normalized)) {
          return mode;
        }
      }
      throw new IllegalArgumentException("Unknown command: " + word);
    }
  }

  public CliCommand {
    Objects.requireNonNull(mode, "mode");
  }

  /**
   * Parses the non-option arguments. No arguments means {@code run}.
   *
   * @param catchUpDefault slot limit used when {@code catch-up} has no count
   * @throws IllegalArgumentException on an unknown command or a missing or malformed argument
   */
  public static CliCommand parse(List<String> args, int catchUpDefault) {
    if (args.isEmpty()) {
      return new CliCommand(Mode.RUN, 1, null);
    }
    Mode mode = Mode.of(args.get(0));
    List<String> rest = args.subList(1, args.size());
    return switch (mode) {
      case CATCH_UP -> new CliCommand(mode, rest.isEmpty() ? catchUpDefault : positive(rest.get(0)), null);
      case FAILED -> new CliCommand(mode, rest.isEmpty() ? DEFAULT_FAILED_LIMIT : positive(rest.get(0)), null);
      case REPLAY, SKIP -> {
        if (rest.isEmpty() || rest.get(0).isBlank()) {
          throw new IllegalArgumentException(mode.word() + " requires an entry id");
        }
        yield new CliCommand(mode, 0, rest.get(0));
      }
      default -> {
        if (!rest.isEmpty()) {
          throw new IllegalArgumentException(mode.word() + " takes no arguments");
        }
        yield new CliCommand(mode, 0, null);
      }
    };
  }

  public static String usage() {
    return "usage: slotpost [run | status | catch-up [n] | recover | discover | failed [n]"
        + " | replay <id> | skip <id> | health | purge]";
  }

  private static int positive(String value) {
    int n;
    try {
      n = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number: " + value, e);
    }
    if (n <= 0) {
      throw new IllegalArgumentException("Count must be > 0: " + value);
    }
    return n;
  }
}
