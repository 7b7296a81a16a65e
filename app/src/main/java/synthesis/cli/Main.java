package synthesis.cli;

import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main [run] [--timeout-ms N] [--max-depth N] [--vars x,y] [--examples
 *       "x=0,y=1->-1;x=4,y=1->3"] [--json]}: synthesise a program for the examples
 *   <li>{@code Main enumerate [--depth N] [--limit N] [--vars x,y]}: list enumerated programs
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  static int execute(String[] args) {
    String[] effective = args == null ? new String[0] : args;
    String command = effective.length > 0 && !effective[0].startsWith("--") ? effective[0] : "run";
    String[] rest =
        effective.length > 0 && !effective[0].startsWith("--")
            ? Arrays.copyOfRange(effective, 1, effective.length)
            : effective;
    try {
      return switch (command.toLowerCase(Locale.ROOT)) {
        case "run", "synthesize" -> new RunCommand().execute(rest);
        case "enumerate", "enum" -> new EnumerateCommand(System.out).execute(rest);
        case "help", "-h" -> {
          printUsage();
          yield 0;
        }
        default -> throw new IllegalArgumentException("Unknown command: " + command);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      printUsage();
      return EXIT_USAGE;
    }
  }

  private static void printUsage() {
    System.err.println(
        """
        Usage:
          run [--timeout-ms N] [--max-depth N] [--vars x,y] [--examples "x=0,y=1->-1;..."] [--json]
          enumerate [--depth N] [--limit N] [--vars x,y]""");
  }
}
