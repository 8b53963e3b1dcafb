package com.github.dfa.modthree;

import java.io.PrintStream;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.AutomatonException;

/**
 * Command line front end: prints the remainder modulo 3 of the binary number given as the only
 * argument, eg. {@code ModThreeCli 1111_000}.
 */
public final class ModThreeCli {
  private static final Logger logger = LogManager.getLogger(ModThreeCli.class.getSimpleName());

  public static void main(String args[]) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Returns the process exit status: 0 on success, 1 on a usage, parse or run failure.
   */
  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    if (args == null || args.length < 1) {
      err.println("Usage: " + ModThreeCli.class.getSimpleName() + " <binary-string>");
      err.println("Example: " + ModThreeCli.class.getSimpleName() + " 1111_000");
      return 1;
    }
    final String input = args[0].trim();

    final List<Bit> symbols;
    try {
      symbols = BinaryParser.parse(input);
    } catch (InvalidInputException problem) {
      logger.error("Failed to parse input " + input, problem);
      err.println("Parse error: " + problem.getMessage());
      return 1;
    }

    final Remainder finalState;
    try {
      finalState = ModThree.automaton().run(symbols);
    } catch (AutomatonException problem) {
      logger.error("Failed to run input " + input, problem);
      err.println("Run error: " + problem.getMessage());
      return 1;
    }

    out.printf("Input: %s%nFinal state: %s%nRemainder (mod 3): %d%n", input, finalState,
        finalState.getValue());
    return 0;
  }

  private ModThreeCli() {}
}
