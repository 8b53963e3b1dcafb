package com.github.dfa.modthree;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import com.github.dfa.Automaton;
import com.github.dfa.AutomatonException;

/**
 * The canonical three state automaton that computes the remainder of a binary number divided by 3,
 * reading the most significant digit first. Every state is accepting, the answer is the final state
 * itself.
 */
public final class ModThree {
  private static final Automaton<Remainder, Bit> automaton = buildAutomaton();

  public static Automaton<Remainder, Bit> automaton() {
    return automaton;
  }

  /**
   * Parse the binary text and report its remainder modulo 3.
   */
  public static Remainder remainder(final String binary)
      throws InvalidInputException, AutomatonException {
    return automaton.run(BinaryParser.parse(binary));
  }

  private static Automaton<Remainder, Bit> buildAutomaton() {
    final Map<Remainder, Map<Bit, Remainder>> delta = new EnumMap<>(Remainder.class);
    delta.put(Remainder.R0, row(Remainder.R0, Remainder.R1));
    delta.put(Remainder.R1, row(Remainder.R2, Remainder.R0));
    delta.put(Remainder.R2, row(Remainder.R1, Remainder.R2));
    try {
      return Automaton.create(EnumSet.allOf(Remainder.class), EnumSet.allOf(Bit.class),
          Remainder.R0, EnumSet.allOf(Remainder.class), delta, true);
    } catch (AutomatonException problem) {
      // the table above is fixed, failing here is a programming error
      throw new IllegalStateException("Mod-three automaton definition is invalid", problem);
    }
  }

  private static Map<Bit, Remainder> row(final Remainder onZero, final Remainder onOne) {
    final Map<Bit, Remainder> row = new EnumMap<>(Bit.class);
    row.put(Bit.ZERO, onZero);
    row.put(Bit.ONE, onOne);
    return row;
  }

  private ModThree() {}
}
