package com.github.dfa.modthree;

/**
 * States of the mod-three automaton. Each state stands for the remainder, modulo 3, of the binary
 * number read so far.
 */
public enum Remainder {
  // nothing read yet, or value % 3 == 0
  R0(0),
  R1(1),
  R2(2);

  private final int value;

  private Remainder(final int value) {
    this.value = value;
  }

  public int getValue() {
    return value;
  }
}
