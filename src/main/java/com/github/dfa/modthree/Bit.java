package com.github.dfa.modthree;

/**
 * Input symbols of the mod-three automaton, one per binary digit.
 */
public enum Bit {
  ZERO('0', 0),
  ONE('1', 1);

  private final char digit;
  private final int value;

  private Bit(final char digit, final int value) {
    this.digit = digit;
    this.value = value;
  }

  public int getValue() {
    return value;
  }

  @Override
  public String toString() {
    return String.valueOf(digit);
  }
}
