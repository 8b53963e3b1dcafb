package com.github.dfa.modthree;

/**
 * Thrown when raw text handed to {@link BinaryParser} contains a character that is neither a binary
 * digit nor a separator. This is a text-level problem and never reaches the automaton.
 */
public final class InvalidInputException extends Exception {
  private static final long serialVersionUID = 1L;
  private final char character;
  private final int index;

  public InvalidInputException(final char character, final int index) {
    super(String.format("Invalid input character '%s' at index %d", character, index));
    this.character = character;
    this.index = index;
  }

  public char getCharacter() {
    return character;
  }

  public int getIndex() {
    return index;
  }
}
