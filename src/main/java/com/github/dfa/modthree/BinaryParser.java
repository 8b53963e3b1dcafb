package com.github.dfa.modthree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps a binary string such as {@code "1011_000"} to the symbols of the mod-three automaton.
 * Spaces, tabs and underscores are accepted as digit separators and skipped.
 */
public final class BinaryParser {

  public static List<Bit> parse(final String text) throws InvalidInputException {
    if (text == null) {
      return Collections.emptyList();
    }
    final List<Bit> symbols = new ArrayList<>(text.length());
    for (int index = 0; index < text.length(); index++) {
      final char character = text.charAt(index);
      switch (character) {
        case '0':
          symbols.add(Bit.ZERO);
          break;
        case '1':
          symbols.add(Bit.ONE);
          break;
        case ' ':
        case '\t':
        case '_':
          break;
        default:
          throw new InvalidInputException(character, index);
      }
    }
    return symbols;
  }

  private BinaryParser() {}
}
