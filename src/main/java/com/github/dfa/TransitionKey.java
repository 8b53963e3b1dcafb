package com.github.dfa;

import java.util.Objects;

/**
 * Composite (state, symbol) key of the transition table. The same key type is used both to
 * validate the table and to look transitions up while running, so the two never disagree.
 *
 * Keys are built on every {@link Automaton#step(Object, Object)}, the hash is computed once here.
 */
public final class TransitionKey<Q, S> {
  private final Q state;
  private final S symbol;
  private final int hash;

  private TransitionKey(final Q state, final S symbol) {
    this.state = state;
    this.symbol = symbol;
    this.hash = 31 * state.hashCode() + symbol.hashCode();
  }

  public Q getState() {
    return state;
  }

  public S getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey<?, ?> other = (TransitionKey<?, ?>) o;
    return hash == other.hash && state.equals(other.state) && symbol.equals(other.symbol);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "(" + state + ", " + symbol + ")";
  }

  /**
   * Null is never a valid state or symbol, so a key with a null part cannot exist.
   */
  public static <Q, S> TransitionKey<Q, S> of(final Q state, final S symbol) {
    Objects.requireNonNull(state, "Transition key state cannot be null");
    Objects.requireNonNull(symbol, "Transition key symbol cannot be null");
    return new TransitionKey<>(state, symbol);
  }
}
