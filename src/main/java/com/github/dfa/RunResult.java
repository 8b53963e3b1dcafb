package com.github.dfa;

/**
 * This object encapsulates the outcome of running an input sequence to completion through an
 * Automaton: the state it ended in and whether that state is accepting.
 *
 * Runs that hit an undefined transition never produce a RunResult, they fail with an
 * {@link AutomatonException} instead.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class RunResult<Q> {
  private final boolean accepted;
  private final Q finalState;

  RunResult(final boolean accepted, final Q finalState) {
    this.accepted = accepted;
    this.finalState = finalState;
  }

  public boolean isAccepted() {
    return accepted;
  }

  public Q getFinalState() {
    return finalState;
  }

  @Override
  public String toString() {
    return "RunResult [accepted=" + accepted + ", finalState=" + finalState + "]";
  }
}
