package com.github.dfa;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.AutomatonException.Code;

/**
 * A simple builder to let users use fluent APIs to define and validate automata.
 *
 * Nothing is checked until {@link #build()}, which validates the whole definition in a fixed order
 * and throws on the first problem found:<br>
 * 0. no null parts and no (state, symbol) pair mapped to two different states<br>
 * 1. the initial state is one of the states<br>
 * 2. every final state is one of the states<br>
 * 3. every row of the table belongs to a known state, even an empty row<br>
 * 4. every transition, in insertion order, starts from a known state, reads a known symbol and
 * leads to a known state<br>
 * 5. if completeness was asked for, every (state, symbol) pair has a transition<br>
 *
 * States, symbols and final states may be supplied more than once, duplicates are coalesced.
 * Iteration order follows first insertion, so diagnostics are deterministic.
 */
public final class AutomatonBuilder<Q, S> {
  private static final Logger logger = LogManager.getLogger(AutomatonBuilder.class.getSimpleName());

  private final Set<Q> states = new LinkedHashSet<>();
  private final Set<S> alphabet = new LinkedHashSet<>();
  private final Set<Q> finals = new LinkedHashSet<>();
  private final Map<TransitionKey<Q, S>, Q> transitions = new LinkedHashMap<>();
  // states that own a row of the table, even an empty one
  private final Set<Q> rowSources = new LinkedHashSet<>();
  private Q initial;
  private boolean requireComplete;

  // first definition problem seen while collecting, reported by build()
  private AutomatonException definitionProblem;

  public static <Q, S> AutomatonBuilder<Q, S> newBuilder() {
    return new AutomatonBuilder<>();
  }

  public AutomatonBuilder<Q, S> states(final Collection<Q> states) {
    if (states == null) {
      recordProblem(new AutomatonException(Code.INVALID_DEFINITION, "States cannot be null"));
      return this;
    }
    for (final Q state : states) {
      if (state == null) {
        recordProblem(new AutomatonException(Code.INVALID_DEFINITION, "Null state is invalid"));
      } else {
        this.states.add(state);
      }
    }
    return this;
  }

  @SafeVarargs
  public final AutomatonBuilder<Q, S> states(final Q... states) {
    return states(states == null ? null : Arrays.asList(states));
  }

  public AutomatonBuilder<Q, S> alphabet(final Collection<S> alphabet) {
    if (alphabet == null) {
      recordProblem(new AutomatonException(Code.INVALID_DEFINITION, "Alphabet cannot be null"));
      return this;
    }
    for (final S symbol : alphabet) {
      if (symbol == null) {
        recordProblem(new AutomatonException(Code.INVALID_DEFINITION, "Null symbol is invalid"));
      } else {
        this.alphabet.add(symbol);
      }
    }
    return this;
  }

  @SafeVarargs
  public final AutomatonBuilder<Q, S> alphabet(final S... alphabet) {
    return alphabet(alphabet == null ? null : Arrays.asList(alphabet));
  }

  public AutomatonBuilder<Q, S> initial(final Q initial) {
    this.initial = initial;
    return this;
  }

  public AutomatonBuilder<Q, S> finals(final Collection<Q> finals) {
    if (finals == null) {
      recordProblem(
          new AutomatonException(Code.INVALID_DEFINITION, "Final states cannot be null"));
      return this;
    }
    for (final Q state : finals) {
      if (state == null) {
        recordProblem(
            new AutomatonException(Code.INVALID_DEFINITION, "Null final state is invalid"));
      } else {
        this.finals.add(state);
      }
    }
    return this;
  }

  @SafeVarargs
  public final AutomatonBuilder<Q, S> finals(final Q... finals) {
    return finals(finals == null ? null : Arrays.asList(finals));
  }

  /**
   * Add δ(from, on) = to. Adding the same entry twice is harmless; mapping the same pair to a
   * different state makes the definition non-deterministic and {@link #build()} will reject it.
   */
  public AutomatonBuilder<Q, S> transition(final Q from, final S on, final Q to) {
    if (from == null || on == null || to == null) {
      recordProblem(new AutomatonException(Code.INVALID_DEFINITION,
          String.format("Transition cannot have null parts: (%s, %s) -> %s", from, on, to)));
      return this;
    }
    final TransitionKey<Q, S> key = TransitionKey.of(from, on);
    final Q existing = transitions.putIfAbsent(key, to);
    if (existing != null && !existing.equals(to)) {
      recordProblem(AutomatonException.ofTransition(Code.CONFLICTING_TRANSITION, from, on, to));
    }
    return this;
  }

  /**
   * Add a whole row of the transition table: δ(from, a) = row.get(a) for every symbol a in row.
   */
  public AutomatonBuilder<Q, S> row(final Q from, final Map<S, Q> row) {
    if (from == null || row == null) {
      recordProblem(new AutomatonException(Code.INVALID_DEFINITION,
          "Transition row cannot be null or belong to a null state: " + from));
      return this;
    }
    rowSources.add(from);
    for (final Map.Entry<S, Q> entry : row.entrySet()) {
      transition(from, entry.getKey(), entry.getValue());
    }
    return this;
  }

  /**
   * Add a nested transition table where {@code transitions.get(q).get(a)} is δ(q, a).
   */
  public AutomatonBuilder<Q, S> transitions(final Map<Q, ? extends Map<S, Q>> transitions) {
    if (transitions == null) {
      recordProblem(
          new AutomatonException(Code.INVALID_DEFINITION, "Transition table cannot be null"));
      return this;
    }
    for (final Map.Entry<Q, ? extends Map<S, Q>> row : transitions.entrySet()) {
      row(row.getKey(), row.getValue());
    }
    return this;
  }

  public AutomatonBuilder<Q, S> requireComplete(final boolean requireComplete) {
    this.requireComplete = requireComplete;
    return this;
  }

  public Automaton<Q, S> build() throws AutomatonException {
    try {
      validate();
    } catch (AutomatonException problem) {
      logger.warn("Rejected automaton definition: " + problem.getMessage());
      throw problem;
    }
    return new Automaton<>(states, alphabet, initial, finals, transitions);
  }

  private void validate() throws AutomatonException {
    if (definitionProblem != null) {
      throw definitionProblem;
    }
    if (initial == null) {
      throw new AutomatonException(Code.INVALID_DEFINITION, "Initial state cannot be null");
    }
    if (!states.contains(initial)) {
      throw AutomatonException.ofState(Code.UNKNOWN_INITIAL_STATE, initial);
    }
    for (final Q state : finals) {
      if (!states.contains(state)) {
        throw AutomatonException.ofState(Code.UNKNOWN_FINAL_STATE, state);
      }
    }
    for (final Q from : rowSources) {
      if (!states.contains(from)) {
        throw AutomatonException.ofState(Code.UNKNOWN_SOURCE_STATE, from);
      }
    }
    for (final Map.Entry<TransitionKey<Q, S>, Q> entry : transitions.entrySet()) {
      final Q from = entry.getKey().getState();
      final S on = entry.getKey().getSymbol();
      final Q to = entry.getValue();
      if (!states.contains(from)) {
        throw AutomatonException.ofTransition(Code.UNKNOWN_SOURCE_STATE, from, on, to);
      }
      if (!alphabet.contains(on)) {
        throw AutomatonException.ofTransition(Code.UNKNOWN_SYMBOL, from, on, to);
      }
      if (!states.contains(to)) {
        throw AutomatonException.ofTransition(Code.UNKNOWN_TARGET_STATE, from, on, to);
      }
    }
    if (requireComplete) {
      for (final Q state : states) {
        for (final S symbol : alphabet) {
          if (!transitions.containsKey(TransitionKey.of(state, symbol))) {
            throw AutomatonException.ofTransition(Code.INCOMPLETE_TRANSITION_FUNCTION, state,
                symbol, null);
          }
        }
      }
    }
  }

  private void recordProblem(final AutomatonException problem) {
    if (definitionProblem == null) {
      definitionProblem = problem;
    }
  }

  private AutomatonBuilder() {}
}
