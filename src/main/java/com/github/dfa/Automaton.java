package com.github.dfa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.AutomatonException.Code;

/**
 * A generic Deterministic Finite Automaton, the 5-tuple (Q, Σ, q0, F, δ).
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this automaton<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. an Automaton is only ever handed out by {@link AutomatonBuilder#build()} or
 * {@link #create(Collection, Collection, Object, Collection, Map, boolean)}, both of which validate
 * the whole definition first. There is no such thing as a partially valid Automaton.<br>
 *
 * 2. it is immutable once built and hence thread-safe. Any number of threads may call
 * {@link #step(Object, Object)}, {@link #run(List)} or {@link #accepts(List)} on the same instance
 * without coordination.<br>
 *
 * 3. states and symbols can be of any type with a well-behaved equals()/hashCode(), eg. an enum,
 * an Integer or a String. Null is never a valid state or symbol.<br>
 *
 * 4. execution is a strict left-to-right fold of {@link #step(Object, Object)} over the input. Each
 * step depends only on the current state and the current symbol.<br>
 *
 * 5. an undefined transition fails only the call that ran into it, the automaton remains usable for
 * other inputs.<br>
 *
 * @param <Q> type of the state identifiers
 * @param <S> type of the input symbols
 */
public final class Automaton<Q, S> {
  private static final Logger logger = LogManager.getLogger(Automaton.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final Set<Q> states;
  private final Set<S> alphabet;
  private final Q initial;
  private final Set<Q> finals;
  // K=(state, symbol), V=next state. Built once by the builder, never modified afterwards.
  private final Map<TransitionKey<Q, S>, Q> transitionTable;
  private final boolean complete;

  Automaton(final Set<Q> states, final Set<S> alphabet, final Q initial, final Set<Q> finals,
      final Map<TransitionKey<Q, S>, Q> transitionTable) {
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
    this.initial = initial;
    this.finals = Collections.unmodifiableSet(new LinkedHashSet<>(finals));
    this.transitionTable = Collections.unmodifiableMap(new LinkedHashMap<>(transitionTable));
    this.complete = this.transitionTable.size() == this.states.size() * this.alphabet.size();
    logInfo(automatonId, String.format(
        "Built automaton with %d states, %d symbols, %d final states, %d transitions, complete:%s",
        this.states.size(), this.alphabet.size(), this.finals.size(), this.transitionTable.size(),
        complete));
  }

  /**
   * Build and validate an automaton from a nested transition table where
   * {@code transitions.get(q).get(a)} is δ(q, a).
   *
   * Duplicates in {@code states}, {@code alphabet} and {@code finals} are coalesced. If
   * {@code requireComplete} is set, every (state, symbol) pair of Q × Σ must have an entry.
   */
  public static <Q, S> Automaton<Q, S> create(final Collection<Q> states,
      final Collection<S> alphabet, final Q initial, final Collection<Q> finals,
      final Map<Q, ? extends Map<S, Q>> transitions, final boolean requireComplete)
      throws AutomatonException {
    return AutomatonBuilder.<Q, S>newBuilder().states(states).alphabet(alphabet).initial(initial)
        .finals(finals).transitions(transitions).requireComplete(requireComplete).build();
  }

  /**
   * Apply a single transition: q' = δ(q, a). Fails with {@link Code#UNDEFINED_TRANSITION} if the
   * table has no entry for the pair, whether because the automaton is incomplete or because the
   * state or symbol is not part of it at all.
   */
  public Q step(final Q currentState, final S symbol) throws AutomatonException {
    final Q nextState = currentState == null || symbol == null ? null
        : transitionTable.get(TransitionKey.of(currentState, symbol));
    if (nextState == null) {
      throw AutomatonException.ofTransition(Code.UNDEFINED_TRANSITION, currentState, symbol, null);
    }
    if (logger.isDebugEnabled()) {
      logDebug(automatonId,
          String.format("Stepped %s -%s-> %s", currentState, symbol, nextState));
    }
    return nextState;
  }

  /**
   * Consume the input sequence from the initial state and return the state it ends in. An empty
   * input yields the initial state.
   *
   * Fails fast on the first undefined transition. The thrown exception reports the state reached
   * right before the failing step via {@link AutomatonException#getState()} and the index of the
   * failing symbol via {@link AutomatonException#getPosition()}.
   */
  public Q run(final List<S> input) throws AutomatonException {
    if (input == null) {
      throw new IllegalArgumentException("Input sequence cannot be null");
    }
    Q currentState = initial;
    int position = 0;
    for (final S symbol : input) {
      try {
        currentState = step(currentState, symbol);
      } catch (AutomatonException undefined) {
        logDebug(automatonId, String.format("Run stopped at input position %d in state %s",
            position, currentState));
        throw AutomatonException.atPosition(undefined, position);
      }
      position++;
    }
    return currentState;
  }

  /**
   * Run the input and report whether the final state is accepting, along with the final state.
   * Failures from {@link #run(List)} propagate unchanged.
   */
  public RunResult<Q> accepts(final List<S> input) throws AutomatonException {
    final Q finalState = run(input);
    return new RunResult<>(finals.contains(finalState), finalState);
  }

  /**
   * Recognizer view of the automaton: an undefined transition counts as rejection rather than a
   * failure. Useful for automata built without requiring completeness.
   */
  public boolean matches(final List<S> input) {
    try {
      return accepts(input).isAccepted();
    } catch (AutomatonException undefined) {
      logDebug(automatonId, "Rejecting input, " + undefined.getMessage());
      return false;
    }
  }

  /**
   * Report the route of states visited while consuming the input, starting with the initial state.
   * The returned list has one more element than the input.
   */
  public List<Q> trace(final List<S> input) throws AutomatonException {
    if (input == null) {
      throw new IllegalArgumentException("Input sequence cannot be null");
    }
    final List<Q> route = new ArrayList<>(input.size() + 1);
    Q currentState = initial;
    route.add(currentState);
    int position = 0;
    for (final S symbol : input) {
      try {
        currentState = step(currentState, symbol);
      } catch (AutomatonException undefined) {
        throw AutomatonException.atPosition(undefined, position);
      }
      route.add(currentState);
      position++;
    }
    return Collections.unmodifiableList(route);
  }

  public boolean isAccepting(final Q state) {
    return finals.contains(state);
  }

  public String getId() {
    return automatonId;
  }

  public Set<Q> getStates() {
    return states;
  }

  public Set<S> getAlphabet() {
    return alphabet;
  }

  public Q getInitialState() {
    return initial;
  }

  public Set<Q> getFinalStates() {
    return finals;
  }

  public Map<TransitionKey<Q, S>, Q> getTransitions() {
    return transitionTable;
  }

  /**
   * True iff δ is defined for every pair in Q × Σ, regardless of whether completeness was
   * required at build time.
   */
  public boolean isComplete() {
    return complete;
  }

  @Override
  public String toString() {
    return "Automaton [id=" + automatonId + ", states=" + states + ", alphabet=" + alphabet
        + ", initial=" + initial + ", finals=" + finals + ", transitions=" + transitionTable + "]";
  }

  private static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }
}
