package com.github.dfa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.dfa.AutomatonException.Code;

/**
 * Tests to maintain the sanity and correctness of automaton definition validation.
 */
public class AutomatonBuilderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2.properties");
  }

  private static AutomatonBuilder<Integer, Character> singleState() {
    return AutomatonBuilder.<Integer, Character>newBuilder().states(0).alphabet('a').initial(0)
        .finals(0);
  }

  private static Code failureOf(final AutomatonBuilder<?, ?> builder) {
    return assertThrows(AutomatonException.class, builder::build).getCode();
  }

  @Test
  public void testValidDefinition() throws AutomatonException {
    final Automaton<Integer, Character> automaton =
        singleState().transition(0, 'a', 0).requireComplete(true).build();
    assertEquals(Collections.singleton(0), automaton.getStates());
    assertEquals(Collections.singleton('a'), automaton.getAlphabet());
    assertEquals(Integer.valueOf(0), automaton.getInitialState());
    assertEquals(Collections.singleton(0), automaton.getFinalStates());
    assertEquals(Integer.valueOf(0), automaton.getTransitions().get(TransitionKey.of(0, 'a')));
    assertTrue(automaton.isComplete());
  }

  @Test
  public void testDuplicatesAreCoalesced() throws AutomatonException {
    final Automaton<Integer, Character> automaton = AutomatonBuilder
        .<Integer, Character>newBuilder().states(Arrays.asList(0, 1, 0, 1))
        .alphabet(Arrays.asList('a', 'a')).initial(0).finals(Arrays.asList(1, 1))
        .transition(0, 'a', 1).transition(1, 'a', 0).transition(0, 'a', 1).requireComplete(true)
        .build();
    assertEquals(Arrays.asList(0, 1), Arrays.asList(automaton.getStates().toArray()));
    assertEquals(1, automaton.getAlphabet().size());
    assertEquals(1, automaton.getFinalStates().size());
    assertEquals(2, automaton.getTransitions().size());
  }

  @Test
  public void testUnknownInitialState() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().initial(1).transition(0, 'a', 0).requireComplete(true).build());
    assertEquals(Code.UNKNOWN_INITIAL_STATE, problem.getCode());
    assertEquals(1, problem.getState());
  }

  @Test
  public void testUnknownFinalState() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().finals(1).transition(0, 'a', 0).requireComplete(true).build());
    assertEquals(Code.UNKNOWN_FINAL_STATE, problem.getCode());
    assertEquals(1, problem.getState());
  }

  @Test
  public void testUnknownSourceState() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().transition(0, 'a', 0).transition(7, 'a', 0).build());
    assertEquals(Code.UNKNOWN_SOURCE_STATE, problem.getCode());
    assertEquals(7, problem.getState());
    assertEquals('a', problem.getSymbol());
  }

  @Test
  public void testUnknownSymbol() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().transition(0, 'a', 0).transition(0, 'b', 0).requireComplete(true)
            .build());
    assertEquals(Code.UNKNOWN_SYMBOL, problem.getCode());
    assertEquals(0, problem.getState());
    assertEquals('b', problem.getSymbol());
  }

  @Test
  public void testUnknownTargetState() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().transition(0, 'a', 1).requireComplete(true).build());
    assertEquals(Code.UNKNOWN_TARGET_STATE, problem.getCode());
    assertEquals(1, problem.getTarget());
  }

  @Test
  public void testRequireComplete() throws AutomatonException {
    // missing transition for 'b'
    final AutomatonBuilder<Integer, Character> builder = AutomatonBuilder
        .<Integer, Character>newBuilder().states(0).alphabet('a', 'b').initial(0).finals(0)
        .transition(0, 'a', 0);

    final AutomatonException problem =
        assertThrows(AutomatonException.class, () -> builder.requireComplete(true).build());
    assertEquals(Code.INCOMPLETE_TRANSITION_FUNCTION, problem.getCode());
    assertEquals(0, problem.getState());
    assertEquals('b', problem.getSymbol());
    assertTrue(problem.getCode().isConstructionFailure());

    // same definition is fine when completeness is not required
    final Automaton<Integer, Character> partial = builder.requireComplete(false).build();
    assertFalse(partial.isComplete());
    final AutomatonException undefined =
        assertThrows(AutomatonException.class, () -> partial.step(0, 'b'));
    assertEquals(Code.UNDEFINED_TRANSITION, undefined.getCode());
  }

  @Test
  public void testIncompleteReportsFirstMissingPairInDefinitionOrder() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> AutomatonBuilder.<String, Integer>newBuilder().states("x", "y", "z")
            .alphabet(1, 2).initial("x").finals().transition("x", 1, "y").transition("x", 2, "z")
            .transition("y", 1, "x").transition("z", 1, "x").transition("z", 2, "x")
            .requireComplete(true).build());
    assertEquals(Code.INCOMPLETE_TRANSITION_FUNCTION, problem.getCode());
    assertEquals("y", problem.getState());
    assertEquals(2, problem.getSymbol());
    assertNull(problem.getTarget());
  }

  @Test
  public void testConflictingTransition() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> AutomatonBuilder.<Integer, Character>newBuilder().states(0, 1).alphabet('a')
            .initial(0).finals(1).transition(0, 'a', 0).transition(0, 'a', 1).build());
    assertEquals(Code.CONFLICTING_TRANSITION, problem.getCode());
    assertEquals(0, problem.getState());
    assertEquals('a', problem.getSymbol());
    assertEquals(1, problem.getTarget());
  }

  @Test
  public void testNullParts() {
    assertEquals(Code.INVALID_DEFINITION, failureOf(singleState().initial(null)));
    assertEquals(Code.INVALID_DEFINITION,
        failureOf(singleState().states(Arrays.asList(1, null))));
    assertEquals(Code.INVALID_DEFINITION,
        failureOf(singleState().alphabet((Collection<Character>) null)));
    assertEquals(Code.INVALID_DEFINITION, failureOf(singleState().transition(0, null, 0)));
    assertEquals(Code.INVALID_DEFINITION,
        failureOf(singleState().transitions((Map<Integer, Map<Character, Integer>>) null)));
  }

  @Test
  public void testEmptyDefinitionHasNoInitialState() {
    assertEquals(Code.UNKNOWN_INITIAL_STATE,
        failureOf(AutomatonBuilder.<Integer, Character>newBuilder().initial(0)));
  }

  @Test
  public void testEmptyAlphabetIsCompleteWithoutTransitions() throws AutomatonException {
    final Automaton<Integer, Character> automaton = AutomatonBuilder
        .<Integer, Character>newBuilder().states(0).initial(0).requireComplete(true).build();
    assertTrue(automaton.isComplete());
    assertEquals(Integer.valueOf(0), automaton.run(Collections.<Character>emptyList()));
    assertFalse(automaton.accepts(Collections.<Character>emptyList()).isAccepted());
  }

  @Test
  public void testCreateFromNestedTable() throws AutomatonException {
    final Map<String, Map<Character, String>> delta = new LinkedHashMap<>();
    final Map<Character, String> fromOff = new HashMap<>();
    fromOff.put('t', "on");
    delta.put("off", fromOff);
    final Map<Character, String> fromOn = new HashMap<>();
    fromOn.put('t', "off");
    delta.put("on", fromOn);

    final List<String> states = Arrays.asList("off", "on");
    final Automaton<String, Character> toggle = Automaton.create(states,
        Collections.singletonList('t'), "off", Collections.singletonList("on"), delta, true);
    assertEquals("on", toggle.run(Arrays.asList('t', 't', 't')));
    assertTrue(toggle.accepts(Arrays.asList('t')).isAccepted());

    // drop a row, completeness now fails
    delta.remove("on");
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> Automaton.create(states, Collections.singletonList('t'), "off",
            Collections.singletonList("on"), delta, true));
    assertEquals(Code.INCOMPLETE_TRANSITION_FUNCTION, problem.getCode());
    assertEquals("on", problem.getState());
  }

  @Test
  public void testEmptyRowForUnknownStateIsRejected() {
    final Map<Integer, Map<Character, Integer>> delta = new LinkedHashMap<>();
    delta.put(0, Collections.singletonMap('a', 0));
    // typo'd state with nothing in its row
    delta.put(99, Collections.<Character, Integer>emptyMap());

    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> Automaton.create(Collections.singletonList(0), Collections.singletonList('a'), 0,
            Collections.singletonList(0), delta, true));
    assertEquals(Code.UNKNOWN_SOURCE_STATE, problem.getCode());
    assertEquals(99, problem.getState());
    assertNull(problem.getSymbol());

    // same through the builder, completeness not required
    assertEquals(Code.UNKNOWN_SOURCE_STATE,
        failureOf(singleState().row(99, Collections.<Character, Integer>emptyMap())));
  }

  @Test
  public void testNullRowOwnerIsRejected() {
    assertEquals(Code.INVALID_DEFINITION,
        failureOf(singleState().row(null, Collections.<Character, Integer>emptyMap())));
  }

  @Test
  public void testValidationOrder() {
    // initial is checked before finals, finals before transitions
    assertEquals(Code.UNKNOWN_INITIAL_STATE,
        failureOf(singleState().initial(5).finals(6).transition(7, 'z', 8)));
    assertEquals(Code.UNKNOWN_FINAL_STATE,
        failureOf(singleState().finals(6).transition(7, 'z', 8)));
    assertEquals(Code.UNKNOWN_SOURCE_STATE, failureOf(singleState().transition(7, 'z', 8)));
    assertEquals(Code.UNKNOWN_SYMBOL, failureOf(singleState().transition(0, 'z', 8)));
  }

  @Test
  public void testErrorMessageCarriesPayload() {
    final AutomatonException problem = assertThrows(AutomatonException.class,
        () -> singleState().transition(0, 'q', 0).build());
    assertEquals(Code.UNKNOWN_SYMBOL.getDescription() + " [state=0, symbol=q, target=0]",
        problem.getMessage());
    assertEquals(-1, problem.getPosition());
  }
}
