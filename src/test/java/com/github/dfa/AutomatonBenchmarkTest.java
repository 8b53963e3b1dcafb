package com.github.dfa;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Test;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class AutomatonBenchmarkTest {
  private final Automaton<String, Character> automaton = Automata.evenBs();
  private final List<Character> input = randomInput(10_000);

  private static List<Character> randomInput(final int length) {
    final Random random = new Random(42L);
    final List<Character> symbols = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      symbols.add(random.nextBoolean() ? 'a' : 'b');
    }
    return symbols;
  }

  @Benchmark
  public String benchmarkRun() throws AutomatonException {
    return automaton.run(input);
  }

  @Benchmark
  public Automaton<String, Character> benchmarkBuild() {
    return Automata.evenBs();
  }

  @Test
  public void testBenchmarkBodies() throws AutomatonException {
    int bs = 0;
    for (final Character symbol : input) {
      if (symbol == 'b') {
        bs++;
      }
    }
    assertEquals(bs % 2 == 0 ? "even" : "odd", benchmarkRun());
    assertEquals(automaton.getTransitions(), benchmarkBuild().getTransitions());
  }

  public static void main(String args[]) throws AutomatonException {
    AutomatonBenchmarkTest test = new AutomatonBenchmarkTest();
    test.benchmarkRun();
  }
}
