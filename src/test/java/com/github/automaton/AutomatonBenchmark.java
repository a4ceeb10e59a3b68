package com.github.automaton;

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;

import com.github.automaton.PowerOfTwoDetector.Bit;
import com.github.automaton.PowerOfTwoDetector.PowerStatus;

@State(Scope.Thread)
public class AutomatonBenchmark {
  private final List<Bit> input = PowerOfTwoDetector.encode(1 << 20);

  @Benchmark
  public boolean testPowerOfTwoDetector() throws AutomatonException {
    // 1. build the automaton
    final Automaton<PowerStatus, Bit> automaton = PowerOfTwoDetector.newAutomaton();

    // 2. run it
    return automaton.execute(input);
  }

  public static void main(String args[]) throws AutomatonException {
    AutomatonBenchmark benchmark = new AutomatonBenchmark();
    benchmark.testPowerOfTwoDetector();
  }

}
