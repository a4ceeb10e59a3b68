package com.github.automaton;

/**
 * Simple statistics holder for an automaton. Counters are updated by the owning automaton only, on
 * the thread driving it.
 */
public final class AutomatonStatistics {
  private final String automatonId;
  private final long startTstampMillis = System.currentTimeMillis();
  int executions;
  int acceptances;
  int resets;
  int transitionFailures;
  long consumedSymbols;

  AutomatonStatistics(final String automatonId) {
    this.automatonId = automatonId;
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getExecutions() {
    return executions;
  }

  public int getAcceptances() {
    return acceptances;
  }

  public int getResets() {
    return resets;
  }

  public int getTransitionFailures() {
    return transitionFailures;
  }

  public long getConsumedSymbols() {
    return consumedSymbols;
  }

  @Override
  public String toString() {
    return "AutomatonStatistics [automatonId=" + automatonId + ", startTstampMillis="
        + startTstampMillis + ", executions=" + executions + ", acceptances=" + acceptances
        + ", resets=" + resets + ", transitionFailures=" + transitionFailures
        + ", consumedSymbols=" + consumedSymbols + "]";
  }

}
