package com.github.automaton;

import java.util.List;

/**
 * A deterministic finite-state automaton over statuses of type S and input symbols of type A.
 * 
 * Notes for users:<br>
 * 1. an automaton instance is NOT thread-safe. It owns exactly one current status and nothing is
 * shared between instances, so if several threads need to run the same automaton definition, each
 * one should build its own instance.<br>
 * 
 * 2. the Status and Transition roles themselves are intended to be stateless and reusable. All
 * state is held within the automaton itself and doesn't spill out, so the same pair of roles may
 * back as many automatons as needed.<br>
 * 
 * 3. {@link #execute(List)} is cumulative: it continues from whatever status the previous call left
 * behind. Only {@link #reset()} returns the automaton to the initial status.<br>
 * 
 * @author gaurav
 */
public interface Automaton<S, A> {

  /**
   * Set the current status back to the initial status of the Status role.
   */
  void reset();

  /**
   * Feed every symbol of the input, left to right, through the Transition role starting from the
   * current status and report whether the status reached is final. An empty input leaves the
   * status untouched.
   * 
   * Exceptions thrown by the Transition role are rethrown as is.
   */
  boolean execute(final List<A> input) throws AutomatonException;

  /**
   * Read/report the current status of the automaton. Never null.
   */
  S readCurrentStatus();

  /**
   * Pull the most recent statuses held by this automaton, oldest first and the current status
   * last. The route is bounded by {@link AutomatonConfiguration#getRouteCapacity()}, everything
   * prior will have been pruned.
   */
  List<S> getStatusRoute();

  /**
   * Reports the id of this automaton instance.
   */
  String getId();

  /**
   * Returns the config that this automaton is wired with.
   */
  AutomatonConfiguration getConfiguration();

  /**
   * Report statistics for this automaton.
   */
  AutomatonStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build automatons.
   */
  public final static class AutomatonBuilder<S, A> {
    private AutomatonConfiguration config;
    private Status<S> status;
    private Transition<S, A> transition;

    public static <S, A> AutomatonBuilder<S, A> newBuilder() {
      return new AutomatonBuilder<>();
    }

    public AutomatonBuilder<S, A> config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomatonBuilder<S, A> status(final Status<S> status) {
      this.status = status;
      return this;
    }

    public AutomatonBuilder<S, A> transition(final Transition<S, A> transition) {
      this.transition = transition;
      return this;
    }

    public Automaton<S, A> build() throws AutomatonException {
      if (config == null) {
        config = AutomatonConfiguration.AutomatonConfigurationBuilder.newBuilder().build();
      }
      return new FiniteStateMachine<>(config, status, transition);
    }

    private AutomatonBuilder() {}
  }

}
