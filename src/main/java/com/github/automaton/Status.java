package com.github.automaton;

/**
 * The Status role of an automaton: it fixes the type that represents automaton state, the state
 * every run starts from and which states are accepting.
 * 
 * Implementations are meant to be stateless, so a single instance may back any number of
 * automatons. Status values themselves should be immutable and support equals(), an enum being the
 * natural fit.
 */
public interface Status<S> {

  /**
   * The fixed starting status. Must never return null.
   */
  S initial();

  /**
   * Pure predicate telling whether the given status is a final (accepting) one. Must be defined for
   * every status reachable from {@link #initial()}.
   */
  boolean isFinal(final S status);

}
