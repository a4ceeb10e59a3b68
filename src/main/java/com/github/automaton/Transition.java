package com.github.automaton;

/**
 * The Transition role of an automaton: the pure function that computes the next status from the
 * current status and one input symbol.
 * 
 * The function must be deterministic and total over every (status, symbol) pair reachable from the
 * initial status. An implementation that cannot cover a pair must throw an
 * {@link AutomatonException} with {@link AutomatonException.Code#UNHANDLED_TRANSITION} rather than
 * guess a next status. Whatever is thrown from here is propagated to the caller of
 * {@link Automaton#execute(java.util.List)} unchanged.
 */
public interface Transition<S, A> {

  S next(final S status, final A symbol) throws AutomatonException;

}
