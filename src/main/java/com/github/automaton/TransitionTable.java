package com.github.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.automaton.AutomatonException.Code;

/**
 * A {@link Transition} backed by an explicit table of (status, symbol) -> status entries. Looking up
 * a pair the table does not define fails with {@link Code#UNHANDLED_TRANSITION}, it never falls
 * back to some default status.
 * 
 * Tables are immutable once built and may be shared across automatons and threads.
 */
public final class TransitionTable<S, A> implements Transition<S, A> {
  // K=(fromStatus, symbol), V=toStatus
  private final Map<Pair<S, A>, S> table;

  private TransitionTable(final Map<Pair<S, A>, S> table) {
    this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
  }

  @Override
  public S next(final S status, final A symbol) throws AutomatonException {
    final S toStatus = table.get(Pair.of(status, symbol));
    if (toStatus == null) {
      throw new AutomatonException(Code.UNHANDLED_TRANSITION,
          "No transition defined for " + Pair.of(status, symbol));
    }
    return toStatus;
  }

  /**
   * Verify that every combination of the given statuses and symbols has an entry. Throws
   * {@link Code#UNHANDLED_TRANSITION} naming the first missing pair.
   */
  public void checkTotal(final Collection<S> statuses, final Collection<A> symbols)
      throws AutomatonException {
    for (final S status : statuses) {
      for (final A symbol : symbols) {
        if (!table.containsKey(Pair.of(status, symbol))) {
          throw new AutomatonException(Code.UNHANDLED_TRANSITION,
              "Transition table is not total, missing " + Pair.of(status, symbol));
        }
      }
    }
  }

  public int size() {
    return table.size();
  }

  @Override
  public String toString() {
    return "TransitionTable " + table;
  }

  public static <S, A> TransitionTableBuilder<S, A> newBuilder() {
    return new TransitionTableBuilder<>();
  }

  /**
   * Fluent builder, reads as {@code from(s1).on(one).to(s2).on(zero).to(s1).from(s2)...}.
   */
  public final static class TransitionTableBuilder<S, A> {
    private final Map<Pair<S, A>, S> table = new LinkedHashMap<>();
    private S fromStatus;
    private A symbol;

    public TransitionTableBuilder<S, A> from(final S fromStatus) {
      this.fromStatus = fromStatus;
      this.symbol = null;
      return this;
    }

    public TransitionTableBuilder<S, A> on(final A symbol) {
      this.symbol = symbol;
      return this;
    }

    /**
     * Completes the pending from/on pair. Redefining a pair with the same target is tolerated,
     * with a different target it is not.
     */
    public TransitionTableBuilder<S, A> to(final S toStatus) throws AutomatonException {
      if (fromStatus == null || symbol == null || toStatus == null) {
        throw new AutomatonException(Code.INVALID_ROLES, String
            .format("Incomplete transition entry: %s x %s -> %s", fromStatus, symbol, toStatus));
      }
      final Pair<S, A> key = Pair.of(fromStatus, symbol);
      final S existing = table.putIfAbsent(key, toStatus);
      if (existing != null && !existing.equals(toStatus)) {
        throw new AutomatonException(Code.INVALID_ROLES, String
            .format("Conflicting transitions for %s: %s and %s", key, existing, toStatus));
      }
      symbol = null;
      return this;
    }

    public TransitionTable<S, A> build() {
      return new TransitionTable<>(table);
    }

    private TransitionTableBuilder() {}
  }

}
