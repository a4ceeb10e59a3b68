package com.github.automaton;

import java.util.Objects;

/**
 * An immutable (status, symbol) key of a {@link TransitionTable}.
 */
public final class Pair<S, A> {
  private final S status;
  private final A symbol;

  private Pair(S status, A symbol) {
    this.status = status;
    this.symbol = symbol;
  }

  public S getStatus() {
    return status;
  }

  public A getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Pair)) {
      return false;
    }
    Pair<?, ?> pair = (Pair<?, ?>) o;
    return Objects.equals(status, pair.status) && Objects.equals(symbol, pair.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, symbol);
  }

  @Override
  public String toString() {
    return "(" + status + ", " + symbol + ")";
  }

  public static <S, A> Pair<S, A> of(S status, A symbol) {
    return new Pair<>(status, symbol);
  }
}
