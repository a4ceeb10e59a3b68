package com.github.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.github.automaton.AutomatonException.Code;

/**
 * A {@link Status} defined by an initial status and an explicit set of final statuses.
 */
public final class FinalStatuses<S> implements Status<S> {
  private final S initialStatus;
  private final Set<S> finalStatuses;

  private FinalStatuses(final S initialStatus, final Set<S> finalStatuses) {
    this.initialStatus = initialStatus;
    this.finalStatuses = Collections.unmodifiableSet(finalStatuses);
  }

  @SafeVarargs
  public static <S> FinalStatuses<S> of(final S initialStatus, final S... finalStatuses)
      throws AutomatonException {
    if (initialStatus == null || finalStatuses == null) {
      throw new AutomatonException(Code.INVALID_STATUS);
    }
    final Set<S> finals = new HashSet<>(Arrays.asList(finalStatuses));
    if (finals.contains(null)) {
      throw new AutomatonException(Code.INVALID_STATUS);
    }
    return new FinalStatuses<>(initialStatus, finals);
  }

  @Override
  public S initial() {
    return initialStatus;
  }

  @Override
  public boolean isFinal(final S status) {
    return finalStatuses.contains(status);
  }

  public Set<S> getFinalStatuses() {
    return finalStatuses;
  }

  @Override
  public String toString() {
    return "FinalStatuses [initialStatus=" + initialStatus + ", finalStatuses=" + finalStatuses
        + "]";
  }

}
