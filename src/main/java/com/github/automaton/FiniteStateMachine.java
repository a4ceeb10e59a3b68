package com.github.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * A simple deterministic Finite State Machine, the engine behind every {@link Automaton}.
 * 
 * The machine is bound to one {@link Status} role and one {@link Transition} role at construction
 * and never swaps them. Apart from the current status (and the bounded route of recent statuses)
 * there is no modifiable state held by the machine, so any DFA expressible as an initial status, a
 * finality predicate and a transition function plugs in without touching this class.
 * 
 * Not thread-safe, see {@link Automaton}.
 * 
 * @author gaurav
 */
public final class FiniteStateMachine<S, A> implements Automaton<S, A> {
  private static final Logger logger =
      LogManager.getLogger(FiniteStateMachine.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final AutomatonConfiguration config;
  private final Status<S> status;
  private final Transition<S, A> transition;

  // never null once constructed
  private S currentStatus;

  // bounded by config.routeCapacity, oldest first
  private final Deque<S> statusRoute = new ArrayDeque<>();

  private final AutomatonStatistics statistics;

  FiniteStateMachine(final AutomatonConfiguration config, final Status<S> status,
      final Transition<S, A> transition) throws AutomatonException {
    if (config == null) {
      throw new AutomatonException(Code.INVALID_MACHINE_CONFIG);
    }
    if (status == null || transition == null) {
      throw new AutomatonException(Code.INVALID_ROLES);
    }
    this.config = config;
    this.status = status;
    this.transition = transition;
    this.statistics = new AutomatonStatistics(automatonId);

    final S initialStatus = status.initial();
    if (initialStatus == null) {
      throw new AutomatonException(Code.INVALID_STATUS, "Status role returned a null initial status");
    }
    enter(initialStatus);
    logInfo(automatonId, "Fired up automaton with " + config + ", initial status: " + initialStatus);
  }

  @Override
  public void reset() {
    final S initialStatus = status.initial();
    if (initialStatus == null) {
      throw new IllegalStateException(Code.INVALID_STATUS.getDescription());
    }
    statusRoute.clear();
    enter(initialStatus);
    statistics.resets++;
    logDebug(automatonId, "Reset to " + initialStatus);
  }

  @Override
  public boolean execute(final List<A> input) throws AutomatonException {
    if (input == null) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    statistics.executions++;
    final S startStatus = currentStatus;
    for (final A symbol : input) {
      final S fromStatus = currentStatus;
      try {
        final S toStatus = transition.next(fromStatus, symbol);
        if (toStatus == null) {
          throw new AutomatonException(Code.INVALID_STATUS, String
              .format("Transition role returned a null status for %s x %s", fromStatus, symbol));
        }
        enter(toStatus);
        statistics.consumedSymbols++;
        logDebug(automatonId, String.format("%s x %s -> %s", fromStatus, symbol, toStatus));
      } catch (AutomatonException | RuntimeException problem) {
        statistics.transitionFailures++;
        logError(automatonId,
            String.format("Failed to transition from %s on %s", fromStatus, symbol), problem);
        if (config.getResetToInitialOnFailure()) {
          reset();
        }
        throw problem;
      }
    }
    final boolean accepted = status.isFinal(currentStatus);
    if (accepted) {
      statistics.acceptances++;
    }
    logDebug(automatonId, String.format("Executed %d symbols, %s->%s, accepted:%s", input.size(),
        startStatus, currentStatus, accepted));
    return accepted;
  }

  @Override
  public S readCurrentStatus() {
    return currentStatus;
  }

  @Override
  public List<S> getStatusRoute() {
    return Collections.unmodifiableList(new ArrayList<>(statusRoute));
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return statistics;
  }

  private void enter(final S nextStatus) {
    currentStatus = nextStatus;
    final int routeCapacity = config.getRouteCapacity();
    if (routeCapacity > 0) {
      if (statusRoute.size() == routeCapacity) {
        statusRoute.pollFirst();
      }
      statusRoute.addLast(nextStatus);
    }
  }

  @Override
  public String toString() {
    return "FiniteStateMachine [automatonId=" + automatonId + ", currentStatus=" + currentStatus
        + "]";
  }

  private static void logError(final String automatonId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString(), error);
  }

  private static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }

}
