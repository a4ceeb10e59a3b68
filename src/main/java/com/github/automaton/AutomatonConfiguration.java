package com.github.automaton;

/**
 * This class encapsulates all the configuration parameters for an Automaton. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. routeCapacity bounds the number of recent statuses an automaton remembers for
 * {@link Automaton#getStatusRoute()}. If this is not set, the last 100 statuses are kept. Setting it
 * to 0 switches route tracking off.<br>
 * 2. resetToInitialOnFailure makes the automaton fall back to its initial status when the
 * Transition role throws. Otherwise the automaton stays at the last status it successfully
 * reached. Either way the failure itself is rethrown untouched.<br>
 * 
 * @author gaurav
 */
public final class AutomatonConfiguration {
  final static int defaultRouteCapacity = 100;

  private final int routeCapacity;
  private final boolean resetToInitialOnFailure;

  public int getRouteCapacity() {
    return routeCapacity;
  }

  public boolean getResetToInitialOnFailure() {
    return resetToInitialOnFailure;
  }

  public final static class AutomatonConfigurationBuilder {
    private int routeCapacity = defaultRouteCapacity;
    private boolean resetToInitialOnFailure;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder routeCapacity(int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public AutomatonConfigurationBuilder resetToInitialOnFailure(boolean resetToInitialOnFailure) {
      this.resetToInitialOnFailure = resetToInitialOnFailure;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config =
          new AutomatonConfiguration(routeCapacity, resetToInitialOnFailure);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (routeCapacity < 0) {
      messages.append("RouteCapacity cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [routeCapacity=" + routeCapacity + ", resetToInitialOnFailure="
        + resetToInitialOnFailure + "]";
  }

  private AutomatonConfiguration(final int routeCapacity, final boolean resetToInitialOnFailure) {
    this.routeCapacity = routeCapacity;
    this.resetToInitialOnFailure = resetToInitialOnFailure;
  }

}
