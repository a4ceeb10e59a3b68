package com.github.automaton;

/**
 * Unified single exception that's thrown and handled by this automaton. The idea is to use the code
 * enum to encapsulate various error conditions. Exceptions raised by user-supplied Status and
 * Transition roles are never wrapped into this one, they surface exactly as thrown.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNHANDLED_TRANSITION("No transition is defined for the given status and symbol"),
    // 2.
    INVALID_STATUS("Null status is invalid"),
    // 3.
    INVALID_ROLES("Status and Transition roles must both be supplied and consistent"),
    // 4.
    INVALID_INPUT("Null input sequence is invalid"),
    // 5.
    INVALID_MACHINE_CONFIG("Automaton configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
