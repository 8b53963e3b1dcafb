package com.github.dfa;

/**
 * Unified single exception that's thrown by the automaton, both while validating a definition and
 * while executing input against it. The code enum tells callers what went wrong; the payload
 * fields tell them where.
 *
 * Payload fields are optional and only populated where meaningful for the code:<br>
 * 1. {@link #getState()} is the offending state, or for {@link Code#UNDEFINED_TRANSITION} the
 * state the automaton was in when it hit the missing transition<br>
 * 2. {@link #getSymbol()} is the offending symbol<br>
 * 3. {@link #getTarget()} is the offending target state of a transition entry<br>
 * 4. {@link #getPosition()} is the zero-based input index of the failing symbol during a run, -1
 * otherwise<br>
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final transient Object state;
  private final transient Object symbol;
  private final transient Object target;
  private final int position;

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.state = null;
    this.symbol = null;
    this.target = null;
    this.position = -1;
  }

  public AutomatonException(final Code code, final Object state, final Object symbol,
      final Object target, final int position) {
    super(describe(code, state, symbol, target, position));
    this.code = code;
    this.state = state;
    this.symbol = symbol;
    this.target = target;
    this.position = position;
  }

  static AutomatonException ofState(final Code code, final Object state) {
    return new AutomatonException(code, state, null, null, -1);
  }

  static AutomatonException ofTransition(final Code code, final Object state, final Object symbol,
      final Object target) {
    return new AutomatonException(code, state, symbol, target, -1);
  }

  /**
   * Re-raise an undefined transition hit while consuming the symbol at {@code position}.
   */
  static AutomatonException atPosition(final AutomatonException cause, final int position) {
    return new AutomatonException(cause.code, cause.state, cause.symbol, cause.target, position);
  }

  public Code getCode() {
    return code;
  }

  public Object getState() {
    return state;
  }

  public Object getSymbol() {
    return symbol;
  }

  public Object getTarget() {
    return target;
  }

  public int getPosition() {
    return position;
  }

  private static String describe(final Code code, final Object state, final Object symbol,
      final Object target, final int position) {
    final StringBuilder message = new StringBuilder(code.getDescription());
    if (state != null || symbol != null || target != null) {
      message.append(" [");
      String separator = "";
      if (state != null) {
        message.append("state=").append(state);
        separator = ", ";
      }
      if (symbol != null) {
        message.append(separator).append("symbol=").append(symbol);
        separator = ", ";
      }
      if (target != null) {
        message.append(separator).append("target=").append(target);
      }
      message.append(']');
    }
    if (position >= 0) {
      message.append(" at input position ").append(position);
    }
    return message.toString();
  }

  public static enum Code {
    // 1.
    INVALID_DEFINITION("Automaton definition has null or missing parts"),
    // 2.
    CONFLICTING_TRANSITION("Transition table maps one (state, symbol) pair to different states"),
    // 3.
    UNKNOWN_INITIAL_STATE("Initial state is not a member of the set of states"),
    // 4.
    UNKNOWN_FINAL_STATE("Final state is not a member of the set of states"),
    // 5.
    UNKNOWN_SOURCE_STATE("Transition source state is not a member of the set of states"),
    // 6.
    UNKNOWN_SYMBOL("Transition symbol is not a member of the alphabet"),
    // 7.
    UNKNOWN_TARGET_STATE("Transition target state is not a member of the set of states"),
    // 8.
    INCOMPLETE_TRANSITION_FUNCTION("Transition function is missing a (state, symbol) pair"),
    // 9.
    UNDEFINED_TRANSITION("No transition is defined for (state, symbol)");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }

    /**
     * True for the codes raised while validating a definition, false for execution-time codes.
     */
    public boolean isConstructionFailure() {
      return this != UNDEFINED_TRANSITION;
    }
  }

}
