package io.intellixity.sqlgrammar.plan;

/**
 * Raised when a query plan cannot be compiled because its shape is wrong
 * (endpoint or tuple arity, non-integer raw lists, empty nested groups, ...).
 * <p>
 * Signals a defect in whatever built the plan, never a data problem.
 */
public final class MalformedPlanException extends RuntimeException {
  public MalformedPlanException(String message) {
    super(message);
  }

  public MalformedPlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
