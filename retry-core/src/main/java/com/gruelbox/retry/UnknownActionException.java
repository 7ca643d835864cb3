package com.gruelbox.retry;

/** Thrown when a {@link NamedActionRetrier} is asked to run an action nobody registered. */
public class UnknownActionException extends IllegalArgumentException {

  public UnknownActionException(String actionName) {
    super("No action registered with name '" + actionName + "'");
  }
}
