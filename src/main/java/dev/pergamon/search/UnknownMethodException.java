package dev.pergamon.search;

/** The caller named a search method that does not exist. */
public class UnknownMethodException extends SearchException {

  public UnknownMethodException(String method) {
    super("Unknown search method: " + method);
  }
}
