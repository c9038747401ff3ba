package dev.pergamon.search;

/** Empty or malformed caller input, rejected before any sub-search runs. */
public class InvalidQueryException extends SearchException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
