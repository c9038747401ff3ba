package dev.pergamon.search;

/** The calling thread was interrupted while the search was in flight. */
public class SearchCancelledException extends SearchException {

  public SearchCancelledException(String message) {
    super(message);
  }

  public SearchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
