package dev.pergamon.search;

/**
 * Base type for failures scoped to a single search invocation.
 *
 * <p>{@link SearchService#search(String, SearchOptions)} never lets these escape: they are turned
 * into an error envelope with {@code success=false}.
 */
public abstract class SearchException extends RuntimeException {

  protected SearchException(String message) {
    super(message);
  }

  protected SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
