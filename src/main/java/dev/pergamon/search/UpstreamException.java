package dev.pergamon.search;

/**
 * The vector store, embedding model or document store failed or violated its contract.
 *
 * <p>Thrown by individual sub-searches, where it degrades that sub-search to an empty
 * contribution. Surfaces to the caller only when every launched sub-search failed.
 */
public class UpstreamException extends SearchException {

  public UpstreamException(String message) {
    super(message);
  }

  public UpstreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
