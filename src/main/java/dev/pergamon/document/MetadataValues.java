package dev.pergamon.document;

import dev.langchain4j.data.document.Metadata;

/** Lenient readers for document metadata values, which may be strings or numbers. */
public final class MetadataValues {

  private MetadataValues() {}

  /**
   * Returns the first present value among {@code keys} rendered as a string, or {@code ""} when
   * none of the keys is present.
   */
  public static String text(Metadata metadata, String... keys) {
    for (String key : keys) {
      Object value = metadata.toMap().get(key);
      if (value != null) {
        return value.toString();
      }
    }
    return "";
  }
}
