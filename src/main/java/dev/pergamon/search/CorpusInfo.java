package dev.pergamon.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Summary of the searchable corpus.
 *
 * @param totalDocuments number of stored documents, 0 when the store is unavailable
 * @param sampleMetadataKeys distinct metadata keys of the first few documents
 * @param error store failure description, null when the store answered
 */
public record CorpusInfo(
    long totalDocuments, List<String> sampleMetadataKeys, @Nullable String error) {}
