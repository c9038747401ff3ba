package dev.pergamon.document;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link DocumentChunk} entities. Only read methods are used. */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {}
