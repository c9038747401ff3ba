package dev.pergamon.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.document.Metadata;
import org.junit.jupiter.api.Test;

class DocumentTest {

  @Test
  void blank_id_is_rejected() {
    assertThatThrownBy(() -> new Document(" ", "text", new Metadata()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void null_content_and_metadata_default_to_empty() {
    Document document = new Document("d1", null, null);

    assertThat(document.content()).isEmpty();
    assertThat(document.metadata().toMap()).isEmpty();
  }

  @Test
  void metadata_values_returns_first_present_key() {
    Metadata metadata = Metadata.from("source", "kisa.pdf").put("page", 3);

    assertThat(MetadataValues.text(metadata, "filename", "source")).isEqualTo("kisa.pdf");
    assertThat(MetadataValues.text(metadata, "page")).isEqualTo("3");
    assertThat(MetadataValues.text(metadata, "filename")).isEmpty();
  }
}
