package io.b2mash.b2b.artifactstore.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.artifactstore.exception.InvalidDescriptorException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class DataUriTest {

  @Test
  void parse_base64Payload() {
    var data = DataUri.parse("data:application/pdf;base64,JVBERi0xLjQ=");

    assertThat(data.mimeType()).isEqualTo("application/pdf");
    assertThat(new String(data.content(), StandardCharsets.US_ASCII)).isEqualTo("%PDF-1.4");
  }

  @Test
  void parse_percentEncodedPayload() {
    var data = DataUri.parse("data:text/plain;charset=utf-8,a%20b+c");

    assertThat(data.mimeType()).isEqualTo("text/plain");
    assertThat(new String(data.content(), StandardCharsets.UTF_8)).isEqualTo("a b+c");
  }

  @Test
  void parse_percentEncodedBinaryKeepsHighBytes() {
    var data = DataUri.parse("data:application/octet-stream,%89PNG%FF");

    assertThat(data.content()).containsExactly(0x89, 'P', 'N', 'G', 0xFF);
  }

  @Test
  void parse_unescapedTextIsUtf8() {
    var data = DataUri.parse("data:text/plain,caf\u00e9%21");

    assertThat(new String(data.content(), StandardCharsets.UTF_8)).isEqualTo("caf\u00e9!");
  }

  @Test
  void parse_missingMimeType() {
    assertThat(DataUri.parse("data:,x").mimeType()).isNull();
  }

  @Test
  void parse_rejectsMalformedInput() {
    assertThatThrownBy(() -> DataUri.parse("https://example.com/a.pdf"))
        .isInstanceOf(InvalidDescriptorException.class);
    assertThatThrownBy(() -> DataUri.parse("data:application/pdf;base64"))
        .isInstanceOf(InvalidDescriptorException.class);
    assertThatThrownBy(() -> DataUri.parse("data:text/plain,100%"))
        .isInstanceOf(InvalidDescriptorException.class);
    assertThatThrownBy(() -> DataUri.parse("data:text/plain,%zz"))
        .isInstanceOf(InvalidDescriptorException.class);
  }
}
