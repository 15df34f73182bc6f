package io.itemsapi.platform.domain.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.itemsapi.platform.domain.error.ProblemTypes.ProblemType;
import io.itemsapi.platform.domain.error.ProblemTypes.Severity;
import org.junit.jupiter.api.Test;

class ProblemTypesTest {

  @Test
  void clientMessagesAndStatusesAreFixed() {
    assertThat(ProblemTypes.ITEM_NOT_FOUND)
        .extracting(ProblemType::message, ProblemType::status, ProblemType::severity)
        .containsExactly("Item not found", 404, Severity.WARN);
    assertThat(ProblemTypes.NAME_REQUIRED)
        .extracting(ProblemType::message, ProblemType::status, ProblemType::severity)
        .containsExactly("Name is required", 400, Severity.ERROR);
    assertThat(ProblemTypes.ROUTE_NOT_FOUND)
        .extracting(ProblemType::message, ProblemType::status)
        .containsExactly("Endpoint not found", 404);
    assertThat(ProblemTypes.INTERNAL_ERROR)
        .extracting(ProblemType::message, ProblemType::status, ProblemType::severity)
        .containsExactly("Internal server error", 500, Severity.ERROR);
  }

  @Test
  void statusOnlyFailuresResolveToCatalogEntries() {
    assertThat(ProblemTypes.forStatus(404, "Not Found")).isSameAs(ProblemTypes.ROUTE_NOT_FOUND);
    assertThat(ProblemTypes.forStatus(405, "Method Not Allowed"))
        .isSameAs(ProblemTypes.METHOD_NOT_ALLOWED);
    assertThat(ProblemTypes.forStatus(415, "Unsupported Media Type"))
        .isSameAs(ProblemTypes.UNSUPPORTED_MEDIA_TYPE);
    assertThat(ProblemTypes.forStatus(503, "Service Unavailable"))
        .isSameAs(ProblemTypes.INTERNAL_ERROR);
    assertThat(ProblemTypes.forStatus(302, "Found")).isSameAs(ProblemTypes.INTERNAL_ERROR);
  }

  @Test
  void otherClientStatusesGetAnAdHocType() {
    ProblemType conflict = ProblemTypes.forStatus(409, "Conflict");

    assertThat(conflict)
        .extracting(ProblemType::slug, ProblemType::message, ProblemType::status)
        .containsExactly("http-409", "Conflict", 409);
    assertThat(conflict.severity()).isEqualTo(Severity.WARN);
    assertThat(conflict.isServerError()).isFalse();
    assertThat(ProblemTypes.forStatus(418, null).message())
        .isEqualTo("Request could not be processed");
  }

  @Test
  void rejectsNonErrorStatus() {
    assertThatThrownBy(() -> new ProblemType("ok", "OK", 200, Severity.WARN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
