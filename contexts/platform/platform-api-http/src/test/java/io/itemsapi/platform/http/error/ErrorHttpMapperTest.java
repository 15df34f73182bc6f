package io.itemsapi.platform.http.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.itemsapi.platform.domain.error.ProblemTypes;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

class ErrorHttpMapperTest {

  private final ErrorHttpMapper mapper = new ErrorHttpMapper();

  @Test
  void rendersFixedMessageStatusAndJsonContentType() {
    ResponseEntity<ErrorPayload> res = mapper.toResponse(ProblemTypes.ITEM_NOT_FOUND);

    assertThat(res.getStatusCode().value()).isEqualTo(404);
    assertThat(res.getBody()).isEqualTo(new ErrorPayload("Item not found"));
    assertThat(res.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
  }

  @Test
  void keepsExtraHeaders() {
    HttpHeaders headers = new HttpHeaders();
    headers.setAllow(Set.of(HttpMethod.GET));

    ResponseEntity<ErrorPayload> res = mapper.toResponse(ProblemTypes.METHOD_NOT_ALLOWED, headers);

    assertThat(res.getStatusCode().value()).isEqualTo(405);
    assertThat(res.getHeaders().getAllow()).containsExactly(HttpMethod.GET);
    assertThat(res.getBody().error()).isEqualTo("Method not allowed");
  }
}
