package io.itemsapi.items.service.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.itemsapi.platform.starter.error.web.autoconfig.ErrorExceptionAdvice;
import net.logstash.logback.marker.SingleFieldAppendingMarker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext
class RequestLoggingTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper json;

  private final Logger adviceLog = (Logger) LoggerFactory.getLogger(ErrorExceptionAdvice.class);
  private final Logger controllerLog = (Logger) LoggerFactory.getLogger(ItemController.class);
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void attach() {
    appender =
        new ListAppender<>() {
          @Override
          protected void append(ILoggingEvent e) {
            e.prepareForDeferredProcessing();
            super.append(e);
          }
        };
    appender.start();
    adviceLog.addAppender(appender);
    controllerLog.addAppender(appender);
  }

  @AfterEach
  void detach() {
    adviceLog.detachAppender(appender);
    controllerLog.detachAppender(appender);
  }

  @Test
  void listIsLoggedOnceAtInfo() throws Exception {
    String requestId = requestId(mvc.perform(get("/api/items")).andReturn().getResponse());

    assertThat(appender.list).hasSize(1);
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.INFO);
    assertThat(event.getFormattedMessage()).isEqualTo("Fetching all items");
    assertThat(event.getMDCPropertyMap()).containsEntry("request_id", requestId);
  }

  @Test
  void createIsLoggedWithTheNewItemId() throws Exception {
    MockHttpServletResponse res =
        mvc.perform(
                post("/api/items")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\":\"Logged\"}"))
            .andReturn()
            .getResponse();
    long id = json.readTree(res.getContentAsString()).get("id").asLong();

    assertThat(appender.list).hasSize(1);
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.INFO);
    assertThat(event.getFormattedMessage()).isEqualTo("Created item " + id);
    assertThat(event.getMDCPropertyMap()).containsEntry("request_id", requestId(res));
    assertItemIdArgument(event, id);
  }

  @Test
  void deleteIsLoggedBeforeAndAfterRemoval() throws Exception {
    long id =
        json.readTree(
                mvc.perform(
                        post("/api/items")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Doomed\"}"))
                    .andReturn()
                    .getResponse()
                    .getContentAsString())
            .get("id")
            .asLong();
    appender.list.clear();

    String requestId =
        requestId(mvc.perform(delete("/api/items/" + id)).andReturn().getResponse());

    assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .containsExactly("Deleting item " + id, "Deleted item " + id);
    assertThat(appender.list)
        .allSatisfy(
            e -> {
              assertThat(e.getLevel()).isEqualTo(Level.INFO);
              assertThat(e.getMDCPropertyMap()).containsEntry("request_id", requestId);
              assertItemIdArgument(e, id);
            });
  }

  @Test
  void missingItemIsWarnedUnderTheResponseRequestId() throws Exception {
    String requestId =
        requestId(mvc.perform(get("/api/items/404")).andReturn().getResponse());

    assertThat(appender.list)
        .extracting(ILoggingEvent::getFormattedMessage)
        .containsExactly("Fetching item 404", "Item 404 not found");
    assertThat(appender.list)
        .allSatisfy(e -> assertThat(e.getMDCPropertyMap()).containsEntry("request_id", requestId));
    assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.WARN);
  }

  @Test
  void validationFailureIsLoggedAtError() throws Exception {
    mvc.perform(post("/api/items").contentType(MediaType.APPLICATION_JSON).content("{}"));

    assertThat(appender.list).hasSize(1);
    assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.ERROR);
  }

  private static String requestId(MockHttpServletResponse res) {
    String id = res.getHeader("X-Request-Id");
    assertThat(id).isNotBlank();
    return id;
  }

  private static void assertItemIdArgument(ILoggingEvent event, long id) {
    assertThat(event.getArgumentArray())
        .hasSize(1)
        .allSatisfy(
            arg -> {
              assertThat(arg).isInstanceOf(SingleFieldAppendingMarker.class);
              assertThat(((SingleFieldAppendingMarker) arg).getFieldName()).isEqualTo("item_id");
              assertThat(arg.toString()).isEqualTo(Long.toString(id));
            });
  }
}
