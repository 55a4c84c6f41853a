package com.sds.phucth.sessioncontext.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.sessioncontext.config.JacksonConfig;
import com.sds.phucth.sessioncontext.dto.DispatchResult;
import java.net.SocketTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class WebhookDispatcherTest {

    private static final String WEBHOOK = "http://automation.local/webhook/actions";

    private MockRestServiceServer server;
    private WebhookDispatcher dispatcher;
    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        dispatcher = new WebhookDispatcher(builder.build(), objectMapper, WEBHOOK);
    }

    @Test
    @DisplayName("Posts the payload as JSON with session and intent headers")
    void postsPayload() {
        server.expect(requestTo(WEBHOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Session-Id", "s1"))
                .andExpect(header("X-Intent", "send_email"))
                .andExpect(content().json("{\"recipient\":\"bob@x.com\",\"subject\":\"Hello Bob\"}"))
                .andRespond(withSuccess("{\"executionId\":\"42\"}", MediaType.APPLICATION_JSON));

        DispatchResult result = dispatcher.send("s1", "send_email",
                Map.of("recipient", "bob@x.com", "subject", "Hello Bob"));

        server.verify();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHttpStatus()).isEqualTo(200);
        assertThat(result.getResponse()).containsEntry("executionId", "42");
    }

    @Test
    @DisplayName("Non-JSON response body is kept as a message")
    void plainTextBody() {
        server.expect(requestTo(WEBHOOK))
                .andRespond(withSuccess("Workflow was started", MediaType.TEXT_PLAIN));

        DispatchResult result = dispatcher.send("s1", "send_email", Map.of());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse()).containsEntry("message", "Workflow was started");
    }

    @Test
    @DisplayName("Server error is a structured failure and is not retried")
    void serverErrorNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(WEBHOOK))
                .andRespond(withServerError());

        DispatchResult result = dispatcher.send("s1", "send_email", Map.of("a", 1));

        server.verify();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatus()).isEqualTo(500);
        assertThat(result.getError()).contains("HTTP 500");
    }

    @Test
    @DisplayName("Client error is a structured failure")
    void clientError() {
        server.expect(requestTo(WEBHOOK)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        DispatchResult result = dispatcher.send("s1", "send_email", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("Timeout is a structured failure, nothing is thrown")
    void timeout() {
        server.expect(requestTo(WEBHOOK)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        DispatchResult result = dispatcher.send("s1", "send_email", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatus()).isNull();
        assertThat(result.getError()).isEqualTo("Automation webhook timed out");
    }

    @Test
    @DisplayName("Missing webhook URL fails without any request")
    void notConfigured() {
        WebhookDispatcher unconfigured = new WebhookDispatcher(RestClient.create(), objectMapper, " ");

        DispatchResult result = unconfigured.send("s1", "send_email", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("not configured");
    }
}
