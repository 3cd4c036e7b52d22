package com.openforge.clarifier.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.clarifier.config.AppConfig;
import com.openforge.clarifier.llm.model.ChatRequest;
import com.openforge.clarifier.llm.model.Message;
import com.openforge.clarifier.support.TestLlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmClientTest {

    private static final ChatRequest REQUEST =
            ChatRequest.of("test/model", List.of(Message.user("hi")), 0.7, 100);

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private LlmClient client;

    @BeforeEach
    void setUp() {
        client = new LlmClient(httpClient, objectMapper, TestLlmProperties.create());
    }

    @Test
    void shouldReturnTrimmedContentOfFirstChoice() throws Exception {
        respond(200, """
                {"id":"x","model":"test/model","choices":[{"index":0,"message":{"role":"assistant","content":"  Hello there \\n"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":3,"completion_tokens":2,"total_tokens":5}}""");

        String content = client.complete(REQUEST, Duration.ofSeconds(3));

        assertThat(content).isEqualTo("Hello there");
        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(sent.capture(), any());
        assertThat(sent.getValue().uri().toString()).endsWith("/chat/completions");
        assertThat(sent.getValue().headers().firstValue("Authorization")).hasValue("Bearer test-key");
        assertThat(sent.getValue().timeout()).hasValue(Duration.ofSeconds(3));
    }

    @Test
    void shouldFailBeforeNetworkWhenApiKeyMissing() {
        LlmClient unconfigured = new LlmClient(httpClient, objectMapper,
                new LlmProperties("http://localhost", " ", null, null, null));

        assertThatThrownBy(() -> unconfigured.complete(REQUEST, Duration.ofSeconds(1)))
                .isInstanceOf(LlmException.class)
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.MISSING_API_KEY);
        verifyNoInteractions(httpClient);
    }

    @Test
    void shouldClassifyHttpErrors() throws Exception {
        respond(429, "{\"error\":{\"message\":\"Rate limit exceeded\"}}");

        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .isInstanceOf(LlmException.class)
                .satisfies(e -> {
                    LlmException le = (LlmException) e;
                    assertThat(le.kind()).isEqualTo(LlmErrorKind.RATE_LIMITED);
                    assertThat(le.httpStatus()).isEqualTo(429);
                    assertThat(le.retryable()).isFalse();
                });
    }

    @Test
    void shouldTreatBlankContentAsEmptyResponse() throws Exception {
        respond(200, "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"   \"}}]}");

        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.EMPTY_RESPONSE);
    }

    @Test
    void shouldTreatMissingChoicesAsEmptyResponse() throws Exception {
        respond(200, "{\"id\":\"x\",\"choices\":[]}");

        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.EMPTY_RESPONSE);
    }

    @Test
    void shouldReportUnparseableBodyAsInvalidResponse() throws Exception {
        respond(200, "<html>gateway</html>");

        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.INVALID_RESPONSE);
    }

    @Test
    void shouldMapTransportFailures() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());
        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.TIMEOUT);

        doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());
        assertThatThrownBy(() -> client.complete(REQUEST, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.NETWORK);
    }

    @Test
    void shouldRequireModel() {
        ChatRequest noModel = REQUEST.toBuilder().model(" ").build();

        assertThatThrownBy(() -> client.complete(noModel, Duration.ofSeconds(1)))
                .extracting(e -> ((LlmException) e).kind())
                .isEqualTo(LlmErrorKind.BAD_REQUEST);
        verifyNoInteractions(httpClient);
    }

    private void respond(int status, String body) throws Exception {
        when(httpResponse.statusCode()).thenReturn(status);
        when(httpResponse.body()).thenReturn(body);
        doReturn(httpResponse).when(httpClient).send(any(), any());
    }
}
