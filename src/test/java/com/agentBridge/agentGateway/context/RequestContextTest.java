package com.agentBridge.agentGateway.context;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void generatesRequestIdWhenMissing() {
        RequestContext context = RequestContext.builder().path("/v1/messages").method("POST").build();

        assertThat(context.getRequestId()).matches("req_[0-9a-f]{12}");
        assertThat(RequestContext.builder().requestId(" ").build().getRequestId()).startsWith("req_");
        assertThat(RequestContext.builder().requestId("req_client").build().getRequestId()).isEqualTo("req_client");
    }

    @Test
    void tokenTotalsOnlyMoveUpward() {
        RequestContext context = RequestContext.builder().build();

        context.raiseTokensIn(10);
        context.raiseTokensIn(4);
        context.raiseTokensOut(3);
        context.addTokensOut(2);

        assertThat(context.getTokensIn()).isEqualTo(10);
        assertThat(context.getTokensOut()).isEqualTo(5);
        assertThat(context.getTotalTokens()).isEqualTo(15);
    }

    @Test
    void logMapKeepsFieldOrderAndOmitsUnsetCancel() {
        RequestContext context = RequestContext.builder()
                .requestId("req_1")
                .sessionId("chat-1")
                .path("/v1/messages")
                .method("POST")
                .model("test-model")
                .build();
        context.addTokens(7, 2);
        context.recordError(new IllegalStateException("broken"));

        Map<String, Object> fields = context.toLogMap();

        assertThat(fields.keySet()).containsExactly("request_id", "session_id", "path", "method", "model",
                "duration_ms", "tokens_in", "tokens_out", "stream", "canceled", "disconnect_reason", "error");
        assertThat(fields).containsEntry("tokens_in", 7L)
                .containsEntry("canceled", null)
                .containsEntry("error", "IllegalStateException: broken");

        context.markCanceled();
        assertThat(context.toLogMap()).containsEntry("canceled", Boolean.TRUE);
    }

    @Test
    void holderBindsContextAndMdcUntilScopeCloses() {
        RequestContext outer = RequestContext.builder().requestId("req_outer").sessionId("s-1").build();
        RequestContext inner = RequestContext.builder().requestId("req_inner").build();

        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(outer)) {
            assertThat(RequestContextHolder.current()).isSameAs(outer);
            assertThat(MDC.get(RequestContextHolder.MDC_SESSION_ID)).isEqualTo("s-1");

            try (RequestContextHolder.Scope nested = RequestContextHolder.bind(inner)) {
                assertThat(MDC.get(RequestContextHolder.MDC_REQUEST_ID)).isEqualTo("req_inner");
                assertThat(MDC.get(RequestContextHolder.MDC_SESSION_ID)).isNull();
            }

            assertThat(RequestContextHolder.current()).isSameAs(outer);
            assertThat(MDC.get(RequestContextHolder.MDC_REQUEST_ID)).isEqualTo("req_outer");
        }

        assertThat(RequestContextHolder.current()).isNull();
        assertThat(MDC.get(RequestContextHolder.MDC_REQUEST_ID)).isNull();
    }
}
