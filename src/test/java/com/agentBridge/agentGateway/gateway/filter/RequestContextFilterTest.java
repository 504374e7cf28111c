package com.agentBridge.agentGateway.gateway.filter;

import com.agentBridge.agentGateway.audit.AuditRecord;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import com.agentBridge.agentGateway.support.RecordingLogSink;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestContextFilterTest {

    private final RecordingLogSink sink = new RecordingLogSink();
    private final RequestContextFilter filter = new RequestContextFilter(sink);

    private static MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/messages");
        request.addHeader("User-Agent", "test-agent");
        request.setRemoteAddr("10.0.0.7");
        return request;
    }

    @Test
    void bindsContextForTheChainAndRecordsCompletion() throws Exception {
        MockHttpServletRequest request = request();
        request.addHeader(RequestContextFilter.REQUEST_ID_HEADER, "req_given");
        request.addHeader(RequestContextFilter.SESSION_ID_HEADER, " chat-1 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<RequestContext> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new jakarta.servlet.http.HttpServlet() {
            @Override
            protected void service(jakarta.servlet.http.HttpServletRequest req, HttpServletResponse res) {
                seen.set(RequestContextHolder.current());
                res.setStatus(201);
            }
        }));

        assertThat(seen.get()).isSameAs(RequestContextFilter.contextOf(request));
        assertThat(seen.get().getSessionId()).isEqualTo("chat-1");
        assertThat(response.getHeader(RequestContextFilter.REQUEST_ID_HEADER)).isEqualTo("req_given");
        assertThat(RequestContextHolder.current()).isNull();

        AuditRecord record = sink.records(AuditRecord.REQUEST_COMPLETED).get(0);
        assertThat(record.get("request_id")).isEqualTo("req_given");
        assertThat(record.get("path")).isEqualTo("/v1/messages");
        assertThat(record.get("status")).isEqualTo(201);
        assertThat(record.get("user_agent")).isEqualTo("test-agent");
        assertThat(record.get("client_ip")).isEqualTo("10.0.0.7");
    }

    @Test
    void blankSessionHeaderMeansAnonymous() throws Exception {
        MockHttpServletRequest request = request();
        request.addHeader(RequestContextFilter.SESSION_ID_HEADER, "   ");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(RequestContextFilter.contextOf(request).getSessionId()).isNull();
        assertThat(RequestContextFilter.contextOf(request).getRequestId()).startsWith("req_");
    }

    @Test
    void chainFailureIsRecordedAsServerError() {
        MockHttpServletRequest request = request();
        MockFilterChain failing = new MockFilterChain(new jakarta.servlet.http.HttpServlet() {
            @Override
            protected void service(jakarta.servlet.http.HttpServletRequest req, HttpServletResponse res) {
                throw new IllegalStateException("handler exploded");
            }
        });

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class);

        AuditRecord record = sink.records(AuditRecord.REQUEST_COMPLETED).get(0);
        assertThat(record.get("status")).isEqualTo(500);
        assertThat((String) record.get("error")).contains("handler exploded");
        assertThat(record.getOutcome()).isEqualTo(AuditRecord.Outcome.FAILURE);
    }

    @Test
    void contextOfFallsBackOutsideTheFilter() {
        MockHttpServletRequest request = request();
        request.addHeader(RequestContextFilter.REQUEST_ID_HEADER, "req_late");

        RequestContext context = RequestContextFilter.contextOf(request);

        assertThat(context.getRequestId()).isEqualTo("req_late");
        assertThat(context.getPath()).isEqualTo("/v1/messages");
    }
}
