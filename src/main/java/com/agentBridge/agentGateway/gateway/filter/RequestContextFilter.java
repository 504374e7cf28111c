package com.agentBridge.agentGateway.gateway.filter;

import com.agentBridge.agentGateway.audit.AuditRecord;
import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.context.RequestContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Creates the {@link RequestContext} for every HTTP request.
 *
 * Responsibilities:
 * - Take the request id from {@code x-request-id} (or generate one) and echo it back
 * - Take the session id from {@code x-session-id}
 * - Bind the context to the handling thread (and the MDC)
 * - Write one {@code request_completed} record when the response is done
 */
@Slf4j
@RequiredArgsConstructor
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String SESSION_ID_HEADER = "x-session-id";
    public static final String CONTEXT_ATTRIBUTE = RequestContext.class.getName();

    private final LogSink logSink;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        RequestContext context = RequestContext.builder()
                .requestId(request.getHeader(REQUEST_ID_HEADER))
                .sessionId(blankToNull(request.getHeader(SESSION_ID_HEADER)))
                .path(request.getRequestURI())
                .method(request.getMethod())
                .userAgent(request.getHeader("User-Agent"))
                .clientIp(request.getRemoteAddr())
                .build();
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        response.setHeader(REQUEST_ID_HEADER, context.getRequestId());

        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(context)) {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            context.recordError(e);
            record(context, 500);
            throw e;
        }
        record(context, response.getStatus());
    }

    /**
     * Context of the current request, as created by this filter.
     */
    public static RequestContext contextOf(HttpServletRequest request) {
        Object context = request.getAttribute(CONTEXT_ATTRIBUTE);
        if (context instanceof RequestContext requestContext) {
            return requestContext;
        }
        return RequestContext.builder()
                .requestId(request.getHeader(REQUEST_ID_HEADER))
                .sessionId(blankToNull(request.getHeader(SESSION_ID_HEADER)))
                .path(request.getRequestURI())
                .method(request.getMethod())
                .build();
    }

    private void record(RequestContext context, int status) {
        AuditRecord.Outcome outcome = status >= 500
                ? AuditRecord.Outcome.FAILURE
                : status >= 400 || context.isCanceled() ? AuditRecord.Outcome.WARNING : AuditRecord.Outcome.SUCCESS;
        try (RequestContextHolder.Scope ignored = RequestContextHolder.bind(context)) {
            logSink.record(AuditRecord.builder(AuditRecord.REQUEST_COMPLETED)
                    .outcome(outcome)
                    .fields(context.toLogMap())
                    .field("status", status)
                    .field("user_agent", context.getUserAgent())
                    .field("client_ip", context.getClientIp())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Log sink failed to record request completion - requestId: {}", context.getRequestId(), e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
