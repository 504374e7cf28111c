package com.agentBridge.agentGateway.context;

import org.slf4j.MDC;

/**
 * Binds the current {@link RequestContext} to the executing thread and mirrors its
 * identifiers into the SLF4J MDC.
 *
 * Work handed to another thread (stream pulls, batch entries) re-binds the context
 * explicitly with {@link #bind(RequestContext)}.
 */
public final class RequestContextHolder {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SESSION_ID = "sessionId";

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static RequestContext current() {
        return CURRENT.get();
    }

    /**
     * Binds the context to the current thread until the returned scope is closed,
     * restoring whatever was bound before.
     */
    public static Scope bind(RequestContext context) {
        RequestContext previous = CURRENT.get();
        set(context);
        return () -> set(previous);
    }

    private static void set(RequestContext context) {
        if (context == null) {
            CURRENT.remove();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_SESSION_ID);
            return;
        }
        CURRENT.set(context);
        MDC.put(MDC_REQUEST_ID, context.getRequestId());
        if (context.getSessionId() != null) {
            MDC.put(MDC_SESSION_ID, context.getSessionId());
        } else {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    /**
     * Binding scope; closing it restores the previous binding.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
