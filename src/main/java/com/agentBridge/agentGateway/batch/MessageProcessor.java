package com.agentBridge.agentGateway.batch;

import com.agentBridge.agentGateway.cancellation.CancellationToken;
import com.agentBridge.agentGateway.context.RequestContext;
import com.agentBridge.agentGateway.gateway.dto.MessagesRequest;
import com.agentBridge.agentGateway.gateway.dto.MessagesResponse;

/**
 * Non-streaming message execution used for batch entries: acquire a session,
 * invoke the backend, release the session.
 */
@FunctionalInterface
public interface MessageProcessor {

    MessagesResponse process(MessagesRequest request, RequestContext context, CancellationToken cancellation);
}
