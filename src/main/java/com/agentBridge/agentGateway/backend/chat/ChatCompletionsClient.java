package com.agentBridge.agentGateway.backend.chat;

import com.agentBridge.agentGateway.backend.chat.dto.ChatCompletionsRequest;
import com.agentBridge.agentGateway.backend.chat.dto.ChatCompletionsResponse;
import com.agentBridge.agentGateway.backend.exception.BackendRejectedException;
import com.agentBridge.agentGateway.backend.exception.BackendTimeoutException;
import com.agentBridge.agentGateway.backend.exception.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Client for an OpenAI-style chat completions endpoint.
 * Handles HTTP communication and maps transport failures onto backend exceptions.
 */
@Slf4j
public class ChatCompletionsClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestClient restClient;
    private final String apiKey;

    public ChatCompletionsClient(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
    }

    ChatCompletionsClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    /**
     * Calls the completions endpoint once.
     *
     * @param request Chat completions request
     * @return Parsed response, never null
     * @throws BackendRejectedException on 4xx responses
     * @throws BackendTimeoutException when the read timeout elapses
     * @throws BackendUnavailableException on 5xx responses, I/O failures or an empty body
     */
    public ChatCompletionsResponse complete(ChatCompletionsRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendUnavailableException("Backend API key is not configured. Set gateway.backend.api-key");
        }

        try {
            log.debug("Calling chat completions - model: {}, messages: {}",
                    request.getModel(), request.getMessages() != null ? request.getMessages().size() : 0);

            ChatCompletionsResponse response = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionsResponse.class);

            if (response == null) {
                throw new BackendUnavailableException("Chat completions returned an empty response");
            }

            log.debug("Chat completions response received - model: {}, tokens used: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

            return response;

        } catch (HttpClientErrorException e) {
            log.warn("Chat completions rejected request - status: {}", e.getStatusCode());
            throw new BackendRejectedException(e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        } catch (HttpServerErrorException e) {
            log.warn("Chat completions failed - status: {}", e.getStatusCode());
            throw new BackendUnavailableException("Backend error " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new BackendTimeoutException("Backend did not answer in time", e);
            }
            throw new BackendUnavailableException("Backend unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Error calling chat completions", e);
            throw new BackendUnavailableException("Failed to call backend: " + e.getMessage(), e);
        }
    }
}
