package com.agentBridge.agentGateway;

import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.batch.BatchProcessingEngine;
import com.agentBridge.agentGateway.gateway.filter.RequestContextFilter;
import com.agentBridge.agentGateway.session.SessionPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "gateway.session.max-sessions=7",
        "gateway.batch.concurrency=3",
        "gateway.backend.api-key="
})
@AutoConfigureMockMvc
class AgentGatewayApplicationTest {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private MockMvc mvc;

    @Autowired
    private SessionPool sessionPool;

    @Autowired
    private BatchProcessingEngine batchEngine;

    @Autowired
    private BackendOptions backendOptions;

    @Test
    void contextStartsPoolAndEngineFromProperties() {
        assertThat(sessionPool.isRunning()).isTrue();
        assertThat(sessionPool.stats().getCapacity()).isEqualTo(7);
        assertThat(batchEngine.stats().getConcurrency()).isEqualTo(3);
    }

    @Test
    void requestContextFilterBeanDoesNotClashWithSpringsOwnFilter() {
        assertThat(applicationContext.containsBean("gatewayRequestContextFilter")).isTrue();
        FilterRegistrationBean<?> registration =
                applicationContext.getBean("gatewayRequestContextFilter", FilterRegistrationBean.class);
        assertThat(registration.getFilter()).isInstanceOf(RequestContextFilter.class);
    }

    @Test
    void modelsListTheDefaultBackendModelFirst() throws Exception {
        mvc.perform(get("/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value(backendOptions.getModel()));
    }

    @Test
    void healthIsServedThroughTheFilter() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(header().string("x-request-id", startsWith("req_")))
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.sessions.capacity").value(7));
    }

    @Test
    void missingBackendKeySurfacesAsServiceUnavailable() throws Exception {
        mvc.perform(post("/v1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"m\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.type").value("api_error"));
    }
}
