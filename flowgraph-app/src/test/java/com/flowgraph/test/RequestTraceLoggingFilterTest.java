package com.flowgraph.test;

import com.flowgraph.api.response.Response;
import com.flowgraph.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(new RequestTraceLoggingFilter())
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(get("/api/test/trace"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.data").isNotEmpty());
    }

    @Test
    public void shouldPropagateIncomingTraceId() throws Exception {
        mockMvc.perform(get("/api/test/trace").header("X-Trace-Id", "trace-123"))
                .andExpect(header().string("X-Trace-Id", "trace-123"))
                .andExpect(jsonPath("$.data").value("trace-123"));
    }

    @Test
    public void shouldSkipNonApiPath() throws Exception {
        mockMvc.perform(get("/actuator/ping"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @RestController
    private static class TestController {

        @GetMapping("/api/test/trace")
        public Response<String> trace() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data(MDC.get("traceId"))
                    .build();
        }

        @GetMapping("/actuator/ping")
        public Response<String> ping() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("pong")
                    .build();
        }
    }
}
