package com.flowgraph.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.test.support.EngineFixture;
import com.flowgraph.test.support.ScriptedModelGateway;
import com.flowgraph.trigger.application.common.WorkflowViewAssembler;
import com.flowgraph.trigger.application.workflow.WorkflowExecutionApplicationService;
import com.flowgraph.trigger.http.GlobalApiExceptionHandler;
import com.flowgraph.trigger.http.WorkflowController;
import com.flowgraph.types.enums.NodeTypeEnum;
import com.flowgraph.types.enums.ResponseCode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.flowgraph.test.support.GraphDefinitions.config;
import static com.flowgraph.test.support.GraphDefinitions.graph;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class WorkflowControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EngineFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        fixture = new EngineFixture(ScriptedModelGateway.echo());
        fixture.definitions().save("linear", graph()
                .node("start", "start")
                .node("answer", "llm")
                .node("end", "end")
                .edge("start", "answer")
                .edge("answer", "end")
                .build());
        fixture.definitions().save("review", graph()
                .node("start", "start")
                .node("gate", "human", config("interaction_type", "input", "prompt", "Comment?"))
                .node("end", "end", config("output_variable", "gate.feedback"))
                .edge("start", "gate")
                .edge("gate", "end")
                .build());

        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", new SimpleMeterRegistry());
        WorkflowExecutionApplicationService service = new WorkflowExecutionApplicationService(fixture.engine(),
                fixture.parser(), fixture.registry(), fixture.definitions(), beanFactory.getBeanProvider(MeterRegistry.class));
        WorkflowController controller = new WorkflowController(service, new WorkflowViewAssembler(), Runnable::run);
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    private String runBody(String threadId, Map<String, Object> inputs) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("threadId", threadId);
        body.put("userId", "tester");
        body.put("inputs", inputs);
        return objectMapper.writeValueAsString(body);
    }

    @Test
    public void shouldRunStoredWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/linear/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(runBody("t-1", Map.of("message", "hi"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.output").value("reply:hi"))
                .andExpect(jsonPath("$.data.steps").value(3))
                .andExpect(jsonPath("$.data.threadId").value("t-1"))
                .andExpect(jsonPath("$.data.events[0].type").value("workflow_start"));
    }

    @Test
    public void shouldRunWithoutBodyThroughInvoke() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/linear/invoke"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.output").value("reply:"));
    }

    @Test
    public void shouldReturnBusinessCodeForUnknownWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/absent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(runBody("t-1", Map.of())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.WORKFLOW_NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("Workflow not found: absent"));
    }

    @Test
    public void shouldSuspendInspectAndResume() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/review/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(runBody("t-h", Map.of("message", "draft v1"))))
                .andExpect(jsonPath("$.data.status").value("suspended"))
                .andExpect(jsonPath("$.data.pendingNodes[0]").value("gate"));

        mockMvc.perform(get("/api/v1/workflows/review/state").param("threadId", "t-h"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.nextNodes[0]").value("gate"))
                .andExpect(jsonPath("$.data.stepIndex").value(1))
                .andExpect(jsonPath("$.data.messages[0].role").value("human"))
                .andExpect(jsonPath("$.data.messages[0].content").value("draft v1"));

        mockMvc.perform(post("/api/v1/workflows/review/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threadId\":\"t-h\",\"feedback\":\"ship it\"}"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.output").value("ship it"));

        mockMvc.perform(get("/api/v1/workflows/review/history").param("threadId", "t-h").param("limit", "2"))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].stepIndex").value(3));

        mockMvc.perform(post("/api/v1/workflows/review/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threadId\":\"t-h\",\"feedback\":\"again\"}"))
                .andExpect(jsonPath("$.code").value(ResponseCode.RUN_NOT_SUSPENDED.getCode()));
    }

    @Test
    public void shouldRejectMissingThreadId() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/review/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
        mockMvc.perform(post("/api/v1/workflows/review/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedback\":\"x\"}"))
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("threadId is required"));
        mockMvc.perform(get("/api/v1/workflows/review/state").param("threadId", "ghost"))
                .andExpect(jsonPath("$.code").value(ResponseCode.THREAD_NOT_FOUND.getCode()));
    }

    @Test
    public void shouldValidateDefinition() throws Exception {
        String definition = objectMapper.writeValueAsString(graph()
                .node("start", "start")
                .node("orphan", "llm")
                .build());

        mockMvc.perform(post("/api/v1/workflows/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(definition))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.nodeCount").value(2))
                .andExpect(jsonPath("$.data.errors[0]").value("Workflow must have at least one end node"))
                .andExpect(jsonPath("$.data.warnings.length()").value(2));
    }

    @Test
    public void shouldListNodeTypes() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/node-types"))
                .andExpect(jsonPath("$.data.length()").value(NodeTypeEnum.values().length))
                .andExpect(jsonPath("$.data[0].type").value("start"))
                .andExpect(jsonPath("$.data[2].router").value(true));
    }

    @Test
    public void shouldRegisterDefinitionThenRunIt() throws Exception {
        String valid = objectMapper.writeValueAsString(graph()
                .node("start", "start")
                .node("end", "end")
                .edge("start", "end")
                .build());
        String invalid = objectMapper.writeValueAsString(graph().node("start", "start").build());

        mockMvc.perform(put("/api/v1/workflows/fresh/definition")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(valid))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.valid").value(true));
        mockMvc.perform(put("/api/v1/workflows/broken/definition")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(invalid))
                .andExpect(jsonPath("$.code").value(ResponseCode.GRAPH_CONFIG_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value("Workflow must have at least one end node"));

        mockMvc.perform(post("/api/v1/workflows/fresh/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(runBody("t-1", Map.of("message", "ping"))))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.output").value("ping"));
        Assertions.assertNull(fixture.definitions().findById("broken"));
    }

    @Test
    public void shouldStreamEventsAsServerSentEvents() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/workflows/linear/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(runBody("t-s", Map.of("message", "hi"))))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        Assertions.assertTrue(body.contains("event:workflow_start"));
        Assertions.assertTrue(body.contains("event:token"));
        Assertions.assertTrue(body.contains("event:workflow_end"));
        Assertions.assertEquals("no-cache, no-transform", result.getResponse().getHeader("Cache-Control"));
    }

    @Test
    public void shouldStreamErrorEventForUnknownWorkflow() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/workflows/absent/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(runBody("t-s", Map.of())))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        Assertions.assertTrue(body.contains("event:error"));
        Assertions.assertTrue(body.contains(ResponseCode.WORKFLOW_NOT_FOUND.getCode()));
    }
}
