package com.pipewright.orchestrator.api;

import com.pipewright.orchestrator.tool.ToolException;
import com.pipewright.orchestrator.tool.ToolManifest;
import com.pipewright.orchestrator.tool.ToolScope;
import com.pipewright.orchestrator.tool.ToolScopeGate;
import com.pipewright.orchestrator.tool.ToolScopeViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired MockMvc        mockMvc;
    @MockitoBean ToolScopeGate gate;

    @Test
    void list_passesTheCallerTaskId() throws Exception {
        when(gate.listTools("t1")).thenReturn(List.of(new ToolManifest(
                "write_result", "1.0.0", "write_result(result: str) -> dict", "Store findings", ToolScope.SHARED)));

        mockMvc.perform(get("/tools").header(ToolController.TASK_ID_HEADER, "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("write_result"))
                .andExpect(jsonPath("$[0].scope").value("SHARED"));
    }

    @Test
    void call_returnsTheToolResult() throws Exception {
        when(gate.call(eq("t1"), eq("write_result"), any())).thenReturn(Map.of("task_id", "t1", "stored", true));

        mockMvc.perform(post("/tools/{name}", "write_result")
                        .header(ToolController.TASK_ID_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"done\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored").value(true));
    }

    @Test
    void call_scopeViolation_returns403() throws Exception {
        when(gate.call(isNull(), eq("set_process_decision"), any()))
                .thenThrow(new ToolScopeViolationException(null, "set_process_decision"));

        mockMvc.perform(post("/tools/{name}", "set_process_decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"abort\",\"reasoning\":\"no\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("scope_violation"));
    }

    @Test
    void call_badArguments_returns400() throws Exception {
        when(gate.call(eq("t1"), eq("load_result"), any()))
                .thenThrow(new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "give exactly one"));

        mockMvc.perform(post("/tools/{name}", "load_result")
                        .header(ToolController.TASK_ID_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_arguments"));
    }
}
