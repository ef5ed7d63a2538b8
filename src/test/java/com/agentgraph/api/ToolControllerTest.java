package com.agentgraph.api;

import com.agentgraph.support.RecordingTool;
import com.agentgraph.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ToolRegistry toolRegistry;

    @Test
    void testListTools() throws Exception {
        when(toolRegistry.getAll()).thenReturn(List.of(
                RecordingTool.returning("web_search", ""), RecordingTool.returning("rag_retrieval", "")));

        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("web_search"))
                .andExpect(jsonPath("$[1].description").value("Test tool rag_retrieval"));
    }
}
