package com.agentgraph.api;

import com.agentgraph.tools.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolInfo> list() {
        return toolRegistry.getAll().stream()
                .map(tool -> new ToolInfo(tool.name(), tool.description()))
                .toList();
    }

    public record ToolInfo(String name, String description) {
    }
}
