package com.agentgraph.config;

import com.agentgraph.stream.RunStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RunStreamWebSocketHandler runStreamWebSocketHandler;

    public WebSocketConfig(RunStreamWebSocketHandler runStreamWebSocketHandler) {
        this.runStreamWebSocketHandler = runStreamWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(runStreamWebSocketHandler, "/ws/stream")
                .setAllowedOrigins("*");
    }
}
