package com.agentgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentGraphApplication.class, args);
    }
}
