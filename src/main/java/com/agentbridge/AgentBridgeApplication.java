package com.agentbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentBridgeApplication.class, args);
    }
}
