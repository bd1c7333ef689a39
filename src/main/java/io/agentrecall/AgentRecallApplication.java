package io.agentrecall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgentRecall — hybrid memory retrieval for AI agents, powered by Spring AI.
 */
@SpringBootApplication
public class AgentRecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRecallApplication.class, args);
    }
}
