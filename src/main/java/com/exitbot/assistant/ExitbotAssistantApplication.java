package com.exitbot.assistant;

import com.exitbot.assistant.config.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LlmProperties.class)
public class ExitbotAssistantApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExitbotAssistantApplication.class, args);
    }
}
