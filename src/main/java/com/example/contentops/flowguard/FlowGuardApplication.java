package com.example.contentops.flowguard;

import com.example.contentops.flowguard.config.Langchain4jOpenAiProperties;
import com.example.contentops.flowguard.config.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({MonitorProperties.class, Langchain4jOpenAiProperties.class})
public class FlowGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowGuardApplication.class, args);
    }

}
