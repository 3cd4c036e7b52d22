package com.openforge.clarifier;

import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.ratelimit.RateLimitProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, RateLimitProperties.class})
public class ClarifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClarifierApplication.class, args);
    }
}
