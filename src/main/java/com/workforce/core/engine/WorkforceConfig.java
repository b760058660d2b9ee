package com.workforce.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.artifacts.ArtifactReplayer;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.protocol.MessageCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class WorkforceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public ArtifactReplayer artifactReplayer(ArtifactStore artifactStore) {
        return new ArtifactReplayer(artifactStore);
    }
}
