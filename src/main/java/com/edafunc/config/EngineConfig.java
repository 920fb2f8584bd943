package com.edafunc.config;

import com.edafunc.core.CoreFactory;
import com.edafunc.core.InProcessCore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the decision backend. Swapping the backend (native library,
 * sandboxed module) means providing another {@link CoreFactory} bean.
 */
@Configuration
public class EngineConfig {

    @Bean
    public CoreFactory coreFactory(EdaProperties properties, ObjectMapper objectMapper) {
        return () -> new InProcessCore(properties, objectMapper);
    }
}
