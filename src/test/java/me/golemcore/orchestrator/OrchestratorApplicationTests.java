package me.golemcore.orchestrator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class OrchestratorApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(OrchestratorApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(OrchestratorApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(OrchestratorApplication.class.getAnnotation(EnableAsync.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(OrchestratorApplication.class.getMethod("main", String[].class));
    }
}
