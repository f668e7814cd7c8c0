package me.ditto.bot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class DittoApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(DittoApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(DittoApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(DittoApplication.class.getAnnotation(EnableScheduling.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(DittoApplication.class.getMethod("main", String[].class));
    }
}
