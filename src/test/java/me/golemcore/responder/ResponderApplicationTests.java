package me.golemcore.responder;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ResponderApplicationTests {

    @Test
    void shouldCarrySpringBootAnnotations() {
        assertNotNull(ResponderApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ResponderApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(ResponderApplication.class.getAnnotation(EnableAsync.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ResponderApplication.class.getMethod("main", String[].class));
    }
}
