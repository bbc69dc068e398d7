package ai.storygen.chapters.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage("wrote \"Saga\"\n");
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(Map.of("book", "Saga"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"wrote \\\"Saga\\\"\\n\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).contains("\"mdc\":{\"book\":\"Saga\"}");
        assertThat(json).contains("\"error\":\"java.lang.IllegalStateException: boom\"");
        assertThat(json).endsWith(System.lineSeparator());
    }
}
