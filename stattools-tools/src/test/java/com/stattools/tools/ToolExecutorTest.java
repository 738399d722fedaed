package com.stattools.tools;

import com.stattools.config.SessionConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolExecutorTest {

    private static final class UpperCaseToolProvider implements ToolProvider {
        @Override
        public String getToolId() {
            return "UPPER";
        }

        @Override
        public String getDescription() {
            return "Upper-cases the text input.";
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.OTHER;
        }

        @Override
        public Tool getTool() {
            return (inputs, session) -> {
                String text = ToolInputs.requireString(inputs, "text");
                if ("io".equals(text)) {
                    throw new IOException("disk gone");
                }
                return Map.of("text", text.toUpperCase(), "session", session.getSessionId());
            };
        }
    }

    private ToolRegistry registry;
    private SimpleMeterRegistry meters;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        registry.register(new UpperCaseToolProvider());
        meters = new SimpleMeterRegistry();
        executor = new ToolExecutor(registry, meters);
    }

    @Test
    void execute_json_roundTripsThroughTool() {
        String out = executor.execute("UPPER", "{\"text\":\"mass\"}", SessionConfig.of("s1", Map.of()));

        assertTrue(out.contains("\"text\":\"MASS\""), out);
        assertTrue(out.contains("\"session\":\"s1\""), out);
        assertEquals(Map.of("text", "MASS", "session", "s1"),
                executor.execute("UPPER", Map.of("text", "mass"), SessionConfig.of("s1", Map.of())));
        assertEquals(2.0, meters.counter(ToolExecutor.INVOCATIONS_METRIC, "tool", "UPPER", "outcome", "success").count());
    }

    @Test
    void execute_unknownToolFails() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> executor.execute("NOPE", Map.of(), null));
        assertEquals("No tool registered with id=NOPE", e.getMessage());
    }

    @Test
    void execute_invalidJsonFails() {
        assertThrows(IllegalArgumentException.class, () -> executor.execute("UPPER", "{text", null));
    }

    @Test
    void execute_uncheckedFailurePropagatesUnchanged() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> executor.execute("UPPER", Map.of(), null));

        assertEquals("Missing required input: text", e.getMessage());
        assertEquals(1.0, meters.counter(ToolExecutor.INVOCATIONS_METRIC, "tool", "UPPER", "outcome", "failure").count());
    }

    @Test
    void execute_checkedFailureIsWrapped() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> executor.execute("UPPER", Map.of("text", "io"), null));

        assertEquals("UPPER", e.getToolId());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void registry_rejectsDuplicateIds() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.register(new UpperCaseToolProvider()));
        assertEquals("Tool already registered: UPPER", e.getMessage());
        assertEquals(1, registry.size());
        assertEquals("OTHER", registry.describe().get(0).getCategoryName());
        assertSame(registry.get(" UPPER "), registry.getAll().get(0));
    }
}
