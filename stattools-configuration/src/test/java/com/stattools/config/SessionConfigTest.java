package com.stattools.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionConfigTest {

    @Test
    void of_returnsEmptyWhenNothingGiven() {
        assertSame(SessionConfig.EMPTY, SessionConfig.of(null, null));
        assertSame(SessionConfig.EMPTY, SessionConfig.of("  ", Map.of("formulaQuoteStyle", " ")));
        assertEquals(Optional.empty(), SessionConfig.EMPTY.getClassificationColumn());
    }

    @Test
    void of_readsTypedOverrides() {
        Map<String, Object> settings = new HashMap<>();
        settings.put("classificationColumn", " recclass ");
        settings.put("classificationLabelColumn", "type");
        settings.put("formulaQuoteStyle", "double_quote");
        settings.put("unset", null);

        SessionConfig session = SessionConfig.of(" s-1 ", settings);

        assertEquals("s-1", session.getSessionId());
        assertEquals(Optional.of("recclass"), session.getClassificationColumn());
        assertEquals(Optional.of("type"), session.getClassificationLabelColumn());
        assertEquals(Optional.of("double_quote"), session.getFormulaQuoteStyle());
        assertEquals(Optional.empty(), session.get("unset"));
        assertEquals(3, session.getOverrides().size());
    }

    @Test
    void builder_blankValueClearsOverride() {
        SessionConfig session = SessionConfig.builder()
                .sessionId("s-2")
                .classificationColumn("recclass")
                .classificationColumn(" ")
                .classificationLabelColumn("scientific_type")
                .build();

        assertEquals(Optional.empty(), session.getClassificationColumn());
        assertEquals(Optional.of("scientific_type"), session.getClassificationLabelColumn());
        assertThrows(UnsupportedOperationException.class, () -> session.getOverrides().put("k", "v"));
    }
}
