package com.stattools.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of one analysis session, passed to every {@link com.stattools.tools.Tool#execute} call the
 * agent makes for that session. Besides the session id (used in logs) it carries per-session
 * overrides that tools consult after the call's own inputs and before the process-wide
 * {@link StatToolsConfig} defaults:
 * <ul>
 *   <li>{@value #CLASSIFICATION_COLUMN}: column classified when a call names none</li>
 *   <li>{@value #CLASSIFICATION_LABEL_COLUMN}: label column appended by classification</li>
 *   <li>{@value #FORMULA_QUOTE_STYLE}: quote style for rewritten formulas (e.g. "DOUBLE_QUOTE" when the
 *       session's model-fitting backend speaks SQL)</li>
 * </ul>
 * Immutable; blank values are treated as absent.
 */
public final class SessionConfig {

    public static final String CLASSIFICATION_COLUMN = "classificationColumn";
    public static final String CLASSIFICATION_LABEL_COLUMN = "classificationLabelColumn";
    public static final String FORMULA_QUOTE_STYLE = "formulaQuoteStyle";

    /** No session id, no overrides. */
    public static final SessionConfig EMPTY = new SessionConfig("", Collections.emptyMap());

    private final String sessionId;
    private final Map<String, String> overrides;

    private SessionConfig(String sessionId, Map<String, String> overrides) {
        this.sessionId = sessionId;
        this.overrides = overrides;
    }

    /**
     * Creates a session config from loosely typed settings (e.g. parsed from an agent request).
     * Values are stored as trimmed strings; null and blank values are dropped.
     *
     * @param sessionId session id (may be null)
     * @param settings  setting key to value (may be null)
     */
    public static SessionConfig of(String sessionId, Map<String, ?> settings) {
        Builder b = builder().sessionId(sessionId);
        if (settings != null) {
            settings.forEach((k, v) -> b.set(k, v != null ? v.toString() : null));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSessionId() {
        return sessionId;
    }

    /** Override for {@code key}, if the session sets one. */
    public Optional<String> get(String key) {
        return Optional.ofNullable(overrides.get(key));
    }

    /** Classification column override. */
    public Optional<String> getClassificationColumn() {
        return get(CLASSIFICATION_COLUMN);
    }

    /** Classification label column override. */
    public Optional<String> getClassificationLabelColumn() {
        return get(CLASSIFICATION_LABEL_COLUMN);
    }

    /** Formula quote style override, as configured (not validated here). */
    public Optional<String> getFormulaQuoteStyle() {
        return get(FORMULA_QUOTE_STYLE);
    }

    /** All overrides, read-only. */
    public Map<String, String> getOverrides() {
        return overrides;
    }

    @Override
    public String toString() {
        return "SessionConfig{sessionId=" + sessionId + ", overrides=" + overrides + "}";
    }

    public static final class Builder {
        private String sessionId = "";
        private final Map<String, String> overrides = new LinkedHashMap<>();

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId != null ? sessionId.trim() : "";
            return this;
        }

        public Builder classificationColumn(String column) {
            return set(CLASSIFICATION_COLUMN, column);
        }

        public Builder classificationLabelColumn(String labelColumn) {
            return set(CLASSIFICATION_LABEL_COLUMN, labelColumn);
        }

        public Builder formulaQuoteStyle(String quoteStyle) {
            return set(FORMULA_QUOTE_STYLE, quoteStyle);
        }

        public Builder set(String key, String value) {
            if (key == null) return this;
            if (value == null || value.isBlank()) {
                overrides.remove(key);
            } else {
                overrides.put(key, value.trim());
            }
            return this;
        }

        public SessionConfig build() {
            if (sessionId.isEmpty() && overrides.isEmpty()) return EMPTY;
            return new SessionConfig(sessionId, Collections.unmodifiableMap(new LinkedHashMap<>(overrides)));
        }
    }
}
