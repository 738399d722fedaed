package com.stattools.formula.naming;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps any raw identifier (dataset header, formula term) to its canonical name:
 * lower case, alphabet {@code [a-z0-9_]}, single underscores, no leading or trailing underscore.
 * Examples: {@code "Mass (g)" → "mass_g"}, {@code "Growth %" → "growth_percent"}, {@code "Driver's Age" → "drivers_age"}.
 * <p>
 * Total, pure and idempotent: {@code normalize(normalize(x)).equals(normalize(x))} for every x.
 */
public final class NameNormalizer {

    private static final Pattern NON_CANONICAL_RUN = Pattern.compile("[^a-z0-9_]+");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private NameNormalizer() {
    }

    /**
     * Returns the canonical name for {@code raw}. Null yields the empty string.
     *
     * @param raw raw identifier, taken verbatim from headers or formula text
     * @return canonical name; empty when {@code raw} has no letters or digits
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        String name = raw.toLowerCase(Locale.ROOT);
        name = name.replace("'", "");
        name = name.replace("%", "percent");
        name = NON_CANONICAL_RUN.matcher(name).replaceAll("_");
        name = UNDERSCORE_RUN.matcher(name).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(name).replaceAll("");
    }
}
