package com.stattools.formula;

/**
 * Quoting syntax of the target expression grammar, used to make a raw column name with spaces or
 * punctuation referable inside a formula.
 */
public enum QuoteStyle {

    /** R / dplyr non-syntactic names: {@code `mass (g)`}. */
    BACKTICK('`', '`'),

    /** SQL-style quoted identifiers: {@code "mass (g)"}. */
    DOUBLE_QUOTE('"', '"');

    private final char open;
    private final char close;

    QuoteStyle(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char getOpen() {
        return open;
    }

    public char getClose() {
        return close;
    }

    /** Whether {@code name} is already wrapped in this style's delimiters. */
    public boolean isQuoted(String name) {
        return name != null && name.length() >= 2
                && name.charAt(0) == open && name.charAt(name.length() - 1) == close;
    }

    /** Returns the text between the delimiters when {@code name} is quoted, else {@code name}. */
    public String unquote(String name) {
        return isQuoted(name) ? name.substring(1, name.length() - 1) : name;
    }

    /**
     * Whether {@code name} must be quoted to be used as a variable reference: it contains a character
     * outside {@code [A-Za-z0-9_.]} and is not quoted already.
     */
    public boolean needsQuoting(String name) {
        if (name == null || name.isEmpty() || isQuoted(name)) return false;
        for (int i = 0; i < name.length(); i++) {
            if (!isIdentifierChar(name.charAt(i))) return true;
        }
        return false;
    }

    /** Returns {@code name} quoted when {@link #needsQuoting(String)} says so, else unchanged. */
    public String quote(String name) {
        return needsQuoting(name) ? open + name + close : name;
    }

    /**
     * Parses a configured style name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is not a known style
     */
    public static QuoteStyle fromName(String name) {
        if (name == null || name.isBlank()) return BACKTICK;
        return QuoteStyle.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
    }

    static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '.';
    }
}
