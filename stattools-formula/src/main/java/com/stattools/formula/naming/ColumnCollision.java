package com.stattools.formula.naming;

/**
 * Two raw column names that normalize to the same canonical name. The first one seen is kept
 * in the {@link ColumnMap}; the later one cannot be reached by canonical lookup.
 *
 * @param canonical canonical name both columns share
 * @param retained  raw name kept under {@code canonical} (first occurrence)
 * @param shadowed  raw name that lost the key
 */
public record ColumnCollision(String canonical, String retained, String shadowed) {
}
