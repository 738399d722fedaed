package com.stattools.formula.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical name → raw column name lookup for one dataset, built once from the dataset header
 * and read-only afterwards (safe to share across threads).
 * <p>
 * Collision policy: first occurrence wins. When two raw names normalize to the same canonical name,
 * the later one is recorded as a {@link ColumnCollision} and logged at WARN; it is not an error.
 * Headers whose canonical name is empty (no letters or digits) are not addressable and are skipped.
 */
public final class ColumnMap {

    private static final Logger log = LoggerFactory.getLogger(ColumnMap.class);

    private final List<String> rawNames;
    private final Map<String, String> rawByCanonical;
    private final List<ColumnCollision> collisions;

    private ColumnMap(List<String> rawNames, Map<String, String> rawByCanonical, List<ColumnCollision> collisions) {
        this.rawNames = Collections.unmodifiableList(rawNames);
        this.rawByCanonical = Collections.unmodifiableMap(rawByCanonical);
        this.collisions = Collections.unmodifiableList(collisions);
    }

    /**
     * Builds the map from the dataset's raw column names, in header order.
     *
     * @param rawNames column headers; null entries are ignored
     * @return column map (never null)
     */
    public static ColumnMap build(List<String> rawNames) {
        Objects.requireNonNull(rawNames, "rawNames");
        List<String> names = new ArrayList<>(rawNames.size());
        Map<String, String> byCanonical = new LinkedHashMap<>();
        List<ColumnCollision> collisions = new ArrayList<>();
        for (String raw : rawNames) {
            if (raw == null) continue;
            names.add(raw);
            String canonical = NameNormalizer.normalize(raw);
            if (canonical.isEmpty()) {
                log.debug("Column '{}' has no canonical name; not addressable by name", raw);
                continue;
            }
            String existing = byCanonical.putIfAbsent(canonical, raw);
            if (existing != null) {
                ColumnCollision collision = new ColumnCollision(canonical, existing, raw);
                collisions.add(collision);
                log.warn("Ambiguous column: '{}' and '{}' both normalize to '{}'; keeping '{}'",
                        existing, raw, canonical, existing);
            }
        }
        return new ColumnMap(names, byCanonical, collisions);
    }

    /**
     * Returns the raw column registered under the given canonical name.
     *
     * @param canonical canonical name (see {@link NameNormalizer})
     * @return raw column name, or empty if the dataset has no such column
     */
    public Optional<String> resolve(String canonical) {
        if (canonical == null) return Optional.empty();
        return Optional.ofNullable(rawByCanonical.get(canonical));
    }

    /**
     * Normalizes {@code name} and resolves it. Accepts raw or already-canonical spellings
     * (e.g. "Mass (g)", "mass_g", "MASS G" all resolve to the same column).
     */
    public Optional<String> resolveName(String name) {
        return resolve(NameNormalizer.normalize(name));
    }

    /**
     * Resolves user-supplied column names (e.g. columns whose missing rows should be dropped) to raw
     * dataset columns. Names that match no column are skipped; the result has no duplicates and
     * keeps the order of {@code names}.
     */
    public List<String> resolveAll(Collection<String> names) {
        if (names == null || names.isEmpty()) return List.of();
        Set<String> resolved = new LinkedHashSet<>();
        for (String name : names) {
            resolveName(name).ifPresent(resolved::add);
        }
        return List.copyOf(resolved);
    }

    public boolean contains(String canonical) {
        return canonical != null && rawByCanonical.containsKey(canonical);
    }

    /** Canonical → raw entries in header order (unmodifiable). */
    public Map<String, String> asMap() {
        return rawByCanonical;
    }

    /**
     * Raw → canonical entries for headers whose name changes under normalization
     * (e.g. "Mass (g)" → "mass_g"). Unchanged headers are omitted.
     */
    public Map<String, String> renamedColumns() {
        Map<String, String> renamed = new LinkedHashMap<>();
        for (String raw : rawNames) {
            String canonical = NameNormalizer.normalize(raw);
            if (!canonical.equals(raw)) {
                renamed.put(raw, canonical);
            }
        }
        return Collections.unmodifiableMap(renamed);
    }

    /** Raw names in header order, including shadowed ones. */
    public List<String> getRawNames() {
        return rawNames;
    }

    /** Collisions found while building; empty when all headers have distinct canonical names. */
    public List<ColumnCollision> getCollisions() {
        return collisions;
    }

    public int size() {
        return rawByCanonical.size();
    }

    @Override
    public String toString() {
        return "ColumnMap" + rawByCanonical;
    }
}
