package io.github.yok.sqlmodelrunner.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Physical form produced for a model's output. Tables and incremental tables are rebuilt on every
 * run; an incremental table is additionally partitioned.
 *
 * @author Yasuharu.Okawauchi
 */
public enum Materialization {
    // CREATE OR REPLACE VIEW ... AS
    VIEW,
    // CREATE OR REPLACE TABLE ... AS
    TABLE,
    // CREATE OR REPLACE TABLE ... PARTITIONED BY (...) AS
    INCREMENTAL;

    /**
     * Looks up a materialization by its header value, ignoring case and surrounding blanks.
     *
     * @param value header value such as {@code "view"} or {@code "Table"}
     * @return matching constant, or empty if the value is not recognized
     */
    public static Optional<Materialization> fromHeaderValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Materialization m : values()) {
            if (m.name().equals(normalized)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the lower-case header spelling of this constant.
     *
     * @return header value
     */
    public String headerValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
