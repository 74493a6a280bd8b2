package dev.dataprep.plan;

import java.util.Locale;

public enum JoinType {
    INNER,
    LEFT;

    public static JoinType parse(String text) {
        if (text == null || text.isBlank()) {
            return LEFT;
        }
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
