package dev.dataprep.steps;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;

/**
 * Comparison of cell values that may be strings (from CSV) or JSON scalars. Values that parse as
 * numbers compare numerically and order before all other values, which compare by their string
 * form. This keeps the order total over mixed columns.
 */
final class Values {

    static final Comparator<Object> NATURAL_NON_NULL = Values::compare;

    /** Nulls sort after every value. */
    static final Comparator<Object> NATURAL = Comparator.nullsLast(NATURAL_NON_NULL);

    private Values() {}

    static int compare(Object a, Object b) {
        Optional<BigDecimal> x = number(a);
        Optional<BigDecimal> y = number(b);
        if (x.isPresent() && y.isPresent()) {
            return x.get().compareTo(y.get());
        }
        if (x.isPresent() != y.isPresent()) {
            return x.isPresent() ? -1 : 1;
        }
        return a.toString().compareTo(b.toString());
    }

    static boolean equal(Object a, Object b) {
        return compare(a, b) == 0;
    }

    static Optional<BigDecimal> number(Object value) {
        if (value instanceof Number || value instanceof String) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
