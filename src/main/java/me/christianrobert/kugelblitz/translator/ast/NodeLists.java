package me.christianrobert.kugelblitz.translator.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Argument checks shared by the node constructors.
 */
final class NodeLists {

    private NodeLists() {
    }

    static <T> T require(T value, String description) {
        if (value == null) {
            throw new IllegalArgumentException(description + " cannot be null");
        }
        return value;
    }

    static String requireIdentifier(String value, String description) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(description + " cannot be null or empty");
        }
        return value;
    }

    static <T> List<T> copyOf(List<? extends T> values, String description) {
        if (values == null) {
            throw new IllegalArgumentException(description + " cannot be null");
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value == null) {
                throw new IllegalArgumentException(description + " cannot contain null elements");
            }
            copy.add(value);
        }
        return Collections.unmodifiableList(copy);
    }

    static List<String> copyIdentifiers(List<String> values, String description) {
        List<String> copy = copyOf(values, description);
        for (String value : copy) {
            requireIdentifier(value, description + " element");
        }
        return copy;
    }
}
