package com.xksgroup.downloadtracker.service.helper;

import java.util.Collection;
import java.util.Iterator;

/**
 * Coerces loosely typed season/episode values into one optional integer.
 * Empty collection gives null, a collection gives its first usable element,
 * a scalar gives itself. Never throws.
 */
public final class EpisodeNumberNormalizer {

    private EpisodeNumberNormalizer() {
    }

    public static Integer toSingle(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> values) {
            Iterator<?> iterator = values.iterator();
            return iterator.hasNext() ? toSingle(iterator.next()) : null;
        }
        if (value instanceof Object[] array) {
            return array.length > 0 ? toSingle(array[0]) : null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Integer.valueOf(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
