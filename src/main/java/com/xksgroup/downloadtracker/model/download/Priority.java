package com.xksgroup.downloadtracker.model.download;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical priority table shared with the download controller.
 * <p>
 * Codes follow the SABnzbd API: Force=2, High=1, Normal=0, Low=-1.
 * Any other code is rejected rather than mapped to a neighbour.
 */
public enum Priority {
    FORCE("Force", 2),
    HIGH("High", 1),
    NORMAL("Normal", 0),
    LOW("Low", -1);

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+");

    private final String label;
    private final int code;

    Priority(String label, int code) {
        this.label = label;
        this.code = code;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getCode() {
        return code;
    }

    /**
     * Label to priority, case-insensitive.
     *
     * @throws IllegalArgumentException for blank or unknown labels
     */
    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Priority label cannot be null or empty");
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority label: " + label);
    }

    /**
     * Controller code to priority.
     *
     * @throws IllegalArgumentException for codes outside the canonical table
     */
    public static Priority fromCode(int code) {
        for (Priority priority : values()) {
            if (priority.code == code) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority code: " + code);
    }

    /**
     * Parses a value as reported by the controller, which may be either a label
     * ("High") or a numeric string ("1"). Returns empty when the value fits neither.
     */
    public static Optional<Priority> fromReported(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            if (NUMERIC.matcher(value).matches()) {
                return Optional.of(fromCode(Integer.parseInt(value)));
            }
            return Optional.of(fromLabel(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
