package com.opsforge.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical keyword key used to bucket incidents for adaptive learning.
 *
 * <p>
 * At most {@value #MAX_KEYWORDS} keywords are kept. The lookup {@link #getKey()
 * key} is the lower-cased keywords, sorted and joined with {@code _}, so
 * keyword order and case do not matter. An incident with no usable keywords
 * gets the empty key, which is a valid bucket like any other.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentSignature implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Maximum number of keywords contributing to a signature. */
    public static final int MAX_KEYWORDS = 3;

    private final List<String> keywords;
    private final String key;

    private IncidentSignature(List<String> keywords) {
        this.keywords = Collections.unmodifiableList(new ArrayList<>(keywords));
        this.key = keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining("_"));
    }

    /**
     * @param keywords extracted keywords in extraction order; only the first
     *                 {@value #MAX_KEYWORDS} are used
     * @return the signature
     */
    public static IncidentSignature of(List<String> keywords) {
        Objects.requireNonNull(keywords, "keywords must not be null");
        List<String> top = keywords.size() > MAX_KEYWORDS ? keywords.subList(0, MAX_KEYWORDS) : keywords;
        for (String keyword : top) {
            if (keyword == null || keyword.isBlank()) {
                throw new MalformedInputException("Signature keywords must not be blank");
            }
        }
        return new IncidentSignature(top);
    }

    /**
     * @return keywords in extraction order
     */
    public List<String> getKeywords() {
        return keywords;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentSignature that))
            return false;
        return key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "IncidentSignature{" + key + '}';
    }
}
