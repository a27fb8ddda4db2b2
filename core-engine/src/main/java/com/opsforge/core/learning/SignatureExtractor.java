package com.opsforge.core.learning;

import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.IncidentSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Derives an {@link IncidentSignature} from the leading alerts of an incident.
 *
 * <p>
 * Each of the first {@value IncidentSignature#MAX_KEYWORDS} alerts contributes
 * at most one keyword: the first word of its title that is longer than three
 * characters and is not a stop-word. Alerts without such a word contribute
 * nothing.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureExtractor {

    static final int MIN_WORD_LENGTH = 4;

    private static final Set<String> STOP_WORDS = Set.of("with", "from", "that", "this");

    private SignatureExtractor() {
        // utility class, not instantiable
    }

    /**
     * @param alerts incident alerts in arrival order; must not be {@code null}
     * @return the signature, possibly with the empty key
     */
    public static IncidentSignature extract(List<AlertRecord> alerts) {
        Objects.requireNonNull(alerts, "Alerts must not be null");
        List<String> keywords = new ArrayList<>(IncidentSignature.MAX_KEYWORDS);
        int limit = Math.min(alerts.size(), IncidentSignature.MAX_KEYWORDS);
        for (int i = 0; i < limit; i++) {
            String keyword = firstMeaningfulWord(alerts.get(i).getTitle());
            if (keyword != null) {
                keywords.add(keyword);
            }
        }
        return IncidentSignature.of(keywords);
    }

    private static String firstMeaningfulWord(String title) {
        for (String word : title.trim().split("\\s+")) {
            if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                return word;
            }
        }
        return null;
    }
}
