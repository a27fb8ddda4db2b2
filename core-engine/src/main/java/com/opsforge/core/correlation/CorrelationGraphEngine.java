package com.opsforge.core.correlation;

import com.opsforge.core.config.CorrelationSettings;
import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.CorrelationResult;
import com.opsforge.core.model.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups a batch of alerts into the dominant incident cluster.
 *
 * <h3>Scoring</h3>
 * <p>
 * Every unordered pair of alerts is scored as the sum of independent signals,
 * each counted at most once:
 * </p>
 * <ul>
 * <li>same host: {@code sameHostWeight}</li>
 * <li>timestamps at most {@code timeWindowSeconds} apart:
 * {@code timeProximityWeight}</li>
 * <li>shared lower-cased title words: {@code keywordMatchWeight} per word,
 * capped at {@code keywordWeightCap}</li>
 * </ul>
 * <p>
 * A pair becomes an edge only when its score is strictly above
 * {@code edgeThreshold}.
 * </p>
 *
 * <h3>Cluster selection</h3>
 * <p>
 * The largest connected component wins. Equal-size components are ordered by
 * the timestamp of their earliest alert, then by that alert's id. Inside the
 * cluster the earliest alert is the primary (root cause) and every other member
 * is reported as related and suppressible.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Works on a private copy of the settings taken at construction, so later
 * changes to the caller's bean have no effect. Safe to share across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationGraphEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationGraphEngine.class);

    static final String NO_ALERTS = "No alerts";
    static final String EMPTY_REASON = "No alerts to correlate";
    static final String SINGLE_ALERT_REASON = "Only one alert, no correlation needed";
    static final String NO_CORRELATION = "No clear correlation detected";
    static final String UNRELATED_REASON = "Alerts appear unrelated";

    private final CorrelationSettings settings;

    public CorrelationGraphEngine() {
        this(new CorrelationSettings());
    }

    /**
     * @param settings scoring weights and thresholds
     * @throws IllegalStateException if the settings are invalid
     */
    public CorrelationGraphEngine(CorrelationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "CorrelationSettings must not be null").copy();
        this.settings.validate();
    }

    /**
     * Correlate a batch of alerts.
     *
     * @param alerts alerts in arrival order; must not be {@code null}
     * @return the correlation outcome; never {@code null}
     * @throws MalformedInputException if the list contains {@code null} or
     *                                 duplicate alert ids
     */
    public CorrelationResult correlate(List<AlertRecord> alerts) {
        Objects.requireNonNull(alerts, "Alerts must not be null");
        requireDistinctIds(alerts);

        if (alerts.isEmpty()) {
            return new CorrelationResult(null, List.of(), 1.0, NO_ALERTS, List.of(EMPTY_REASON), 0);
        }
        if (alerts.size() == 1) {
            AlertRecord only = alerts.get(0);
            return new CorrelationResult(only.getId(), List.of(), 1.0, only.getTitle(),
                    List.of(SINGLE_ALERT_REASON), 0);
        }

        AlertGraph graph = buildGraph(alerts);
        LOG.debug("Correlation graph: {} node(s), {} edge(s)", graph.nodeCount(), graph.edgeCount());

        if (graph.edgeCount() == 0) {
            return new CorrelationResult(alerts.get(0).getId(), List.of(),
                    settings.getUnrelatedConfidence(), NO_CORRELATION, List.of(UNRELATED_REASON), 0);
        }

        List<AlertRecord> cluster = selectCluster(graph, alerts);
        AlertRecord primary = cluster.get(0);
        AlertRecord latest = cluster.get(cluster.size() - 1);
        List<String> relatedIds = cluster.subList(1, cluster.size()).stream()
                .map(AlertRecord::getId)
                .toList();
        long spanSeconds = Duration.between(primary.getTimestamp(), latest.getTimestamp()).getSeconds();

        List<String> reasoning = List.of(
                "Identified cluster of " + cluster.size() + " related alerts",
                "Primary alert: " + primary.getTitle() + " on " + primary.getHost(),
                "Time span: " + spanSeconds + "s");

        LOG.debug("Selected cluster primary={} related={}", primary.getId(), relatedIds);
        return new CorrelationResult(primary.getId(), relatedIds, settings.getClusterConfidence(),
                primary.getTitle(), reasoning, relatedIds.size());
    }

    /**
     * Pairwise similarity score between two alerts.
     */
    double score(AlertRecord a, AlertRecord b) {
        return score(a, b, titleTokens(a), titleTokens(b));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AlertGraph buildGraph(List<AlertRecord> alerts) {
        List<Set<String>> tokens = alerts.stream().map(CorrelationGraphEngine::titleTokens).toList();
        AlertGraph graph = new AlertGraph(alerts.size());

        for (int i = 0; i < alerts.size(); i++) {
            for (int j = i + 1; j < alerts.size(); j++) {
                double pairScore = score(alerts.get(i), alerts.get(j), tokens.get(i), tokens.get(j));
                LOG.trace("Pair [{} , {}] score={}", alerts.get(i).getId(), alerts.get(j).getId(), pairScore);
                if (pairScore > settings.getEdgeThreshold()) {
                    graph.addEdge(i, j);
                }
            }
        }
        return graph;
    }

    private double score(AlertRecord a, AlertRecord b, Set<String> tokensA, Set<String> tokensB) {
        double total = 0.0;

        if (a.getHost().equals(b.getHost())) {
            total += settings.getSameHostWeight();
        }

        Duration gap = Duration.between(a.getTimestamp(), b.getTimestamp()).abs();
        if (gap.compareTo(Duration.ofSeconds(settings.getTimeWindowSeconds())) <= 0) {
            total += settings.getTimeProximityWeight();
        }

        Set<String> shared = new HashSet<>(tokensA);
        shared.retainAll(tokensB);
        if (!shared.isEmpty()) {
            total += Math.min(settings.getKeywordWeightCap(), shared.size() * settings.getKeywordMatchWeight());
        }
        return total;
    }

    /**
     * Pick the winning component and return its alerts in timestamp order.
     * {@link List#sort} is stable, so equal timestamps keep arrival order.
     */
    private static List<AlertRecord> selectCluster(AlertGraph graph, List<AlertRecord> alerts) {
        Comparator<List<AlertRecord>> bySizeDesc = Comparator.comparingInt(List::size);
        Comparator<List<AlertRecord>> ranking = bySizeDesc.reversed()
                .thenComparing(members -> members.get(0).getTimestamp())
                .thenComparing(members -> members.get(0).getId());

        return graph.connectedComponents().stream()
                .map(component -> {
                    List<AlertRecord> members = new ArrayList<>(component.size());
                    for (int index : component) {
                        members.add(alerts.get(index));
                    }
                    members.sort(Comparator.comparing(AlertRecord::getTimestamp));
                    return members;
                })
                .min(ranking)
                .orElseThrow();
    }

    static Set<String> titleTokens(AlertRecord alert) {
        return Arrays.stream(alert.getTitle().toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    private static void requireDistinctIds(List<AlertRecord> alerts) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < alerts.size(); i++) {
            AlertRecord alert = alerts.get(i);
            if (alert == null) {
                throw new MalformedInputException("Alert at index " + i + " is null");
            }
            if (!seen.add(alert.getId())) {
                throw new MalformedInputException("Duplicate alert id: '" + alert.getId() + "'");
            }
        }
    }
}
