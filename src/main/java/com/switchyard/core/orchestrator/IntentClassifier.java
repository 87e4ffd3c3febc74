package com.switchyard.core.orchestrator;

import com.switchyard.core.model.AgentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword table mapping request text to an {@link AgentCategory}.
 * <p>
 * Matching is a case-insensitive substring test; every matched keyword adds one point to
 * its category. The single highest score wins. A tie for the top score, or no match at
 * all, resolves to {@link AgentCategory#GENERAL}.
 */
public class IntentClassifier {

    private static final Map<AgentCategory, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

    private final Map<AgentCategory, List<String>> keywords;

    public IntentClassifier(Map<AgentCategory, List<String>> keywords) {
        var table = new EnumMap<AgentCategory, List<String>>(AgentCategory.class);
        keywords.forEach((category, words) -> table.put(category, words.stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toList()));
        this.keywords = Collections.unmodifiableMap(table);
    }

    public IntentClassifier() {
        this(DEFAULT_KEYWORDS);
    }

    /**
     * Default table with per-category overrides applied. Unknown category names are rejected.
     */
    public static IntentClassifier fromProperties(OrchestratorProperties properties) {
        var table = new EnumMap<AgentCategory, List<String>>(DEFAULT_KEYWORDS);
        properties.getKeywords().forEach((name, words) -> table.put(AgentCategory.fromValue(name), List.copyOf(words)));
        return new IntentClassifier(table);
    }

    public AgentCategory classify(String message) {
        Map<AgentCategory, Integer> scores = score(message);
        AgentCategory best = AgentCategory.GENERAL;
        int bestScore = 0;
        boolean tied = false;
        for (var entry : scores.entrySet()) {
            int score = entry.getValue();
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }
        return bestScore == 0 || tied ? AgentCategory.GENERAL : best;
    }

    /** Per-category keyword hit counts, for diagnostics. */
    public Map<AgentCategory, Integer> score(String message) {
        var scores = new EnumMap<AgentCategory, Integer>(AgentCategory.class);
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        keywords.forEach((category, words) -> {
            int score = 0;
            for (String keyword : words) {
                if (lower.contains(keyword)) {
                    score++;
                }
            }
            scores.put(category, score);
        });
        return scores;
    }

    public Map<AgentCategory, List<String>> keywords() {
        return keywords;
    }

    private static Map<AgentCategory, List<String>> defaultKeywords() {
        var table = new EnumMap<AgentCategory, List<String>>(AgentCategory.class);
        table.put(AgentCategory.TRADING, List.of(
                "trade", "trading", "forex", "gbp", "usd", "eur", "jpy", "setup", "bias", "ict",
                "btmm", "quarterly", "order block", "fvg", "liquidity", "manipulation",
                "tradingview", "chart", "analysis", "journal"));
        table.put(AgentCategory.CAD, List.of(
                "cad", "solidworks", "inventor", "autocad", "bentley", "part", "sketch", "extrude",
                "flange", "model", "3d", "drawing", "assembly", "ecn", "revision", "pdf"));
        table.put(AgentCategory.SKETCH, List.of(
                "photo", "sketch", "hand-drawn", "napkin", "ocr", "vision", "geometry extraction",
                "image to cad", "convert image"));
        table.put(AgentCategory.WORK, List.of(
                "teams", "outlook", "email", "meeting", "calendar", "tracker", "work", "job",
                "microsoft", "task"));
        table.put(AgentCategory.INSPECTOR, List.of(
                "audit", "review", "grade", "inspect", "judge", "report", "performance", "analyze results"));
        table.put(AgentCategory.SYSTEM, List.of(
                "backup", "health", "status", "metrics", "schedule", "system", "maintenance", "uptime"));
        return Collections.unmodifiableMap(table);
    }
}
