package com.switchyard.core.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guesses the domain of a request from its text when the caller does not name one.
 * Each domain scores one point per matching pattern; the single highest score wins.
 * A tie or no match yields {@code general}.
 */
public final class DomainDetector {

    private static final Logger log = LoggerFactory.getLogger(DomainDetector.class);

    static final String GENERAL = "general";

    private final Map<String, List<Pattern>> patterns = new LinkedHashMap<>();

    public DomainDetector(RouterProperties properties) {
        properties.getDomainPatterns().forEach((domain, expressions) -> patterns.put(domain,
                expressions.stream()
                        .map(e -> Pattern.compile("\\b(?:" + e + ")\\b", Pattern.CASE_INSENSITIVE))
                        .toList()));
    }

    public DomainDetector() {
        this(new RouterProperties());
    }

    public String detect(String message) {
        if (message == null || message.isBlank()) {
            return GENERAL;
        }
        String best = GENERAL;
        int bestScore = 0;
        boolean tied = false;
        for (var entry : patterns.entrySet()) {
            int score = 0;
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(message).find()) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }
        String domain = tied ? GENERAL : best;
        log.debug("Detected domain {} (score {})", domain, bestScore);
        return domain;
    }
}
