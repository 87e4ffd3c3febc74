package com.switchyard.core.router;

import com.switchyard.core.model.ComplexityTier;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps request text to a {@link ComplexityTier}. Pure and deterministic.
 *
 * <p>Score = complex-pattern matches + booster matches + 1 when the message is longer
 * than the length threshold (in words). Score of 2 or more is COMPLEX; a zero score with
 * at least one simple-pattern match is SIMPLE; everything else is MODERATE.
 */
public final class ComplexityClassifier {

    static final int COMPLEX_SCORE = 2;

    private final List<Pattern> simplePatterns;
    private final List<Pattern> complexPatterns;
    private final List<Pattern> boosters;
    private final int lengthThreshold;
    private final Set<String> forceComplexDomains;

    public ComplexityClassifier(RouterProperties properties) {
        this.simplePatterns = compile(properties.getSimplePatterns());
        this.complexPatterns = compile(properties.getComplexPatterns());
        this.boosters = compile(properties.getBoosters());
        this.lengthThreshold = properties.getLengthThreshold();
        this.forceComplexDomains = properties.getForceComplexDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ComplexityClassifier() {
        this(new RouterProperties());
    }

    public ComplexityTier classify(String message) {
        int score = score(message);
        if (score >= COMPLEX_SCORE) {
            return ComplexityTier.COMPLEX;
        }
        if (score == 0 && countMatches(simplePatterns, message) > 0) {
            return ComplexityTier.SIMPLE;
        }
        return ComplexityTier.MODERATE;
    }

    /**
     * Classifies with a domain policy applied: some domains always get the COMPLEX tier.
     */
    public ComplexityTier classify(String message, String domain) {
        if (forcesComplex(domain)) {
            return ComplexityTier.COMPLEX;
        }
        return classify(message);
    }

    public boolean forcesComplex(String domain) {
        return domain != null && forceComplexDomains.contains(domain.toLowerCase(Locale.ROOT));
    }

    /** Combined complexity score of a message. */
    public int score(String message) {
        if (message == null || message.isBlank()) {
            return 0;
        }
        int score = countMatches(complexPatterns, message) + countMatches(boosters, message);
        if (wordCount(message) > lengthThreshold) {
            score++;
        }
        return score;
    }

    static int wordCount(String message) {
        String trimmed = message.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static int countMatches(List<Pattern> patterns, String message) {
        if (message == null || message.isBlank()) {
            return 0;
        }
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(message).find()) {
                count++;
            }
        }
        return count;
    }

    private static List<Pattern> compile(List<String> expressions) {
        return expressions.stream()
                .map(e -> Pattern.compile("\\b(?:" + e + ")\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
