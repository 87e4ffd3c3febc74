package com.switchyard.core.router;

import com.switchyard.core.model.ComplexityTier;
import com.switchyard.core.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Picks a compute profile (model, token budget, temperature) for a generative request.
 * Consulted by handlers; not on the orchestrator's routing path.
 * <p>
 * With no domain, or {@code general}, the domain is detected from the message text.
 */
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    static final String DEFAULT_DOMAIN = "general";

    private final ComplexityClassifier classifier;
    private final DomainDetector domainDetector;

    public ModelRouter(ComplexityClassifier classifier, DomainDetector domainDetector) {
        this.classifier = classifier;
        this.domainDetector = domainDetector;
    }

    public ModelRouter(ComplexityClassifier classifier) {
        this(classifier, new DomainDetector());
    }

    public ModelRouter() {
        this(new ComplexityClassifier());
    }

    public ComplexityTier classify(String message) {
        return classifier.classify(message);
    }

    public RoutingDecision route(String message) {
        return route(message, null);
    }

    public String detectDomain(String message) {
        return domainDetector.detect(message);
    }

    public RoutingDecision route(String message, String domain) {
        String effectiveDomain = domain == null || domain.isBlank() || DEFAULT_DOMAIN.equalsIgnoreCase(domain)
                ? domainDetector.detect(message)
                : domain;
        boolean forced = classifier.forcesComplex(effectiveDomain);
        ComplexityTier tier = forced ? ComplexityTier.COMPLEX : classifier.classify(message);
        var profile = ModelCatalog.profileFor(tier, effectiveDomain);

        String reason = forced
                ? String.format("%s domain always uses the complex tier -> %s (%s)",
                        effectiveDomain, profile.model(), profile.description())
                : String.format("%s %s request (score %d) -> %s (%s)",
                        capitalize(tier.name()), effectiveDomain, classifier.score(message),
                        profile.model(), profile.description());

        log.debug("Model routing: domain={} tier={} model={}", effectiveDomain, tier, profile.model());
        return new RoutingDecision(effectiveDomain, tier, profile.provider(), profile.model(),
                profile.maxTokens(), profile.temperature(), reason);
    }

    private static String capitalize(String s) {
        return s.charAt(0) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
