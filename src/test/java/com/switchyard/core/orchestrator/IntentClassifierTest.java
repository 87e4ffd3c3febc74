package com.switchyard.core.orchestrator;

import com.switchyard.core.model.AgentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    @DisplayName("forex setup request is TRADING")
    void tradingRequest() {
        assertEquals(AgentCategory.TRADING, classifier.classify("Analyze the GBP/USD setup"));
    }

    @Test
    @DisplayName("CAD modelling request is CAD")
    void cadRequest() {
        assertEquals(AgentCategory.CAD, classifier.classify("Extrude the flange in SolidWorks"));
    }

    @Test
    @DisplayName("matching is case-insensitive")
    void caseInsensitive() {
        assertEquals(AgentCategory.WORK, classifier.classify("CHECK MY OUTLOOK CALENDAR"));
    }

    @Test
    @DisplayName("no keyword match resolves to GENERAL")
    void noMatch() {
        assertEquals(AgentCategory.GENERAL, classifier.classify("tell me a joke"));
        assertEquals(AgentCategory.GENERAL, classifier.classify(""));
    }

    @Test
    @DisplayName("a tie for the top score resolves to GENERAL")
    void tieIsGeneral() {
        // "email" (work) and "backup" (system) score one each
        assertEquals(AgentCategory.GENERAL, classifier.classify("email the backup"));
    }

    @Test
    @DisplayName("scores count every matched keyword")
    void scoresCountMatches() {
        Map<AgentCategory, Integer> scores = classifier.score("GBP/USD setup");
        assertEquals(3, scores.get(AgentCategory.TRADING));
        assertEquals(0, scores.get(AgentCategory.CAD));
    }

    @Test
    @DisplayName("configured keywords replace a category's defaults")
    void propertiesOverride() {
        var props = new OrchestratorProperties();
        props.getKeywords().put("work", List.of("jira", "sprint"));
        var custom = IntentClassifier.fromProperties(props);

        assertEquals(AgentCategory.WORK, custom.classify("move the ticket in JIRA"));
        assertEquals(AgentCategory.GENERAL, custom.classify("send an email"));
        assertEquals(AgentCategory.TRADING, custom.classify("forex journal"));
    }

    @Test
    @DisplayName("an unknown category name in configuration is rejected")
    void unknownCategoryRejected() {
        var props = new OrchestratorProperties();
        props.getKeywords().put("music", List.of("song"));
        assertThrows(IllegalArgumentException.class, () -> IntentClassifier.fromProperties(props));
    }
}
