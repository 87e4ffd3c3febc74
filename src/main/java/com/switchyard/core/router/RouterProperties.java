package com.switchyard.core.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables for the complexity classifier and domain detector. Patterns are regular
 * expressions matched case-insensitively on word boundaries.
 */
@Component
@ConfigurationProperties(prefix = "switchyard.router")
public class RouterProperties {

    private List<String> simplePatterns = new ArrayList<>(List.of(
            "hi", "hello", "hey", "thanks", "thank you", "ok", "okay", "yes", "no",
            "ping", "status", "what time", "list", "show"));

    private List<String> complexPatterns = new ArrayList<>(List.of(
            "analy[sz]e", "analysis", "optimi[sz]e", "confluence", "strategy", "backtest",
            "architecture", "design", "refactor", "debug", "compare", "evaluate", "calculate",
            "simulate", "correlat\\w*", "multi-?timeframe", "tolerance stack", "root cause", "trade-?offs?"));

    private List<String> boosters = new ArrayList<>(List.of(
            "step by step", "in detail", "explain why", "comprehensive", "pros and cons",
            "deep dive", "thorough(ly)?"));

    private int lengthThreshold = 30;

    private List<String> forceComplexDomains = new ArrayList<>(List.of("inspector", "audit", "review"));

    private Map<String, List<String>> domainPatterns = defaultDomainPatterns();

    public List<String> getSimplePatterns() { return simplePatterns; }
    public void setSimplePatterns(List<String> simplePatterns) { this.simplePatterns = simplePatterns; }
    public List<String> getComplexPatterns() { return complexPatterns; }
    public void setComplexPatterns(List<String> complexPatterns) { this.complexPatterns = complexPatterns; }
    public List<String> getBoosters() { return boosters; }
    public void setBoosters(List<String> boosters) { this.boosters = boosters; }
    public int getLengthThreshold() { return lengthThreshold; }
    public void setLengthThreshold(int lengthThreshold) { this.lengthThreshold = lengthThreshold; }
    public List<String> getForceComplexDomains() { return forceComplexDomains; }
    public void setForceComplexDomains(List<String> forceComplexDomains) { this.forceComplexDomains = forceComplexDomains; }
    public Map<String, List<String>> getDomainPatterns() { return domainPatterns; }
    public void setDomainPatterns(Map<String, List<String>> domainPatterns) { this.domainPatterns = domainPatterns; }

    private static Map<String, List<String>> defaultDomainPatterns() {
        var table = new LinkedHashMap<String, List<String>>();
        table.put("cad", new ArrayList<>(List.of(
                "cad", "solidworks", "inventor", "models?", "geometry", "dimensions?", "tolerances?",
                "drawings?", "part numbers?", "assembl(y|ies)", "bom", "materials?", "weld\\w*", "gdt", "gd&t")));
        table.put("trading", new ArrayList<>(List.of(
                "trad(e|es|ing)", "finance", "markets?", "prices?", "charts?", "ict", "fvg", "liquidity",
                "bias", "trends?", "forex", "crypto", "stocks?", "quarterly", "manipulation")));
        return table;
    }
}
