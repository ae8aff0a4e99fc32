package com.strategist.core.taskgraph;

import com.strategist.core.model.PhaseType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a phase display name to the {@link PhaseType} whose task template applies.
 * <p>
 * An exact, case-insensitive match against {@link #EXACT_NAMES} wins. Otherwise
 * the name is split into words and the first type with a keyword that starts one
 * of those words is chosen, types checked in {@link #KEYWORDS} order. A name that
 * matches neither resolves to empty; choosing a fallback is the caller's decision.
 */
@Component
public class PhaseTypeResolver {

    static final Map<String, PhaseType> EXACT_NAMES = Map.ofEntries(
            Map.entry("system design & architecture", PhaseType.DESIGN),
            Map.entry("system design and architecture", PhaseType.DESIGN),
            Map.entry("design & architecture", PhaseType.DESIGN),
            Map.entry("design and architecture", PhaseType.DESIGN),
            Map.entry("architecture", PhaseType.DESIGN),
            Map.entry("design", PhaseType.DESIGN),
            Map.entry("backend api development", PhaseType.BACKEND),
            Map.entry("backend development", PhaseType.BACKEND),
            Map.entry("api development", PhaseType.BACKEND),
            Map.entry("server development", PhaseType.BACKEND),
            Map.entry("backend", PhaseType.BACKEND),
            Map.entry("frontend ui implementation", PhaseType.FRONTEND),
            Map.entry("frontend implementation", PhaseType.FRONTEND),
            Map.entry("ui development", PhaseType.FRONTEND),
            Map.entry("user interface", PhaseType.FRONTEND),
            Map.entry("frontend", PhaseType.FRONTEND),
            Map.entry("frontend-backend integration", PhaseType.INTEGRATION),
            Map.entry("system integration", PhaseType.INTEGRATION),
            Map.entry("api integration", PhaseType.INTEGRATION),
            Map.entry("integration", PhaseType.INTEGRATION),
            Map.entry("testing & validation", PhaseType.TESTING),
            Map.entry("testing and validation", PhaseType.TESTING),
            Map.entry("quality assurance", PhaseType.TESTING),
            Map.entry("testing", PhaseType.TESTING),
            Map.entry("deployment & infrastructure", PhaseType.DEPLOYMENT),
            Map.entry("deployment and infrastructure", PhaseType.DEPLOYMENT),
            Map.entry("infrastructure setup", PhaseType.DEPLOYMENT),
            Map.entry("deployment", PhaseType.DEPLOYMENT)
    );

    static final Map<PhaseType, List<String>> KEYWORDS = keywords();

    private static Map<PhaseType, List<String>> keywords() {
        var map = new LinkedHashMap<PhaseType, List<String>>();
        map.put(PhaseType.DESIGN, List.of("design", "architect", "plan"));
        map.put(PhaseType.BACKEND, List.of("backend", "api", "server", "database"));
        map.put(PhaseType.FRONTEND, List.of("frontend", "ui", "interface", "client"));
        map.put(PhaseType.INTEGRATION, List.of("integration", "connect", "combine"));
        map.put(PhaseType.TESTING, List.of("test", "qa", "validation", "verify"));
        map.put(PhaseType.DEPLOYMENT, List.of("deploy", "infrastructure", "production", "hosting"));
        return map;
    }

    public Optional<PhaseType> resolve(String phaseName) {
        if (phaseName == null || phaseName.isBlank()) {
            return Optional.empty();
        }
        String lower = phaseName.trim().toLowerCase(Locale.ROOT);
        PhaseType exact = EXACT_NAMES.get(lower);
        if (exact != null) {
            return Optional.of(exact);
        }
        String[] words = lower.split("[^a-z0-9]+");
        for (var entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                for (String word : words) {
                    if (word.startsWith(keyword)) {
                        return Optional.of(entry.getKey());
                    }
                }
            }
        }
        return Optional.empty();
    }
}
