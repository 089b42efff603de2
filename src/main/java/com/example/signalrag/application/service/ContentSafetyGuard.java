package com.example.signalrag.application.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keyword screen for questions and generated answers. A term matches as a whole word or phrase,
 * case-insensitively, so "kill" flags "how to kill" but not "skills".
 */
@Component
public class ContentSafetyGuard {

    private static final Logger log = LoggerFactory.getLogger(ContentSafetyGuard.class);

    public static final String FILTERED_ANSWER = "I cannot provide that information due to safety concerns.";

    private final boolean enabled;
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();

    public ContentSafetyGuard(
            @Value("${signalrag.safety.enabled:true}") boolean enabled,
            @Value("${signalrag.safety.patterns}") List<String> terms
    ) {
        this.enabled = enabled;
        for (String term : terms) {
            String t = term == null ? "" : term.trim();
            if (!t.isEmpty()) {
                patterns.put(t, compile(t));
            }
        }
        log.info("event=content_safety_config enabled={} patterns={}", enabled, patterns.size());
    }

    public SafetyCheck check(String text) {
        if (!enabled || text == null || text.isBlank()) {
            return SafetyCheck.SAFE;
        }
        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            if (m.find()) {
                matched.add(e.getKey());
            }
        }
        return matched.isEmpty() ? SafetyCheck.SAFE : new SafetyCheck(false, List.copyOf(matched));
    }

    private static Pattern compile(String term) {
        // phrases tolerate any run of whitespace between words
        String body = Arrays.stream(term.split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile("\\b" + body + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public record SafetyCheck(boolean safe, List<String> matched) {

        static final SafetyCheck SAFE = new SafetyCheck(true, List.of());

        public String riskLevel() {
            return safe ? "low" : "high";
        }
    }
}
