package com.deepansh.recall.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the many spellings a model uses for the same attribute onto one canonical
 * key, so "full_name" and "username" both land on the "name" fact.
 * Unknown keys pass through lower-cased.
 */
@Component
@Slf4j
public class KeyNormalizer {

    private static final Map<String, List<String>> CANONICAL_KEYS = Map.ofEntries(
            Map.entry("name", List.of("full_name", "username", "first_name", "my_name")),
            Map.entry("language", List.of("programming_language", "preferred_language", "lang", "code_language")),
            Map.entry("formatter", List.of("code_formatter", "formatting_tool", "format_tool")),
            Map.entry("location", List.of("city", "place", "where", "based_in")),
            Map.entry("timezone", List.of("tz", "time_zone")),
            Map.entry("project", List.of("working_on", "current_project", "hackathon_project")),
            Map.entry("job", List.of("occupation", "role", "work", "profession")),
            Map.entry("testing_framework", List.of("test_framework", "testing_tool")),
            Map.entry("api_framework", List.of("api_tool", "web_framework")),
            Map.entry("type_hints", List.of("use_type_hints", "type_annotations")),
            Map.entry("docstrings", List.of("documentation_style", "doc_style")),
            Map.entry("line_length", List.of("max_line_length", "code_width")),
            Map.entry("database", List.of("db", "database_system")),
            Map.entry("latency_target", List.of("target_latency", "latency_goal"))
    );

    private final Map<String, String> aliasToCanonical = new HashMap<>();

    public KeyNormalizer() {
        CANONICAL_KEYS.forEach((canonical, aliases) -> {
            aliasToCanonical.put(canonical, canonical);
            aliases.forEach(alias -> aliasToCanonical.put(alias, canonical));
        });
    }

    public String normalize(String rawKey) {
        String key = rawKey.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
        String canonical = aliasToCanonical.get(key);
        if (canonical == null) {
            log.debug("Non-canonical key used: {}", key);
            return key;
        }
        if (!canonical.equals(key)) {
            log.debug("Normalized key: {} -> {}", key, canonical);
        }
        return canonical;
    }
}
