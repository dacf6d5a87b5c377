package com.openrag.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credential-bearing fields before OAuth and API key payloads reach a log line.
 * <p>
 * Matching is a case-insensitive substring match on the field name, so {@code access_token},
 * {@code refresh_token} and {@code id_token} are all caught by {@code token}.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "token", "secret", "password", "authorization", "api_key", "api-key", "apikey",
            "code", "cookie", "credential", "state"
    );

    private static final int PREVIEW_LENGTH = 8;

    private final Pattern compiledPattern;

    /** Creates a redactor with the default OAuth / API key field patterns. */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom field patterns (case-insensitive).
     *
     * @param patterns field name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        String regex = String.join("|", patterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Nested maps are redacted recursively. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redactNested(nested));
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    /**
     * Short, non-reversible preview of a credential for correlating log lines,
     * e.g. {@code orag_abc…}.
     */
    public static String preview(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<none>";
        }
        if (secret.length() <= PREVIEW_LENGTH) {
            return REDACTED;
        }
        return secret.substring(0, PREVIEW_LENGTH) + "…";
    }

    /** Whether the field name contains a sensitive fragment. */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    private Map<String, Object> redactNested(Map<?, ?> nested) {
        Map<String, Object> copy = new LinkedHashMap<>(nested.size());
        nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return redact(copy);
    }
}
