package io.procwarden.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.procwarden.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "api-key", "credential"
    );
    // --api-key=abc, API_TOKEN=abc
    private static final Pattern ASSIGNMENT = Pattern.compile("(?<name>[-\\w]+)=(?<value>\\S+)");
    // --password abc
    private static final Pattern FLAG_WITH_VALUE = Pattern.compile("(?<name>--?[-\\w]+)\\s+(?<value>[^-\\s]\\S*)");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else if (value.isTextual() && "command".equals(key)) {
                    out.put(key, maskCommandLine(value.asText("")));
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    public static String maskCommandLine(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return commandLine;
        }
        String out = replaceSensitive(ASSIGNMENT, commandLine, "=");
        return replaceSensitive(FLAG_WITH_VALUE, out, " ");
    }

    private static String replaceSensitive(Pattern pattern, String input, String separator) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group("name");
            String replacement = isSensitiveKey(name) ? name + separator + MASK : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        // Absolute paths are long but not secret.
        if (v.length() < 24 || v.startsWith("/")) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
