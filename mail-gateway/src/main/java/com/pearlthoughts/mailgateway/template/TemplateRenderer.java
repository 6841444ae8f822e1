package com.pearlthoughts.mailgateway.template;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{key}}} placeholders with values from a data mapping.
 *
 * <p>Single pass: substituted values are never scanned again. Placeholders whose key is
 * missing (or mapped to {@code null}) stay in the output verbatim.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");

    public String render(String template, Map<String, String> data) {
        if (template == null) {
            return "";
        }
        if (data == null || data.isEmpty()) {
            return template;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = data.get(matcher.group(1));
            matcher.appendReplacement(rendered,
                    Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * Merge shared and per-recipient data; recipient values win on key collision.
     */
    public Map<String, String> merge(Map<String, String> shared, Map<String, String> recipient) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (shared != null) {
            merged.putAll(shared);
        }
        if (recipient != null) {
            merged.putAll(recipient);
        }
        return merged;
    }
}
