package com.pearlthoughts.mailgateway.template;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void testRender_SubstitutesAllPlaceholders() {
        String rendered = renderer.render("Hi {{name}}, code {{code}}",
                Map.of("name", "Jane", "code", "DEF456"));

        assertEquals("Hi Jane, code DEF456", rendered);
    }

    @Test
    void testRender_UnmatchedPlaceholderLeftVerbatim() {
        String rendered = renderer.render("Hello {{name}}, your order {{orderId}} shipped",
                Map.of("name", "Jane"));

        assertEquals("Hello Jane, your order {{orderId}} shipped", rendered);
    }

    @Test
    void testRender_RepeatedPlaceholder() {
        assertEquals("a-a-a", renderer.render("{{x}}-{{x}}-{{x}}", Map.of("x", "a")));
    }

    @Test
    void testRender_SubstitutedValueIsNotRescanned() {
        String rendered = renderer.render("{{first}} and {{second}}",
                Map.of("first", "{{second}}", "second", "two"));

        assertEquals("{{second}} and two", rendered);
    }

    @Test
    void testRender_ValuesWithRegexSpecialCharacters() {
        String rendered = renderer.render("Price: {{price}}", Map.of("price", "$5 \\ 10"));

        assertEquals("Price: $5 \\ 10", rendered);
    }

    @Test
    void testRender_NonWordIdentifierIsNotAPlaceholder() {
        String rendered = renderer.render("{{first-name}} {{ name }}", Map.of("first-name", "X", "name", "Y"));

        assertEquals("{{first-name}} {{ name }}", rendered);
    }

    @Test
    void testRender_NullValueTreatedAsMissing() {
        Map<String, String> data = new HashMap<>();
        data.put("name", null);

        assertEquals("Hi {{name}}", renderer.render("Hi {{name}}", data));
    }

    @Test
    void testRender_EmptyValueSubstituted() {
        assertEquals("Hi !", renderer.render("Hi {{name}}!", Map.of("name", "")));
    }

    @Test
    void testRender_NullTemplateAndData() {
        assertEquals("", renderer.render(null, Map.of("a", "b")));
        assertEquals("Hi {{name}}", renderer.render("Hi {{name}}", null));
    }

    @Test
    void testRender_IsReferentiallyTransparent() {
        Map<String, String> data = Map.of("name", "Jane");
        String template = "Dear {{name}}, {{missing}}";

        assertEquals(renderer.render(template, data), renderer.render(template, data));
    }

    @Test
    void testMerge_RecipientOverridesShared() {
        Map<String, String> merged = renderer.merge(
                Map.of("company", "Acme", "name", "Customer"),
                Map.of("name", "Jane"));

        assertEquals("Jane", merged.get("name"));
        assertEquals("Acme", merged.get("company"));
        assertEquals("Hello Jane from Acme", renderer.render("Hello {{name}} from {{company}}", merged));
    }

    @Test
    void testMerge_NullMaps() {
        assertTrue(renderer.merge(null, null).isEmpty());
        assertEquals("v", renderer.merge(null, Map.of("k", "v")).get("k"));
    }
}
