package com.tandem.dispatch.tools;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * Neutralises markup in free text before it is stored or echoed back.
 * <p>
 * Script blocks are removed before escaping so that they cannot survive as escaped text;
 * {@code javascript:} URLs and quoted inline {@code on*=} handlers are removed afterwards.
 */
@Component
public class InputSanitizer {

    private static final Pattern SCRIPT_BLOCK =
            Pattern.compile("<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern JAVASCRIPT_URL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
    /** Handler attribute with a quoted value, as it reads after escaping. */
    private static final Pattern INLINE_HANDLER = Pattern.compile(
            "\\bon\\w+\\s*=\\s*(?:&quot;.*?&quot;|&#39;.*?&#39;)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /**
     * @return the cleaned text, or null when {@code text} is null
     */
    public String sanitize(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = SCRIPT_BLOCK.matcher(text).replaceAll("");
        cleaned = HtmlUtils.htmlEscape(cleaned);
        cleaned = JAVASCRIPT_URL.matcher(cleaned).replaceAll("");
        cleaned = INLINE_HANDLER.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }
}
