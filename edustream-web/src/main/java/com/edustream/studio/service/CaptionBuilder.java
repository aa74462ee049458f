package com.edustream.studio.service;

import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ScriptPayload;

final class CaptionBuilder {

    static final String DEFAULT_CAPTION = "Check this out!";

    private CaptionBuilder() {
    }

    /**
     * First non-empty of: the custom caption, the script's tweet text, hook and CTA, the hook
     * alone, a default line.
     */
    static String build(ContentItem content, String customCaption) {
        if (hasText(customCaption)) {
            return customCaption;
        }
        ScriptPayload script = content.getScriptData();
        if (script == null) {
            return DEFAULT_CAPTION;
        }
        if (hasText(script.getTweetText())) {
            return script.getTweetText();
        }
        String hook = script.getHookText();
        if (hasText(hook) && hasText(script.getCtaText())) {
            return hook + "\n\n" + script.getCtaText();
        }
        return hasText(hook) ? hook : DEFAULT_CAPTION;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
