package com.purchasingpower.concierge.safety;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizes messages that try to get allergy filtering relaxed ("show it anyway",
 * "ignore my allergies", "I'll take the risk", ...).
 *
 * Pure and synchronous. Runs on every inbound message before anything else in the turn;
 * a positive result ends the turn with {@link #REFUSAL}.
 */
@Slf4j
@Component
public class OverrideAttemptDetector {

    public static final String REFUSAL =
            "I understand you'd like to see those products, but I can't recommend items "
                    + "containing ingredients you're allergic to. Your safety is my top priority. "
                    + "I can help you find alternatives that work for your skin without those ingredients.";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s']", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<CompiledRule> rules;

    public OverrideAttemptDetector() {
        List<CompiledRule> compiled = new ArrayList<>();
        for (OverrideCategory category : OverrideCategory.values()) {
            for (String regex : category.getPatterns()) {
                compiled.add(new CompiledRule(category, Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS)));
            }
        }
        this.rules = Collections.unmodifiableList(compiled);
        log.debug("Override detector compiled {} patterns in {} categories",
                rules.size(), OverrideCategory.values().length);
    }

    public boolean isOverrideAttempt(String message) {
        return detect(message).isPresent();
    }

    /**
     * First matching category, in declaration order.
     */
    public Optional<OverrideCategory> detect(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }

        String normalized = normalize(message);
        for (CompiledRule rule : rules) {
            if (rule.pattern().matcher(normalized).find()) {
                log.info("🛑 Override attempt detected: category={}", rule.category());
                return Optional.of(rule.category());
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-case, straighten curly quotes, turn punctuation other than apostrophes
     * into spaces and collapse whitespace.
     */
    static String normalize(String message) {
        String text = message.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .replace('“', '"')
                .replace('”', '"');
        text = WHITESPACE.matcher(text).replaceAll(" ");
        text = PUNCTUATION.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.strip();
    }

    private record CompiledRule(OverrideCategory category, Pattern pattern) {
    }
}
