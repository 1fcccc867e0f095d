package com.purchasingpower.concierge.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks explicit self-statements ("I have oily skin", "I'm allergic to parabens")
 * out of a user message. At most one fact per pattern.
 */
@Component
public class FactDetector {

    private final List<FactPattern> patterns = List.of(
            new FactPattern(Pattern.compile("\\bi(?:'m| am) (\\d+)\\b"), FactCategory.AGE),
            new FactPattern(Pattern.compile("\\bmy skin (?:is|type is) (\\w+)"), FactCategory.SKIN_TYPE),
            new FactPattern(Pattern.compile("\\bi have (\\w+) skin\\b"), FactCategory.SKIN_TYPE),
            new FactPattern(Pattern.compile("\\bi(?:'m| am) allergic to (.+?)(?:\\.|,|$)"), FactCategory.ALLERGY),
            new FactPattern(Pattern.compile("\\bi have (?:an? )?allergy to (.+?)(?:\\.|,|$)"), FactCategory.ALLERGY),
            new FactPattern(Pattern.compile("\\bi(?:'m| am) sensitive to (.+?)(?:\\.|,|$)"), FactCategory.SENSITIVITY),
            new FactPattern(Pattern.compile("\\bi prefer (.+?)(?:\\.|,|$)"), FactCategory.PREFERENCE),
            new FactPattern(Pattern.compile("\\bi like (.+?)(?:\\.|,|!|$)"), FactCategory.PREFERENCE),
            new FactPattern(Pattern.compile("\\bi don'?t like (.+?)(?:\\.|,|!|$)"), FactCategory.AVERSION)
    );

    public List<Fact> detect(String text) {
        List<Fact> facts = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return facts;
        }

        String lower = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (FactPattern pattern : patterns) {
            Matcher matcher = pattern.regex().matcher(lower);
            if (matcher.find()) {
                String value = matcher.group(1).strip();
                if (!value.isEmpty()) {
                    facts.add(new Fact(pattern.category(), value, text));
                }
            }
        }
        return facts;
    }

    private record FactPattern(Pattern regex, FactCategory category) {
    }
}
