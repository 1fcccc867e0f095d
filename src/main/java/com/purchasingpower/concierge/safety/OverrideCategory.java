package com.purchasingpower.concierge.safety;

import java.util.List;

/**
 * Families of phrasing that try to weaken or bypass allergy filtering.
 * Patterns run against normalized text (see {@link OverrideAttemptDetector#normalize(String)}).
 */
public enum OverrideCategory {

    SHOW_ANYWAY(
            "\\b(?:show|give|list|recommend|tell)\\b.{0,30}\\banyway\\b"),

    DISABLE_SAFETY(
            "\\bignore\\b.{0,15}\\b(?:allerg|sensitiv)",
            "\\boverride\\b.{0,15}\\b(?:safety|allerg|filter|check)",
            "\\bbypass\\b.{0,15}\\b(?:safety|allerg|filter|check)",
            "\\bskip\\b.{0,15}\\b(?:safety|allerg|filter|check)",
            "\\bdisable\\b.{0,15}\\b(?:safety|allerg|filter|check)",
            "\\bturn\\s+off\\b.{0,15}\\b(?:safety|allerg|filter|check)"),

    RISK_ACCEPTANCE(
            "\\b(?:i'?ll|i\\s+will|willing\\s+to)\\b.{0,15}\\b(?:take|accept)\\b.{0,10}\\brisk"),

    DONT_CARE(
            "\\bdon'?t\\s+care\\b.{0,15}\\b(?:allerg|safety|sensitiv|ingredient|reaction)"),

    ALLERGY_DENIAL(
            "\\bi\\s+(?:don'?t|do\\s+not)\\s+(?:actually\\s+)?have\\b.{0,10}\\ballerg"),

    SHOW_UNSAFE(
            "\\bshow\\b.{0,15}\\bunsafe\\b",
            "\\bjust\\s+give\\b.{0,15}\\b(?:all|every)\\b.{0,10}\\bproduct",
            "\\b(?:show|give|list)\\b.{0,15}\\b(?:everything|all)\\b.{0,15}\\bregardless\\b"),

    INCLUDE_FLAGGED(
            "\\b(?:include|add)\\b.{0,15}\\b(?:unsafe|flagged|blocked|filtered|removed)\\b"),

    REMOVE_CONSTRAINTS(
            "\\b(?:remove|delete|clear)\\b.{0,15}\\b(?:my\\s+)?(?:allerg|constraint|restriction|safety\\s+(?:filter|check))",
            "\\bforget\\b.{0,15}\\b(?:my\\s+)?allerg"),

    PRETEND_NOT_ALLERGIC(
            "\\bpretend\\b.{0,15}\\b(?:not\\s+allergic|no\\s+allerg)",
            "\\bnot\\s+(?:really|actually)\\s+allergic\\b"),

    STOP_FILTERING(
            "\\bstop\\b.{0,10}\\b(?:filter|block|check|flag)");

    private final List<String> patterns;

    OverrideCategory(String... patterns) {
        this.patterns = List.of(patterns);
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
