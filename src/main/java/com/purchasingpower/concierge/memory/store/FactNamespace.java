package com.purchasingpower.concierge.memory.store;

/**
 * Long-term store namespace: one kind of document for one user.
 *
 * @param kind Document kind
 * @param userId Owning user
 */
public record FactNamespace(Kind kind, String userId) {

    public FactNamespace {
        if (kind == null || userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Namespace requires a kind and a user id");
        }
    }

    public static FactNamespace userFacts(String userId) {
        return new FactNamespace(Kind.USER_FACTS, userId);
    }

    public static FactNamespace constraints(String userId) {
        return new FactNamespace(Kind.CONSTRAINTS, userId);
    }

    public static FactNamespace pendingConfirmations(String userId) {
        return new FactNamespace(Kind.PENDING_CONFIRMATIONS, userId);
    }

    public static FactNamespace extractionProgress(String userId) {
        return new FactNamespace(Kind.EXTRACTION_PROGRESS, userId);
    }

    @Override
    public String toString() {
        return kind.getLabel() + "/" + userId;
    }

    public enum Kind {
        USER_FACTS("user_facts"),
        CONSTRAINTS("constraints"),
        PENDING_CONFIRMATIONS("pending_confirmations"),
        EXTRACTION_PROGRESS("extraction_progress");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
