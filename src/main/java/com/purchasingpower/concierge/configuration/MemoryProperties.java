package com.purchasingpower.concierge.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
public class MemoryProperties {

    /**
     * Ignored surfacings after which a pending confirmation auto-accepts the new value.
     */
    @Min(1)
    private int maxIgnoredAttempts = 3;

    /**
     * Fact categories where a changed value raises a pending confirmation.
     */
    @NotEmpty
    private Set<String> contradictionCategories = new LinkedHashSet<>(List.of("skin_type", "age"));

    /**
     * Qualifier appended to the old value when the user keeps both facts.
     */
    @NotBlank
    private String keepBothQualifier = "(sometimes)";

    /**
     * Timeout for each long-term store load within a turn.
     */
    @NotNull
    private Duration storeTimeout = Duration.ofSeconds(2);

    @Valid
    @NotNull
    private Extraction extraction = new Extraction();

    @Data
    public static class Extraction {

        private boolean enabled = true;

        /**
         * Delay before a conversation's transcript is mined for facts.
         * A newer turn on the same conversation restarts the delay.
         */
        @NotNull
        private Duration delay = Duration.ofSeconds(30);
    }
}
