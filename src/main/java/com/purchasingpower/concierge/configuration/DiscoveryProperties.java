package com.purchasingpower.concierge.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class DiscoveryProperties {

    @Min(1)
    private int maxCandidates = 10;

    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    @NotBlank
    private String catalogLocation = "classpath:catalog/products.yaml";
}
