package com.purchasingpower.concierge.catalog;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.ontology.IngredientParser;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword search over a product catalog loaded from YAML at startup.
 */
@Slf4j
@Component
public class InMemoryProductCatalog implements CandidateFetcher {

    private static final int MIN_KEYWORD_LENGTH = 3;

    private final ResourceLoader resourceLoader;
    private final String location;
    private final YAMLMapper yamlMapper = new YAMLMapper();

    private List<Candidate> products = List.of();

    public InMemoryProductCatalog(ResourceLoader resourceLoader, AppProperties appProperties) {
        this.resourceLoader = resourceLoader;
        this.location = appProperties.getDiscovery().getCatalogLocation();
    }

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Product catalog {} not found - discovery will return no candidates", location);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogDocument document = yamlMapper.readValue(in, CatalogDocument.class);
            products = List.copyOf(document.getProducts());
            log.info("✅ Product catalog loaded: {} products from {}", products.size(), location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load product catalog " + location, e);
        }
    }

    @Override
    public List<Candidate> fetch(CandidateQuery query) {
        Set<String> keywords = keywords(query.text());

        List<Candidate> allowed = products.stream()
                .filter(p -> !containsExcluded(p, query.excludedIngredients()))
                .toList();

        List<Candidate> ranked = allowed.stream()
                .filter(p -> score(p, keywords) > 0)
                .sorted(Comparator.comparingInt((Candidate p) -> score(p, keywords)).reversed())
                .limit(query.limit())
                .toList();

        List<Candidate> result = ranked.isEmpty()
                ? allowed.stream().limit(query.limit()).toList()
                : ranked;

        log.debug("Catalog search '{}': {} allowed, {} returned", query.text(), allowed.size(), result.size());
        return result;
    }

    private static boolean containsExcluded(Candidate product, Set<String> excluded) {
        if (excluded.isEmpty()) {
            return false;
        }
        return product.ingredientList().stream()
                .map(IngredientParser::normalize)
                .anyMatch(excluded::contains);
    }

    private static Set<String> keywords(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() >= MIN_KEYWORD_LENGTH)
                .map(InMemoryProductCatalog::singular)
                .collect(Collectors.toSet());
    }

    private static String singular(String word) {
        return word.endsWith("s") && word.length() > MIN_KEYWORD_LENGTH ? word.substring(0, word.length() - 1) : word;
    }

    private static int score(Candidate product, Set<String> keywords) {
        String haystack = String.join(" ",
                nullToEmpty(product.getName()),
                nullToEmpty(product.getCategory()),
                nullToEmpty(product.getBrand())).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Data
    public static class CatalogDocument {
        private String version;
        private List<Candidate> products = new ArrayList<>();
    }
}
