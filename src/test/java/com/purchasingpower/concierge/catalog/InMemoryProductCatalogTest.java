package com.purchasingpower.concierge.catalog;

import com.purchasingpower.concierge.TestFixtures;
import com.purchasingpower.concierge.configuration.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Product Catalog Tests")
class InMemoryProductCatalogTest {

    private InMemoryProductCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryProductCatalog(new DefaultResourceLoader(), new AppProperties());
        catalog.load();
    }

    private static List<String> ids(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::getId).toList();
    }

    @Test
    @DisplayName("Keyword search should match the product category")
    void testFetch_Keyword() {
        List<Candidate> result = catalog.fetch(new CandidateQuery("show me moisturizers", Set.of(), 10));

        assertEquals(List.of("p-001", "p-002", "p-003"), ids(result));
    }

    @Test
    @DisplayName("Products containing an excluded ingredient should never be returned")
    void testFetch_Exclusions() {
        Set<String> excluded = TestFixtures.matcher().expand(List.of("fragrance"));

        List<Candidate> result = catalog.fetch(new CandidateQuery("moisturizer", excluded, 10));

        assertEquals(List.of("p-002"), ids(result));
    }

    @Test
    @DisplayName("No keyword hit should fall back to allowed products up to the limit")
    void testFetch_Fallback() {
        List<Candidate> result = catalog.fetch(new CandidateQuery("hello there", Set.of(), 3));

        assertEquals(3, result.size());
    }

    @Test
    @DisplayName("Missing catalog should yield no candidates")
    void testLoad_Missing() {
        AppProperties properties = new AppProperties();
        properties.getDiscovery().setCatalogLocation("classpath:catalog/does-not-exist.yaml");
        InMemoryProductCatalog empty = new InMemoryProductCatalog(new DefaultResourceLoader(), properties);
        empty.load();

        assertTrue(empty.fetch(new CandidateQuery("moisturizer", Set.of(), 10)).isEmpty());
    }
}
