package dev.orderscanner.controller;

import dev.orderscanner.config.SuppliersConfig;
import dev.orderscanner.supplier.SupplierDirectory;
import dev.orderscanner.supplier.SupplierMergeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

class SupplierControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        SupplierMergeService mergeService = new SupplierMergeService(new SupplierDirectory(new SuppliersConfig()));
        client = WebTestClient.bindToController(new SupplierController(mergeService)).build();
    }

    @Test
    void shouldMergeDiscoveredSuppliersWithPriorityList() {
        String body = """
                [
                  {"domain": "mcmaster-carr.com", "displayName": "McMaster", "emailCount": 4, "score": 70,
                   "category": "industrial", "sampleSubjects": ["McMaster-Carr Order 1"], "isRecommended": false},
                  {"domain": "grainger.com", "displayName": "Grainger", "emailCount": 2, "score": 60,
                   "category": "unknown", "sampleSubjects": [], "isRecommended": true},
                  {"domain": "amazon.com", "displayName": "Amazon", "emailCount": 9, "score": 90,
                   "category": "marketplace", "sampleSubjects": [], "isRecommended": false}
                ]
                """;

        client.post().uri("/api/suppliers/merge")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[0].domain").isEqualTo("mcmaster.com")
                .jsonPath("$[0].emailCount").isEqualTo(4)
                .jsonPath("$[0].isRecommended").isEqualTo(true)
                .jsonPath("$[1].domain").isEqualTo("uline.com")
                .jsonPath("$[2].domain").isEqualTo("grainger.com");
    }
}
