package dev.orderscanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for known suppliers and the primary marketplace.
 * Loaded from application.yml under 'suppliers' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "suppliers")
public class SuppliersConfig {

    private int maxDomains = 25;
    private List<String> marketplaceDomains = new ArrayList<>(List.of("amazon.com"));
    private List<PrioritySupplier> priority = new ArrayList<>(List.of(
            new PrioritySupplier("mcmaster.com", "McMaster-Carr", new ArrayList<>(List.of("mcmaster-carr.com"))),
            new PrioritySupplier("uline.com", "Uline", new ArrayList<>())));

    @Data
    public static class PrioritySupplier {
        private String domain;
        private String displayName;
        private List<String> aliases = new ArrayList<>();

        public PrioritySupplier() {
        }

        public PrioritySupplier(String domain, String displayName, List<String> aliases) {
            this.domain = domain;
            this.displayName = displayName;
            this.aliases = aliases;
        }
    }
}
