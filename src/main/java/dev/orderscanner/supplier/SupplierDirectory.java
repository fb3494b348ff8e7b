package dev.orderscanner.supplier;

import dev.orderscanner.config.SuppliersConfig;
import dev.orderscanner.config.SuppliersConfig.PrioritySupplier;
import dev.orderscanner.model.DiscoveredSupplier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Known supplier domains: priority suppliers with their alias spellings and
 * the primary marketplace, which has its own job category.
 */
@Component
public class SupplierDirectory {

    private final Map<String, String> aliasToCanonical;
    private final Map<String, List<String>> canonicalToAliases;
    private final List<PrioritySupplier> prioritySuppliers;
    private final Set<String> marketplaceLabels;
    private final List<String> marketplaceDomains;

    public SupplierDirectory(SuppliersConfig suppliersConfig) {
        Map<String, String> aliases = new HashMap<>();
        Map<String, List<String>> groups = new LinkedHashMap<>();

        for (PrioritySupplier supplier : suppliersConfig.getPriority()) {
            String canonical = normalize(supplier.getDomain());
            List<String> group = new ArrayList<>();
            group.add(canonical);
            for (String alias : supplier.getAliases()) {
                String normalized = normalize(alias);
                if (!group.contains(normalized)) {
                    group.add(normalized);
                }
            }
            group.forEach(alias -> aliases.put(alias, canonical));
            groups.put(canonical, List.copyOf(group));
        }

        this.aliasToCanonical = Collections.unmodifiableMap(aliases);
        this.canonicalToAliases = Collections.unmodifiableMap(groups);
        this.prioritySuppliers = List.copyOf(suppliersConfig.getPriority());
        this.marketplaceDomains = suppliersConfig.getMarketplaceDomains().stream()
                .map(SupplierDirectory::normalize)
                .toList();
        this.marketplaceLabels = marketplaceDomains.stream()
                .map(domain -> domain.contains(".") ? domain.substring(0, domain.indexOf('.')) : domain)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Collapse an alias spelling onto its canonical priority domain.
     * Unknown domains are only normalized.
     */
    public String canonicalize(String domain) {
        String normalized = normalize(domain);
        return aliasToCanonical.getOrDefault(normalized, normalized);
    }

    /**
     * Every known spelling of a domain, canonical first. Unknown domains
     * expand to themselves.
     */
    public List<String> aliasesOf(String domain) {
        String canonical = canonicalize(domain);
        return canonicalToAliases.getOrDefault(canonical, List.of(canonical));
    }

    public boolean isPriority(String domain) {
        return canonicalToAliases.containsKey(canonicalize(domain));
    }

    /**
     * True for the marketplace domain itself, its subdomains and its
     * country variants (amazon.com, smile.amazon.com, amazon.co.uk).
     */
    public boolean isMarketplace(String domain) {
        String normalized = normalize(domain);
        for (String label : normalized.split("\\.")) {
            if (marketplaceLabels.contains(label)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getMarketplaceDomains() {
        return marketplaceDomains;
    }

    public List<String> getPriorityDomains() {
        return List.copyOf(canonicalToAliases.keySet());
    }

    /**
     * Priority suppliers as seed records for merging with discovery results.
     */
    public List<DiscoveredSupplier> prioritySeeds() {
        return prioritySuppliers.stream()
                .map(supplier -> DiscoveredSupplier.builder()
                        .domain(normalize(supplier.getDomain()))
                        .displayName(supplier.getDisplayName())
                        .emailCount(0)
                        .score(100)
                        .category("industrial")
                        .sampleSubjects(List.of())
                        .recommended(true)
                        .build())
                .toList();
    }

    static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
