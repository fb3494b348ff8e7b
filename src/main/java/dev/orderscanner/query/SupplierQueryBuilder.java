package dev.orderscanner.query;

import dev.orderscanner.config.SuppliersConfig;
import dev.orderscanner.model.JobCategory;
import dev.orderscanner.model.QueryMode;
import dev.orderscanner.supplier.SupplierDirectory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds Gmail search expressions for a set of supplier domains.
 */
@Component
public class SupplierQueryBuilder {

    static final List<String> DEFAULT_SUBJECT_KEYWORDS = List.of(
            "order", "invoice", "receipt", "confirmation", "shipment", "purchase", "payment");

    static final List<String> PRIORITY_SUBJECT_KEYWORDS = List.of(
            "order", "invoice", "receipt", "confirmation", "acknowledgment", "acknowledgement",
            "shipment", "shipped", "delivered", "purchase", "payment", "order status", "purchase order");

    private static final DateTimeFormatter AFTER_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final SupplierDirectory supplierDirectory;
    private final Clock clock;
    private final int maxDomains;

    public SupplierQueryBuilder(SupplierDirectory supplierDirectory, SuppliersConfig suppliersConfig, Clock clock) {
        this.supplierDirectory = supplierDirectory;
        this.clock = clock;
        this.maxDomains = suppliersConfig.getMaxDomains();
    }

    /**
     * Trim, lower-case and dedupe domains, dropping anything that does not
     * look like a domain. Stops at the configured maximum.
     */
    public List<String> sanitizeDomains(Collection<?> domains) {
        if (domains == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (Object domain : domains) {
            String normalized = domain instanceof String s ? s.trim().toLowerCase(Locale.ROOT) : "";
            if (!isValidDomain(normalized)) {
                continue;
            }
            seen.add(normalized);
            if (seen.size() >= maxDomains) {
                break;
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Sanitize and expand every domain to all of its known spellings, so the
     * search covers mail sent under legacy domains too.
     */
    public List<String> expandDomains(Collection<?> domains) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String domain : sanitizeDomains(domains)) {
            expanded.addAll(supplierDirectory.aliasesOf(domain));
        }
        return new ArrayList<>(expanded);
    }

    public int lookbackMonths(JobCategory category) {
        return category == null ? JobCategory.OTHER.getLookbackMonths() : category.getLookbackMonths();
    }

    public String build(Collection<?> domains, JobCategory category, QueryMode mode) {
        return build(domains, category, mode, LocalDate.now(clock));
    }

    /**
     * Build a search expression.
     *
     * @return the query, or an empty string when no valid domain remains
     */
    public String build(Collection<?> domains, JobCategory category, QueryMode mode, LocalDate today) {
        List<String> normalized = sanitizeDomains(domains);
        if (normalized.isEmpty()) {
            return "";
        }

        String fromClause = normalized.stream()
                .map(domain -> "from:" + domain)
                .collect(Collectors.joining(" OR "));
        String afterDate = today.minusMonths(lookbackMonths(category)).format(AFTER_FORMAT);

        if (mode == QueryMode.FALLBACK) {
            return "(" + fromClause + ") after:" + afterDate;
        }

        List<String> keywords = category != null && category.isPriority()
                ? PRIORITY_SUBJECT_KEYWORDS
                : DEFAULT_SUBJECT_KEYWORDS;
        String subjectClause = keywords.stream()
                .map(SupplierQueryBuilder::quoteKeyword)
                .collect(Collectors.joining(" OR "));
        return "(" + fromClause + ") subject:(" + subjectClause + ") after:" + afterDate;
    }

    private static boolean isValidDomain(String domain) {
        return domain.length() > 2 && domain.contains(".") && domain.chars().noneMatch(Character::isWhitespace);
    }

    private static String quoteKeyword(String keyword) {
        return keyword.contains(" ") ? "\"" + keyword + "\"" : keyword;
    }
}
