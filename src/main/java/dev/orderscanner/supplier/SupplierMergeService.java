package dev.orderscanner.supplier;

import dev.orderscanner.model.DiscoveredSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the priority supplier list with suppliers found by discovery into a
 * single ranked list keyed by canonical domain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SupplierMergeService {

    static final int MAX_SAMPLE_SUBJECTS = 5;

    private final SupplierDirectory supplierDirectory;

    /**
     * Merge using the configured priority suppliers as seeds.
     */
    public List<DiscoveredSupplier> mergeWithPriority(List<DiscoveredSupplier> discovered) {
        return merge(supplierDirectory.prioritySeeds(), discovered);
    }

    /**
     * Merge two supplier lists.
     * <p>
     * Records that share a canonical domain are folded together: email counts
     * summed, max score, known category preferred, sample subjects unioned and
     * capped, recommended flags ORed. Email counts are summed across distinct
     * source spellings only; a spelling seen again contributes its larger count
     * instead of adding to it, so merging a list with itself changes nothing.
     * Marketplace domains are dropped. Priority suppliers sort first in their
     * given order, the rest by descending score.
     */
    public List<DiscoveredSupplier> merge(List<DiscoveredSupplier> priority, List<DiscoveredSupplier> discovered) {
        Map<String, Accumulator> merged = new LinkedHashMap<>();
        Set<String> priorityDomains = new HashSet<>();

        for (DiscoveredSupplier supplier : priority) {
            String canonical = supplierDirectory.canonicalize(supplier.getDomain());
            priorityDomains.add(canonical);
            merged.computeIfAbsent(canonical, Accumulator::new).add(supplier);
        }

        int dropped = 0;
        for (DiscoveredSupplier supplier : discovered) {
            String canonical = supplierDirectory.canonicalize(supplier.getDomain());
            if (supplierDirectory.isMarketplace(canonical)) {
                dropped++;
                continue;
            }
            merged.computeIfAbsent(canonical, Accumulator::new).add(supplier);
        }

        if (dropped > 0) {
            log.debug("Excluded {} marketplace suppliers from merge", dropped);
        }

        List<DiscoveredSupplier> result = new ArrayList<>(merged.size());
        merged.values().forEach(acc -> result.add(acc.toSupplier()));

        // List.sort is stable: priority suppliers keep their seed order
        result.sort(Comparator
                .comparing((DiscoveredSupplier s) -> !priorityDomains.contains(s.getDomain()))
                .thenComparing((a, b) -> priorityDomains.contains(a.getDomain())
                        ? 0
                        : Double.compare(b.getScore(), a.getScore())));
        return result;
    }

    private static final class Accumulator {
        private final String domain;
        private final Map<String, Integer> countsBySpelling = new HashMap<>();
        private final Set<String> subjects = new LinkedHashSet<>();
        private DiscoveredSupplier first;
        private double score = Double.NEGATIVE_INFINITY;
        private String category;
        private boolean recommended;

        Accumulator(String domain) {
            this.domain = domain;
        }

        void add(DiscoveredSupplier supplier) {
            if (first == null) {
                first = supplier;
                category = supplier.getCategory();
            } else if (!isKnown(category) && supplier.hasKnownCategory()) {
                category = supplier.getCategory();
            }
            countsBySpelling.merge(SupplierDirectory.normalize(supplier.getDomain()),
                    supplier.getEmailCount(), Math::max);
            score = Math.max(score, supplier.getScore());
            if (supplier.getSampleSubjects() != null) {
                supplier.getSampleSubjects().stream()
                        .filter(subject -> subject != null && !subject.isBlank())
                        .forEach(subjects::add);
            }
            recommended = recommended || supplier.isRecommended();
        }

        private static boolean isKnown(String category) {
            return category != null && !category.isBlank()
                    && !DiscoveredSupplier.UNKNOWN_CATEGORY.equalsIgnoreCase(category);
        }

        DiscoveredSupplier toSupplier() {
            return first.toBuilder()
                    .domain(domain)
                    .emailCount(countsBySpelling.values().stream().mapToInt(Integer::intValue).sum())
                    .score(score)
                    .category(category)
                    .sampleSubjects(subjects.stream().limit(MAX_SAMPLE_SUBJECTS).toList())
                    .recommended(recommended)
                    .build();
        }
    }
}
