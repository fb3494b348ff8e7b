package dev.orderscanner.repository;

import dev.orderscanner.entity.OrderRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Repository for persisted order history.
 */
@Repository
public interface OrderRecordRepository extends JpaRepository<OrderRecord, Long> {

    /**
     * All orders saved for an owner, oldest save first.
     */
    List<OrderRecord> findByOwnerKeyOrderByIdAsc(String ownerKey);

    /**
     * Source email ids from a set that are already stored for an owner.
     */
    @Query("SELECT o.originalEmailId FROM OrderRecord o WHERE o.ownerKey = :ownerKey AND o.originalEmailId IN :emailIds")
    Set<String> findExistingEmailIds(String ownerKey, Set<String> emailIds);

    long countByOwnerKey(String ownerKey);

    /**
     * Delete orders saved before a certain date (for cleanup).
     */
    long deleteBySavedAtBefore(LocalDateTime date);
}
