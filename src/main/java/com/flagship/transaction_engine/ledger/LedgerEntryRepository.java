package com.flagship.transaction_engine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Query access to ledger entries.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID> {

    /**
     * Entries for an account in the order they were committed.
     */
    List<LedgerEntryEntity> findByAccountIdOrderByCreatedAtAscSequenceNumberAsc(String accountId);

    long countByAccountId(String accountId);
}
