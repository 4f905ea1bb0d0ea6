package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.instruction.InstructionKind;
import com.flagship.transaction_engine.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only JPA mapping of the ledger_entries table.
 *
 * Writes go through {@link LedgerAppender}; this entity serves the query path only.
 */
@Entity
@Immutable
@Table(name = "ledger_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "from_account_id")
    private String fromAccountId;

    @Column(name = "to_account_id")
    private String toAccountId;

    @Column(name = "type", nullable = false, length = 20)
    private String type;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentBalance;

    @Column(name = "instruction_id")
    private UUID instructionId;

    public LedgerEntry toDomain() {
        return new LedgerEntry(
            this.id,
            this.accountId,
            this.fromAccountId,
            this.toAccountId,
            InstructionKind.fromWireName(this.type),
            Money.of(this.amount),
            this.createdAt,
            Money.of(this.currentBalance),
            this.instructionId
        );
    }
}
