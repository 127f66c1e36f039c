package com.lendingengine.events;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one mutating pool operation.
 *
 * Events are append-only: never updated or deleted. They exist for observability
 * and audit and never drive control flow.
 */
@Entity
@Table(name = "lending_events", indexes = {
    @Index(name = "idx_event_account", columnList = "account"),
    @Index(name = "idx_event_occurred_at", columnList = "occurred_at")
})
@Data
@NoArgsConstructor
public class LendingEvent {

    @Id
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LendingEventType eventType;

    /**
     * Account that performed the operation.
     */
    @Column(nullable = false)
    private String account;

    /**
     * Other party, e.g. the liquidated borrower or the new fee recipient.
     */
    private String counterparty;

    private long amount;

    private long secondaryAmount;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    public LendingEvent(LendingEventType eventType, String account, String counterparty,
                        long amount, long secondaryAmount, Instant occurredAt) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.account = account;
        this.counterparty = counterparty;
        this.amount = amount;
        this.secondaryAmount = secondaryAmount;
        this.occurredAt = occurredAt;
    }
}
