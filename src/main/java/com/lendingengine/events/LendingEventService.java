package com.lendingengine.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Journal of pool operations.
 *
 * Events are written in the same transaction as the state change they describe,
 * so a rolled-back operation leaves no event behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LendingEventService {

    private final LendingEventRepository eventRepository;

    @Transactional
    public LendingEvent recordDeposit(String lender, long amount, Instant at) {
        return record(new LendingEvent(LendingEventType.DEPOSIT, lender, null, amount, 0, at));
    }

    @Transactional
    public LendingEvent recordWithdraw(String lender, long amount, Instant at) {
        return record(new LendingEvent(LendingEventType.WITHDRAW, lender, null, amount, 0, at));
    }

    @Transactional
    public LendingEvent recordCollateralDeposit(String borrower, long amount, Instant at) {
        return record(new LendingEvent(LendingEventType.COLLATERAL_DEPOSIT, borrower, null, amount, 0, at));
    }

    @Transactional
    public LendingEvent recordCollateralWithdraw(String borrower, long amount, Instant at) {
        return record(new LendingEvent(LendingEventType.COLLATERAL_WITHDRAW, borrower, null, amount, 0, at));
    }

    @Transactional
    public LendingEvent recordBorrow(String borrower, long amount, Instant at) {
        return record(new LendingEvent(LendingEventType.BORROW, borrower, null, amount, 0, at));
    }

    @Transactional
    public LendingEvent recordRepay(String borrower, long principal, long interest, Instant at) {
        return record(new LendingEvent(LendingEventType.REPAY, borrower, null, principal, interest, at));
    }

    @Transactional
    public LendingEvent recordLiquidation(String liquidator, String borrower, long debt, long collateral,
                                          Instant at) {
        return record(new LendingEvent(LendingEventType.LIQUIDATE, liquidator, borrower, debt, collateral, at));
    }

    @Transactional
    public LendingEvent recordFeeRecipientUpdate(String owner, String newRecipient, Instant at) {
        return record(new LendingEvent(LendingEventType.FEE_RECIPIENT_UPDATED, owner, newRecipient, 0, 0, at));
    }

    @Transactional(readOnly = true)
    public List<LendingEvent> getAccountEvents(String account) {
        return eventRepository.findByAccountOrderByOccurredAtAsc(account);
    }

    @Transactional(readOnly = true)
    public List<LendingEvent> getEventsOfType(LendingEventType eventType) {
        return eventRepository.findByEventTypeOrderByOccurredAtAsc(eventType);
    }

    private LendingEvent record(LendingEvent event) {
        eventRepository.save(event);
        log.info("Recorded {}: account={}, counterparty={}, amount={}, secondary={}",
            event.getEventType(), event.getAccount(), event.getCounterparty(),
            event.getAmount(), event.getSecondaryAmount());
        return event;
    }
}
