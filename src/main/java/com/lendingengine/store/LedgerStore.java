package com.lendingengine.store;

import com.lendingengine.config.PoolConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Access point for lender, borrower and pool records.
 *
 * Holds no business rules: loads records, creates them on first use and saves
 * them back. Callers run inside their own transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerStore {

    private final LenderRecordRepository lenderRepository;
    private final BorrowerRecordRepository borrowerRepository;
    private final PoolStateRepository poolStateRepository;
    private final PoolConfiguration configuration;

    public Optional<LenderRecord> findLender(String account) {
        return lenderRepository.findById(account);
    }

    public LenderRecord getOrCreateLender(String account) {
        return lenderRepository.findById(account).orElseGet(() -> {
            log.debug("Creating lender record for {}", account);
            return new LenderRecord(account);
        });
    }

    public LenderRecord saveLender(LenderRecord lender) {
        return lenderRepository.save(lender);
    }

    public Optional<BorrowerRecord> findBorrower(String account) {
        return borrowerRepository.findById(account);
    }

    public BorrowerRecord getOrCreateBorrower(String account) {
        return borrowerRepository.findById(account).orElseGet(() -> {
            log.debug("Creating borrower record for {}", account);
            return new BorrowerRecord(account);
        });
    }

    public BorrowerRecord saveBorrower(BorrowerRecord borrower) {
        return borrowerRepository.save(borrower);
    }

    public List<BorrowerRecord> findActiveBorrowers() {
        return borrowerRepository.findByAmountBorrowedGreaterThanOrderByAccountAsc(0);
    }

    /**
     * Load the pool row, creating it from configuration the first time.
     */
    public PoolState loadPool() {
        return poolStateRepository.findById(PoolState.POOL_ID).orElseGet(() -> {
            log.info("Initializing pool state with fee recipient {}", configuration.getFeeRecipient());
            return poolStateRepository.save(new PoolState(configuration.getFeeRecipient()));
        });
    }

    /**
     * Read the pool row without creating it. Before the first write this is the
     * configured initial state.
     */
    public PoolState viewPool() {
        return poolStateRepository.findById(PoolState.POOL_ID)
            .orElseGet(() -> new PoolState(configuration.getFeeRecipient()));
    }

    public PoolState savePool(PoolState pool) {
        return poolStateRepository.save(pool);
    }

    /**
     * Write pending record and journal changes to the database now.
     *
     * Engines call this before moving assets so constraint and version failures
     * surface while nothing has left the pool yet.
     */
    public void flush() {
        borrowerRepository.flush();
    }

    public long sumLenderBalances() {
        return lenderRepository.sumAmountSupplied();
    }
}
