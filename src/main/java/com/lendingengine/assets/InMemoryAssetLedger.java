package com.lendingengine.assets;

import com.lendingengine.common.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory asset ledger used as the default transfer collaborator.
 *
 * Tracks balances and the allowance each account has granted the pool. Pulls
 * spend allowance; pushes draw on the pool's custody balance.
 *
 * USE CASES:
 * - Running the service without external asset rails
 * - Unit and integration testing, including forced transfer failures
 *
 * NOT FOR PRODUCTION: this is a stand-in for a real asset integration.
 */
@Slf4j
public class InMemoryAssetLedger implements AssetTransferAdapter {

    private final String assetId;
    private final String custodyAccount;

    // account -> balance
    private final Map<String, Long> balances = new ConcurrentHashMap<>();

    // account -> amount the pool may still pull
    private final Map<String, Long> allowances = new ConcurrentHashMap<>();

    // Accounts whose movements are refused, e.g. a sanctioned or closed account
    private final Set<String> frozenAccounts = ConcurrentHashMap.newKeySet();

    // Simulated outage: every movement fails while set
    private volatile boolean failing;

    public InMemoryAssetLedger(String assetId, String custodyAccount) {
        this.assetId = assetId;
        this.custodyAccount = custodyAccount;
    }

    @Override
    public String getAssetId() {
        return assetId;
    }

    /**
     * Credit an account out of thin air. Helper for setup and testing.
     */
    public synchronized void mint(String account, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive: " + amount);
        }
        balances.merge(account, amount, Math::addExact);
        log.debug("{}: minted {} to {}", assetId, amount, account);
    }

    /**
     * Authorize the pool to pull up to {@code amount} from {@code owner}.
     * Replaces any previous allowance.
     */
    public synchronized void approve(String owner, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Allowance cannot be negative: " + amount);
        }
        allowances.put(owner, amount);
        log.debug("{}: {} approved pool for {}", assetId, owner, amount);
    }

    public long allowanceOf(String owner) {
        return allowances.getOrDefault(owner, 0L);
    }

    @Override
    public long balanceOf(String account) {
        return balances.getOrDefault(account, 0L);
    }

    @Override
    public synchronized void pull(String from, long amount) {
        log.info("{}: pulling {} from {}", assetId, amount, from);
        checkAvailable(from, "pull");

        long allowance = allowanceOf(from);
        if (allowance < amount) {
            throw new TransferFailedException(
                String.format("Allowance %d below pull amount %d", allowance, amount),
                assetId, from, "pull");
        }
        long balance = balanceOf(from);
        if (balance < amount) {
            throw new TransferFailedException(
                String.format("Balance %d below pull amount %d", balance, amount),
                assetId, from, "pull");
        }

        allowances.put(from, allowance - amount);
        move(from, custodyAccount, amount);
    }

    @Override
    public synchronized void push(String to, long amount) {
        log.info("{}: pushing {} to {}", assetId, amount, to);
        checkAvailable(to, "push");

        long custody = balanceOf(custodyAccount);
        if (custody < amount) {
            throw new TransferFailedException(
                String.format("Pool custody %d below push amount %d", custody, amount),
                assetId, to, "push");
        }

        move(custodyAccount, to, amount);
    }

    /**
     * Refuse every movement into or out of an account.
     */
    public void freeze(String account) {
        frozenAccounts.add(account);
    }

    /**
     * Make every subsequent movement fail (for testing failure scenarios).
     */
    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    /**
     * Clear all state (for test cleanup).
     */
    public synchronized void reset() {
        balances.clear();
        allowances.clear();
        frozenAccounts.clear();
        failing = false;
    }

    private void checkAvailable(String account, String operation) {
        if (failing) {
            throw new TransferFailedException(assetId + " ledger unavailable", assetId, account, operation);
        }
        if (frozenAccounts.contains(account)) {
            throw new TransferFailedException("Account is frozen: " + account, assetId, account, operation);
        }
    }

    private void move(String from, String to, long amount) {
        balances.put(from, balanceOf(from) - amount);
        balances.merge(to, amount, Math::addExact);
    }
}
