package com.lendingengine.assets;

import com.lendingengine.common.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered set of asset movements that succeed or fail as a unit.
 *
 * Legs run in the order they were added. If a leg fails, every pull that already
 * completed is refunded by pushing the same amount back, most recent first, and
 * the original failure propagates unchanged. Pushes cannot be
 * clawed back, so callers add pulls before pushes.
 *
 * Zero-amount legs are skipped.
 */
@Slf4j
public class TransferBatch {

    private final List<Leg> legs = new ArrayList<>();

    public static TransferBatch create() {
        return new TransferBatch();
    }

    public TransferBatch pull(AssetTransferAdapter asset, String from, long amount) {
        legs.add(new Leg(asset, from, amount, true));
        return this;
    }

    public TransferBatch push(AssetTransferAdapter asset, String to, long amount) {
        legs.add(new Leg(asset, to, amount, false));
        return this;
    }

    public int size() {
        return legs.size();
    }

    /**
     * Execute all legs.
     *
     * @throws TransferFailedException if any leg fails; completed pulls have been refunded
     */
    public void execute() {
        Deque<Leg> completedPulls = new ArrayDeque<>();

        for (Leg leg : legs) {
            if (leg.amount == 0) {
                continue;
            }
            try {
                if (leg.pull) {
                    leg.asset.pull(leg.account, leg.amount);
                    completedPulls.push(leg);
                } else {
                    leg.asset.push(leg.account, leg.amount);
                }
            } catch (RuntimeException e) {
                log.warn("Transfer leg failed ({} {} {} {}): {}", leg.pull ? "pull" : "push",
                    leg.asset.getAssetId(), leg.account, leg.amount, e.getMessage());
                refund(completedPulls, e);
                throw e;
            }
        }
    }

    private void refund(Deque<Leg> completedPulls, RuntimeException failure) {
        while (!completedPulls.isEmpty()) {
            Leg leg = completedPulls.pop();
            try {
                leg.asset.push(leg.account, leg.amount);
                log.info("Refunded {} {} to {}", leg.amount, leg.asset.getAssetId(), leg.account);
            } catch (RuntimeException refundFailure) {
                log.error("Refund of {} {} to {} failed", leg.amount, leg.asset.getAssetId(),
                    leg.account, refundFailure);
                failure.addSuppressed(refundFailure);
            }
        }
    }

    private static final class Leg {
        final AssetTransferAdapter asset;
        final String account;
        final long amount;
        final boolean pull;

        Leg(AssetTransferAdapter asset, String account, long amount, boolean pull) {
            this.asset = asset;
            this.account = account;
            this.amount = amount;
            this.pull = pull;
        }
    }
}
