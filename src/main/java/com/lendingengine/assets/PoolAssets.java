package com.lendingengine.assets;

/**
 * The two assets a lending pool moves: the lendable base asset and the collateral asset.
 */
public class PoolAssets {

    private final AssetTransferAdapter base;
    private final AssetTransferAdapter collateral;

    public PoolAssets(AssetTransferAdapter base, AssetTransferAdapter collateral) {
        this.base = base;
        this.collateral = collateral;
    }

    public AssetTransferAdapter base() {
        return base;
    }

    public AssetTransferAdapter collateral() {
        return collateral;
    }
}
