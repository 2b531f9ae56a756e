package assetup.ledger.model;

public enum AssetType {
    PHYSICAL,
    DIGITAL
}
