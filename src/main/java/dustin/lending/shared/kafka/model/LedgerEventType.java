package dustin.lending.shared.kafka.model;

public enum LedgerEventType {
    MARKET_REGISTERED,
    PRICE_UPDATED,
    PROTOCOL_PAUSE_CHANGED,
    SUPPLIED,
    WITHDRAWN,
    BORROWED,
    REPAID,
    COLLATERAL_CHANGED,
    LIQUIDATED
}
