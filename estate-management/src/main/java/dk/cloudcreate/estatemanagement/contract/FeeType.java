package dk.cloudcreate.estatemanagement.contract;

/**
 * Who a {@link TransactionFee} is charged to
 */
public enum FeeType {
    Merchant,
    ServiceProvider
}
