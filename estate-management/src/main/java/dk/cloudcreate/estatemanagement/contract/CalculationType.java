package dk.cloudcreate.estatemanagement.contract;

/**
 * How the value of a {@link TransactionFee} is interpreted
 */
public enum CalculationType {
    /**
     * The fee value is a fixed amount
     */
    Fixed,
    /**
     * The fee value is a fraction of the transaction amount
     */
    Percentage
}
