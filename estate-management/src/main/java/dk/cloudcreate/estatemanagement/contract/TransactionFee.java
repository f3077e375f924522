package dk.cloudcreate.estatemanagement.contract;

import java.math.BigDecimal;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A fee charged for transactions of a {@link ContractProduct}. Fees are never removed from a product, but they can be disabled
 */
public record TransactionFee(TransactionFeeId transactionFeeId,
                             String description,
                             CalculationType calculationType,
                             FeeType feeType,
                             BigDecimal value,
                             boolean enabled) {

    /**
     * Calculate the fee for a transaction
     *
     * @param transactionAmount the amount of the transaction
     * @return {@link #value()} for a {@link CalculationType#Fixed} fee and <code>transactionAmount * value</code> for a {@link CalculationType#Percentage} fee
     */
    public BigDecimal calculateFee(BigDecimal transactionAmount) {
        requireNonNull(transactionAmount, "You must supply a transactionAmount");
        switch (calculationType) {
            case Fixed:
                return value;
            case Percentage:
                return transactionAmount.multiply(value);
            default:
                throw new IllegalStateException("Unsupported calculationType " + calculationType);
        }
    }

    public TransactionFee disable() {
        return new TransactionFee(transactionFeeId, description, calculationType, feeType, value, false);
    }
}
