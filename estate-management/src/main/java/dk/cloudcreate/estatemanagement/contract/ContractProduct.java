package dk.cloudcreate.estatemanagement.contract;

import java.math.BigDecimal;
import java.util.*;

/**
 * A product sold under a {@link Contract}
 *
 * @param value the fixed value of the product or <code>null</code> for a variable value product
 */
public record ContractProduct(ProductId productId,
                              String name,
                              String displayText,
                              BigDecimal value,
                              List<TransactionFee> transactionFees) {
    public ContractProduct {
        transactionFees = List.copyOf(transactionFees);
    }

    public boolean isVariableValue() {
        return value == null;
    }

    public Optional<TransactionFee> getTransactionFee(TransactionFeeId transactionFeeId) {
        return transactionFees.stream()
                              .filter(transactionFee -> transactionFee.transactionFeeId().equals(transactionFeeId))
                              .findFirst();
    }

    ContractProduct withTransactionFee(TransactionFee transactionFee) {
        var fees = new ArrayList<>(transactionFees);
        fees.add(transactionFee);
        return new ContractProduct(productId, name, displayText, value, fees);
    }

    ContractProduct withTransactionFeeDisabled(TransactionFeeId transactionFeeId) {
        var fees = new ArrayList<TransactionFee>(transactionFees.size());
        for (var transactionFee : transactionFees) {
            fees.add(transactionFee.transactionFeeId().equals(transactionFeeId) ? transactionFee.disable() : transactionFee);
        }
        return new ContractProduct(productId, name, displayText, value, fees);
    }
}
