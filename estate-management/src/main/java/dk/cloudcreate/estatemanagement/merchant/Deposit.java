package dk.cloudcreate.estatemanagement.merchant;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * A manual deposit made to the merchant's balance
 */
public record Deposit(DepositId depositId, BigDecimal amount, String reference, OffsetDateTime depositDateTime) {
    /**
     * Is this deposit a duplicate of another deposit with the given details (same reference, amount and deposit time)
     */
    public boolean isSameDepositAs(BigDecimal otherAmount, String otherReference, OffsetDateTime otherDepositDateTime) {
        return reference.equals(otherReference) &&
                amount.compareTo(otherAmount) == 0 &&
                depositDateTime.isEqual(otherDepositDateTime);
    }
}
