package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.estate.OperatorId;

/**
 * An estate operator assigned to a merchant
 *
 * @param operatorId     the id of the operator on the merchant's estate
 * @param name           the operator name
 * @param merchantNumber the merchant number used with the operator (<code>null</code> if none was supplied)
 * @param terminalNumber the terminal number used with the operator (<code>null</code> if none was supplied)
 */
public record MerchantOperator(OperatorId operatorId, String name, String merchantNumber, String terminalNumber) {
}
