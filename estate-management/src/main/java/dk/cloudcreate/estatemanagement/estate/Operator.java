package dk.cloudcreate.estatemanagement.estate;

/**
 * An operator (payment provider) that merchants of the estate can be assigned to
 */
public record Operator(OperatorId operatorId,
                       String name,
                       boolean requireCustomMerchantNumber,
                       boolean requireCustomTerminalNumber) {
}
