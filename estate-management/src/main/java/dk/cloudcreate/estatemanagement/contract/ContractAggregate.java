package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.contract.ContractEvent.*;
import dk.cloudcreate.estatemanagement.estate.*;

import java.math.BigDecimal;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A contract between an estate and one of its operators, listing the products sold under the contract
 * and the transaction fees charged per product.<br>
 * The contract doesn't verify that the operator exists on the estate, that check belongs to the {@link ContractDomainService}
 */
public class ContractAggregate extends AggregateRoot<ContractId, ContractEvent, ContractAggregate> {
    private final EventHandler                    eventHandler = new EventHandler();
    private       EstateId                        estateId;
    private       OperatorId                      operatorId;
    private       String                          operatorName;
    private       String                          description;
    private final Map<ProductId, ContractProduct> products = new LinkedHashMap<>();

    public ContractAggregate(ContractId contractId) {
        super(contractId);
    }

    /**
     * Create the contract
     *
     * @param operatorName the name the operator has on the estate when the contract is created
     */
    public void create(EstateId estateId, OperatorId operatorId, String operatorName, String description) {
        requireNonNull(estateId, "You must supply an estateId");
        requireNonNull(operatorId, "You must supply an operatorId");
        requireNonBlank(operatorName, "Operator name must be provided");
        requireNonBlank(description, "Contract description must be provided");
        if (isCreated()) {
            throw new DomainValidationException(msg("Contract with id '{}' has already been created", aggregateId()));
        }
        apply(new ContractCreated(aggregateId(), estateId, operatorId, operatorName, description));
    }

    public void addFixedValueProduct(ProductId productId, String productName, String displayText, BigDecimal value) {
        validateNewProduct(productId, productName, displayText);
        if (value == null || value.signum() <= 0) {
            throw new DomainValidationException(msg("Product '{}' must have a value greater than zero", productName));
        }
        apply(new FixedValueProductAddedToContract(aggregateId(), estateId, productId, productName, displayText, value));
    }

    public void addVariableValueProduct(ProductId productId, String productName, String displayText) {
        validateNewProduct(productId, productName, displayText);
        apply(new VariableValueProductAddedToContract(aggregateId(), estateId, productId, productName, displayText));
    }

    public void addTransactionFee(ProductId productId,
                                  TransactionFeeId transactionFeeId,
                                  String description,
                                  CalculationType calculationType,
                                  FeeType feeType,
                                  BigDecimal value) {
        requireNonNull(transactionFeeId, "You must supply a transactionFeeId");
        requireNonBlank(description, "Transaction fee description must be provided");
        if (calculationType == null) {
            throw new DomainValidationException("Transaction fee calculation type must be provided");
        }
        if (feeType == null) {
            throw new DomainValidationException("Transaction fee type must be provided");
        }
        if (value == null || value.signum() < 0) {
            throw new DomainValidationException(msg("Transaction fee '{}' must have a value of zero or more", description));
        }
        var product = requireProduct(productId);
        if (product.getTransactionFee(transactionFeeId).isPresent()) {
            throw new DomainValidationException(msg("Transaction fee with id '{}' has already been added to Product '{}'",
                                                    transactionFeeId,
                                                    product.name()));
        }
        apply(new TransactionFeeForProductAddedToContract(aggregateId(),
                                                          estateId,
                                                          productId,
                                                          transactionFeeId,
                                                          description,
                                                          calculationType,
                                                          feeType,
                                                          value));
    }

    /**
     * Disable a transaction fee. Disabling a fee that's already disabled doesn't produce an event
     */
    public void disableTransactionFee(ProductId productId, TransactionFeeId transactionFeeId) {
        requireNonNull(transactionFeeId, "You must supply a transactionFeeId");
        var product = requireProduct(productId);
        var transactionFee = product.getTransactionFee(transactionFeeId)
                                    .orElseThrow(() -> new DomainValidationException(msg("Transaction fee with id '{}' not found on Product '{}'",
                                                                                         transactionFeeId,
                                                                                         product.name())));
        if (!transactionFee.enabled()) {
            return;
        }
        apply(new TransactionFeeForProductDisabled(aggregateId(), estateId, productId, transactionFeeId));
    }

    @Override
    protected void applyEventToTheAggregate(ContractEvent event) {
        event.dispatchTo(eventHandler);
    }

    public boolean isCreated() {
        return description != null;
    }

    public Optional<ContractProduct> getProduct(ProductId productId) {
        return Optional.ofNullable(products.get(productId));
    }

    public Contract getContract() {
        return new Contract(aggregateId(),
                            estateId,
                            operatorId,
                            operatorName,
                            description,
                            new ArrayList<>(products.values()));
    }

    private void validateNewProduct(ProductId productId, String productName, String displayText) {
        requireNonNull(productId, "You must supply a productId");
        requireNonBlank(productName, "Product name must be provided");
        requireNonBlank(displayText, "Product display text must be provided");
        requireCreated();
        if (products.containsKey(productId)) {
            throw new DomainValidationException(msg("Product with id '{}' has already been added to Contract '{}'", productId, description));
        }
        if (products.values().stream().anyMatch(product -> product.name().equals(productName))) {
            throw new DomainValidationException(msg("Product with name '{}' has already been added to Contract '{}'", productName, description));
        }
    }

    private ContractProduct requireProduct(ProductId productId) {
        requireNonNull(productId, "You must supply a productId");
        requireCreated();
        return getProduct(productId).orElseThrow(() -> new DomainValidationException(msg("Product with id '{}' not found on Contract '{}'",
                                                                                         productId,
                                                                                         description)));
    }

    private void requireCreated() {
        if (!isCreated()) {
            throw new DomainValidationException(msg("Contract with id '{}' has not been created", aggregateId()));
        }
    }

    private static void requireNonBlank(String value, String errorMessage) {
        if (value == null || value.isBlank()) {
            throw new DomainValidationException(errorMessage);
        }
    }

    private class EventHandler implements ContractEvent.Handler {
        @Override
        public void handle(ContractCreated event) {
            estateId = event.estateId();
            operatorId = event.operatorId();
            operatorName = event.operatorName();
            description = event.description();
        }

        @Override
        public void handle(FixedValueProductAddedToContract event) {
            products.put(event.productId(), new ContractProduct(event.productId(),
                                                                event.productName(),
                                                                event.displayText(),
                                                                event.value(),
                                                                List.of()));
        }

        @Override
        public void handle(VariableValueProductAddedToContract event) {
            products.put(event.productId(), new ContractProduct(event.productId(),
                                                                event.productName(),
                                                                event.displayText(),
                                                                null,
                                                                List.of()));
        }

        @Override
        public void handle(TransactionFeeForProductAddedToContract event) {
            products.computeIfPresent(event.productId(),
                                      (productId, product) -> product.withTransactionFee(new TransactionFee(event.transactionFeeId(),
                                                                                                            event.description(),
                                                                                                            event.calculationType(),
                                                                                                            event.feeType(),
                                                                                                            event.value(),
                                                                                                            true)));
        }

        @Override
        public void handle(TransactionFeeForProductDisabled event) {
            products.computeIfPresent(event.productId(),
                                      (productId, product) -> product.withTransactionFeeDisabled(event.transactionFeeId()));
        }
    }
}
