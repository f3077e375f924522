package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.eventstore.AggregateNotFoundException;
import org.slf4j.*;

import java.math.BigDecimal;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles the commands that target a {@link ContractAggregate}.<br>
 * Creating a contract validates the operator against the (read only) {@link EstateAggregate}
 */
public class ContractDomainService {
    private static final Logger log = LoggerFactory.getLogger(ContractDomainService.class);

    private final AggregateRepository<ContractId, ContractEvent, ContractAggregate> contractRepository;
    private final AggregateRepository<EstateId, EstateEvent, EstateAggregate>       estateRepository;

    public ContractDomainService(AggregateRepository<ContractId, ContractEvent, ContractAggregate> contractRepository,
                                 AggregateRepository<EstateId, EstateEvent, EstateAggregate> estateRepository) {
        this.contractRepository = requireNonNull(contractRepository, "No contractRepository provided");
        this.estateRepository = requireNonNull(estateRepository, "No estateRepository provided");
    }

    public ContractId createContract(EstateId estateId, OperatorId operatorId, String description) {
        return createContract(ContractId.random(), estateId, operatorId, description);
    }

    /**
     * Create a contract between an estate and one of its operators
     *
     * @return the id of the new contract
     * @throws DomainValidationException in case the estate doesn't exist, the operator isn't added to the estate
     *                                   or a contract with the given id already exists
     */
    public ContractId createContract(ContractId contractId, EstateId estateId, OperatorId operatorId, String description) {
        requireNonNull(contractId, "No contractId provided");
        requireNonNull(estateId, "No estateId provided");
        requireNonNull(operatorId, "No operatorId provided");
        var estate = estateRepository.tryLoad(estateId)
                                     .orElseThrow(() -> new DomainValidationException(msg("Estate with id '{}' doesn't exist", estateId)));
        var operator = estate.getOperator(operatorId)
                             .orElseThrow(() -> new DomainValidationException(msg("Operator with id '{}' has not been added to Estate '{}'", operatorId, estateId)));
        if (contractRepository.tryLoad(contractId).isPresent()) {
            throw new DomainValidationException(msg("Contract with id '{}' already exists", contractId));
        }
        var contract = new ContractAggregate(contractId);
        contract.create(estateId, operatorId, operator.name(), description);
        contractRepository.persist(contract);
        log.debug("Created Contract '{}' with id '{}' for Operator '{}' on Estate '{}'", description, contractId, operatorId, estateId);
        return contractId;
    }

    /**
     * Add a variable value product, using the product name as display text
     */
    public ProductId addProductToContract(ContractId contractId, String productName) {
        return addProductToContract(contractId, productName, productName, null);
    }

    /**
     * Add a product to the contract
     *
     * @param value the fixed value of the product or <code>null</code> to add a variable value product
     * @return the id of the new product
     * @throws AggregateNotFoundException in case the contract doesn't exist
     * @throws DomainValidationException  in case a product with the same name is already added to the contract
     */
    public ProductId addProductToContract(ContractId contractId, String productName, String displayText, BigDecimal value) {
        var contract  = contractRepository.load(contractId);
        var productId = ProductId.random();
        if (value == null) {
            contract.addVariableValueProduct(productId, productName, displayText);
        } else {
            contract.addFixedValueProduct(productId, productName, displayText, value);
        }
        contractRepository.persist(contract);
        log.debug("Added Product '{}' with id '{}' to Contract '{}'", productName, productId, contractId);
        return productId;
    }

    /**
     * Add a transaction fee to one of the contract's products
     *
     * @return the id of the new transaction fee
     * @throws AggregateNotFoundException in case the contract doesn't exist
     * @throws DomainValidationException  in case the product doesn't exist on the contract or the fee value is negative
     */
    public TransactionFeeId addTransactionFeeForProductToContract(ContractId contractId,
                                                                  ProductId productId,
                                                                  String description,
                                                                  CalculationType calculationType,
                                                                  FeeType feeType,
                                                                  BigDecimal value) {
        var contract         = contractRepository.load(contractId);
        var transactionFeeId = TransactionFeeId.random();
        contract.addTransactionFee(productId, transactionFeeId, description, calculationType, feeType, value);
        contractRepository.persist(contract);
        log.debug("Added {} {} Transaction fee '{}' with id '{}' to Product '{}' on Contract '{}'",
                  calculationType,
                  feeType,
                  description,
                  transactionFeeId,
                  productId,
                  contractId);
        return transactionFeeId;
    }

    /**
     * Disable a transaction fee. Disabling an already disabled fee has no effect
     *
     * @throws AggregateNotFoundException in case the contract doesn't exist
     * @throws DomainValidationException  in case the product or the fee doesn't exist on the contract
     */
    public void disableTransactionFeeForProduct(ContractId contractId, ProductId productId, TransactionFeeId transactionFeeId) {
        var contract = contractRepository.load(contractId);
        contract.disableTransactionFee(productId, transactionFeeId);
        contractRepository.persist(contract);
        log.debug("Disabled Transaction fee '{}' on Product '{}' on Contract '{}'", transactionFeeId, productId, contractId);
    }

    /**
     * Get the current state of a contract
     *
     * @throws AggregateNotFoundException in case the contract doesn't exist
     */
    public Contract getContract(ContractId contractId) {
        return contractRepository.load(contractId).getContract();
    }
}
