package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.estatemanagement.EstateManagement;
import dk.cloudcreate.estatemanagement.aggregates.DomainValidationException;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.eventstore.AggregateNotFoundException;
import dk.cloudcreate.estatemanagement.security.RecordingSecurityServiceClient;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class ContractDomainServiceTest {
    private EstateManagement      estateManagement;
    private ContractDomainService contractDomainService;
    private EstateId              estateId;
    private OperatorId            operatorId;

    @BeforeEach
    void setup() {
        estateManagement = EstateManagement.usingInMemoryEventStore(new RecordingSecurityServiceClient());
        contractDomainService = estateManagement.contractDomainService();
        estateId = estateManagement.estateDomainService().createEstate("Test Estate 1");
        operatorId = estateManagement.estateDomainService().addOperatorToEstate(estateId, "Test Operator 1", true, true);
    }

    @Test
    void create_contract() {
        // When
        var contractId = contractDomainService.createContract(estateId, operatorId, "Operator 1 Contract");

        // Then
        var contract = contractDomainService.getContract(contractId);
        assertThat(contract.estateId()).isEqualTo(estateId);
        assertThat(contract.operatorId()).isEqualTo(operatorId);
        assertThat(contract.operatorName()).isEqualTo("Test Operator 1");
        assertThat(contract.description()).isEqualTo("Operator 1 Contract");
    }

    @Test
    void creating_a_contract_for_an_operator_that_is_not_on_the_estate_is_rejected() {
        var unknownOperatorId = OperatorId.random();

        assertThatThrownBy(() -> contractDomainService.createContract(estateId, unknownOperatorId, "Operator 1 Contract"))
                .isInstanceOf(DomainValidationException.class);
    }

    @Test
    void creating_a_contract_for_an_unknown_estate_is_rejected() {
        var unknownEstateId = EstateId.random();

        assertThatThrownBy(() -> contractDomainService.createContract(unknownEstateId, operatorId, "Operator 1 Contract"))
                .isInstanceOf(DomainValidationException.class);
    }

    @Test
    void creating_a_contract_with_an_existing_id_is_rejected() {
        var contractId = contractDomainService.createContract(ContractId.random(), estateId, operatorId, "Operator 1 Contract");

        assertThatThrownBy(() -> contractDomainService.createContract(contractId, estateId, operatorId, "Other Contract"))
                .isInstanceOf(DomainValidationException.class);
    }

    @Test
    void add_fixed_and_variable_value_products() {
        // Given
        var contractId = contractDomainService.createContract(estateId, operatorId, "Operator 1 Contract");

        // When
        var variableProductId = contractDomainService.addProductToContract(contractId, "Product A");
        var fixedProductId    = contractDomainService.addProductToContract(contractId, "100 KES Topup", "100 KES", new BigDecimal("100.00"));

        // Then
        var contract = contractDomainService.getContract(contractId);
        assertThat(contract.products()).extracting(ContractProduct::productId)
                                       .containsExactly(variableProductId, fixedProductId);
        assertThat(contract.getProduct(variableProductId).get().displayText()).isEqualTo("Product A");
        assertThat(contract.getProduct(variableProductId).get().isVariableValue()).isTrue();
        assertThat(contract.getProduct(fixedProductId).get().value()).isEqualByComparingTo("100.00");
    }

    @Test
    void adding_a_product_to_an_unknown_contract() {
        var contractId = ContractId.random();

        assertThatThrownBy(() -> contractDomainService.addProductToContract(contractId, "Product A"))
                .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void add_and_disable_a_transaction_fee() {
        // Given
        var contractId = contractDomainService.createContract(estateId, operatorId, "Operator 1 Contract");
        var productId  = contractDomainService.addProductToContract(contractId, "Product A");
        var feeId      = contractDomainService.addTransactionFeeForProductToContract(contractId,
                                                                                     productId,
                                                                                     "Merchant Commission",
                                                                                     CalculationType.Percentage,
                                                                                     FeeType.Merchant,
                                                                                     new BigDecimal("0.05"));

        // When
        contractDomainService.disableTransactionFeeForProduct(contractId, productId, feeId);
        contractDomainService.disableTransactionFeeForProduct(contractId, productId, feeId);

        // Then
        var fee = contractDomainService.getContract(contractId).getProduct(productId).get().getTransactionFee(feeId).get();
        assertThat(fee.enabled()).isFalse();
        assertThat(fee.calculateFee(new BigDecimal("200"))).isEqualByComparingTo("10");
        assertThat(estateManagement.eventStore().fetchStream(EstateManagement.CONTRACTS, contractId).get().eventList()).hasSize(4);
    }

    @Test
    void adding_a_transaction_fee_to_an_unknown_product_is_rejected() {
        var contractId = contractDomainService.createContract(estateId, operatorId, "Operator 1 Contract");
        var productId  = ProductId.random();

        assertThatThrownBy(() -> contractDomainService.addTransactionFeeForProductToContract(contractId,
                                                                                             productId,
                                                                                             "Merchant Commission",
                                                                                             CalculationType.Fixed,
                                                                                             FeeType.Merchant,
                                                                                             BigDecimal.ONE))
                .isInstanceOf(DomainValidationException.class);
    }
}
