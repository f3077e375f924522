package dk.cloudcreate.estatemanagement;

import dk.cloudcreate.estatemanagement.aggregates.DomainValidationException;
import dk.cloudcreate.estatemanagement.contract.*;
import dk.cloudcreate.estatemanagement.estate.OperatorId;
import dk.cloudcreate.estatemanagement.eventstore.persistence.OptimisticAppendToStreamException;
import dk.cloudcreate.estatemanagement.security.RecordingSecurityServiceClient;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class EstateManagementIT {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("estate-management")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi             jdbi;
    private EstateManagement estateManagement;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        estateManagement = EstateManagement.usingPostgresql(jdbi, new RecordingSecurityServiceClient());
    }

    @Test
    void an_event_table_is_created_per_aggregate_type() {
        for (var table : new String[]{"estates_events", "merchants_events", "contracts_events"}) {
            var regclass = jdbi.withHandle(handle -> handle.select("SELECT to_regclass(?)", table)
                                                           .mapTo(String.class)
                                                           .findOne());
            assertThat(regclass).contains(table);
        }
    }

    @Test
    void estate_operator_contract_product_and_transaction_fee() {
        // Given
        var estateId   = estateManagement.estateDomainService().createEstate("Test Estate 1");
        var operatorId = estateManagement.estateDomainService().addOperatorToEstate(estateId, "Test Operator 1", true, true);
        var contractId = estateManagement.contractDomainService().createContract(estateId, operatorId, "desc");
        var productId  = estateManagement.contractDomainService().addProductToContract(contractId, "Product A");

        // When
        var feeId = estateManagement.contractDomainService().addTransactionFeeForProductToContract(contractId,
                                                                                                   productId,
                                                                                                   "desc",
                                                                                                   CalculationType.Fixed,
                                                                                                   FeeType.Merchant,
                                                                                                   new BigDecimal("0.05"));

        // Then
        var reloadedManagement = EstateManagement.usingPostgresql(jdbi, new RecordingSecurityServiceClient());
        var contract           = reloadedManagement.contractDomainService().getContract(contractId);
        assertThat(contract.products()).hasSize(1);
        assertThat(contract.products().get(0).transactionFees()).hasSize(1);
        var fee = contract.products().get(0).transactionFees().get(0);
        assertThat(fee.transactionFeeId()).isEqualTo(feeId);
        assertThat(fee.value()).isEqualByComparingTo("0.05");
        assertThat(reloadedManagement.estateDomainService().getEstate(estateId).operators()).hasSize(1);
    }

    @Test
    void merchant_deposits_and_validation_failures() {
        // Given
        var estateId   = estateManagement.estateDomainService().createEstate("Test Estate 1");
        var operatorId = estateManagement.estateDomainService().addOperatorToEstate(estateId, "Test Operator 1", false, false);
        var merchantId = estateManagement.merchantDomainService().createMerchant(estateId, "Test Merchant 1");

        // When
        estateManagement.merchantDomainService().assignOperatorToMerchant(estateId, merchantId, operatorId);
        estateManagement.merchantDomainService().addDeviceToMerchant(merchantId, "123456780");
        estateManagement.merchantDomainService().makeMerchantDeposit(merchantId, new BigDecimal("500.00"), "Deposit1");
        assertThatThrownBy(() -> estateManagement.merchantDomainService().makeMerchantDeposit(merchantId, new BigDecimal("-5"), "ref"))
                .isInstanceOf(DomainValidationException.class);
        assertThatThrownBy(() -> estateManagement.merchantDomainService().assignOperatorToMerchant(estateId, merchantId, OperatorId.random()))
                .isInstanceOf(DomainValidationException.class);

        // Then
        var merchant = estateManagement.merchantDomainService().getMerchant(merchantId);
        assertThat(merchant.balance()).isEqualByComparingTo("500.00");
        assertThat(merchant.operators()).hasSize(1);
        assertThat(merchant.devices()).hasSize(1);
        assertThat(estateManagement.merchantRepository().load(merchantId).eventOrderOfLastRehydratedEvent().longValue()).isEqualTo(3L);
    }

    @Test
    void a_stale_aggregate_cannot_be_persisted() {
        // Given
        var estateId     = estateManagement.estateDomainService().createEstate("Test Estate 1");
        var firstWriter  = estateManagement.estateRepository().load(estateId);
        var secondWriter = estateManagement.estateRepository().load(estateId);
        firstWriter.addOperator(OperatorId.random(), "Test Operator 1", true, true);
        secondWriter.addOperator(OperatorId.random(), "Test Operator 2", true, true);
        estateManagement.estateRepository().persist(firstWriter);

        // When
        var thrown = catchThrowable(() -> estateManagement.estateRepository().persist(secondWriter));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(estateManagement.estateDomainService().getEstate(estateId).operators()).hasSize(1);
    }
}
