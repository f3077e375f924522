package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.EstateManagement;
import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.estatemanagement.merchant.MerchantEvent.*;
import dk.cloudcreate.estatemanagement.security.SecurityUserId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;

import static org.assertj.core.api.Assertions.*;

class MerchantAggregateTest {
    private static final OffsetDateTime CREATED_AT = OffsetDateTime.of(2023, 3, 1, 10, 15, 30, 0, ZoneOffset.UTC);

    private final EstateId estateId = EstateId.random();

    @Test
    void creating_a_merchant() {
        // Given
        var merchantId = MerchantId.random();
        var merchant   = new MerchantAggregate(merchantId);

        // When
        merchant.create(estateId, "Test Merchant 1", CREATED_AT);

        // Then
        assertThat(merchant.isCreated()).isTrue();
        assertThat(merchant.getEstateId()).isEqualTo(estateId);
        assertThat(merchant.getBalance()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(merchant.getUncommittedChanges()).containsExactly(new MerchantCreated(merchantId, estateId, "Test Merchant 1", CREATED_AT));
    }

    @Test
    void commands_on_a_merchant_that_has_not_been_created_are_rejected() {
        var merchant = new MerchantAggregate(MerchantId.random());

        assertThatThrownBy(() -> merchant.addDevice(DeviceId.random(), "device1"))
                .isInstanceOf(DomainValidationException.class);
        assertThatThrownBy(() -> merchant.makeDeposit(DepositId.random(), new BigDecimal("100"), "ref", CREATED_AT))
                .isInstanceOf(DomainValidationException.class);
        assertThat(merchant.getUncommittedChanges()).isEmpty();
    }

    @Test
    void deposits_add_up_to_the_balance() {
        // Given
        var merchant = createdMerchant();

        // When
        merchant.makeDeposit(DepositId.random(), new BigDecimal("100.00"), "Deposit 1", CREATED_AT.plusHours(1));
        merchant.makeDeposit(DepositId.random(), new BigDecimal("50.50"), "Deposit 2", CREATED_AT.plusHours(2));

        // Then
        assertThat(merchant.getBalance()).isEqualByComparingTo("150.50");
        assertThat(merchant.getMerchant().deposits()).extracting(Deposit::reference)
                                                     .containsExactly("Deposit 1", "Deposit 2");
    }

    @Test
    void a_negative_deposit_is_rejected_and_the_balance_is_unchanged() {
        // Given
        var merchant = createdMerchant();
        merchant.makeDeposit(DepositId.random(), new BigDecimal("100.00"), "Deposit 1", CREATED_AT);
        var numberOfChanges = merchant.getUncommittedChanges().size();

        // When
        assertThatThrownBy(() -> merchant.makeDeposit(DepositId.random(), new BigDecimal("-5"), "ref", CREATED_AT))
                .isInstanceOf(DomainValidationException.class);
        assertThatThrownBy(() -> merchant.makeDeposit(DepositId.random(), BigDecimal.ZERO, "ref", CREATED_AT))
                .isInstanceOf(DomainValidationException.class);

        // Then
        assertThat(merchant.getUncommittedChanges()).hasSize(numberOfChanges);
        assertThat(merchant.getBalance()).isEqualByComparingTo("100.00");
    }

    @Test
    void a_duplicate_deposit_is_rejected() {
        // Given
        var merchant = createdMerchant();
        merchant.makeDeposit(DepositId.random(), new BigDecimal("100.00"), "Deposit 1", CREATED_AT);

        // When
        assertThatThrownBy(() -> merchant.makeDeposit(DepositId.random(), new BigDecimal("100"), "Deposit 1", CREATED_AT))
                .isInstanceOf(DomainValidationException.class);
        merchant.makeDeposit(DepositId.random(), new BigDecimal("100.00"), "Deposit 1", CREATED_AT.plusMinutes(1));

        // Then
        assertThat(merchant.getMerchant().deposits()).hasSize(2);
        assertThat(merchant.getBalance()).isEqualByComparingTo("200.00");
    }

    @Test
    void a_device_identifier_is_only_added_once() {
        // Given
        var merchant = createdMerchant();
        var deviceId = DeviceId.random();
        merchant.addDevice(deviceId, "123456789");

        // When
        assertThatThrownBy(() -> merchant.addDevice(DeviceId.random(), "123456789"))
                .isInstanceOf(DomainValidationException.class);

        // Then
        assertThat(merchant.getMerchant().devices()).containsExactly(new Device(deviceId, "123456789"));
    }

    @Test
    void an_operator_is_only_assigned_once() {
        // Given
        var merchant   = createdMerchant();
        var operatorId = OperatorId.random();
        merchant.assignOperator(operatorId, "Test Operator 1", "00000001", "10000001");

        // When
        assertThatThrownBy(() -> merchant.assignOperator(operatorId, "Test Operator 1", null, null))
                .isInstanceOf(DomainValidationException.class);

        // Then
        assertThat(merchant.isOperatorAssigned(operatorId)).isTrue();
        assertThat(merchant.getMerchant().operators())
                .containsExactly(new MerchantOperator(operatorId, "Test Operator 1", "00000001", "10000001"));
    }

    @Test
    void replaying_the_persisted_events_reproduces_the_merchant() {
        // Given
        var repository = AggregateRepository.from(new InMemoryEventStore(),
                                                  AggregateTypeConfiguration.standardConfigurationUsingJackson(EstateManagement.MERCHANTS,
                                                                                                               JacksonJSONSerializer.createDefaultObjectMapper(),
                                                                                                               AggregateIdSerializer.of(MerchantId::of)),
                                                  MerchantAggregate::new,
                                                  MerchantAggregate.class);
        var merchant = createdMerchant();
        merchant.assignOperator(OperatorId.random(), "Test Operator 1", "00000001", null);
        merchant.addDevice(DeviceId.random(), "123456789");
        merchant.addSecurityUser(SecurityUserId.of("user-1"), "merchantuser@testmerchant1.co.uk");
        merchant.makeDeposit(DepositId.random(), new BigDecimal("1000.00"), "Deposit 1", CREATED_AT.plusDays(1));
        var expectedMerchant = merchant.getMerchant();
        repository.persist(merchant);

        // When
        var loaded = repository.load(merchant.aggregateId());

        // Then
        assertThat(loaded.getMerchant()).isEqualTo(expectedMerchant);
        assertThat(loaded.getBalance()).isEqualByComparingTo("1000.00");
        assertThat(repository.load(merchant.aggregateId()).getMerchant()).isEqualTo(loaded.getMerchant());
    }

    @Test
    void merchant_state_cannot_be_changed_by_handing_it_events_directly() {
        assertThat(MerchantEvent.Handler.class.isAssignableFrom(MerchantAggregate.class)).isFalse();
    }

    private MerchantAggregate createdMerchant() {
        var merchant = new MerchantAggregate(MerchantId.random());
        merchant.create(estateId, "Test Merchant 1", CREATED_AT);
        return merchant;
    }
}
