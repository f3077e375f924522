package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.merchant.MerchantEvent.*;
import dk.cloudcreate.estatemanagement.security.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A merchant belongs to a single estate. It keeps track of its assigned operators, its devices, its security users
 * and the deposits made to its balance
 */
public class MerchantAggregate extends AggregateRoot<MerchantId, MerchantEvent, MerchantAggregate> {
    private final EventHandler                      eventHandler  = new EventHandler();
    private       EstateId                          estateId;
    private       String                            name;
    private       OffsetDateTime                    createdAt;
    private final Map<OperatorId, MerchantOperator> operators     = new LinkedHashMap<>();
    private final Map<DeviceId, Device>             devices       = new LinkedHashMap<>();
    private final Map<SecurityUserId, SecurityUser> securityUsers = new LinkedHashMap<>();
    private final List<Deposit>                     deposits      = new ArrayList<>();
    private       BigDecimal                        balance       = BigDecimal.ZERO;

    public MerchantAggregate(MerchantId merchantId) {
        super(merchantId);
    }

    public void create(EstateId estateId, String merchantName, OffsetDateTime createdAt) {
        requireNonNull(estateId, "You must supply an estateId");
        requireNonNull(createdAt, "You must supply a createdAt timestamp");
        if (merchantName == null || merchantName.isBlank()) {
            throw new DomainValidationException("Merchant name must be provided");
        }
        if (isCreated()) {
            throw new DomainValidationException(msg("Merchant with id '{}' has already been created", aggregateId()));
        }
        apply(new MerchantCreated(aggregateId(), estateId, merchantName, createdAt));
    }

    public void assignOperator(OperatorId operatorId, String operatorName, String merchantNumber, String terminalNumber) {
        requireNonNull(operatorId, "You must supply an operatorId");
        requireNonNull(operatorName, "You must supply an operatorName");
        requireCreated();
        if (operators.containsKey(operatorId)) {
            throw new DomainValidationException(msg("Operator '{}' with id '{}' is already assigned to Merchant '{}'",
                                                    operatorName,
                                                    operatorId,
                                                    name));
        }
        apply(new OperatorAssignedToMerchant(aggregateId(), estateId, operatorId, operatorName, merchantNumber, terminalNumber));
    }

    public void addDevice(DeviceId deviceId, String deviceIdentifier) {
        requireNonNull(deviceId, "You must supply a deviceId");
        if (deviceIdentifier == null || deviceIdentifier.isBlank()) {
            throw new DomainValidationException("Device identifier must be provided");
        }
        requireCreated();
        if (devices.containsKey(deviceId) ||
                devices.values().stream().anyMatch(device -> device.deviceIdentifier().equals(deviceIdentifier))) {
            throw new DomainValidationException(msg("Device '{}' has already been added to Merchant '{}'", deviceIdentifier, name));
        }
        apply(new DeviceAddedToMerchant(aggregateId(), estateId, deviceId, deviceIdentifier));
    }

    public void addSecurityUser(SecurityUserId securityUserId, String emailAddress) {
        requireNonNull(securityUserId, "You must supply a securityUserId");
        if (emailAddress == null || emailAddress.isBlank()) {
            throw new DomainValidationException("Email address must be provided");
        }
        requireCreated();
        if (securityUsers.containsKey(securityUserId) || hasSecurityUser(emailAddress)) {
            throw new DomainValidationException(msg("Security user '{}' with email address '{}' is already added to Merchant '{}'",
                                                    securityUserId,
                                                    emailAddress,
                                                    name));
        }
        apply(new SecurityUserAddedToMerchant(aggregateId(), estateId, securityUserId, emailAddress));
    }

    public void makeDeposit(DepositId depositId, BigDecimal amount, String reference, OffsetDateTime depositDateTime) {
        requireNonNull(depositId, "You must supply a depositId");
        requireNonNull(depositDateTime, "You must supply a depositDateTime");
        requireCreated();
        if (amount == null) {
            throw new DomainValidationException("Deposit amount must be provided");
        }
        if (amount.signum() <= 0) {
            throw new DomainValidationException(msg("Deposit amount must be greater than zero but was '{}'", amount));
        }
        if (reference == null || reference.isBlank()) {
            throw new DomainValidationException("Deposit reference must be provided");
        }
        if (deposits.stream().anyMatch(deposit -> deposit.isSameDepositAs(amount, reference, depositDateTime))) {
            throw new DomainValidationException(msg("A deposit with reference '{}', amount '{}' and date '{}' has already been made to Merchant '{}'",
                                                    reference,
                                                    amount,
                                                    depositDateTime,
                                                    name));
        }
        apply(new ManualDepositMade(aggregateId(), estateId, depositId, reference, depositDateTime, amount));
    }

    @Override
    protected void applyEventToTheAggregate(MerchantEvent event) {
        event.dispatchTo(eventHandler);
    }

    public boolean isCreated() {
        return name != null;
    }

    /**
     * The estate that owns this merchant (<code>null</code> until the merchant has been created)
     */
    public EstateId getEstateId() {
        return estateId;
    }

    public boolean isOperatorAssigned(OperatorId operatorId) {
        return operators.containsKey(operatorId);
    }

    public boolean hasSecurityUser(String emailAddress) {
        return securityUsers.values().stream().anyMatch(user -> user.emailAddress().equalsIgnoreCase(emailAddress));
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public Merchant getMerchant() {
        return new Merchant(aggregateId(),
                            estateId,
                            name,
                            createdAt,
                            new ArrayList<>(operators.values()),
                            new ArrayList<>(devices.values()),
                            new ArrayList<>(securityUsers.values()),
                            deposits,
                            balance);
    }

    private void requireCreated() {
        if (!isCreated()) {
            throw new DomainValidationException(msg("Merchant with id '{}' has not been created", aggregateId()));
        }
    }

    private class EventHandler implements MerchantEvent.Handler {
        @Override
        public void handle(MerchantCreated event) {
            estateId = event.estateId();
            name = event.merchantName();
            createdAt = event.createdAt();
        }

        @Override
        public void handle(OperatorAssignedToMerchant event) {
            operators.put(event.operatorId(), new MerchantOperator(event.operatorId(),
                                                                   event.name(),
                                                                   event.merchantNumber(),
                                                                   event.terminalNumber()));
        }

        @Override
        public void handle(DeviceAddedToMerchant event) {
            devices.put(event.deviceId(), new Device(event.deviceId(), event.deviceIdentifier()));
        }

        @Override
        public void handle(SecurityUserAddedToMerchant event) {
            securityUsers.put(event.securityUserId(), new SecurityUser(event.securityUserId(), event.emailAddress()));
        }

        @Override
        public void handle(ManualDepositMade event) {
            deposits.add(new Deposit(event.depositId(), event.amount(), event.reference(), event.depositDateTime()));
            balance = balance.add(event.amount());
        }
    }
}
