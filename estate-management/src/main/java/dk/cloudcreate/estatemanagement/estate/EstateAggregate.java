package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.estate.EstateEvent.*;
import dk.cloudcreate.estatemanagement.security.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * An estate owns the operators its merchants can be assigned to and the security users that administer it
 */
public class EstateAggregate extends AggregateRoot<EstateId, EstateEvent, EstateAggregate> {
    private final EventHandler                      eventHandler  = new EventHandler();
    private       String                            name;
    private final Map<OperatorId, Operator>         operators     = new LinkedHashMap<>();
    private final Map<SecurityUserId, SecurityUser> securityUsers = new LinkedHashMap<>();

    public EstateAggregate(EstateId estateId) {
        super(estateId);
    }

    public void create(String estateName) {
        requireNonBlank(estateName, "Estate name must be provided");
        if (isCreated()) {
            throw new DomainValidationException(msg("Estate with id '{}' has already been created", aggregateId()));
        }
        apply(new EstateCreated(aggregateId(), estateName));
    }

    public void addOperator(OperatorId operatorId,
                            String operatorName,
                            boolean requireCustomMerchantNumber,
                            boolean requireCustomTerminalNumber) {
        requireNonNull(operatorId, "You must supply an operatorId");
        requireNonBlank(operatorName, "Operator name must be provided");
        requireCreated();
        if (operators.containsKey(operatorId)) {
            throw new DomainValidationException(msg("Duplicate operator id '{}' detected on Estate '{}'", operatorId, name));
        }
        if (operators.values().stream().anyMatch(operator -> operator.name().equals(operatorName))) {
            throw new DomainValidationException(msg("Duplicate operator name '{}' detected on Estate '{}'", operatorName, name));
        }
        apply(new OperatorAddedToEstate(aggregateId(),
                                        operatorId,
                                        operatorName,
                                        requireCustomMerchantNumber,
                                        requireCustomTerminalNumber));
    }

    public void addSecurityUser(SecurityUserId securityUserId, String emailAddress) {
        requireNonNull(securityUserId, "You must supply a securityUserId");
        requireNonBlank(emailAddress, "Email address must be provided");
        requireCreated();
        if (securityUsers.containsKey(securityUserId) || hasSecurityUser(emailAddress)) {
            throw new DomainValidationException(msg("Security user '{}' with email address '{}' is already added to Estate '{}'",
                                                    securityUserId,
                                                    emailAddress,
                                                    name));
        }
        apply(new SecurityUserAddedToEstate(aggregateId(), securityUserId, emailAddress));
    }

    @Override
    protected void applyEventToTheAggregate(EstateEvent event) {
        event.dispatchTo(eventHandler);
    }

    public boolean isCreated() {
        return name != null;
    }

    public Optional<Operator> getOperator(OperatorId operatorId) {
        return Optional.ofNullable(operators.get(operatorId));
    }

    public boolean hasSecurityUser(String emailAddress) {
        return securityUsers.values().stream().anyMatch(user -> user.emailAddress().equalsIgnoreCase(emailAddress));
    }

    public Estate getEstate() {
        return new Estate(aggregateId(),
                          name,
                          new ArrayList<>(operators.values()),
                          new ArrayList<>(securityUsers.values()));
    }

    private void requireCreated() {
        if (!isCreated()) {
            throw new DomainValidationException(msg("Estate with id '{}' has not been created", aggregateId()));
        }
    }

    private static void requireNonBlank(String value, String errorMessage) {
        if (value == null || value.isBlank()) {
            throw new DomainValidationException(errorMessage);
        }
    }

    private class EventHandler implements EstateEvent.Handler {
        @Override
        public void handle(EstateCreated event) {
            name = event.estateName();
        }

        @Override
        public void handle(OperatorAddedToEstate event) {
            operators.put(event.operatorId(), new Operator(event.operatorId(),
                                                           event.name(),
                                                           event.requireCustomMerchantNumber(),
                                                           event.requireCustomTerminalNumber()));
        }

        @Override
        public void handle(SecurityUserAddedToEstate event) {
            securityUsers.put(event.securityUserId(), new SecurityUser(event.securityUserId(), event.emailAddress()));
        }
    }
}
