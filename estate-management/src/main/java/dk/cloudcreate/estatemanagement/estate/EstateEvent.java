package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.estatemanagement.aggregates.DomainEvent;
import dk.cloudcreate.estatemanagement.security.SecurityUserId;

/**
 * The events of the {@link EstateAggregate}
 */
public sealed interface EstateEvent extends DomainEvent<EstateId> {
    EstateId estateId();

    @Override
    default EstateId aggregateId() {
        return estateId();
    }

    void dispatchTo(Handler handler);

    interface Handler {
        void handle(EstateCreated event);

        void handle(OperatorAddedToEstate event);

        void handle(SecurityUserAddedToEstate event);
    }

    record EstateCreated(EstateId estateId, String estateName) implements EstateEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record OperatorAddedToEstate(EstateId estateId,
                                 OperatorId operatorId,
                                 String name,
                                 boolean requireCustomMerchantNumber,
                                 boolean requireCustomTerminalNumber) implements EstateEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record SecurityUserAddedToEstate(EstateId estateId,
                                     SecurityUserId securityUserId,
                                     String emailAddress) implements EstateEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }
}
