package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.aggregates.DomainEvent;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.security.SecurityUserId;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * The events of the {@link MerchantAggregate}. Every event carries the id of the estate that owns the merchant
 */
public sealed interface MerchantEvent extends DomainEvent<MerchantId> {
    MerchantId merchantId();

    EstateId estateId();

    @Override
    default MerchantId aggregateId() {
        return merchantId();
    }

    void dispatchTo(Handler handler);

    interface Handler {
        void handle(MerchantCreated event);

        void handle(OperatorAssignedToMerchant event);

        void handle(DeviceAddedToMerchant event);

        void handle(SecurityUserAddedToMerchant event);

        void handle(ManualDepositMade event);
    }

    record MerchantCreated(MerchantId merchantId,
                           EstateId estateId,
                           String merchantName,
                           OffsetDateTime createdAt) implements MerchantEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record OperatorAssignedToMerchant(MerchantId merchantId,
                                      EstateId estateId,
                                      OperatorId operatorId,
                                      String name,
                                      String merchantNumber,
                                      String terminalNumber) implements MerchantEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record DeviceAddedToMerchant(MerchantId merchantId,
                                 EstateId estateId,
                                 DeviceId deviceId,
                                 String deviceIdentifier) implements MerchantEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record SecurityUserAddedToMerchant(MerchantId merchantId,
                                       EstateId estateId,
                                       SecurityUserId securityUserId,
                                       String emailAddress) implements MerchantEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record ManualDepositMade(MerchantId merchantId,
                             EstateId estateId,
                             DepositId depositId,
                             String reference,
                             OffsetDateTime depositDateTime,
                             BigDecimal amount) implements MerchantEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }
}
