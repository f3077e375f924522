package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.estatemanagement.aggregates.DomainEvent;
import dk.cloudcreate.estatemanagement.estate.*;

import java.math.BigDecimal;

/**
 * The events of the {@link ContractAggregate}
 */
public sealed interface ContractEvent extends DomainEvent<ContractId> {
    ContractId contractId();

    EstateId estateId();

    @Override
    default ContractId aggregateId() {
        return contractId();
    }

    void dispatchTo(Handler handler);

    interface Handler {
        void handle(ContractCreated event);

        void handle(FixedValueProductAddedToContract event);

        void handle(VariableValueProductAddedToContract event);

        void handle(TransactionFeeForProductAddedToContract event);

        void handle(TransactionFeeForProductDisabled event);
    }

    record ContractCreated(ContractId contractId,
                           EstateId estateId,
                           OperatorId operatorId,
                           String operatorName,
                           String description) implements ContractEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record FixedValueProductAddedToContract(ContractId contractId,
                                            EstateId estateId,
                                            ProductId productId,
                                            String productName,
                                            String displayText,
                                            BigDecimal value) implements ContractEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record VariableValueProductAddedToContract(ContractId contractId,
                                               EstateId estateId,
                                               ProductId productId,
                                               String productName,
                                               String displayText) implements ContractEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record TransactionFeeForProductAddedToContract(ContractId contractId,
                                                   EstateId estateId,
                                                   ProductId productId,
                                                   TransactionFeeId transactionFeeId,
                                                   String description,
                                                   CalculationType calculationType,
                                                   FeeType feeType,
                                                   BigDecimal value) implements ContractEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }

    record TransactionFeeForProductDisabled(ContractId contractId,
                                            EstateId estateId,
                                            ProductId productId,
                                            TransactionFeeId transactionFeeId) implements ContractEvent {
        @Override
        public void dispatchTo(Handler handler) {
            handler.handle(this);
        }
    }
}
