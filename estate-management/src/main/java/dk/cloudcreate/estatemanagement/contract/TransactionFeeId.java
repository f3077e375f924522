package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class TransactionFeeId extends CharSequenceType<TransactionFeeId> {
    public TransactionFeeId(CharSequence value) {
        super(value);
    }

    public static TransactionFeeId random() {
        return new TransactionFeeId(UUID.randomUUID().toString());
    }

    public static TransactionFeeId of(CharSequence id) {
        return new TransactionFeeId(id);
    }
}
