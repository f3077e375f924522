package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class OperatorId extends CharSequenceType<OperatorId> {
    public OperatorId(CharSequence value) {
        super(value);
    }

    public static OperatorId random() {
        return new OperatorId(UUID.randomUUID().toString());
    }

    public static OperatorId of(CharSequence id) {
        return new OperatorId(id);
    }
}
