package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class DepositId extends CharSequenceType<DepositId> {
    public DepositId(CharSequence value) {
        super(value);
    }

    public static DepositId random() {
        return new DepositId(UUID.randomUUID().toString());
    }

    public static DepositId of(CharSequence id) {
        return new DepositId(id);
    }
}
