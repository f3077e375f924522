package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class ContractId extends CharSequenceType<ContractId> {
    public ContractId(CharSequence value) {
        super(value);
    }

    public static ContractId random() {
        return new ContractId(UUID.randomUUID().toString());
    }

    public static ContractId of(CharSequence id) {
        return new ContractId(id);
    }
}
