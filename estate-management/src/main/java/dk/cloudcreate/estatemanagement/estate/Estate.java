package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.estatemanagement.security.SecurityUser;

import java.util.List;

/**
 * Read only projection of an {@link EstateAggregate}
 */
public record Estate(EstateId estateId,
                     String name,
                     List<Operator> operators,
                     List<SecurityUser> securityUsers) {
    public Estate {
        operators = List.copyOf(operators);
        securityUsers = List.copyOf(securityUsers);
    }
}
