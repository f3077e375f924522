package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.estate.EstateId;
import dk.cloudcreate.estatemanagement.security.SecurityUser;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read only projection of a {@link MerchantAggregate}
 *
 * @param balance the sum of all {@link #deposits()}
 */
public record Merchant(MerchantId merchantId,
                       EstateId estateId,
                       String name,
                       OffsetDateTime createdAt,
                       List<MerchantOperator> operators,
                       List<Device> devices,
                       List<SecurityUser> securityUsers,
                       List<Deposit> deposits,
                       BigDecimal balance) {
    public Merchant {
        operators = List.copyOf(operators);
        devices = List.copyOf(devices);
        securityUsers = List.copyOf(securityUsers);
        deposits = List.copyOf(deposits);
    }
}
