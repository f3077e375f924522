package dk.cloudcreate.estatemanagement.contract;

import dk.cloudcreate.estatemanagement.estate.*;

import java.util.*;

/**
 * Read only projection of a {@link ContractAggregate}
 */
public record Contract(ContractId contractId,
                       EstateId estateId,
                       OperatorId operatorId,
                       String operatorName,
                       String description,
                       List<ContractProduct> products) {
    public Contract {
        products = List.copyOf(products);
    }

    public Optional<ContractProduct> getProduct(ProductId productId) {
        return products.stream()
                       .filter(product -> product.productId().equals(productId))
                       .findFirst();
    }
}
