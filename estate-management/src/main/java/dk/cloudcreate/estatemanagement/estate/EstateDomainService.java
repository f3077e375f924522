package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.eventstore.AggregateNotFoundException;
import dk.cloudcreate.estatemanagement.eventstore.persistence.OptimisticAppendToStreamException;
import dk.cloudcreate.estatemanagement.security.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles the commands that target an {@link EstateAggregate}.<br>
 * Each command loads the estate, invokes a single command method and persists the resulting events.
 * The service is stateless and can be shared between threads.<br>
 * A concurrent modification of the same estate surfaces as an {@link OptimisticAppendToStreamException}; the command isn't retried.
 */
public class EstateDomainService {
    private static final Logger log = LoggerFactory.getLogger(EstateDomainService.class);

    public static final String ESTATE_ROLE     = "Estate";
    public static final String ESTATE_ID_CLAIM = "estateId";

    private final AggregateRepository<EstateId, EstateEvent, EstateAggregate> estateRepository;
    private final SecurityServiceClient                                       securityServiceClient;

    public EstateDomainService(AggregateRepository<EstateId, EstateEvent, EstateAggregate> estateRepository,
                               SecurityServiceClient securityServiceClient) {
        this.estateRepository = requireNonNull(estateRepository, "No estateRepository provided");
        this.securityServiceClient = requireNonNull(securityServiceClient, "No securityServiceClient provided");
    }

    /**
     * Create a new estate with a random {@link EstateId}
     *
     * @param estateName the name of the estate
     * @return the id of the new estate
     */
    public EstateId createEstate(String estateName) {
        return createEstate(EstateId.random(), estateName);
    }

    /**
     * Create a new estate
     *
     * @param estateId   the id of the new estate
     * @param estateName the name of the estate
     * @return the id of the new estate
     * @throws DomainValidationException in case an estate with the given id already exists
     */
    public EstateId createEstate(EstateId estateId, String estateName) {
        requireNonNull(estateId, "No estateId provided");
        if (estateRepository.tryLoad(estateId).isPresent()) {
            throw new DomainValidationException(msg("Estate with id '{}' already exists", estateId));
        }
        var estate = new EstateAggregate(estateId);
        estate.create(estateName);
        estateRepository.persist(estate);
        log.debug("Created Estate '{}' with id '{}'", estateName, estateId);
        return estateId;
    }

    /**
     * Add a new operator to an existing estate
     *
     * @return the id of the new operator
     * @throws AggregateNotFoundException in case the estate doesn't exist
     * @throws DomainValidationException  in case the operator name is already used on the estate
     */
    public OperatorId addOperatorToEstate(EstateId estateId,
                                          String operatorName,
                                          boolean requireCustomMerchantNumber,
                                          boolean requireCustomTerminalNumber) {
        var estate     = estateRepository.load(estateId);
        var operatorId = OperatorId.random();
        estate.addOperator(operatorId, operatorName, requireCustomMerchantNumber, requireCustomTerminalNumber);
        estateRepository.persist(estate);
        log.debug("Added Operator '{}' with id '{}' to Estate '{}'", operatorName, operatorId, estateId);
        return operatorId;
    }

    /**
     * Create a user in the security service with the <code>Estate</code> role and attach the user to the estate
     *
     * @return the id the security service assigned to the user
     * @throws AggregateNotFoundException in case the estate doesn't exist
     * @throws DomainValidationException  in case a user with the same email address is already attached to the estate
     */
    public SecurityUserId createEstateUser(EstateId estateId,
                                           String emailAddress,
                                           String password,
                                           String givenName,
                                           String familyName) {
        var estate = estateRepository.load(estateId);
        if (estate.hasSecurityUser(emailAddress)) {
            throw new DomainValidationException(msg("A user with email address '{}' is already added to Estate '{}'", emailAddress, estateId));
        }
        var securityUserId = securityServiceClient.createUser(new CreateUserRequest(emailAddress,
                                                                                    password,
                                                                                    givenName,
                                                                                    familyName,
                                                                                    List.of(ESTATE_ROLE),
                                                                                    Map.of(ESTATE_ID_CLAIM, estateId.toString())));
        estate.addSecurityUser(securityUserId, emailAddress);
        estateRepository.persist(estate);
        log.debug("Added security user '{}' to Estate '{}'", securityUserId, estateId);
        return securityUserId;
    }

    /**
     * Get the current state of an estate
     *
     * @throws AggregateNotFoundException in case the estate doesn't exist
     */
    public Estate getEstate(EstateId estateId) {
        return estateRepository.load(estateId).getEstate();
    }
}
