package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.estatemanagement.aggregates.*;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.eventstore.AggregateNotFoundException;
import dk.cloudcreate.estatemanagement.security.*;
import org.slf4j.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles the commands that target a {@link MerchantAggregate}.<br>
 * Commands that reference the merchant's estate (creating a merchant, assigning an operator) load the {@link EstateAggregate}
 * read only and validate against it before the merchant is changed. The estate and the merchant are persisted independently,
 * so a change to the estate made after the validation isn't detected.
 */
public class MerchantDomainService {
    private static final Logger log = LoggerFactory.getLogger(MerchantDomainService.class);

    public static final String MERCHANT_ROLE     = "Merchant";
    public static final String ESTATE_ID_CLAIM   = "estateId";
    public static final String MERCHANT_ID_CLAIM = "merchantId";

    private final AggregateRepository<MerchantId, MerchantEvent, MerchantAggregate> merchantRepository;
    private final AggregateRepository<EstateId, EstateEvent, EstateAggregate>       estateRepository;
    private final SecurityServiceClient                                             securityServiceClient;
    private final Clock                                                             clock;

    public MerchantDomainService(AggregateRepository<MerchantId, MerchantEvent, MerchantAggregate> merchantRepository,
                                 AggregateRepository<EstateId, EstateEvent, EstateAggregate> estateRepository,
                                 SecurityServiceClient securityServiceClient,
                                 Clock clock) {
        this.merchantRepository = requireNonNull(merchantRepository, "No merchantRepository provided");
        this.estateRepository = requireNonNull(estateRepository, "No estateRepository provided");
        this.securityServiceClient = requireNonNull(securityServiceClient, "No securityServiceClient provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public MerchantId createMerchant(EstateId estateId, String merchantName) {
        return createMerchant(estateId, MerchantId.random(), merchantName);
    }

    /**
     * Create a new merchant belonging to an existing estate
     *
     * @return the id of the new merchant
     * @throws DomainValidationException in case the estate doesn't exist or a merchant with the given id already exists
     */
    public MerchantId createMerchant(EstateId estateId, MerchantId merchantId, String merchantName) {
        requireNonNull(merchantId, "No merchantId provided");
        requireExistingEstate(estateId);
        if (merchantRepository.tryLoad(merchantId).isPresent()) {
            throw new DomainValidationException(msg("Merchant with id '{}' already exists", merchantId));
        }
        var merchant = new MerchantAggregate(merchantId);
        merchant.create(estateId, merchantName, OffsetDateTime.now(clock));
        merchantRepository.persist(merchant);
        log.debug("Created Merchant '{}' with id '{}' on Estate '{}'", merchantName, merchantId, estateId);
        return merchantId;
    }

    public void assignOperatorToMerchant(EstateId estateId, MerchantId merchantId, OperatorId operatorId) {
        assignOperatorToMerchant(estateId, merchantId, operatorId, null, null);
    }

    /**
     * Assign one of the estate's operators to the merchant
     *
     * @param merchantNumber the merchant number to use with the operator (required if the operator requires a custom merchant number)
     * @param terminalNumber the terminal number to use with the operator (required if the operator requires a custom terminal number)
     * @throws AggregateNotFoundException in case the merchant doesn't exist
     * @throws DomainValidationException  in case the merchant doesn't belong to the estate, the operator isn't added to the estate,
     *                                    a required custom number is missing or the operator is already assigned
     */
    public void assignOperatorToMerchant(EstateId estateId,
                                         MerchantId merchantId,
                                         OperatorId operatorId,
                                         String merchantNumber,
                                         String terminalNumber) {
        requireNonNull(operatorId, "No operatorId provided");
        var merchant = loadMerchantBelongingTo(estateId, merchantId);
        var estate   = requireExistingEstate(estateId);
        var operator = estate.getOperator(operatorId)
                             .orElseThrow(() -> new DomainValidationException(msg("Operator with id '{}' has not been added to Estate '{}'",
                                                                                  operatorId,
                                                                                  estateId)));
        if (operator.requireCustomMerchantNumber() && isBlank(merchantNumber)) {
            throw new DomainValidationException(msg("Operator '{}' requires a custom merchant number", operator.name()));
        }
        if (operator.requireCustomTerminalNumber() && isBlank(terminalNumber)) {
            throw new DomainValidationException(msg("Operator '{}' requires a custom terminal number", operator.name()));
        }
        merchant.assignOperator(operatorId, operator.name(), merchantNumber, terminalNumber);
        merchantRepository.persist(merchant);
        log.debug("Assigned Operator '{}' to Merchant '{}'", operatorId, merchantId);
    }

    /**
     * Add a device to the merchant
     *
     * @return the id of the new device
     * @throws AggregateNotFoundException in case the merchant doesn't exist
     * @throws DomainValidationException  in case the device identifier is already added to the merchant
     */
    public DeviceId addDeviceToMerchant(MerchantId merchantId, String deviceIdentifier) {
        var merchant = merchantRepository.load(merchantId);
        var deviceId = DeviceId.random();
        merchant.addDevice(deviceId, deviceIdentifier);
        merchantRepository.persist(merchant);
        log.debug("Added Device '{}' with id '{}' to Merchant '{}'", deviceIdentifier, deviceId, merchantId);
        return deviceId;
    }

    public DepositId makeMerchantDeposit(MerchantId merchantId, BigDecimal amount, String reference) {
        return makeMerchantDeposit(merchantId, amount, reference, OffsetDateTime.now(clock));
    }

    /**
     * Make a manual deposit to the merchant's balance
     *
     * @return the id of the new deposit
     * @throws AggregateNotFoundException in case the merchant doesn't exist
     * @throws DomainValidationException  in case the amount isn't positive or the deposit is a duplicate
     */
    public DepositId makeMerchantDeposit(MerchantId merchantId, BigDecimal amount, String reference, OffsetDateTime depositDateTime) {
        var merchant  = merchantRepository.load(merchantId);
        var depositId = DepositId.random();
        merchant.makeDeposit(depositId, amount, reference, depositDateTime);
        merchantRepository.persist(merchant);
        log.debug("Made deposit '{}' of {} with reference '{}' to Merchant '{}'", depositId, amount, reference, merchantId);
        return depositId;
    }

    /**
     * Create a user in the security service with the <code>Merchant</code> role and attach the user to the merchant
     *
     * @return the id the security service assigned to the user
     * @throws AggregateNotFoundException in case the merchant doesn't exist
     * @throws DomainValidationException  in case the merchant doesn't belong to the estate or the email address is already used
     */
    public SecurityUserId createMerchantUser(EstateId estateId,
                                             MerchantId merchantId,
                                             String emailAddress,
                                             String password,
                                             String givenName,
                                             String familyName) {
        var merchant = loadMerchantBelongingTo(estateId, merchantId);
        if (merchant.hasSecurityUser(emailAddress)) {
            throw new DomainValidationException(msg("A user with email address '{}' is already added to Merchant '{}'", emailAddress, merchantId));
        }
        var securityUserId = securityServiceClient.createUser(new CreateUserRequest(emailAddress,
                                                                                    password,
                                                                                    givenName,
                                                                                    familyName,
                                                                                    List.of(MERCHANT_ROLE),
                                                                                    Map.of(ESTATE_ID_CLAIM, estateId.toString(),
                                                                                           MERCHANT_ID_CLAIM, merchantId.toString())));
        merchant.addSecurityUser(securityUserId, emailAddress);
        merchantRepository.persist(merchant);
        log.debug("Added security user '{}' to Merchant '{}'", securityUserId, merchantId);
        return securityUserId;
    }

    /**
     * Get the current state of a merchant, including its balance
     *
     * @throws AggregateNotFoundException in case the merchant doesn't exist
     */
    public Merchant getMerchant(MerchantId merchantId) {
        return merchantRepository.load(merchantId).getMerchant();
    }

    private EstateAggregate requireExistingEstate(EstateId estateId) {
        requireNonNull(estateId, "No estateId provided");
        return estateRepository.tryLoad(estateId)
                               .orElseThrow(() -> new DomainValidationException(msg("Estate with id '{}' doesn't exist", estateId)));
    }

    private MerchantAggregate loadMerchantBelongingTo(EstateId estateId, MerchantId merchantId) {
        requireNonNull(estateId, "No estateId provided");
        var merchant = merchantRepository.load(merchantId);
        if (!estateId.equals(merchant.getEstateId())) {
            throw new DomainValidationException(msg("Merchant '{}' doesn't belong to Estate '{}'", merchantId, estateId));
        }
        return merchant;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
