package dk.cloudcreate.estatemanagement;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.estatemanagement.aggregates.AggregateRepository;
import dk.cloudcreate.estatemanagement.contract.*;
import dk.cloudcreate.estatemanagement.estate.*;
import dk.cloudcreate.estatemanagement.eventstore.EventStore;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.AggregateType;
import dk.cloudcreate.estatemanagement.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.postgresql.PostgresqlEventStore;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.estatemanagement.merchant.*;
import dk.cloudcreate.estatemanagement.security.SecurityServiceClient;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.time.Clock;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Wires the {@link EventStore}, the aggregate repositories and the domain services together.<br>
 * Create one instance at startup and share its domain services between all callers.
 */
public class EstateManagement {
    private static final Logger log = LoggerFactory.getLogger(EstateManagement.class);

    public static final AggregateType ESTATES   = AggregateType.of("Estates");
    public static final AggregateType MERCHANTS = AggregateType.of("Merchants");
    public static final AggregateType CONTRACTS = AggregateType.of("Contracts");

    private final EventStore                                                        eventStore;
    private final AggregateRepository<EstateId, EstateEvent, EstateAggregate>       estateRepository;
    private final AggregateRepository<MerchantId, MerchantEvent, MerchantAggregate> merchantRepository;
    private final AggregateRepository<ContractId, ContractEvent, ContractAggregate> contractRepository;
    private final EstateDomainService                                               estateDomainService;
    private final MerchantDomainService                                             merchantDomainService;
    private final ContractDomainService                                             contractDomainService;

    /**
     * Create an {@link EstateManagement} backed by an {@link InMemoryEventStore}
     */
    public static EstateManagement usingInMemoryEventStore(SecurityServiceClient securityServiceClient) {
        return new EstateManagement(new InMemoryEventStore(),
                                    JacksonJSONSerializer.createDefaultObjectMapper(),
                                    securityServiceClient,
                                    Clock.systemUTC());
    }

    /**
     * Create an {@link EstateManagement} backed by a {@link PostgresqlEventStore}. The event tables are created if they don't exist
     */
    public static EstateManagement usingPostgresql(Jdbi jdbi, SecurityServiceClient securityServiceClient) {
        return new EstateManagement(new PostgresqlEventStore(jdbi),
                                    JacksonJSONSerializer.createDefaultObjectMapper(),
                                    securityServiceClient,
                                    Clock.systemUTC());
    }

    /**
     * @param eventStore            the event store used by all aggregate repositories
     * @param objectMapper          the {@link ObjectMapper} used to serialize events
     * @param securityServiceClient the client used when creating estate and merchant users
     * @param clock                 the clock used for merchant creation and deposit timestamps
     */
    public EstateManagement(EventStore eventStore,
                            ObjectMapper objectMapper,
                            SecurityServiceClient securityServiceClient,
                            Clock clock) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(objectMapper, "No objectMapper provided");

        estateRepository = AggregateRepository.from(eventStore,
                                                    AggregateTypeConfiguration.standardConfigurationUsingJackson(ESTATES,
                                                                                                                 objectMapper,
                                                                                                                 AggregateIdSerializer.of(EstateId::of)),
                                                    EstateAggregate::new,
                                                    EstateAggregate.class);
        merchantRepository = AggregateRepository.from(eventStore,
                                                      AggregateTypeConfiguration.standardConfigurationUsingJackson(MERCHANTS,
                                                                                                                   objectMapper,
                                                                                                                   AggregateIdSerializer.of(MerchantId::of)),
                                                      MerchantAggregate::new,
                                                      MerchantAggregate.class);
        contractRepository = AggregateRepository.from(eventStore,
                                                      AggregateTypeConfiguration.standardConfigurationUsingJackson(CONTRACTS,
                                                                                                                   objectMapper,
                                                                                                                   AggregateIdSerializer.of(ContractId::of)),
                                                      ContractAggregate::new,
                                                      ContractAggregate.class);

        estateDomainService = new EstateDomainService(estateRepository, securityServiceClient);
        merchantDomainService = new MerchantDomainService(merchantRepository, estateRepository, securityServiceClient, clock);
        contractDomainService = new ContractDomainService(contractRepository, estateRepository);
        log.info("Estate management initialized using '{}'", eventStore.getClass().getSimpleName());
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public AggregateRepository<EstateId, EstateEvent, EstateAggregate> estateRepository() {
        return estateRepository;
    }

    public AggregateRepository<MerchantId, MerchantEvent, MerchantAggregate> merchantRepository() {
        return merchantRepository;
    }

    public AggregateRepository<ContractId, ContractEvent, ContractAggregate> contractRepository() {
        return contractRepository;
    }

    public EstateDomainService estateDomainService() {
        return estateDomainService;
    }

    public MerchantDomainService merchantDomainService() {
        return merchantDomainService;
    }

    public ContractDomainService contractDomainService() {
        return contractDomainService;
    }
}
