package com.rgbregistry.registration.store;

import com.rgbregistry.domain.RegistrationRecord;
import com.rgbregistry.domain.RegistrationRecordRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single source of truth for registrations. Uniqueness of (ethAddress, rgbAddress) is enforced by the
 * eth_rgb_unique index, so concurrent inserts of one pair yield one CREATED and CONFLICT for the rest.
 * One instance per process; writes use the journaled write concern from MongoConfig.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrationStore {

    static final String SEQUENCE_NAME = "registrations";

    private final MongoTemplate mongoTemplate;
    private final RegistrationRecordRepository repository;
    private final SequenceGenerator sequenceGenerator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates the collection, its indexes and the id sequence if absent. Idempotent.
     */
    @PostConstruct
    public void initializeSchema() {
        if (!mongoTemplate.collectionExists(RegistrationRecord.class)) {
            mongoTemplate.createCollection(RegistrationRecord.class);
        }
        IndexOperations indexOps = mongoTemplate.indexOps(RegistrationRecord.class);
        IndexResolver resolver = new MongoPersistentEntityIndexResolver(mongoTemplate.getConverter().getMappingContext());
        resolver.resolveIndexFor(RegistrationRecord.class).forEach(indexOps::ensureIndex);
        sequenceGenerator.ensureSequence(SEQUENCE_NAME);
        log.info("Registration store initialized (collection {})", mongoTemplate.getCollectionName(RegistrationRecord.class));
    }

    /**
     * Inserts a new registration. Never overwrites: a duplicate pair is reported as CONFLICT and the
     * existing record is left as is. No retries.
     */
    public InsertResult insert(String ethAddress, String rgbAddress, String signature, String message) {
        if (closed.get()) {
            return InsertResult.failure(new IllegalStateException("Registration store is closed"));
        }
        long id;
        try {
            id = sequenceGenerator.next(SEQUENCE_NAME);
        } catch (DataAccessException | IllegalStateException e) {
            return InsertResult.failure(e);
        }

        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        RegistrationRecord record = new RegistrationRecord();
        record.setId(id);
        record.setEthAddress(ethAddress);
        record.setRgbAddress(rgbAddress);
        record.setSignature(signature);
        record.setMessage(message);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        try {
            mongoTemplate.insert(record);
            return InsertResult.created(id);
        } catch (DuplicateKeyException e) {
            log.debug("Duplicate registration for {} / {}", ethAddress, rgbAddress);
            return InsertResult.conflict();
        } catch (DataAccessException e) {
            return InsertResult.failure(e);
        }
    }

    /**
     * Current full table ordered by ascending id (insertion order). Each call reads afresh.
     *
     * @throws RegistrationStoreException if the store is closed or cannot be read
     */
    public List<Registration> listAll() {
        if (closed.get()) {
            throw new RegistrationStoreException("Registration store is closed");
        }
        try {
            return repository.findAllByOrderByIdAsc().stream()
                    .map(Registration::from)
                    .toList();
        } catch (DataAccessException e) {
            throw new RegistrationStoreException("Failed to fetch registrations", e);
        }
    }

    /**
     * Stops accepting operations. Every acknowledged insert is already journaled; the Mongo client itself
     * is closed by the application context.
     */
    @PreDestroy
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Registration store closed");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
