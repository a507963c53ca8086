package com.rgbregistry.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for registrations. Inserts go through RegistrationStore (MongoTemplate.insert) so a duplicate
 * pair is rejected by the unique index instead of overwritten by save().
 */
public interface RegistrationRecordRepository extends MongoRepository<RegistrationRecord, Long> {

    /** Full table in insertion order (ascending id). */
    List<RegistrationRecord> findAllByOrderByIdAsc();
}
