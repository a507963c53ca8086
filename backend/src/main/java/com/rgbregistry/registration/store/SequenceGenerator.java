package com.rgbregistry.registration.store;

import com.rgbregistry.domain.SequenceCounter;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Atomic counters in the sequences collection ($inc via findAndModify). Values are never handed out twice.
 */
@Component
@RequiredArgsConstructor
public class SequenceGenerator {

    private final MongoTemplate mongoTemplate;

    /**
     * Creates the counter at 0 if absent; existing counters are left untouched.
     */
    public void ensureSequence(String name) {
        Query query = new Query(where("_id").is(name));
        mongoTemplate.upsert(query, new Update().setOnInsert("seq", 0L), SequenceCounter.class);
    }

    /**
     * Increments the counter and returns the new value (first value is 1).
     */
    public long next(String name) {
        Query query = new Query(where("_id").is(name));
        SequenceCounter counter = mongoTemplate.findAndModify(
                query,
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounter.class);
        if (counter == null) {
            throw new IllegalStateException("Sequence not available: " + name);
        }
        return counter.getSeq();
    }
}
