package com.rgbregistry.config;

import com.mongodb.WriteConcern;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB client settings. Writes are acknowledged only once journaled, so an acknowledged registration
 * survives a restart and RegistrationStore.close() has nothing left to flush.
 * Indexes are ensured by RegistrationStore at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer journaledWriteConcern() {
        return builder -> builder.writeConcern(WriteConcern.JOURNALED);
    }
}
