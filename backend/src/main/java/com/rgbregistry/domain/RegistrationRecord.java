package com.rgbregistry.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Binding of an EVM address to a Taproot address, one document per (ethAddress, rgbAddress).
 * Written once by RegistrationStore; no update or delete path exists.
 */
@Document(collection = "registrations")
@CompoundIndex(name = "eth_rgb_unique", def = "{'ethAddress': 1, 'rgbAddress': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RegistrationRecord {

    /** Assigned from the "registrations" sequence at insert time; never reused. */
    @Id
    @EqualsAndHashCode.Include
    private Long id;
    @Indexed(name = "idx_eth_address")
    private String ethAddress;
    @Indexed(name = "idx_rgb_address")
    private String rgbAddress;
    private String signature;
    private String message;
    @Indexed(name = "idx_created_at")
    private Instant createdAt;
    private Instant updatedAt;
}
