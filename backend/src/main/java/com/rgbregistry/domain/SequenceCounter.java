package com.rgbregistry.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Named monotonically increasing counter (e.g. "registrations"); seq is the last value handed out.
 */
@Document(collection = "sequences")
@NoArgsConstructor
@Getter
@Setter
public class SequenceCounter {

    @Id
    private String id;
    private long seq;
}
