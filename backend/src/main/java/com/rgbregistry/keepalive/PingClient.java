package com.rgbregistry.keepalive;

import reactor.core.publisher.Mono;

/**
 * HTTP GET of a liveness URL; abstraction for testing SelfPingJob.
 */
public interface PingClient {

    /**
     * @param url absolute URL to GET
     * @return response body; errors with PingException on HTTP failure or timeout
     */
    Mono<String> ping(String url);
}
