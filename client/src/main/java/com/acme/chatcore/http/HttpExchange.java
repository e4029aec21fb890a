package com.acme.chatcore.http;

import java.util.concurrent.CompletableFuture;

/**
 * Performs one HTTP request/response exchange. The dispatch coordinator is written
 * against this seam; {@link NettyHttpExchange} is the network implementation.
 */
public interface HttpExchange extends AutoCloseable {

    CompletableFuture<RestResponse> execute(RestRequest request);

    @Override
    default void close() {
    }
}
