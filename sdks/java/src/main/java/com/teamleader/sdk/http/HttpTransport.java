package com.teamleader.sdk.http;

import java.io.IOException;

/**
 * Synchronous HTTP transport used by the SDK.
 *
 * <p>Implementations return a {@link TransportResponse} for every HTTP status, including
 * 4xx and 5xx. An {@link IOException} means no response was received at all.</p>
 */
@FunctionalInterface
public interface HttpTransport {

    TransportResponse execute(TransportRequest request) throws IOException;
}
