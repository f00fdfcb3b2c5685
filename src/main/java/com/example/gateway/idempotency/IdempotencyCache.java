package com.example.gateway.idempotency;

import com.example.gateway.api.ApiResponse;
import com.example.gateway.api.response.NotificationAccepted;

import java.util.Optional;

/**
 * Response cache keyed by the client's {@code request_id}.
 * Both operations throw {@link com.example.gateway.store.StoreUnavailableException} when the store is down.
 */
public interface IdempotencyCache {

    /** Response returned to the first caller, if cached and not expired. Consulted before any side effect. */
    Optional<ApiResponse<NotificationAccepted>> lookup(String requestId);

    /** Caches the exact response returned to the caller. Called only after the job is queued. */
    void store(String requestId, ApiResponse<NotificationAccepted> response);
}
