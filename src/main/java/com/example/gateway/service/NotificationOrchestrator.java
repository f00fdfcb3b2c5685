package com.example.gateway.service;

import com.example.gateway.api.ApiResponse;
import com.example.gateway.api.request.NotificationRequest;
import com.example.gateway.api.response.NotificationAccepted;
import com.example.gateway.auth.AuthValidator;
import com.example.gateway.auth.AuthenticatedCaller;
import com.example.gateway.circuit.CircuitBreaker;
import com.example.gateway.circuit.CircuitOpenException;
import com.example.gateway.idempotency.IdempotencyCache;
import com.example.gateway.messaging.NotificationPublisher;
import com.example.gateway.messaging.PublishFailureException;
import com.example.gateway.metrics.NotificationMetrics;
import com.example.gateway.model.NotificationJob;
import com.example.gateway.model.NotificationStatus;
import com.example.gateway.model.NotificationStatusRecord;
import com.example.gateway.ratelimit.RateLimitExceededException;
import com.example.gateway.ratelimit.RateLimiter;
import com.example.gateway.store.NotificationStatusStore;
import com.example.gateway.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Accept-and-queue workflow. Steps run strictly in order and any failure stops the rest:
 * authenticate, rate-limit, idempotency lookup, build job, publish through the circuit breaker,
 * write the pending status, cache the response. The status record is written only after the
 * broker confirmed the publish.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationOrchestrator {

    static final String ACCEPTED_MESSAGE = "Notification queued for processing";

    private final AuthValidator authValidator;
    private final RateLimiter rateLimiter;
    private final IdempotencyCache idempotencyCache;
    private final CircuitBreaker brokerCircuitBreaker;
    private final NotificationPublisher publisher;
    private final NotificationStatusStore statusStore;
    private final NotificationMetrics metrics;
    private final Clock clock;

    public ApiResponse<NotificationAccepted> accept(
            String authorization,
            NotificationRequest request,
            String correlationId
    ) {
        long startNs = System.nanoTime();

        AuthenticatedCaller caller = authValidator.verifyHeader(authorization);

        try {
            rateLimiter.enforce(caller.userId());
        } catch (RateLimitExceededException e) {
            metrics.recordRateLimited();
            throw e;
        }

        String requestId = request.requestId();
        Optional<ApiResponse<NotificationAccepted>> cached = lookupCached(requestId);
        if (cached.isPresent()) {
            metrics.recordReplay();
            log.info("event=notify_idempotent_replay requestId={} notificationId={}",
                    requestId, cached.get().data().notificationId());
            return cached.get();
        }

        NotificationJob job = buildJob(request, correlationId);
        String routingKey = job.routingKey();

        publish(routingKey, job);

        statusStore.save(NotificationStatusRecord.pending(job));

        ApiResponse<NotificationAccepted> response = ApiResponse.ok(
                new NotificationAccepted(job.notificationId(), NotificationStatus.PENDING, requestId,
                        job.notificationType()),
                ACCEPTED_MESSAGE);

        try {
            idempotencyCache.store(requestId, response);
        } catch (StoreUnavailableException e) {
            // job is already queued; a retry with this request_id will publish again
            log.warn("event=idempotency_store_failed requestId={} notificationId={} error={}",
                    requestId, job.notificationId(), e.getMessage());
        }

        metrics.recordAccepted();
        metrics.recordAcceptDurationNs(System.nanoTime() - startNs);
        log.info("event=notify_accepted notificationId={} type={} userId={} template={} requestId={}",
                job.notificationId(), job.notificationType().value(), job.userId(), job.templateCode(), requestId);
        return response;
    }

    private Optional<ApiResponse<NotificationAccepted>> lookupCached(String requestId) {
        try {
            return idempotencyCache.lookup(requestId);
        } catch (StoreUnavailableException e) {
            log.warn("event=idempotency_lookup_failed requestId={} error={}", requestId, e.getMessage());
            return Optional.empty();
        }
    }

    private NotificationJob buildJob(NotificationRequest request, String correlationId) {
        return new NotificationJob(
                UUID.randomUUID().toString(),
                correlationId != null && !correlationId.isBlank() ? correlationId : UUID.randomUUID().toString(),
                request.userId().toString(),
                request.notificationType(),
                request.templateCode(),
                request.variables(),
                request.priority(),
                request.metadata(),
                Instant.now(clock).toString(),
                0);
    }

    private void publish(String routingKey, NotificationJob job) {
        try {
            brokerCircuitBreaker.run(() -> publisher.publish(routingKey, job));
        } catch (CircuitOpenException e) {
            metrics.recordCircuitRejected();
            throw e;
        } catch (PublishFailureException e) {
            metrics.recordPublishFailed();
            throw e;
        } catch (RuntimeException e) {
            metrics.recordPublishFailed();
            throw new PublishFailureException(job.notificationId(), e);
        }
    }
}
