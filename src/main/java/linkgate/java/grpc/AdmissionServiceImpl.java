package linkgate.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import linkgate.core.cache.CacheStats;
import linkgate.java.engine.KeyedRateLimiter;
import linkgate.java.engine.PopularityGatedCacheManager;
import linkgate.java.engine.RateLimiterConfig;
import linkgate.proto.AdmissionServiceGrpc;
import linkgate.proto.AdmitDestinationRequest;
import linkgate.proto.AdmitDestinationResponse;
import linkgate.proto.CacheStatsRequest;
import linkgate.proto.CacheStatsResponse;
import linkgate.proto.CheckRateLimitRequest;
import linkgate.proto.CheckRateLimitResponse;
import linkgate.proto.ClearCacheRequest;
import linkgate.proto.ClearCacheResponse;
import linkgate.proto.HealthCheckRequest;
import linkgate.proto.HealthCheckResponse;
import linkgate.proto.InvalidateDestinationRequest;
import linkgate.proto.InvalidateDestinationResponse;
import linkgate.proto.LookupDestinationRequest;
import linkgate.proto.LookupDestinationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * gRPC service implementation for admission control.
 *
 * <p>This is a thin wrapper over the two collaborator contracts with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Enable switches: a disabled cache always misses, a disabled limiter always allows</li>
 * </ul>
 *
 * <p>Thread-safety: the cache manager and limiter handle concurrency
 * internally. This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    private final PopularityGatedCacheManager cacheManager;
    private final KeyedRateLimiter rateLimiter;
    private final boolean cacheEnabled;
    private final boolean rateLimitEnabled;

    /**
     * Creates a service with both subsystems enabled.
     *
     * @param cacheManager Destination cache
     * @param rateLimiter Per-client limiter
     */
    public AdmissionServiceImpl(PopularityGatedCacheManager cacheManager, KeyedRateLimiter rateLimiter) {
        this(cacheManager, rateLimiter, true, true);
    }

    /**
     * Creates a service wrapping the given collaborators.
     *
     * @param cacheManager Destination cache (must be thread-safe)
     * @param rateLimiter Per-client limiter (must be thread-safe)
     * @param cacheEnabled false to bypass the cache entirely
     * @param rateLimitEnabled false to allow every request without consuming tokens
     * @throws IllegalArgumentException if a collaborator is null
     */
    public AdmissionServiceImpl(
        PopularityGatedCacheManager cacheManager,
        KeyedRateLimiter rateLimiter,
        boolean cacheEnabled,
        boolean rateLimitEnabled
    ) {
        if (cacheManager == null) {
            throw new IllegalArgumentException("cacheManager cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        this.cacheManager = cacheManager;
        this.rateLimiter = rateLimiter;
        this.cacheEnabled = cacheEnabled;
        this.rateLimitEnabled = rateLimitEnabled;
    }

    @Override
    public void checkRateLimit(
        CheckRateLimitRequest request,
        StreamObserver<CheckRateLimitResponse> responseObserver
    ) {
        respond(responseObserver, "checkRateLimit", () -> {
            String key = requireNonEmpty(request.getKey(), "key");
            RateLimiterConfig config = rateLimiter.config();

            CheckRateLimitResponse.Builder response = CheckRateLimitResponse.newBuilder()
                .setLimit(config.requestsPerWindow())
                .setWindowSeconds(config.windowSeconds());

            if (!rateLimitEnabled) {
                return response.setAllowed(true)
                    .setRemaining(config.requestsPerWindow())
                    .build();
            }

            boolean allowed = rateLimiter.isAllowed(key);
            return response.setAllowed(allowed)
                .setRemaining(rateLimiter.remaining(key))
                .build();
        });
    }

    @Override
    public void lookupDestination(
        LookupDestinationRequest request,
        StreamObserver<LookupDestinationResponse> responseObserver
    ) {
        respond(responseObserver, "lookupDestination", () -> {
            String shortCode = requireNonEmpty(request.getShortCode(), "short_code");
            String destination = cacheEnabled ? cacheManager.lookup(shortCode) : null;

            // Protobuf strings are never null; an absent destination is left unset
            LookupDestinationResponse.Builder response = LookupDestinationResponse.newBuilder()
                .setFound(destination != null);
            if (destination != null) {
                response.setDestination(destination);
            }
            return response.build();
        });
    }

    @Override
    public void admitDestination(
        AdmitDestinationRequest request,
        StreamObserver<AdmitDestinationResponse> responseObserver
    ) {
        respond(responseObserver, "admitDestination", () -> {
            String shortCode = requireNonEmpty(request.getShortCode(), "short_code");
            String destination = requireNonEmpty(request.getDestination(), "destination");
            if (request.getObservedUsage() < 0) {
                throw new IllegalArgumentException("observed_usage must be >= 0, got: " + request.getObservedUsage());
            }
            if (request.getTtlSeconds() < 0) {
                throw new IllegalArgumentException("ttl_seconds must be >= 0, got: " + request.getTtlSeconds());
            }
            if (!cacheEnabled) {
                return AdmitDestinationResponse.newBuilder().setAdmitted(false).build();
            }

            long ttl = request.getTtlSeconds() == 0 ? cacheManager.defaultTtlSeconds() : request.getTtlSeconds();
            boolean admitted = cacheManager.admit(shortCode, destination, request.getObservedUsage(), ttl);
            return AdmitDestinationResponse.newBuilder().setAdmitted(admitted).build();
        });
    }

    @Override
    public void invalidateDestination(
        InvalidateDestinationRequest request,
        StreamObserver<InvalidateDestinationResponse> responseObserver
    ) {
        respond(responseObserver, "invalidateDestination", () -> {
            // Invalidate even when disabled: the cache may have been filled before
            cacheManager.invalidate(requireNonEmpty(request.getShortCode(), "short_code"));
            return InvalidateDestinationResponse.getDefaultInstance();
        });
    }

    @Override
    public void clearCache(
        ClearCacheRequest request,
        StreamObserver<ClearCacheResponse> responseObserver
    ) {
        respond(responseObserver, "clearCache", () -> {
            cacheManager.clear();
            return ClearCacheResponse.getDefaultInstance();
        });
    }

    @Override
    public void getCacheStats(
        CacheStatsRequest request,
        StreamObserver<CacheStatsResponse> responseObserver
    ) {
        respond(responseObserver, "getCacheStats", () -> {
            CacheStats stats = cacheManager.stats();
            return CacheStatsResponse.newBuilder()
                .setSize(stats.size())
                .setMaxSize(stats.maxSize())
                .setHits(stats.hits())
                .setMisses(stats.misses())
                .setHitRate(stats.hitRate())
                .setTotalRequests(stats.totalRequests())
                .setEnabled(cacheEnabled)
                .build();
        });
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // Simple health check: if we can respond, we're serving. Never rate limited.
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    /**
     * Runs a handler and completes the call, mapping failures to gRPC statuses.
     */
    private static <T> void respond(StreamObserver<T> responseObserver, String method, Supplier<T> handler) {
        T response;
        try {
            response = handler.get();
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (RuntimeException e) {
            log.warn("{} failed", method, e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static String requireNonEmpty(String value, String field) {
        // Protobuf strings are never null, only empty
        if (value.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return value;
    }
}
