package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.model.ErrorContext;
import com.fever.resilience.domain.model.ErrorRecord;
import com.fever.resilience.domain.port.out.RemoteCall;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outermost guard for a named service: a failing primary call falls back to a registered
 * alternative and, failing that, to a degraded response. Any {@link Throwable} from the primary
 * or the fallback is absorbed, {@link AssertionError} and other non-fatal errors included; only a
 * {@link VirtualMachineError} propagates. The real error is kept in the logs, the error history and
 * the per-service health map. A null service name is recorded as {@value #UNNAMED_SERVICE}.
 */
public class GracefulDegradation {

    private static final Logger logger = LoggerFactory.getLogger(GracefulDegradation.class);

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED_PREFIX = "degraded: ";
    public static final String UNNAMED_SERVICE = "unknown";

    private final ErrorClassifier errorClassifier;
    private final ErrorHistory errorHistory;
    private final Clock clock;

    private final Map<String, String> serviceStatus = new ConcurrentHashMap<>();
    private final Map<String, RemoteCall<?, ?>> fallbacks = new ConcurrentHashMap<>();

    public GracefulDegradation(ErrorClassifier errorClassifier, ErrorHistory errorHistory, Clock clock) {
        this.errorClassifier = errorClassifier;
        this.errorHistory = errorHistory;
        this.clock = clock;
    }

    /**
     * Register an alternative implementation; it receives the same input as the primary call
     * and must produce the same result type.
     */
    public <I, O> void registerFallback(String fallbackKey, RemoteCall<I, O> fallback) {
        fallbacks.put(fallbackKey, fallback);
    }

    public boolean hasFallback(String fallbackKey) {
        return fallbackKey != null && fallbacks.containsKey(fallbackKey);
    }

    public <I> String call(String serviceName, String fallbackKey, RemoteCall<I, String> primary, I input) {
        return call(serviceName, fallbackKey, primary, input, DegradedResponses::forService);
    }

    /**
     * @param degradedResponse builds the last-resort result from the service name and the primary error
     */
    public <I, O> O call(String serviceName,
                         String fallbackKey,
                         RemoteCall<I, O> primary,
                         I input,
                         BiFunction<String, Throwable, O> degradedResponse) {
        String service = serviceName == null ? UNNAMED_SERVICE : serviceName;
        try {
            O result = primary.call(input);
            serviceStatus.put(service, HEALTHY);
            return result;
        } catch (Throwable e) {
            rethrowIfFatal(e);
            restoreInterrupt(e);
            String message = ErrorClassifier.describe(e);
            serviceStatus.put(service, DEGRADED_PREFIX + message);
            ErrorContext context = errorClassifier.classify(message);
            errorHistory.append(new ErrorRecord(service, message, "degradation", context, clock.instant()));
            logger.warn("Service {} degraded ({}, {}), using fallback: {}",
                    service, context.errorType().code(), context.severity(), message);

            if (hasFallback(fallbackKey)) {
                try {
                    O fallbackResult = invokeFallback(fallbackKey, input);
                    logger.info("Fallback {} succeeded for service {}", fallbackKey, service);
                    return fallbackResult;
                } catch (Throwable fallbackError) {
                    rethrowIfFatal(fallbackError);
                    restoreInterrupt(fallbackError);
                    logger.error("Fallback {} also failed: {}", fallbackKey, ErrorClassifier.describe(fallbackError));
                }
            }

            return degradedResponse.apply(service, e);
        }
    }

    public <I> RemoteCall<I, String> decorate(String serviceName, String fallbackKey, RemoteCall<I, String> primary) {
        return input -> call(serviceName, fallbackKey, primary, input);
    }

    public <I, O> RemoteCall<I, O> decorate(String serviceName,
                                            String fallbackKey,
                                            RemoteCall<I, O> primary,
                                            BiFunction<String, Throwable, O> degradedResponse) {
        return input -> call(serviceName, fallbackKey, primary, input, degradedResponse);
    }

    /**
     * @return sorted copy of the service health map
     */
    public Map<String, String> getServiceHealth() {
        return new TreeMap<>(serviceStatus);
    }

    @SuppressWarnings("unchecked")
    private <I, O> O invokeFallback(String fallbackKey, I input) throws Exception {
        RemoteCall<I, O> fallback = (RemoteCall<I, O>) fallbacks.get(fallbackKey);
        return fallback.call(input);
    }

    private static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError fatal) {
            throw fatal;
        }
    }

    private static void restoreInterrupt(Throwable e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
