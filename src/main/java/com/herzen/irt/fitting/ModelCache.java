package com.herzen.irt.fitting;

import com.herzen.irt.domain.ResponseModels.ResponseMatrix;
import com.herzen.irt.estimation.EstimationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fitted models keyed by dataset identity.
 *
 * <p>A hit returns the stored result and ignores the matrix argument. Concurrent misses for the
 * same key share a single fit; misses for different keys fit in parallel. A result is published
 * only after its fit succeeded, and a failed fit leaves no entry so the next call retries.
 * Entries are only removed through {@link #invalidate(String)} or {@link #clear()}.
 */
@Component
public class ModelCache {
    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private final ModelFitter fitter;
    private final Map<String, FitResult> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<FitResult>> inFlight = new ConcurrentHashMap<>();

    public ModelCache(ModelFitter fitter) {
        this.fitter = fitter;
    }

    public FitResult getOrFit(String key, ResponseMatrix matrix) {
        FitResult cached = entries.get(key);
        if (cached != null) {
            log.debug("Model found in cache for {}", key);
            return cached;
        }

        CompletableFuture<FitResult> flight = new CompletableFuture<>();
        CompletableFuture<FitResult> running = inFlight.putIfAbsent(key, flight);
        if (running != null) {
            log.debug("Waiting for in-flight fit of {}", key);
            return await(running);
        }

        try {
            FitResult result = entries.get(key);
            if (result == null) {
                log.info("Model not in cache, fitting now for {}", key);
                FitResult fitted = fitter.fit(matrix);
                result = entries.computeIfAbsent(key, k -> fitted);
            }
            flight.complete(result);
            return result;
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, flight);
        }
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public void invalidate(String key) {
        if (entries.remove(key) != null) {
            log.info("Evicted cached model for {}", key);
        }
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private FitResult await(CompletableFuture<FitResult> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new EstimationException("Model fit failed: " + e.getMessage(), e);
        }
    }
}
