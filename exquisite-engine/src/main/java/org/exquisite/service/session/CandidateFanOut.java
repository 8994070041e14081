package org.exquisite.service.session;

import lombok.extern.slf4j.Slf4j;
import org.exquisite.config.CandidateExecutorConfig;
import org.exquisite.model.dto.CandidateTile;
import org.exquisite.model.enums.GeneratorFailureKind;
import org.exquisite.service.generator.GeneratorException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntFunction;

/**
 * Requests every candidate on the candidate executor and joins them all before anything is scored.
 * Each slot ends up holding a tile or a failure kind; nothing thrown by a generator escapes. Candidates
 * still running at the deadline are interrupted and count as transient failures.
 */
@Slf4j
@Component
public class CandidateFanOut {

    private final AsyncTaskExecutor executor;

    public CandidateFanOut(@Qualifier(CandidateExecutorConfig.CANDIDATE_EXECUTOR) AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    public List<CandidateTile> requestAll(int count, Duration timeout, IntFunction<BufferedImage> request) {
        List<Future<BufferedImage>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int index = i;
            futures.add(executor.submit(() -> request.apply(index)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<CandidateTile> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(await(i, futures.get(i), deadline, timeout));
        }
        return results;
    }

    private CandidateTile await(int index, Future<BufferedImage> future, long deadline, Duration timeout) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return CandidateTile.of(index, future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Candidate {} timed out after {}", index, timeout);
            return CandidateTile.generatorFailure(index, GeneratorFailureKind.TRANSIENT, "Generator timed out after " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CandidateTile.generatorFailure(index, GeneratorFailureKind.TRANSIENT, "Interrupted while waiting for the generator");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GeneratorException generatorException) {
                log.warn("Candidate {} failed ({}): {}", index, generatorException.getKind(), generatorException.getMessage());
                return CandidateTile.generatorFailure(index, generatorException.getKind(), generatorException.getMessage());
            }
            log.warn("Candidate {} failed unexpectedly: {}", index, cause.toString());
            return CandidateTile.generatorFailure(index, GeneratorFailureKind.PERMANENT, cause.toString());
        }
    }
}
