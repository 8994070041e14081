package org.exquisite.service.generator;

import lombok.extern.slf4j.Slf4j;
import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.enums.GeneratorFailureKind;
import org.exquisite.model.enums.GrowthMode;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries transient generator failures with a fixed backoff. Every other failure kind propagates on
 * the first attempt. Reference-conditioned delegates keep their reference path.
 */
@Slf4j
public class RetryingTileGenerator implements ReferenceConditionedTileGenerator {

    private final TileGenerator delegate;
    private final int maxRetries;
    private final Duration backoff;

    public RetryingTileGenerator(TileGenerator delegate, int maxRetries, Duration backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    @Override
    public boolean acceptsReference() {
        return delegate.acceptsReference();
    }

    @Override
    public BufferedImage generateTile(BufferedImage band, GrowthMode mode, String prompt, int stepIndex) {
        return withRetries(stepIndex, () -> delegate.generateTile(band, mode, prompt, stepIndex));
    }

    @Override
    public BufferedImage generateFromReference(ReferenceTile reference, BufferedImage band, GrowthMode mode,
                                               String prompt, int stepIndex) {
        if (!(delegate instanceof ReferenceConditionedTileGenerator referenceGenerator)) {
            return generateTile(band, mode, prompt, stepIndex);
        }
        return withRetries(stepIndex,
                () -> referenceGenerator.generateFromReference(reference, band, mode, prompt, stepIndex));
    }

    private BufferedImage withRetries(int stepIndex, Supplier<BufferedImage> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (GeneratorException e) {
                if (!e.isRetryable() || attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                log.warn("Transient generator failure for step {} (attempt {}/{}): {}",
                        stepIndex, attempt, maxRetries, e.getMessage());
                sleep();
            }
        }
    }

    private void sleep() {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException(GeneratorFailureKind.TRANSIENT,
                    "Interrupted while backing off", e);
        }
    }
}
