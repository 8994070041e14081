package org.exquisite.service.generator;

import lombok.RequiredArgsConstructor;
import org.exquisite.config.ExquisiteProperties;
import org.exquisite.model.dto.TileContract;
import org.exquisite.service.geometry.TileGeometry;
import org.springframework.stereotype.Component;

/**
 * Builds generators configured from {@code exquisite.generator.*}.
 */
@Component
@RequiredArgsConstructor
public class TileGeneratorFactory {

    private final ExquisiteProperties properties;

    public TileGenerator deterministic() {
        return deterministic(properties.toContract());
    }

    public TileGenerator deterministic(TileContract contract) {
        return new DeterministicTileGenerator(new TileGeometry(contract));
    }

    public TileGenerator withRetries(TileGenerator generator) {
        ExquisiteProperties.Generator settings = properties.getGenerator();
        return new RetryingTileGenerator(generator, settings.getTransientRetries(), settings.getRetryBackoff());
    }
}
