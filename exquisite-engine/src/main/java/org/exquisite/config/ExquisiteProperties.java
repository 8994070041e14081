package org.exquisite.config;

import lombok.Getter;
import lombok.Setter;
import org.exquisite.model.dto.StepRequest;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.MaskStyle;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "exquisite")
@Getter
@Setter
public class ExquisiteProperties {

    /**
     * Directory under which new sessions are allocated, one sub-directory per session id.
     */
    private String artifactRoot = "_generated/exquisite";

    /**
     * ImageIO format name used for the canvas pointer and every image artifact.
     */
    private String imageFormat = "png";

    private Contract contract = new Contract();
    private Step step = new Step();
    private Generator generator = new Generator();
    private Reference reference = new Reference();

    public TileContract toContract() {
        return TileContract.builder()
                .tileSize(contract.getTileSize())
                .bandSize(contract.getBandSize())
                .overlap(contract.getOverlap())
                .advance(contract.getAdvance())
                .build()
                .validate();
    }

    public StepRequest.StepRequestBuilder stepDefaults() {
        return StepRequest.builder()
                .candidateCount(step.getCandidateCount())
                .featherPx(step.getFeatherPx())
                .enforceBandIdentity(step.isEnforceBandIdentity())
                .postEnforceKeep(step.isPostEnforceKeep());
    }

    @Getter
    @Setter
    public static class Contract {
        private int tileSize = TileContract.DEFAULT_TILE_SIZE;
        private int bandSize = TileContract.DEFAULT_BAND_SIZE;
        private int overlap = TileContract.DEFAULT_OVERLAP;
        private int advance = TileContract.DEFAULT_ADVANCE;
    }

    @Getter
    @Setter
    public static class Step {
        private int candidateCount = 1;
        private int featherPx = 0;
        private boolean enforceBandIdentity = true;
        private boolean postEnforceKeep = true;
    }

    @Getter
    @Setter
    public static class Generator {
        private Duration timeout = Duration.ofMinutes(2);
        private int maxParallelCandidates = 4;
        private int transientRetries = 2;
        private Duration retryBackoff = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Reference {
        private MaskStyle maskStyle = MaskStyle.RAMP;
        private int backgroundRgb = 0x000000;
        private boolean scaffold = false;
        private int scaffoldDownsample = 16;
        private int scaffoldBlurRadius = 4;
        private boolean continuationCue = false;
        private int cueOffsetPx = 4;
        private int cueThicknessPx = 2;
    }
}
