package org.exquisite.service.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.exquisite.config.ExquisiteProperties;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.exception.ExquisiteException;
import org.exquisite.model.dto.CandidateScore;
import org.exquisite.model.dto.CandidateTile;
import org.exquisite.model.dto.CanvasSize;
import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.dto.ScoreReport;
import org.exquisite.model.dto.StepRequest;
import org.exquisite.model.dto.StepResult;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.model.enums.StepStatus;
import org.exquisite.service.generator.ReferenceConditionedTileGenerator;
import org.exquisite.service.generator.TileGenerator;
import org.exquisite.service.geometry.ReferenceMaskBuilder;
import org.exquisite.service.geometry.SeamScorer;
import org.exquisite.service.geometry.Stitcher;
import org.exquisite.service.geometry.TileGeometry;
import org.exquisite.util.HashUtils;
import org.exquisite.util.RasterUtils;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Runs one growth step against an open session.
 *
 * <p>Domain failures (bad shapes, band identity, generator errors, no viable candidate) end in a
 * {@code REJECTED} result that leaves the canvas pointer and metadata untouched, so the same step index
 * can simply be retried. Storage failures and consistency violations propagate.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StepExecutor {

    private static final Set<ExquisiteError.Category> PROPAGATED = EnumSet.of(
            ExquisiteError.Category.PERSISTENCE,
            ExquisiteError.Category.CONSISTENCY,
            ExquisiteError.Category.NOT_FOUND);

    private final SessionStateStore stateStore;
    private final CandidateFanOut candidateFanOut;
    private final ExquisiteProperties properties;

    public StepResult executeStep(CanvasSession session, String prompt, TileGenerator generator,
                                  int candidateCount, int featherPx, boolean enforceBandIdentity) {
        StepRequest request = properties.stepDefaults()
                .prompt(prompt)
                .candidateCount(candidateCount)
                .featherPx(featherPx)
                .enforceBandIdentity(enforceBandIdentity)
                .build();
        return executeStep(session, request, generator);
    }

    public StepResult executeStep(CanvasSession session, StepRequest request, TileGenerator generator) {
        validateRequest(request, generator);
        try (SessionStateStore.StepLease ignored = stateStore.acquire(session)) {
            return runStep(session, request, generator);
        }
    }

    private StepResult runStep(CanvasSession session, StepRequest request, TileGenerator generator) {
        // a commit that failed half way in this process leaves the pointer ahead of the in-memory state
        stateStore.recover(session);
        int stepIndex = session.getStepIndex() + 1;
        GrowthMode mode = session.getMode();
        TileGeometry geometry = session.getGeometry();
        TileContract contract = geometry.getContract();

        BufferedImage canvas = stateStore.readCanvas(session);
        CanvasSize sizeBefore = CanvasSize.of(canvas);
        Path stepDirectory = stateStore.prepareStepDirectory(session, stepIndex);

        ScoreReport report = ScoreReport.builder()
                .stepIndex(stepIndex)
                .sessionId(session.getSessionId())
                .mode(mode)
                .promptSha256(HashUtils.sha256Hex(StringUtils.defaultString(request.getPrompt())))
                .tileSize(contract.getTileSize())
                .overlap(contract.getOverlap())
                .advance(contract.getAdvance())
                .featherPx(request.getFeatherPx())
                .enforceBandIdentity(request.isEnforceBandIdentity())
                .postEnforceKeep(request.isPostEnforceKeep())
                .canvasSizeBefore(sizeBefore)
                .build();

        List<CandidateScore> scores = List.of();
        try {
            geometry.validateCanvas(canvas, mode);
            BufferedImage band = geometry.extractBand(canvas, mode);

            ReferenceTile reference = null;
            if (generator.acceptsReference() && generator instanceof ReferenceConditionedTileGenerator) {
                ReferenceMaskBuilder maskBuilder = new ReferenceMaskBuilder(geometry, properties.getReference());
                reference = maskBuilder.build(band, mode);
            }

            List<CandidateTile> rawCandidates = candidateFanOut.requestAll(
                    request.getCandidateCount(),
                    properties.getGenerator().getTimeout(),
                    candidateRequest(generator, band, reference, mode, request.getPrompt(), stepIndex));
            List<CandidateTile> candidates = rawCandidates.stream()
                    .map(candidate -> prepareCandidate(candidate, band, mode, geometry, request))
                    .toList();

            SeamScorer scorer = new SeamScorer(geometry);
            scores = scorer.scoreAll(canvas, mode, candidates);
            report.setCandidates(scores);

            Optional<CandidateScore> winner = scorer.select(scores);
            if (winner.isEmpty()) {
                throw noViableCandidate(candidates);
            }
            int selected = winner.get().getIndex();
            BufferedImage selectedTile = candidates.get(selected).tile();

            BufferedImage canvasAfter = new Stitcher(geometry).glueWithFeather(canvas, selectedTile, mode, request.getFeatherPx());
            CanvasSize expected = geometry.expectedNextSize(canvas, mode);
            CanvasSize sizeAfter = CanvasSize.of(canvasAfter);
            if (!expected.equals(sizeAfter)) {
                throw ExquisiteError.CANVAS_SIZE_INVARIANT.createException(sizeAfter, expected);
            }

            report.setSelectedCandidate(selected);
            report.setCanvasSizeAfter(sizeAfter);
            report.setRecordedAt(Instant.now());

            StepArtifacts artifacts = new StepArtifacts(
                    stepIndex,
                    request.getPrompt(),
                    band,
                    reference,
                    rawCandidates,
                    selectedTile,
                    geometry.splitTile(selectedTile, mode).generated(),
                    report,
                    canvas,
                    canvasAfter);
            stateStore.commitStep(session, artifacts);

            log.info("Committed step {} of session {}: candidate {} of {}, canvas {} -> {}",
                    stepIndex, session.getSessionId(), selected, request.getCandidateCount(), sizeBefore, sizeAfter);
            return StepResult.builder()
                    .status(StepStatus.COMMITTED)
                    .stepIndex(stepIndex)
                    .canvasSizeBefore(sizeBefore)
                    .canvasSizeAfter(sizeAfter)
                    .stepDirectory(stepDirectory)
                    .selectedCandidate(selected)
                    .build();
        } catch (ExquisiteException e) {
            if (PROPAGATED.contains(e.getCategory())) {
                throw e;
            }
            return reject(session, report, scores, stepDirectory, e);
        }
    }

    private StepResult reject(CanvasSession session, ScoreReport report, List<CandidateScore> scores,
                              Path stepDirectory, ExquisiteException cause) {
        report.setCandidates(scores);
        report.setSelectedCandidate(null);
        report.setCanvasSizeAfter(report.getCanvasSizeBefore());
        report.setRejectionError(cause.getError().name());
        report.setRejectionReason(cause.getMessage());
        report.setRecordedAt(Instant.now());
        stateStore.recordRejection(session, report);

        log.warn("Rejected step {} of session {}: {}", report.getStepIndex(), session.getSessionId(), cause.getMessage());
        return StepResult.builder()
                .status(StepStatus.REJECTED)
                .stepIndex(report.getStepIndex())
                .canvasSizeBefore(report.getCanvasSizeBefore())
                .canvasSizeAfter(report.getCanvasSizeBefore())
                .stepDirectory(stepDirectory)
                .rejectionError(cause.getError())
                .rejectionReason(cause.getMessage())
                .build();
    }

    private IntFunction<BufferedImage> candidateRequest(TileGenerator generator, BufferedImage band, ReferenceTile reference,
                                                        GrowthMode mode, String prompt, int stepIndex) {
        if (reference != null) {
            ReferenceConditionedTileGenerator referenceGenerator = (ReferenceConditionedTileGenerator) generator;
            return index -> referenceGenerator.generateFromReference(
                    new ReferenceTile(RasterUtils.copy(reference.reference()), copyMask(reference.mask())),
                    RasterUtils.copy(band), mode, prompt, stepIndex);
        }
        return index -> generator.generateTile(RasterUtils.copy(band), mode, prompt, stepIndex);
    }

    /**
     * Validates shape, optionally restores the keep region from the band and checks band identity.
     */
    private CandidateTile prepareCandidate(CandidateTile candidate, BufferedImage band, GrowthMode mode,
                                           TileGeometry geometry, StepRequest request) {
        if (candidate.failureKind() != null) {
            return candidate;
        }
        try {
            geometry.validateTile(candidate.tile());
            BufferedImage tile = RasterUtils.toRgb(candidate.tile());
            if (request.isPostEnforceKeep()) {
                tile = geometry.enforceKeep(tile, band, mode);
            }
            if (request.isEnforceBandIdentity() && !geometry.matchesBandIdentity(tile, band, mode)) {
                throw ExquisiteError.BAND_IDENTITY_VIOLATION.createException(candidate.index());
            }
            return CandidateTile.of(candidate.index(), tile);
        } catch (ExquisiteException e) {
            log.warn("Candidate {} excluded: {}", candidate.index(), e.getMessage());
            return CandidateTile.rejected(candidate.index(), candidate.tile(), e.getError(), e.getMessage());
        }
    }

    /**
     * Reports the shared cause when every candidate failed the same structural check.
     */
    private ExquisiteException noViableCandidate(List<CandidateTile> candidates) {
        ExquisiteError first = candidates.get(0).failureError();
        boolean shared = first != null && candidates.stream().allMatch(candidate -> candidate.failureError() == first);
        if (shared) {
            return new ExquisiteException(candidates.get(0).failureReason(), first);
        }
        return ExquisiteError.NO_VIABLE_CANDIDATE.createException(candidates.size());
    }

    private void validateRequest(StepRequest request, TileGenerator generator) {
        if (request == null) {
            throw ExquisiteError.INVALID_STEP_REQUEST.createException("request is missing");
        }
        if (generator == null) {
            throw ExquisiteError.INVALID_STEP_REQUEST.createException("generator is missing");
        }
        if (request.getCandidateCount() < 1) {
            throw ExquisiteError.INVALID_STEP_REQUEST.createException("candidateCount must be >= 1, got " + request.getCandidateCount());
        }
    }

    private static BufferedImage copyMask(BufferedImage mask) {
        BufferedImage copy = new BufferedImage(mask.getWidth(), mask.getHeight(), mask.getType());
        copy.setData(mask.getData());
        return copy;
    }
}
