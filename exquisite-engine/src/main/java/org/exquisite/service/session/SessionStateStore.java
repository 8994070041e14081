package org.exquisite.service.session;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.exquisite.config.ExquisiteProperties;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.exception.ExquisiteException;
import org.exquisite.model.dto.CandidateTile;
import org.exquisite.model.dto.CanvasSize;
import org.exquisite.model.dto.ScoreReport;
import org.exquisite.model.dto.SessionState;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.service.file.AtomicFileWriter;
import org.exquisite.util.RasterUtils;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Owns everything a session keeps on disk: the canvas pointer, {@code session_state.json} and the
 * numbered step directories. Every file goes through {@link AtomicFileWriter}.
 *
 * <p>A step directory counts only once its {@code committed.ok} marker exists. On open, the last
 * contiguous committed step is authoritative and the canvas pointer and metadata are rolled back to it
 * if a crash left them ahead or behind.</p>
 */
@Slf4j
@Service
public class SessionStateStore {

    private final ExquisiteProperties properties;
    private final AtomicFileWriter fileWriter;
    private final ObjectMapper objectMapper;
    private final Set<Path> busyRoots = ConcurrentHashMap.newKeySet();

    public SessionStateStore(ExquisiteProperties properties, AtomicFileWriter fileWriter) {
        this.properties = properties;
        this.fileWriter = fileWriter;
        this.objectMapper = JsonMapper.builder()
                .findAndAddModules()
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public CanvasSession create(BufferedImage initialCanvas, GrowthMode mode) {
        return create(initialCanvas, mode, properties.toContract());
    }

    public CanvasSession create(Path initialCanvasFile, GrowthMode mode) {
        BufferedImage image;
        try {
            image = Files.isRegularFile(initialCanvasFile) ? ImageIO.read(initialCanvasFile.toFile()) : null;
        } catch (IOException e) {
            throw ExquisiteError.UNREADABLE_IMAGE.createException(e, initialCanvasFile);
        }
        if (image == null) {
            throw ExquisiteError.UNREADABLE_IMAGE.createException(initialCanvasFile);
        }
        return create(image, mode, properties.toContract());
    }

    public CanvasSession create(BufferedImage initialCanvas, GrowthMode mode, TileContract contract) {
        return create(initialCanvas, mode, contract, Path.of(properties.getArtifactRoot()));
    }

    public CanvasSession create(BufferedImage initialCanvas, GrowthMode mode, TileContract contract, Path artifactRoot) {
        if (mode == null) {
            throw ExquisiteError.INVALID_MODE.createException("null");
        }
        contract.validate();
        int size = contract.getTileSize();
        if (initialCanvas == null || initialCanvas.getWidth() != size || initialCanvas.getHeight() != size) {
            throw ExquisiteError.DIMENSION_MISMATCH.createException("initial canvas "
                    + (initialCanvas == null ? "missing" : CanvasSize.of(initialCanvas)) + " must be " + size + "x" + size);
        }

        String sessionId = UUID.randomUUID().toString();
        SessionLayout layout = new SessionLayout(artifactRoot.resolve(sessionId), properties.getImageFormat());
        BufferedImage canvas = RasterUtils.toRgb(initialCanvas);
        Instant now = Instant.now();

        SessionState state = SessionState.builder()
                .sessionId(sessionId)
                .sessionRoot(layout.getRoot().toString())
                .canvasFilename(layout.canvasFilename())
                .stateFilename(SessionLayout.STATE_FILENAME)
                .imageFormat(layout.getImageFormat())
                .mode(mode)
                .tileSize(contract.getTileSize())
                .bandSize(contract.getBandSize())
                .overlap(contract.getOverlap())
                .advance(contract.getAdvance())
                .canvasWidthExpected(canvas.getWidth())
                .canvasHeightExpected(canvas.getHeight())
                .stepIndexCurrent(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        fileWriter.writeImage(layout.canvasPath(), canvas);
        fileWriter.writeImage(layout.snapshotFor(0), canvas);
        fileWriter.writeJson(layout.statePath(), objectMapper, state);
        fileWriter.writeString(layout.commitMarker(0), now.toString());

        log.info("Created session {} ({}, contract {}) at {}", sessionId, mode.getValue(), contract, layout.getRoot());
        return new CanvasSession(layout, state);
    }

    public CanvasSession open(Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path statePath = normalizedRoot.resolve(SessionLayout.STATE_FILENAME);
        SessionState state = readState(statePath);

        Path storedRoot = state.getSessionRoot() == null ? null : Path.of(state.getSessionRoot()).toAbsolutePath().normalize();
        if (!normalizedRoot.equals(storedRoot)) {
            throw ExquisiteError.SESSION_ROOT_MISMATCH.createException(state.getSessionRoot(), normalizedRoot);
        }
        if (state.getMode() == null) {
            throw ExquisiteError.SESSION_CORRUPT.createException(normalizedRoot, "mode is missing");
        }
        try {
            state.toContract().validate();
        } catch (ExquisiteException e) {
            throw ExquisiteError.SESSION_CORRUPT.createException(e, normalizedRoot, e.getMessage());
        }

        String imageFormat = state.getImageFormat() != null ? state.getImageFormat() : properties.getImageFormat();
        CanvasSession session = new CanvasSession(new SessionLayout(normalizedRoot, imageFormat), state);
        recover(session);
        log.info("Opened session {} at step {} ({})", state.getSessionId(), session.getStepIndex(), session.getExpectedCanvasSize());
        return session;
    }

    /**
     * Rolls the canvas pointer and metadata back to the last contiguous committed step when they disagree with it.
     */
    void recover(CanvasSession session) {
        SessionLayout layout = session.getLayout();
        int lastCommitted = lastContiguousCommitted(layout);
        if (lastCommitted < 0) {
            throw ExquisiteError.SESSION_CORRUPT.createException(layout.getRoot(), "step 0000 carries no commit marker");
        }

        BufferedImage snapshot = readImage(layout.snapshotFor(lastCommitted));
        CanvasSize snapshotSize = CanvasSize.of(snapshot);
        SessionState state = session.getState();
        CanvasSize pointerSize = readPointerSize(layout.canvasPath());

        boolean indexMatches = state.getStepIndexCurrent() == lastCommitted;
        boolean expectedMatches = snapshotSize.equals(state.expectedCanvasSize());
        boolean pointerMatches = snapshotSize.equals(pointerSize);
        if (indexMatches && expectedMatches && pointerMatches) {
            return;
        }

        log.warn("Session {} out of sync with committed step {} (metadata step {}, expected {}, pointer {}); restoring from {}",
                state.getSessionId(), lastCommitted, state.getStepIndexCurrent(), state.expectedCanvasSize(),
                pointerSize, layout.snapshotFor(lastCommitted));
        if (!pointerMatches) {
            fileWriter.writeImage(layout.canvasPath(), snapshot);
        }
        SessionState restored = state.toBuilder()
                .stepIndexCurrent(lastCommitted)
                .canvasWidthExpected(snapshotSize.width())
                .canvasHeightExpected(snapshotSize.height())
                .updatedAt(Instant.now())
                .build();
        fileWriter.writeJson(layout.statePath(), objectMapper, restored);
        session.setState(restored);
    }

    public BufferedImage readCanvas(CanvasSession session) {
        return RasterUtils.toRgb(readImage(session.getLayout().canvasPath()));
    }

    public SessionState readState(Path statePath) {
        if (!Files.isRegularFile(statePath)) {
            throw ExquisiteError.SESSION_NOT_FOUND.createException(statePath);
        }
        try {
            return objectMapper.readValue(Files.readAllBytes(statePath), SessionState.class);
        } catch (IOException | JacksonException e) {
            throw ExquisiteError.SESSION_NOT_FOUND.createException(e, statePath);
        }
    }

    public List<Integer> committedSteps(CanvasSession session) {
        Path stepsDirectory = session.getLayout().stepsDirectory();
        if (!Files.isDirectory(stepsDirectory)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(stepsDirectory)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.matches("\\d{4,}"))
                    .map(Integer::valueOf)
                    .filter(index -> session.getLayout().isCommitted(index))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw ExquisiteError.PERSISTENCE_FAILURE.createException(e, stepsDirectory, e.getMessage());
        }
    }

    /**
     * Makes an empty directory for the attempt at {@code stepIndex}, discarding leftovers of an earlier
     * attempt that never committed.
     */
    public Path prepareStepDirectory(CanvasSession session, int stepIndex) {
        SessionLayout layout = session.getLayout();
        Path directory = layout.stepDirectory(stepIndex);
        if (layout.isCommitted(stepIndex)) {
            throw ExquisiteError.STEP_ALREADY_COMMITTED.createException(stepIndex, session.getSessionId());
        }
        try {
            if (Files.exists(directory)) {
                log.info("Discarding uncommitted step directory {}", directory);
                FileUtils.deleteDirectory(directory.toFile());
            }
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw ExquisiteError.PERSISTENCE_FAILURE.createException(e, directory, e.getMessage());
        }
        return directory;
    }

    public void recordRejection(CanvasSession session, ScoreReport report) {
        Path record = session.getLayout().stepDirectory(report.getStepIndex()).resolve(SessionLayout.REJECTION_RECORD);
        fileWriter.writeJson(record, objectMapper, report);
    }

    /**
     * Persists a step in commit order: artifacts, canvas pointer, metadata, and the commit marker last.
     */
    public void commitStep(CanvasSession session, StepArtifacts artifacts) {
        SessionLayout layout = session.getLayout();
        int stepIndex = artifacts.stepIndex();
        Path directory = layout.stepDirectory(stepIndex);

        fileWriter.writeString(directory.resolve(SessionLayout.PROMPT), artifacts.prompt() == null ? "" : artifacts.prompt());
        fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.CONDITIONING_BAND), artifacts.band());
        if (artifacts.reference() != null) {
            fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.REFERENCE_TILE), artifacts.reference().reference());
            fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.REFERENCE_MASK), artifacts.reference().mask());
        }
        for (CandidateTile candidate : artifacts.candidates()) {
            if (candidate.tile() != null) {
                fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.candidateName(candidate.index())), candidate.tile());
            }
        }
        fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.SELECTED_TILE), artifacts.selectedTile());
        fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.NEW_HALF), artifacts.newHalf());
        fileWriter.writeJson(directory.resolve(SessionLayout.SCORE_REPORT), objectMapper, artifacts.report());
        fileWriter.writeImage(layout.stepImage(stepIndex, SessionLayout.CANVAS_BEFORE), artifacts.canvasBefore());
        fileWriter.writeImage(layout.snapshotFor(stepIndex), artifacts.canvasAfter());

        fileWriter.writeImage(layout.canvasPath(), artifacts.canvasAfter());

        CanvasSize after = CanvasSize.of(artifacts.canvasAfter());
        SessionState next = session.getState().toBuilder()
                .stepIndexCurrent(stepIndex)
                .canvasWidthExpected(after.width())
                .canvasHeightExpected(after.height())
                .updatedAt(Instant.now())
                .build();
        fileWriter.writeJson(layout.statePath(), objectMapper, next);
        session.setState(next);

        fileWriter.writeString(layout.commitMarker(stepIndex), next.getUpdatedAt().toString());
    }

    /**
     * Claims the session for one step. A second claim on the same root fails fast with {@code SESSION_BUSY}
     * until the first lease is closed; closing the lease forgets the root.
     */
    public StepLease acquire(CanvasSession session) {
        Path root = session.getRoot();
        if (!busyRoots.add(root)) {
            throw ExquisiteError.SESSION_BUSY.createException(session.getSessionId());
        }
        return () -> busyRoots.remove(root);
    }

    int busySessionCount() {
        return busyRoots.size();
    }

    @FunctionalInterface
    public interface StepLease extends AutoCloseable {
        @Override
        void close();
    }

    private int lastContiguousCommitted(SessionLayout layout) {
        int index = -1;
        while (layout.isCommitted(index + 1)) {
            index++;
        }
        return index;
    }

    private CanvasSize readPointerSize(Path canvasPath) {
        if (!Files.isRegularFile(canvasPath)) {
            return null;
        }
        try {
            BufferedImage image = ImageIO.read(canvasPath.toFile());
            return image == null ? null : CanvasSize.of(image);
        } catch (IOException e) {
            log.warn("Canvas pointer {} is unreadable: {}", canvasPath, e.getMessage());
            return null;
        }
    }

    private BufferedImage readImage(Path path) {
        try {
            BufferedImage image = Files.isRegularFile(path) ? ImageIO.read(path.toFile()) : null;
            if (image == null) {
                throw ExquisiteError.SESSION_CORRUPT.createException(path.getParent(), "cannot decode " + path.getFileName());
            }
            return image;
        } catch (IOException e) {
            throw ExquisiteError.PERSISTENCE_FAILURE.createException(e, path, e.getMessage());
        }
    }
}
