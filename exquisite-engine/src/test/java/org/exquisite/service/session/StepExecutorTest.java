package org.exquisite.service.session;

import org.exquisite.TestImages;
import org.exquisite.config.ExquisiteProperties;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.exception.ExquisiteException;
import org.exquisite.model.dto.CandidateScore;
import org.exquisite.model.dto.CanvasSize;
import org.exquisite.model.dto.ReferenceTile;
import org.exquisite.model.dto.ScoreReport;
import org.exquisite.model.dto.StepRequest;
import org.exquisite.model.dto.StepResult;
import org.exquisite.model.dto.TileContract;
import org.exquisite.model.enums.GeneratorFailureKind;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.model.enums.MaskClass;
import org.exquisite.model.enums.StepStatus;
import org.exquisite.service.file.AtomicFileWriter;
import org.exquisite.service.generator.DeterministicTileGenerator;
import org.exquisite.service.generator.GeneratorException;
import org.exquisite.service.generator.ReferenceConditionedTileGenerator;
import org.exquisite.service.generator.TileGenerator;
import org.exquisite.service.geometry.TileGeometry;
import org.exquisite.util.RasterUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StepExecutorTest {

    @TempDir
    Path tempDir;

    private ExquisiteProperties properties;
    private SessionStateStore store;
    private ThreadPoolTaskExecutor candidateExecutor;
    private StepExecutor stepExecutor;

    @BeforeEach
    void setUp() {
        properties = SessionStateStoreTest.smallProperties(tempDir.resolve("sessions"));
        properties.getGenerator().setTimeout(Duration.ofSeconds(30));
        store = new SessionStateStore(properties, new AtomicFileWriter());
        candidateExecutor = new ThreadPoolTaskExecutor();
        candidateExecutor.setCorePoolSize(4);
        candidateExecutor.setMaxPoolSize(4);
        candidateExecutor.setThreadNamePrefix("candidate-test-");
        candidateExecutor.initialize();
        stepExecutor = new StepExecutor(store, new CandidateFanOut(candidateExecutor), properties);
    }

    @AfterEach
    void tearDown() {
        candidateExecutor.shutdown();
    }

    private DeterministicTileGenerator deterministic(TileContract contract) {
        return new DeterministicTileGenerator(new TileGeometry(contract));
    }

    @ParameterizedTest
    @EnumSource(GrowthMode.class)
    void executeStep_ShouldCommitAndPersistEveryArtifact(GrowthMode mode) throws IOException {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), mode);

        StepResult result = stepExecutor.executeStep(session, "a quiet harbour", deterministic(TestImages.SMALL), 1, 0, true);

        assertThat(result.getStatus()).isEqualTo(StepStatus.COMMITTED);
        assertThat(result.getStepIndex()).isEqualTo(1);
        assertThat(result.getSelectedCandidate()).isZero();
        assertThat(mode.growthLength(result.getCanvasSizeAfter())).isEqualTo(96);
        assertThat(mode.crossLength(result.getCanvasSizeAfter())).isEqualTo(64);
        assertThat(session.getStepIndex()).isEqualTo(1);
        assertThat(CanvasSize.of(store.readCanvas(session))).isEqualTo(result.getCanvasSizeAfter());

        Path step = result.getStepDirectory();
        assertThat(step).isEqualTo(session.getLayout().stepDirectory(1));
        assertThat(Files.readString(step.resolve("prompt.txt"))).isEqualTo("a quiet harbour");
        for (String name : new String[]{"conditioning_band.png", "candidate_00.png", "selected_tile.png", "new_half.png",
                "score_report.json", "canvas_before.png", "canvas_after.png", "committed.ok"}) {
            assertThat(step.resolve(name)).exists();
        }
        assertThat(step.resolve("rejected.json")).doesNotExist();
        assertThat(step.resolve("reference_tile.png")).doesNotExist();

        ScoreReport report = store.getObjectMapper().readValue(Files.readAllBytes(step.resolve("score_report.json")), ScoreReport.class);
        assertThat(report.getMode()).isEqualTo(mode);
        assertThat(report.getSelectedCandidate()).isZero();
        assertThat(report.getPromptSha256()).hasSize(64);
        assertThat(report.getCandidates()).hasSize(1);
    }

    @Test
    void executeStep_ScenarioA_ShouldGrowDefaultCanvasToFifteenThirtySix() {
        properties = new ExquisiteProperties();
        properties.setArtifactRoot(tempDir.resolve("defaults").toString());
        store = new SessionStateStore(properties, new AtomicFileWriter());
        stepExecutor = new StepExecutor(store, new CandidateFanOut(candidateExecutor), properties);
        BufferedImage initial = TestImages.solid(1024, 1024, 128);
        CanvasSession session = store.create(initial, GrowthMode.GROW_RIGHT);

        StepResult result = stepExecutor.executeStep(session, "gray", deterministic(TileContract.defaults()), 1, 0, true);

        assertThat(result.isCommitted()).isTrue();
        assertThat(result.getCanvasSizeAfter()).isEqualTo(new CanvasSize(1536, 1024));
        BufferedImage canvas = store.readCanvas(session);
        assertThat(RasterUtils.pixelsEqual(RasterUtils.crop(canvas, 0, 0, 768, 1024), RasterUtils.crop(initial, 0, 0, 768, 1024))).isTrue();
    }

    @Test
    void executeStep_ScenarioB_ShouldRejectTileOfTheWrongSizeWithoutMutation() throws IOException {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);
        byte[] canvasBefore = Files.readAllBytes(session.getLayout().canvasPath());
        byte[] stateBefore = Files.readAllBytes(session.getLayout().statePath());
        TileGenerator generator = mock(TileGenerator.class);
        when(generator.generateTile(any(), any(), any(), anyInt())).thenReturn(TestImages.solid(64, 63, 0));

        StepResult result = stepExecutor.executeStep(session, "short", generator, 1, 0, true);

        assertThat(result.getStatus()).isEqualTo(StepStatus.REJECTED);
        assertThat(result.getRejectionError()).isEqualTo(ExquisiteError.DIMENSION_MISMATCH);
        assertThat(result.getRejectionError().getCategory()).isEqualTo(ExquisiteError.Category.DIMENSION);
        assertThat(result.getCanvasSizeAfter()).isEqualTo(result.getCanvasSizeBefore());
        assertThat(session.getStepIndex()).isZero();
        assertThat(Files.readAllBytes(session.getLayout().canvasPath())).isEqualTo(canvasBefore);
        assertThat(Files.readAllBytes(session.getLayout().statePath())).isEqualTo(stateBefore);
        assertThat(result.getStepDirectory().resolve("rejected.json")).exists();
        assertThat(result.getStepDirectory().resolve("committed.ok")).doesNotExist();
    }

    @Test
    void executeStep_ShouldStayIdempotentAcrossRepeatedGeneratorFailures() throws IOException {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_DOWN);
        byte[] canvasBefore = Files.readAllBytes(session.getLayout().canvasPath());
        TileGenerator generator = mock(TileGenerator.class);
        when(generator.generateTile(any(), any(), anyString(), anyInt()))
                .thenThrow(GeneratorException.transientFailure("rate limited"));

        for (int attempt = 0; attempt < 3; attempt++) {
            StepResult result = stepExecutor.executeStep(session, "retry me", generator, 2, 0, true);

            assertThat(result.getStatus()).isEqualTo(StepStatus.REJECTED);
            assertThat(result.getStepIndex()).isEqualTo(1);
            assertThat(result.getRejectionError()).isEqualTo(ExquisiteError.NO_VIABLE_CANDIDATE);
        }

        verify(generator, times(6)).generateTile(any(), any(), anyString(), anyInt());
        assertThat(session.getStepIndex()).isZero();
        assertThat(store.open(session.getRoot()).getStepIndex()).isZero();
        assertThat(Files.readAllBytes(session.getLayout().canvasPath())).isEqualTo(canvasBefore);
        ScoreReport rejection = store.getObjectMapper().readValue(
                Files.readAllBytes(session.getLayout().stepDirectory(1).resolve("rejected.json")), ScoreReport.class);
        assertThat(rejection.getCandidates()).extracting(CandidateScore::getFailureKind)
                .containsOnly(GeneratorFailureKind.TRANSIENT);
    }

    @Test
    void executeStep_ScenarioD_ShouldContinueAfterReopeningFromDisk() {
        properties = new ExquisiteProperties();
        properties.setArtifactRoot(tempDir.resolve("defaults").toString());
        store = new SessionStateStore(properties, new AtomicFileWriter());
        stepExecutor = new StepExecutor(store, new CandidateFanOut(candidateExecutor), properties);
        DeterministicTileGenerator generator = deterministic(TileContract.defaults());
        CanvasSession session = store.create(TestImages.solid(1024, 1024, 60), GrowthMode.GROW_UP);

        assertThat(stepExecutor.executeStep(session, "first", generator, 1, 0, true).isCommitted()).isTrue();
        CanvasSession reopened = new SessionStateStore(properties, new AtomicFileWriter()).open(session.getRoot());
        StepResult second = stepExecutor.executeStep(reopened, "second", generator, 1, 0, true);

        assertThat(second.isCommitted()).isTrue();
        assertThat(second.getStepIndex()).isEqualTo(2);
        assertThat(second.getCanvasSizeAfter()).isEqualTo(new CanvasSize(1024, 1024 + 2 * 512));
        assertThat(store.committedSteps(reopened)).containsExactly(0, 1, 2);
    }

    @Test
    void executeStep_ShouldRejectBandIdentityViolationWhenKeepIsNotRestored() {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_LEFT);
        TileGenerator generator = (band, mode, prompt, stepIndex) -> TestImages.noise(64, 64, stepIndex);
        StepRequest strict = properties.stepDefaults().prompt("noise").postEnforceKeep(false).build();

        StepResult rejected = stepExecutor.executeStep(session, strict, generator);
        StepResult restored = stepExecutor.executeStep(session, strict.toBuilder().postEnforceKeep(true).build(), generator);

        assertThat(rejected.getStatus()).isEqualTo(StepStatus.REJECTED);
        assertThat(rejected.getRejectionError()).isEqualTo(ExquisiteError.BAND_IDENTITY_VIOLATION);
        assertThat(restored.getStatus()).isEqualTo(StepStatus.COMMITTED);
        assertThat(restored.getStepIndex()).isEqualTo(1);
    }

    @Test
    void executeStep_ShouldCommitForeignTileWhenIdentityIsNotEnforced() {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);
        TileGenerator generator = (band, mode, prompt, stepIndex) -> TestImages.noise(64, 64, 21);
        StepRequest lenient = properties.stepDefaults().prompt("noise").postEnforceKeep(false).enforceBandIdentity(false).build();

        assertThat(stepExecutor.executeStep(session, lenient, generator).isCommitted()).isTrue();
    }

    @Test
    void executeStep_ShouldTreatTimedOutCandidatesAsTransientFailures() throws IOException {
        properties.getGenerator().setTimeout(Duration.ofMillis(200));
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);
        TileGenerator slow = (band, mode, prompt, stepIndex) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TestImages.solid(64, 64, 0);
        };

        StepResult result = stepExecutor.executeStep(session, "slow", slow, 1, 0, true);

        assertThat(result.getStatus()).isEqualTo(StepStatus.REJECTED);
        ScoreReport rejection = store.getObjectMapper().readValue(
                Files.readAllBytes(result.getStepDirectory().resolve("rejected.json")), ScoreReport.class);
        assertThat(rejection.getCandidates().get(0).getFailureKind()).isEqualTo(GeneratorFailureKind.TRANSIENT);
    }

    @Test
    void executeStep_ShouldSelectAmongSurvivingCandidates() throws IOException {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);
        DeterministicTileGenerator delegate = deterministic(TestImages.SMALL);
        AtomicInteger calls = new AtomicInteger();
        TileGenerator flaky = (band, mode, prompt, stepIndex) -> {
            if (calls.getAndIncrement() == 0) {
                throw GeneratorException.safetyRefusal("refused");
            }
            return delegate.generateTile(band, mode, prompt, stepIndex);
        };

        StepResult result = stepExecutor.executeStep(session, "three", flaky, 3, 4, true);

        assertThat(result.isCommitted()).isTrue();
        ScoreReport report = store.getObjectMapper().readValue(
                Files.readAllBytes(result.getStepDirectory().resolve("score_report.json")), ScoreReport.class);
        assertThat(report.getCandidates()).hasSize(3);
        assertThat(report.getCandidates()).filteredOn(CandidateScore::isViable).hasSize(2);
        assertThat(report.getFeatherPx()).isEqualTo(4);
        CandidateScore refused = report.getCandidates().stream().filter(c -> !c.isViable()).findFirst().orElseThrow();
        assertThat(refused.getFailureKind()).isEqualTo(GeneratorFailureKind.SAFETY_REFUSAL);
        assertThat(result.getSelectedCandidate()).isNotEqualTo(refused.getIndex());
    }

    @Test
    void executeStep_ShouldHandReferenceConditionedGeneratorsAMaskedReference() {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_DOWN);
        DeterministicTileGenerator delegate = deterministic(TestImages.SMALL);
        AtomicReference<ReferenceTile> received = new AtomicReference<>();
        ReferenceConditionedTileGenerator generator = new ReferenceConditionedTileGenerator() {
            @Override
            public BufferedImage generateFromReference(ReferenceTile reference, BufferedImage band, GrowthMode mode,
                                                       String prompt, int stepIndex) {
                received.set(reference);
                return delegate.generateTile(band, mode, prompt, stepIndex);
            }

            @Override
            public BufferedImage generateTile(BufferedImage band, GrowthMode mode, String prompt, int stepIndex) {
                throw new AssertionError("reference path expected");
            }
        };

        StepResult result = stepExecutor.executeStep(session, "masked", generator, 1, 0, true);

        assertThat(result.isCommitted()).isTrue();
        assertThat(received.get().classify(0, 0)).isEqualTo(MaskClass.MUST_PRESERVE);
        assertThat(received.get().classify(0, 63)).isEqualTo(MaskClass.FREELY_EDITABLE);
        assertThat(result.getStepDirectory().resolve("reference_tile.png")).exists();
        assertThat(result.getStepDirectory().resolve("reference_mask.png")).exists();
    }

    @Test
    void executeStep_ShouldFailFastWhenTheSessionIsBusy() throws Exception {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);
        DeterministicTileGenerator delegate = deterministic(TestImages.SMALL);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TileGenerator blocking = (band, mode, prompt, stepIndex) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.generateTile(band, mode, prompt, stepIndex);
        };

        CompletableFuture<StepResult> running = CompletableFuture.supplyAsync(
                () -> stepExecutor.executeStep(session, "first", blocking, 1, 0, true));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> stepExecutor.executeStep(session, "second", delegate, 1, 0, true))
                .isInstanceOf(ExquisiteException.class)
                .satisfies(e -> assertThat(((ExquisiteException) e).getError()).isEqualTo(ExquisiteError.SESSION_BUSY));

        release.countDown();
        assertThat(running.get(10, TimeUnit.SECONDS).isCommitted()).isTrue();
    }

    @Test
    void executeStep_ShouldPropagatePersistenceFailureAndRecoverOnReopen() {
        AtomicBoolean failPointer = new AtomicBoolean(false);
        AtomicFileWriter failingWriter = new AtomicFileWriter() {
            @Override
            protected void commit(Path temp, Path target) throws IOException {
                if (failPointer.get() && target.getFileName().toString().equals("canvas_latest.png")) {
                    throw new IOException("simulated crash while replacing the canvas");
                }
                super.commit(temp, target);
            }
        };
        store = new SessionStateStore(properties, failingWriter);
        stepExecutor = new StepExecutor(store, new CandidateFanOut(candidateExecutor), properties);
        BufferedImage initial = TestImages.coordinates(64, 64);
        CanvasSession session = store.create(initial, GrowthMode.GROW_RIGHT);
        failPointer.set(true);

        assertThatThrownBy(() -> stepExecutor.executeStep(session, "crash", deterministic(TestImages.SMALL), 1, 0, true))
                .isInstanceOf(ExquisiteException.class)
                .satisfies(e -> assertThat(((ExquisiteException) e).isPersistenceFailure()).isTrue());

        failPointer.set(false);
        CanvasSession reopened = store.open(session.getRoot());
        assertThat(reopened.getStepIndex()).isZero();
        assertThat(session.getLayout().isCommitted(1)).isFalse();
        assertThat(RasterUtils.pixelsEqual(store.readCanvas(reopened), initial)).isTrue();
        assertThat(stepExecutor.executeStep(reopened, "again", deterministic(TestImages.SMALL), 1, 0, true).isCommitted()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"session_state.json", "committed.ok"})
    void executeStep_ShouldRestoreCommittedCanvasWhenRetryingAfterAPartialCommit(String failingFile) throws IOException {
        AtomicBoolean failOnce = new AtomicBoolean(false);
        AtomicFileWriter failingWriter = new AtomicFileWriter() {
            @Override
            protected void commit(Path temp, Path target) throws IOException {
                if (target.getFileName().toString().equals(failingFile) && failOnce.compareAndSet(true, false)) {
                    throw new IOException("simulated crash while writing " + failingFile);
                }
                super.commit(temp, target);
            }
        };
        store = new SessionStateStore(properties, failingWriter);
        stepExecutor = new StepExecutor(store, new CandidateFanOut(candidateExecutor), properties);
        BufferedImage initial = TestImages.coordinates(64, 64);
        CanvasSession session = store.create(initial, GrowthMode.GROW_RIGHT);
        failOnce.set(true);

        assertThatThrownBy(() -> stepExecutor.executeStep(session, "partial", deterministic(TestImages.SMALL), 1, 0, true))
                .isInstanceOf(ExquisiteException.class)
                .satisfies(e -> assertThat(((ExquisiteException) e).isPersistenceFailure()).isTrue());
        assertThat(CanvasSize.of(store.readCanvas(session))).isEqualTo(new CanvasSize(96, 64));

        StepResult retry = stepExecutor.executeStep(session, "partial", deterministic(TestImages.SMALL), 1, 0, true);

        assertThat(retry.isCommitted()).isTrue();
        assertThat(retry.getStepIndex()).isEqualTo(1);
        assertThat(retry.getCanvasSizeBefore()).isEqualTo(new CanvasSize(64, 64));
        assertThat(retry.getCanvasSizeAfter()).isEqualTo(new CanvasSize(96, 64));
        BufferedImage canvasBefore = ImageIO.read(session.getLayout().stepImage(1, SessionLayout.CANVAS_BEFORE).toFile());
        assertThat(RasterUtils.pixelsEqual(canvasBefore, initial)).isTrue();

        CanvasSession reopened = store.open(session.getRoot());
        assertThat(reopened.getStepIndex()).isEqualTo(1);
        assertThat(reopened.getExpectedCanvasSize()).isEqualTo(new CanvasSize(96, 64));
        assertThat(CanvasSize.of(store.readCanvas(reopened))).isEqualTo(new CanvasSize(96, 64));
    }

    @Test
    void executeStep_ShouldRejectInvalidRequests() {
        CanvasSession session = store.create(TestImages.coordinates(64, 64), GrowthMode.GROW_RIGHT);

        assertThatThrownBy(() -> stepExecutor.executeStep(session, "none", deterministic(TestImages.SMALL), 0, 0, true))
                .isInstanceOf(ExquisiteException.class)
                .satisfies(e -> assertThat(((ExquisiteException) e).getError()).isEqualTo(ExquisiteError.INVALID_STEP_REQUEST));
        assertThat(session.getLayout().stepDirectory(1)).doesNotExist();
    }
}
