package org.exquisite.service.session;

import lombok.Getter;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File names and directory resolution inside one session root.
 */
@Getter
public class SessionLayout {

    public static final String STATE_FILENAME = "session_state.json";
    public static final String CANVAS_BASENAME = "canvas_latest";
    public static final String STEPS_DIRECTORY = "steps";

    public static final String COMMIT_MARKER = "committed.ok";
    public static final String REJECTION_RECORD = "rejected.json";
    public static final String SCORE_REPORT = "score_report.json";
    public static final String PROMPT = "prompt.txt";

    public static final String CANVAS_INITIAL = "canvas_initial";
    public static final String CONDITIONING_BAND = "conditioning_band";
    public static final String SELECTED_TILE = "selected_tile";
    public static final String NEW_HALF = "new_half";
    public static final String CANVAS_BEFORE = "canvas_before";
    public static final String CANVAS_AFTER = "canvas_after";
    public static final String REFERENCE_TILE = "reference_tile";
    public static final String REFERENCE_MASK = "reference_mask";

    private final Path root;
    private final String imageFormat;

    public SessionLayout(Path root, String imageFormat) {
        this.root = root.toAbsolutePath().normalize();
        this.imageFormat = imageFormat;
    }

    public static String stepDirectoryName(int stepIndex) {
        return String.format("%04d", stepIndex);
    }

    public static String candidateName(int candidateIndex) {
        return String.format("candidate_%02d", candidateIndex);
    }

    public String canvasFilename() {
        return imageName(CANVAS_BASENAME);
    }

    public String imageName(String basename) {
        return basename + "." + imageFormat;
    }

    public Path statePath() {
        return root.resolve(STATE_FILENAME);
    }

    public Path canvasPath() {
        return root.resolve(canvasFilename());
    }

    public Path stepsDirectory() {
        return root.resolve(STEPS_DIRECTORY);
    }

    public Path stepDirectory(int stepIndex) {
        return stepsDirectory().resolve(stepDirectoryName(stepIndex));
    }

    public Path stepImage(int stepIndex, String basename) {
        return stepDirectory(stepIndex).resolve(imageName(basename));
    }

    public Path commitMarker(int stepIndex) {
        return stepDirectory(stepIndex).resolve(COMMIT_MARKER);
    }

    public boolean isCommitted(int stepIndex) {
        return Files.isRegularFile(commitMarker(stepIndex));
    }

    /**
     * Canvas as it stood once step {@code stepIndex} committed.
     */
    public Path snapshotFor(int stepIndex) {
        return stepImage(stepIndex, stepIndex == 0 ? CANVAS_INITIAL : CANVAS_AFTER);
    }
}
