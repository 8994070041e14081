package org.exquisite.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.exquisite.exception.ExquisiteError;
import org.exquisite.model.dto.CanvasSize;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Direction in which a session grows its canvas.
 *
 * <p>Forward modes have their frontier on the maximal edge (right or bottom), reverse modes on the
 * minimal edge (left or top). Positions along the growth axis are "oriented": 0 is the side away from
 * the growth direction, so a reverse mode reads raster coordinates from the far end.</p>
 */
@Getter
public enum GrowthMode {
    GROW_RIGHT("grow-right", "x_ltr", true, true),
    GROW_LEFT("grow-left", "x_rtl", true, false),
    GROW_DOWN("grow-down", "y_ttb", false, true),
    GROW_UP("grow-up", "y_btt", false, false);

    private final String value;
    private final String legacyValue;
    private final boolean horizontal;
    private final boolean forward;

    GrowthMode(String value, String legacyValue, boolean horizontal, boolean forward) {
        this.value = value;
        this.legacyValue = legacyValue;
        this.horizontal = horizontal;
        this.forward = forward;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GrowthMode fromValue(String value) {
        if (value == null) {
            throw ExquisiteError.INVALID_MODE.createException("null");
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(m -> m.value.equals(normalized)
                        || m.legacyValue.equals(normalized)
                        || m.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> ExquisiteError.INVALID_MODE.createException(value));
    }

    public boolean isVertical() {
        return !horizontal;
    }

    public int growthLength(BufferedImage image) {
        return horizontal ? image.getWidth() : image.getHeight();
    }

    public int crossLength(BufferedImage image) {
        return horizontal ? image.getHeight() : image.getWidth();
    }

    public int growthLength(CanvasSize size) {
        return horizontal ? size.width() : size.height();
    }

    public int crossLength(CanvasSize size) {
        return horizontal ? size.height() : size.width();
    }

    /**
     * Builds a size from lengths along and across the growth axis.
     */
    public CanvasSize sizeOf(int growth, int cross) {
        return horizontal ? new CanvasSize(growth, cross) : new CanvasSize(cross, growth);
    }

    /**
     * Maps an oriented half-open span {@code [start, end)} of a raster of the given length along the
     * growth axis to its raster start coordinate.
     */
    public int rasterStart(int length, int orientedStart, int orientedEnd) {
        return forward ? orientedStart : length - orientedEnd;
    }

    /**
     * Maps a single oriented position to its raster coordinate.
     */
    public int rasterIndex(int length, int orientedIndex) {
        return forward ? orientedIndex : length - 1 - orientedIndex;
    }
}
