package org.exquisite.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.exquisite.model.enums.GrowthMode;

import java.time.Instant;

/**
 * Persisted session metadata ({@code session_state.json}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {
    private String sessionId;
    private String sessionRoot;

    @Builder.Default
    private String canvasFilename = "canvas_latest.png";
    @Builder.Default
    private String stateFilename = "session_state.json";
    @Builder.Default
    private String imageFormat = "png";

    private GrowthMode mode;

    private int tileSize;
    private int bandSize;
    private int overlap;
    private int advance;

    private int canvasWidthExpected;
    private int canvasHeightExpected;

    private int stepIndexCurrent;

    private Instant createdAt;
    private Instant updatedAt;

    public TileContract toContract() {
        return TileContract.builder()
                .tileSize(tileSize)
                .bandSize(bandSize)
                .overlap(overlap)
                .advance(advance)
                .build();
    }

    public CanvasSize expectedCanvasSize() {
        return new CanvasSize(canvasWidthExpected, canvasHeightExpected);
    }
}
