package org.exquisite.service.session;

import lombok.Getter;
import lombok.Setter;
import org.exquisite.model.dto.CanvasSize;
import org.exquisite.model.dto.SessionState;
import org.exquisite.model.enums.GrowthMode;
import org.exquisite.service.geometry.TileGeometry;

import java.nio.file.Path;

/**
 * Handle on an open session: its layout, the geometry of its contract and the last persisted state.
 */
@Getter
public class CanvasSession {

    private final SessionLayout layout;
    private final TileGeometry geometry;
    @Setter
    private SessionState state;

    public CanvasSession(SessionLayout layout, SessionState state) {
        this.layout = layout;
        this.state = state;
        this.geometry = new TileGeometry(state.toContract());
    }

    public Path getRoot() {
        return layout.getRoot();
    }

    public String getSessionId() {
        return state.getSessionId();
    }

    public GrowthMode getMode() {
        return state.getMode();
    }

    public int getStepIndex() {
        return state.getStepIndexCurrent();
    }

    public CanvasSize getExpectedCanvasSize() {
        return state.expectedCanvasSize();
    }
}
