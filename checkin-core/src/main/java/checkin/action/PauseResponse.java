package checkin.action;

import java.time.Instant;

/**
 * @param pauseUntil   pause end, or {@code null} after a resume
 * @param eventsPaused number of open events flipped to paused
 */
public record PauseResponse(Instant pauseUntil, int eventsPaused) {

    public boolean paused() {
        return pauseUntil != null;
    }
}
