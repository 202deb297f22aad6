package com.bubblelevel.replay.recording;

/**
 * A recording could not be loaded. Carries the resource location so callers can
 * tell a missing recording apart from a failed run.
 */
public class RecordingException extends RuntimeException {

    private final String location;
    private final boolean missing;

    private RecordingException(String location, String message, boolean missing, Throwable cause) {
        super(message + " location=" + location, cause);
        this.location = location;
        this.missing  = missing;
    }

    public static RecordingException notFound(String location) {
        return new RecordingException(location, "Recording not found.", true, null);
    }

    public static RecordingException unreadable(String location, Throwable cause) {
        return new RecordingException(location, "Failed to read recording.", false, cause);
    }

    public String getLocation() {
        return location;
    }

    /** True when no resource exists at {@link #getLocation()}. */
    public boolean isMissing() {
        return missing;
    }
}
