package com.bubblelevel.replay.service;

import java.time.Instant;

/**
 * Mutable playback progress, shared between {@link OrientationStreamService}
 * (writer) and the controller (reader).
 *
 * <p>All writes come from the single playback thread, apart from
 * {@link #start} which happens before that thread is launched, so volatile
 * visibility is enough.
 */
public class ReplayState {

    public enum Status { IDLE, RUNNING, COMPLETE, ERROR }

    private volatile Status  status = Status.IDLE;
    private volatile String  recording;
    private volatile int     samplesReplayed;
    private volatile int     totalSamples;
    private volatile long    eventsEmitted;
    private volatile String  errorMessage;
    private volatile Instant startedAt;

    // ── mutators ───────────────────────────────────────────────────────────

    public void start(String recording, int totalSamples) {
        this.recording       = recording;
        this.totalSamples    = totalSamples;
        this.samplesReplayed = 0;
        this.eventsEmitted   = 0;
        this.errorMessage    = null;
        this.startedAt       = Instant.now();
        this.status          = Status.RUNNING;
    }

    public void complete() { this.status = Status.COMPLETE; }

    public void error(String msg) { this.errorMessage = msg; this.status = Status.ERROR; }

    public void advance(int samplesReplayed) { this.samplesReplayed = samplesReplayed; }

    public void incrementEvents() { this.eventsEmitted++; }

    // ── accessors ──────────────────────────────────────────────────────────

    public Status  getStatus()          { return status; }
    public String  getRecording()       { return recording; }
    public int     getSamplesReplayed() { return samplesReplayed; }
    public int     getTotalSamples()    { return totalSamples; }
    public long    getEventsEmitted()   { return eventsEmitted; }
    public String  getErrorMessage()    { return errorMessage; }
    public Instant getStartedAt()       { return startedAt; }

    public double getProgressPct() {
        return totalSamples > 0 ? (double) samplesReplayed / totalSamples * 100.0 : 0.0;
    }
}
