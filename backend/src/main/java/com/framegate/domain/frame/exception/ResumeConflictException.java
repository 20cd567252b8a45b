package com.framegate.domain.frame.exception;

/**
 * Persisted run state belongs to a different manifest and no override was given.
 */
public class ResumeConflictException extends ConfigException {

    private final String persistedFingerprint;
    private final String currentFingerprint;

    public ResumeConflictException(String runId, String persistedFingerprint, String currentFingerprint) {
        super("Run " + runId + " was started with a different manifest (persisted "
                + abbreviate(persistedFingerprint) + ", current " + abbreviate(currentFingerprint)
                + "). Resume requires an explicit override.");
        this.persistedFingerprint = persistedFingerprint;
        this.currentFingerprint = currentFingerprint;
    }

    public String getPersistedFingerprint() {
        return persistedFingerprint;
    }

    public String getCurrentFingerprint() {
        return currentFingerprint;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint == null || fingerprint.length() <= 12 ? String.valueOf(fingerprint) : fingerprint.substring(0, 12);
    }
}
