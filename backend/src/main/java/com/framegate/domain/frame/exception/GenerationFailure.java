package com.framegate.domain.frame.exception;

public enum GenerationFailure {
    /** Not worth retrying: bad request, auth, refused content. */
    FAIL_FAST,
    /** Server hiccup or network error; eligible for the single generic retry. */
    TRANSIENT,
    /** Quota hit; the caller backs off for the reported hint and tries again. */
    RATE_LIMITED
}
