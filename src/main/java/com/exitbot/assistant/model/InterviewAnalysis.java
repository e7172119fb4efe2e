package com.exitbot.assistant.model;

import com.exitbot.assistant.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Model-written review of a finished interview.
 * When {@link #errorKind} is set the analysis text is the configured "unavailable" notice.
 */
@Value
@Builder
public class InterviewAnalysis {

    String analysis;

    /** Messages in the analysed history */
    int interviewLength;

    Instant timestamp;
    String provider;
    ErrorKind errorKind;

    public boolean isAvailable() {
        return errorKind == null;
    }
}
