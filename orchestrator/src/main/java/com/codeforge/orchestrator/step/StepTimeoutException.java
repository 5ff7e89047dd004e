package com.codeforge.orchestrator.step;

import java.time.Duration;

/** A single step attempt ran past its deadline. Counts as a transient failure. */
public class StepTimeoutException extends StepException {

    public StepTimeoutException(String provider, String step, Duration timeout) {
        super(Kind.TIMEOUT, provider, "Step '" + step + "' did not finish within " + timeout.toSeconds() + "s");
    }
}
