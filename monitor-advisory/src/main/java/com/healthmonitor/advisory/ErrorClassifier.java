package com.healthmonitor.advisory;

import com.healthmonitor.core.exception.ClassificationException;
import com.healthmonitor.core.model.ErrorClassification;

/**
 * Failure classification capability.
 *
 * READ-ONLY: a classifier only explains a failure. It never touches the
 * event store; attaching the result to the event is the caller's job.
 */
public interface ErrorClassifier {

    /**
     * Classify one failure.
     *
     * @param request The failure to explain
     * @return Category, severity, cause, fix, affected data and business impact
     * @throws ClassificationException if the capability fails or returns unusable output
     */
    ErrorClassification classify(ClassificationRequest request);

    /**
     * Whether the capability can currently be called at all, e.g. it has
     * credentials. Callers skip straight to their fallback when false.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Short name used in logs and metrics.
     */
    String name();
}
