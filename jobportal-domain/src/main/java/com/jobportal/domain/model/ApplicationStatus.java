package com.jobportal.domain.model;

/**
 * Application review status. Any status may follow any other; no workflow is enforced.
 */
public enum ApplicationStatus {
    SUBMITTED,
    UNDER_REVIEW,
    ACCEPTED,
    REJECTED
}
