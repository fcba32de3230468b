package com.uconnect.admissionsBot.academicApi.exception;

/**
 * Thrown when none of the planned academic lookups could be answered.
 */
public class AcademicDataUnavailableException extends RuntimeException {

    public AcademicDataUnavailableException(String message) {
        super(message);
    }

    public AcademicDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
