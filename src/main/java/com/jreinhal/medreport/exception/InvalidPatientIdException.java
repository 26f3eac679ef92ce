package com.jreinhal.medreport.exception;

public class InvalidPatientIdException extends ReportException {

    public InvalidPatientIdException(int expectedLength, int actualLength) {
        super(ErrorCode.INVALID_PATIENT_ID, null,
            "Patient national id must be exactly " + expectedLength + " characters (got " + actualLength + ")");
    }
}
