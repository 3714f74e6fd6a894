package com.db.ecd.assessment.exception;

public class InvalidScoreLevelException extends IllegalArgumentException {

    public InvalidScoreLevelException(String message) {
        super(message);
    }
}
