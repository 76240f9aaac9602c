package com.birthdayreminder.scheduler.domain.exceptions;

public class MalformedBirthdayException extends RuntimeException {

    private MalformedBirthdayException(String message) {
        super(message);
    }

    public static MalformedBirthdayException missingDate(String birthdayId) {
        return new MalformedBirthdayException("Birthday " + birthdayId + " has no date");
    }
}
