package com.herzen.coach.engine;

public class InvalidContextException extends RuntimeException {
    public InvalidContextException(String message) {
        super(message);
    }
}
