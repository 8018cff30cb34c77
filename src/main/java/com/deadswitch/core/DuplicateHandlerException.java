package com.deadswitch.core;

/**
 * Thrown when a handler name is registered twice. A name maps to exactly one handler.
 */
public class DuplicateHandlerException extends RuntimeException {

    private final String handlerName;

    public DuplicateHandlerException(String handlerName) {
        super("Handler with provided name already mapped: " + handlerName);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
