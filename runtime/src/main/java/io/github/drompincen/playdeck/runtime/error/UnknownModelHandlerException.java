package io.github.drompincen.playdeck.runtime.error;

public class UnknownModelHandlerException extends PMException {

    private final String handlerName;

    public UnknownModelHandlerException(String handlerName) {
        super("Unknown model handler: " + handlerName);
        this.handlerName = handlerName;
    }

    public UnknownModelHandlerException(String handlerName, Throwable cause) {
        super("Unknown model handler: " + handlerName, cause);
        this.handlerName = handlerName;
    }

    public String getHandlerName() { return handlerName; }
}
