package com.lyshra.open.objects.core.exception;

public class LyshraOpenObjectsRuntimeException extends RuntimeException {
    public LyshraOpenObjectsRuntimeException(String message) {
        super(message);
    }
    public LyshraOpenObjectsRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public LyshraOpenObjectsRuntimeException(Throwable cause) {
        super(cause);
    }
}
