package com.prpulse.pipeline.client;

public class NotFoundException extends SourceException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.NOT_FOUND;
    }
}
