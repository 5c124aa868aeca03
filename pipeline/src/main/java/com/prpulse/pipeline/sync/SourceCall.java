package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.SourceException;

@FunctionalInterface
public interface SourceCall<T> {

    T execute() throws SourceException;
}
