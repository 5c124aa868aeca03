package com.prpulse.pipeline.reconcile;

public enum EntityKind {
    ORGANIZATION,
    REPOSITORY,
    PULL_REQUEST,
    REVIEW,
    USER
}
