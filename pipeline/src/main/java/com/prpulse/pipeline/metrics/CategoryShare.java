package com.prpulse.pipeline.metrics;

public record CategoryShare(String name, String color, long count, double percentage) {}
