package com.mk.fx.qa.stress.dto;

/** Body of the health endpoint, {@code UP} or {@code DOWN}. */
public record HealthResponse(String status) {}
