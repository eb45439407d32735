package com.mk.fx.qa.stress.dto;

import com.mk.fx.qa.stress.model.StressClientState;

public record StressControlResponse(StressClientState state, String message) {}
