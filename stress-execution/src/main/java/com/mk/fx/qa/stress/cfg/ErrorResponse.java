package com.mk.fx.qa.stress.cfg;

/**
 * Error body returned by the control API.
 *
 * @param error short error title
 * @param details the failure message
 */
public record ErrorResponse(String error, String details) {}
