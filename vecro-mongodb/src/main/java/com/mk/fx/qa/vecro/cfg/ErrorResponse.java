package com.mk.fx.qa.vecro.cfg;

/**
 * Body of every failed response.
 *
 * @param error short title derived from the HTTP status
 * @param details the failure message
 */
public record ErrorResponse(String error, String details) {}
