package com.locus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Sprint summary, used only for startup logging and dispatch scoping.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Sprint(String id, String name, String status) {}
