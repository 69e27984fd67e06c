package io.strativerse.curation.geometry.dto;

public record IdentifyGeometryRequest(String wkt) {}
