package io.strativerse.curation.geometry.dto;

import io.strativerse.curation.geometry.GeometryType;
import io.strativerse.curation.geometry.WktBounds;

/** {@code type} is null when the text is not valid WKT; bounds are computed regardless. */
public record IdentifyGeometryResponse(boolean valid, GeometryType type, WktBounds bounds) {}
