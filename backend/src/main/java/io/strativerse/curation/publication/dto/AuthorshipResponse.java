package io.strativerse.curation.publication.dto;

import java.util.UUID;

public record AuthorshipResponse(UUID personId, String name, String role, int order) {}
