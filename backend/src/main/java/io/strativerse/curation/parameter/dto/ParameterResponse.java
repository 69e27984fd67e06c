package io.strativerse.curation.parameter.dto;

import io.strativerse.curation.parameter.Parameter;
import java.util.UUID;

public record ParameterResponse(
    UUID id,
    String name,
    String slug,
    String description,
    String preparation,
    String instrumentation) {

  public static ParameterResponse from(Parameter parameter) {
    return new ParameterResponse(
        parameter.getId(),
        parameter.getName(),
        parameter.getSlug(),
        parameter.getDescription(),
        parameter.getPreparation(),
        parameter.getInstrumentation());
  }
}
