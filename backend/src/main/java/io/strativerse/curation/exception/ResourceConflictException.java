package io.strativerse.curation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Unique-constraint or referential-protection violation. Never resolved by overwriting. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.of(HttpStatus.CONFLICT, title, detail), null);
  }
}
