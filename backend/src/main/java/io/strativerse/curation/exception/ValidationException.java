package io.strativerse.curation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when input is malformed: invalid WKT, a malformed bibliographic entry, a missing year,
 * slug exhaustion or a malformed annotation key. The operation is aborted and its transaction
 * rolled back.
 */
public class ValidationException extends ErrorResponseException {

  public ValidationException(String title, String detail) {
    this(title, detail, null);
  }

  /** Wraps a parser failure, keeping the parser's message as the detail. */
  public ValidationException(String title, String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), cause);
  }
}
