package io.strativerse.curation.exception;

import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A person, publication, feature, record, parameter or annotation that does not exist. Merges
 * raise it when one of the people was removed by a concurrent merge; callers may retry.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String kind, UUID id) {
    this(
        Problems.of(
            HttpStatus.NOT_FOUND,
            kind + " not found",
            "No " + kind.toLowerCase(Locale.ROOT) + " found with id " + id));
  }

  private ResourceNotFoundException(ProblemDetail problem) {
    super(HttpStatus.NOT_FOUND, problem, null);
  }

  /** For lookups by something other than id, such as a slug or an alias. */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(Problems.of(HttpStatus.NOT_FOUND, title, detail));
  }
}
