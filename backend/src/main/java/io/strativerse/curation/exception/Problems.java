package io.strativerse.curation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

final class Problems {

  private Problems() {}

  static ProblemDetail of(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
