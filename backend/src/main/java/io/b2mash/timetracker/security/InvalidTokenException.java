package io.b2mash.timetracker.security;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a bearer token is malformed, badly signed, expired or issued for someone else. */
public class InvalidTokenException extends ErrorResponseException {

  public InvalidTokenException(String detail, Throwable cause) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Invalid token");
    problem.setDetail(detail);
    return problem;
  }
}
