package io.b2mash.b2b.isolation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Safety guard on destructive paths: the schema still has tables or the bucket has objects. */
public class ResourceNotEmptyException extends ErrorResponseException {

  private final String resourceName;

  public ResourceNotEmptyException(String resourceType, String resourceName, String hint) {
    super(HttpStatus.CONFLICT, createProblem(resourceType, resourceName, hint), null);
    this.resourceName = resourceName;
  }

  public String getResourceName() {
    return resourceName;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(
      String resourceType, String resourceName, String hint) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(resourceType + " not empty");
    problem.setDetail(resourceType + " '" + resourceName + "' is not empty. " + hint);
    return problem;
  }
}
