package io.b2mash.b2b.isolation.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A tenant, schema or bucket that an operation needs to be there is missing. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final String resourceName;

  public ResourceNotFoundException(String resourceType, Object resourceName) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, String.valueOf(resourceName)), null);
    this.resourceType = resourceType;
    this.resourceName = String.valueOf(resourceName);
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceName() {
    return resourceName;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String resourceType, String resourceName) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail(
        "No " + resourceType.toLowerCase(Locale.ROOT) + " named '" + resourceName + "'");
    return problem;
  }
}
