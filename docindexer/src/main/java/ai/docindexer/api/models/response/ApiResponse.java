package ai.docindexer.api.models.response;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public abstract class ApiResponse {
  private boolean isFailure = false;
  private int statusCode = 200;
  private String cause = "";
  // delay requested by the service on throttled responses, 0 when absent
  private long retryAfterMillis = 0;

  public void setError(int statusCode, String cause) {
    this.isFailure = true;
    this.statusCode = statusCode;
    this.cause = cause;
  }
}
