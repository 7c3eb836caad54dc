package ai.docindexer.constants;

public class MetricsConstants {
  private MetricsConstants() {}

  public static final int PROMETHEUS_METRICS_SCRAPING_DISABLED = 0;
  public static final int PROMETHEUS_METRICS_SCRAPE_PORT =
      Integer.parseInt(
          System.getenv()
              .getOrDefault(
                  "PROMETHEUS_METRICS_SCRAPE_PORT",
                  String.valueOf(PROMETHEUS_METRICS_SCRAPING_DISABLED)));

  public enum ApiFailureType {
    // rejected requests the caller has to fix: auth, bad payload
    API_FAILURE_USER_ERROR,
    API_FAILURE_SYSTEM_ERROR
  }
}
