package ai.docindexer.indexing.models;

import java.time.Duration;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view derived from run counters. Never persisted. */
@Builder
@Value
public class ProgressMetrics {
  long filesDone;
  long filesTotal;
  long recordsDone;
  long recordsTotal;
  long failures;
  Duration elapsed;
  double recordsPerSecond;
  // null until a rate can be computed
  @Nullable Duration eta;

  public String describe() {
    return String.format(
        "files %d/%d, records %d/%d, failures %d, %.1f records/s, elapsed %ds, eta %s",
        filesDone,
        filesTotal,
        recordsDone,
        recordsTotal,
        failures,
        recordsPerSecond,
        elapsed.getSeconds(),
        eta == null ? "unknown" : eta.getSeconds() + "s");
  }
}
