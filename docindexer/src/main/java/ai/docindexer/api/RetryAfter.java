package ai.docindexer.api;

import static ai.docindexer.constants.ApiConstants.RETRY_AFTER_HEADER;
import static ai.docindexer.constants.ApiConstants.RETRY_AFTER_MS_HEADER;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/** Reads the delay a service asks for through {@code retry-after-ms} or {@code Retry-After}. */
@Slf4j
final class RetryAfter {
  private RetryAfter() {}

  static long parseMillis(Response response) {
    return parseMillis(
        response.header(RETRY_AFTER_MS_HEADER),
        response.header(RETRY_AFTER_HEADER),
        Clock.systemUTC());
  }

  static long parseMillis(String retryAfterMs, String retryAfter, Clock clock) {
    if (NumberUtils.isDigits(StringUtils.trim(retryAfterMs))) {
      return Long.parseLong(retryAfterMs.trim());
    }
    if (StringUtils.isBlank(retryAfter)) {
      return 0;
    }
    String value = retryAfter.trim();
    if (NumberUtils.isDigits(value)) {
      return Duration.ofSeconds(Long.parseLong(value)).toMillis();
    }
    // HTTP-date form
    try {
      ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
      return Math.max(0, at.toInstant().toEpochMilli() - clock.millis());
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparseable {} header: {}", RETRY_AFTER_HEADER, value);
      return 0;
    }
  }
}
