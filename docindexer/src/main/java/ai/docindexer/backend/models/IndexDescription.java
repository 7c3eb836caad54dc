package ai.docindexer.backend.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Field layout of an index as reported by the service. */
@Builder
@Value
public class IndexDescription {
  @NonNull String name;
  @Builder.Default List<DescribedField> fields = ImmutableList.of();

  public Optional<DescribedField> getField(String fieldName) {
    return fields.stream().filter(field -> field.getName().equals(fieldName)).findFirst();
  }

  @Builder
  @Value
  public static class DescribedField {
    @NonNull String name;
    // raw service type name, e.g. Edm.String
    @NonNull String type;
    @Nullable Integer dimensions;
  }
}
