package ai.docindexer.indexing.models;

import java.nio.file.Path;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class SourceFile {
  // path relative to the input root, with '/' separators; stable across runs
  @NonNull String fileId;
  @NonNull Path path;
}
