package ai.docindexer.config;

public enum ConfigVersion {
  V1
}
