package lumen.trace.bootstrap.config.provider;

public enum ConfigOrigin {
  /** configurations that are set through environment variables */
  ENV("env_var"),
  /** values that are set through JVM system properties */
  JVM_PROP("jvm_prop"),
  /** set in code, either by the host application or by tests */
  CODE("code"),
  /** set when the user has not set any configuration for the key (defaults to a value) */
  DEFAULT("default");

  public final String value;

  ConfigOrigin(String value) {
    this.value = value;
  }
}
