package lumen.trace.core.propagation;

/**
 * Cross-process identity of a trace. Built by extractors from inbound headers, and by the
 * transaction for outbound headers, in which case {@code spanId} is the current innermost span.
 *
 * <p>{@code sampled} and {@code priority} are {@code null} when the sender did not decide.
 */
public final class TraceContext {

  public static final String PARENT_TYPE_APP = "App";

  private final String traceId;
  private final String spanId;
  private final String transactionId;
  private final Boolean sampled;
  private final Float priority;
  private final String parentType;
  private final String accountId;
  private final String appId;
  private final String trustKey;
  private final long timestampMillis;
  private final String vendorState;
  private final CatContext catContext;

  private TraceContext(Builder builder) {
    this.traceId = builder.traceId;
    this.spanId = builder.spanId;
    this.transactionId = builder.transactionId;
    this.sampled = builder.sampled;
    this.priority = builder.priority;
    this.parentType = builder.parentType;
    this.accountId = builder.accountId;
    this.appId = builder.appId;
    this.trustKey = builder.trustKey;
    this.timestampMillis = builder.timestampMillis;
    this.vendorState = builder.vendorState;
    this.catContext = builder.catContext;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .traceId(traceId)
        .spanId(spanId)
        .transactionId(transactionId)
        .sampled(sampled)
        .priority(priority)
        .parentType(parentType)
        .accountId(accountId)
        .appId(appId)
        .trustKey(trustKey)
        .timestampMillis(timestampMillis)
        .vendorState(vendorState)
        .catContext(catContext);
  }

  /** True when this context carries a trace to join, as opposed to legacy fields only. */
  public boolean hasTraceId() {
    return traceId != null;
  }

  public String getTraceId() {
    return traceId;
  }

  public String getSpanId() {
    return spanId;
  }

  public String getTransactionId() {
    return transactionId;
  }

  public Boolean getSampled() {
    return sampled;
  }

  public Float getPriority() {
    return priority;
  }

  public String getParentType() {
    return parentType;
  }

  public String getAccountId() {
    return accountId;
  }

  public String getAppId() {
    return appId;
  }

  public String getTrustKey() {
    return trustKey;
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  /** Other vendors' {@code tracestate} members, passed through verbatim; may be {@code null}. */
  public String getVendorState() {
    return vendorState;
  }

  public CatContext getCatContext() {
    return catContext;
  }

  @Override
  public String toString() {
    return "TraceContext{"
        + "traceId='"
        + traceId
        + '\''
        + ", spanId='"
        + spanId
        + '\''
        + ", transactionId='"
        + transactionId
        + '\''
        + ", sampled="
        + sampled
        + ", priority="
        + priority
        + ", accountId='"
        + accountId
        + '\''
        + ", appId='"
        + appId
        + '\''
        + ", cat="
        + catContext
        + '}';
  }

  public static final class Builder {
    private String traceId;
    private String spanId;
    private String transactionId;
    private Boolean sampled;
    private Float priority;
    private String parentType;
    private String accountId;
    private String appId;
    private String trustKey;
    private long timestampMillis;
    private String vendorState;
    private CatContext catContext;

    private Builder() {}

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder spanId(String spanId) {
      this.spanId = spanId;
      return this;
    }

    public Builder transactionId(String transactionId) {
      this.transactionId = transactionId;
      return this;
    }

    public Builder sampled(Boolean sampled) {
      this.sampled = sampled;
      return this;
    }

    public Builder priority(Float priority) {
      this.priority = priority;
      return this;
    }

    public Builder parentType(String parentType) {
      this.parentType = parentType;
      return this;
    }

    public Builder accountId(String accountId) {
      this.accountId = accountId;
      return this;
    }

    public Builder appId(String appId) {
      this.appId = appId;
      return this;
    }

    public Builder trustKey(String trustKey) {
      this.trustKey = trustKey;
      return this;
    }

    public Builder timestampMillis(long timestampMillis) {
      this.timestampMillis = timestampMillis;
      return this;
    }

    public Builder vendorState(String vendorState) {
      this.vendorState = vendorState;
      return this;
    }

    public Builder catContext(CatContext catContext) {
      this.catContext = catContext;
      return this;
    }

    public TraceContext build() {
      return new TraceContext(this);
    }
  }
}
