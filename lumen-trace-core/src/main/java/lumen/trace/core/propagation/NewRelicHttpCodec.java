package lumen.trace.core.propagation;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.Moshi;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import lumen.trace.api.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code newrelic} header: base64 encoded JSON {@code {"v":[0,1],"d":{...}}}. Unknown fields
 * are ignored; a major version above 0 is rejected.
 */
public class NewRelicHttpCodec {
  private static final Logger log = LoggerFactory.getLogger(NewRelicHttpCodec.class);

  static final String NEWRELIC_KEY = "newrelic";
  static final int MAJOR_VERSION = 0;
  static final int MINOR_VERSION = 1;

  static class Payload {
    List<Integer> v;
    Data d;
  }

  static class Data {
    String ty;
    String ac;
    String ap;
    String id;
    String tr;
    String tx;
    Float pr;
    Boolean sa;
    Long ti;
    String tk;
  }

  private static final Moshi MOSHI = new Moshi.Builder().build();
  private static final JsonAdapter<Payload> PAYLOAD_ADAPTER = MOSHI.adapter(Payload.class);

  private NewRelicHttpCodec() {
    // This class should not be created. This also makes code coverage checks happy.
  }

  public static HttpCodec.Injector newInjector() {
    return new Injector();
  }

  public static HttpCodec.Extractor newExtractor(final Config config) {
    final String trustKey = config.getTrustedAccountKey();
    return new InterpretingExtractor(() -> new NewRelicContextInterpreter(trustKey));
  }

  static String encode(TraceContext context) {
    Data data = new Data();
    data.ty =
        context.getParentType() == null ? TraceContext.PARENT_TYPE_APP : context.getParentType();
    data.ac = context.getAccountId();
    data.ap = context.getAppId();
    data.id = context.getSpanId();
    data.tr = context.getTraceId();
    data.tx = context.getTransactionId();
    data.pr = context.getPriority();
    data.sa = context.getSampled();
    data.ti = context.getTimestampMillis();
    // the trust key is only sent when it differs from the account
    if (context.getTrustKey() != null && !context.getTrustKey().equals(context.getAccountId())) {
      data.tk = context.getTrustKey();
    }
    Payload payload = new Payload();
    payload.v = Arrays.asList(MAJOR_VERSION, MINOR_VERSION);
    payload.d = data;
    String json = PAYLOAD_ADAPTER.toJson(payload);
    return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  private static class Injector implements HttpCodec.Injector {
    @Override
    public <C> void inject(
        final TraceContext context, final C carrier, final CarrierSetter<C> setter) {
      if (context.getTraceId() == null
          || context.getAccountId() == null
          || context.getAppId() == null) {
        return;
      }
      setter.set(carrier, NEWRELIC_KEY, encode(context));
    }
  }

  private static class NewRelicContextInterpreter extends ContextInterpreter {

    private final String trustKey;
    private String header;

    private NewRelicContextInterpreter(String trustKey) {
      this.trustKey = trustKey;
    }

    @Override
    public ContextInterpreter reset() {
      header = null;
      return super.reset();
    }

    @Override
    public boolean accept(String key, String value) {
      if (null == key || key.isEmpty()) {
        return true;
      }
      if (NEWRELIC_KEY.equals(toLowerCase(key))) {
        seen = true;
        header = value;
      }
      return true;
    }

    @Override
    protected TraceContext complete() {
      Payload payload = decode(header);
      if (payload == null || payload.v == null || payload.v.isEmpty() || payload.d == null) {
        return null;
      }
      Integer major = payload.v.get(0);
      if (major == null || major > MAJOR_VERSION) {
        log.debug("Ignoring newrelic payload with unsupported version {}", payload.v);
        return null;
      }
      Data d = payload.d;
      if (d.ty == null || d.ac == null || d.ap == null || d.tr == null || d.ti == null) {
        log.debug("Ignoring newrelic payload with missing required fields");
        return null;
      }
      if (d.id == null && d.tx == null) {
        log.debug("Ignoring newrelic payload without span or transaction id");
        return null;
      }
      String sentTrustKey = d.tk != null ? d.tk : d.ac;
      if (trustKey == null || !trustKey.equals(sentTrustKey)) {
        log.debug("Ignoring newrelic payload from untrusted account {}", sentTrustKey);
        return null;
      }
      return builder
          .traceId(d.tr)
          .spanId(d.id)
          .transactionId(d.tx)
          .parentType(d.ty)
          .accountId(d.ac)
          .appId(d.ap)
          .trustKey(sentTrustKey)
          .sampled(d.sa)
          .priority(d.pr)
          .timestampMillis(d.ti)
          .build();
    }

    private static Payload decode(String value) {
      if (value == null || value.trim().isEmpty()) {
        return null;
      }
      String trimmed = value.trim();
      try {
        String json =
            trimmed.startsWith("{")
                ? trimmed
                : new String(Base64.getDecoder().decode(trimmed), StandardCharsets.UTF_8);
        return PAYLOAD_ADAPTER.fromJson(json);
      } catch (IllegalArgumentException | IOException | JsonDataException e) {
        log.debug("Unable to decode newrelic payload", e);
        return null;
      }
    }
  }
}
