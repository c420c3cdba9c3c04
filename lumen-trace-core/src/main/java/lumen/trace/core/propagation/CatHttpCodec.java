package lumen.trace.core.propagation;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import lumen.trace.api.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Legacy cross application tracing headers. Requests carry the caller's obfuscated {@code
 * account#application} id and a transaction array; responses carry an app data array. Ids from
 * accounts outside {@code trusted.account.ids} are ignored.
 */
public class CatHttpCodec {
  private static final Logger log = LoggerFactory.getLogger(CatHttpCodec.class);

  public static final String ID_KEY = "X-NewRelic-ID";
  public static final String TRANSACTION_KEY = "X-NewRelic-Transaction";
  public static final String APP_DATA_KEY = "X-NewRelic-App-Data";

  private static final Moshi MOSHI = new Moshi.Builder().build();
  private static final ParameterizedType LIST_OF_VALUES =
      Types.newParameterizedType(List.class, Object.class);
  private static final JsonAdapter<List<Object>> LIST_ADAPTER = MOSHI.adapter(LIST_OF_VALUES);

  private CatHttpCodec() {
    // This class should not be created. This also makes code coverage checks happy.
  }

  public static HttpCodec.Injector newInjector(final Config config) {
    return new Injector(config.getEncodingKey());
  }

  public static HttpCodec.Extractor newExtractor(final Config config) {
    final String encodingKey = config.getEncodingKey();
    final Set<String> trusted = config.getTrustedAccountIds();
    return new InterpretingExtractor(() -> new CatContextInterpreter(encodingKey, trusted));
  }

  private static class Injector implements HttpCodec.Injector {
    private final String encodingKey;

    private Injector(String encodingKey) {
      this.encodingKey = encodingKey;
    }

    @Override
    public <C> void inject(
        final TraceContext context, final C carrier, final CarrierSetter<C> setter) {
      CatContext cat = context.getCatContext();
      if (encodingKey == null || cat == null || cat.getCrossProcessId() == null) {
        return;
      }
      setter.set(carrier, ID_KEY, Obfuscator.obfuscate(cat.getCrossProcessId(), encodingKey));
      String transaction =
          LIST_ADAPTER.toJson(
              Arrays.<Object>asList(
                  cat.getTransactionGuid(),
                  cat.isRecordTransactionTrace(),
                  cat.getTripId(),
                  cat.getPathHash()));
      setter.set(carrier, TRANSACTION_KEY, Obfuscator.obfuscate(transaction, encodingKey));
    }
  }

  /** @return the obfuscated response header value, or {@code null} without an encoding key */
  public static String encodeAppData(CatAppData appData, String encodingKey) {
    if (encodingKey == null) {
      return null;
    }
    String json =
        LIST_ADAPTER.toJson(
            Arrays.<Object>asList(
                appData.getCrossProcessId(),
                appData.getTransactionName(),
                (double) appData.getQueueTimeSeconds(),
                (double) appData.getResponseTimeSeconds(),
                appData.getContentLength(),
                appData.getTransactionGuid(),
                appData.isRecordTransactionTrace()));
    return Obfuscator.obfuscate(json, encodingKey);
  }

  /** @return the decoded app data, or {@code null} when malformed or untrusted */
  public static CatAppData decodeAppData(
      String header, String encodingKey, Set<String> trustedAccountIds) {
    if (header == null || encodingKey == null) {
      return null;
    }
    List<Object> values = decodeArray(header, encodingKey);
    if (values == null || values.size() < 5) {
      return null;
    }
    String crossProcessId = asString(values.get(0));
    if (!isTrusted(crossProcessId, trustedAccountIds)) {
      log.debug("Ignoring app data from untrusted application {}", crossProcessId);
      return null;
    }
    String transactionName = asString(values.get(1));
    if (transactionName == null) {
      return null;
    }
    return new CatAppData(
        crossProcessId,
        transactionName,
        asNumber(values.get(2)).floatValue(),
        asNumber(values.get(3)).floatValue(),
        asNumber(values.get(4)).longValue(),
        values.size() > 5 ? asString(values.get(5)) : null,
        values.size() > 6 && Boolean.TRUE.equals(values.get(6)));
  }

  /**
   * Identifies the route a request took through applications: the referring hash rotated left by
   * one bit, xored with the low 32 bits of md5({@code appName;transactionName}).
   */
  public static String pathHash(String appName, String transactionName, String referringPathHash) {
    long seed = 0;
    if (referringPathHash != null) {
      try {
        seed = Long.parseLong(referringPathHash, 16) & 0xffffffffL;
      } catch (NumberFormatException e) {
        seed = 0;
      }
    }
    long rotated = ((seed << 1) | (seed >>> 31)) & 0xffffffffL;
    byte[] digest;
    try {
      digest =
          MessageDigest.getInstance("MD5")
              .digest((appName + ';' + transactionName).getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 is a required JDK algorithm", e);
    }
    long low =
        ((digest[12] & 0xffL) << 24)
            | ((digest[13] & 0xffL) << 16)
            | ((digest[14] & 0xffL) << 8)
            | (digest[15] & 0xffL);
    return String.format("%08x", rotated ^ low);
  }

  static boolean isTrusted(String crossProcessId, Set<String> trustedAccountIds) {
    if (crossProcessId == null) {
      return false;
    }
    int hash = crossProcessId.indexOf('#');
    if (hash <= 0 || hash == crossProcessId.length() - 1) {
      return false;
    }
    return trustedAccountIds.contains(crossProcessId.substring(0, hash));
  }

  private static List<Object> decodeArray(String header, String encodingKey) {
    String json = Obfuscator.deobfuscate(header, encodingKey);
    if (json == null) {
      return null;
    }
    try {
      return LIST_ADAPTER.fromJson(json);
    } catch (IOException | JsonDataException e) {
      log.debug("Unable to decode legacy header", e);
      return null;
    }
  }

  private static String asString(Object value) {
    return value instanceof String ? (String) value : null;
  }

  private static Number asNumber(Object value) {
    return value instanceof Number ? (Number) value : Double.valueOf(0);
  }

  private static class CatContextInterpreter extends ContextInterpreter {
    private final String encodingKey;
    private final Set<String> trustedAccountIds;
    private String id;
    private String transaction;

    private CatContextInterpreter(String encodingKey, Set<String> trustedAccountIds) {
      this.encodingKey = encodingKey;
      this.trustedAccountIds = trustedAccountIds;
    }

    @Override
    public ContextInterpreter reset() {
      id = null;
      transaction = null;
      return super.reset();
    }

    @Override
    public boolean accept(String key, String value) {
      if (null == key || key.isEmpty()) {
        return true;
      }
      String lowerCaseKey = toLowerCase(key);
      if ("x-newrelic-id".equals(lowerCaseKey)) {
        seen = true;
        id = value;
      } else if ("x-newrelic-transaction".equals(lowerCaseKey)) {
        transaction = value;
      }
      return true;
    }

    @Override
    protected boolean sawPayload() {
      return false;
    }

    @Override
    protected TraceContext complete() {
      if (encodingKey == null) {
        return null;
      }
      String crossProcessId = Obfuscator.deobfuscate(id, encodingKey);
      if (!isTrusted(crossProcessId, trustedAccountIds)) {
        log.debug("Ignoring legacy headers from untrusted application {}", crossProcessId);
        return null;
      }
      String guid = null;
      boolean recordTt = false;
      String tripId = null;
      String pathHash = null;
      List<Object> values = transaction == null ? null : decodeArray(transaction, encodingKey);
      if (values != null) {
        guid = values.size() > 0 ? asString(values.get(0)) : null;
        recordTt = values.size() > 1 && Boolean.TRUE.equals(values.get(1));
        tripId = values.size() > 2 ? asString(values.get(2)) : null;
        pathHash = values.size() > 3 ? asString(values.get(3)) : null;
      }
      return builder
          .catContext(new CatContext(crossProcessId, guid, recordTt, tripId, pathHash))
          .build();
    }
  }
}
