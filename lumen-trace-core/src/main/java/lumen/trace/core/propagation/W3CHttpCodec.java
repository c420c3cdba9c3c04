package lumen.trace.core.propagation;

import static lumen.trace.core.propagation.PropagationUtils.TRACE_PARENT_KEY;

import java.util.Locale;
import lumen.trace.api.Config;
import lumen.trace.api.HexIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A codec for W3C trace context: {@code traceparent} plus our own {@code tracestate} member
 * {@code <trustKey>@nr=0-<type>-<account>-<app>-<spanId>-<txnId>-<sampled>-<priority>-<ts>}.
 * Members of other vendors are carried through unchanged.
 */
public class W3CHttpCodec {
  private static final Logger log = LoggerFactory.getLogger(W3CHttpCodec.class);

  static final String TRACE_PARENT = TRACE_PARENT_KEY;
  static final String TRACE_STATE = "tracestate";
  static final String VENDOR_SUFFIX = "@nr";
  static final String STATE_VERSION = "0";

  private static final int MAX_TRACE_STATE_MEMBERS = 32;
  // one slot stays free for the member we write on injection
  private static final int MAX_PASSED_THROUGH_MEMBERS = MAX_TRACE_STATE_MEMBERS - 1;

  private W3CHttpCodec() {
    // This class should not be created. This also makes code coverage checks happy.
  }

  public static HttpCodec.Injector newInjector() {
    return new Injector();
  }

  public static HttpCodec.Extractor newExtractor(final Config config) {
    final String trustKey = config.getTrustedAccountKey();
    return new InterpretingExtractor(() -> new W3CContextInterpreter(trustKey));
  }

  private static class Injector implements HttpCodec.Injector {

    @Override
    public <C> void inject(
        final TraceContext context, final C carrier, final CarrierSetter<C> setter) {
      if (context.getTraceId() == null || context.getSpanId() == null) {
        return;
      }
      boolean sampled = Boolean.TRUE.equals(context.getSampled());
      setter.set(
          carrier,
          TRACE_PARENT,
          PropagationUtils.traceParent(context.getTraceId(), context.getSpanId(), sampled));

      StringBuilder traceState = new StringBuilder(128);
      if (context.getTrustKey() != null
          && context.getAccountId() != null
          && context.getAppId() != null) {
        traceState
            .append(context.getTrustKey())
            .append(VENDOR_SUFFIX)
            .append('=')
            .append(STATE_VERSION)
            .append('-')
            .append(PropagationUtils.parentTypeCode(context.getParentType()))
            .append('-')
            .append(context.getAccountId())
            .append('-')
            .append(context.getAppId())
            .append('-')
            .append(context.getSpanId())
            .append('-')
            .append(nullToEmpty(context.getTransactionId()))
            .append('-')
            .append(context.getSampled() == null ? "" : sampled ? "1" : "0")
            .append('-')
            .append(
                context.getPriority() == null
                    ? ""
                    : PropagationUtils.formatPriority(context.getPriority()))
            .append('-')
            .append(context.getTimestampMillis());
      }
      String vendorState = context.getVendorState();
      if (vendorState != null && !vendorState.isEmpty()) {
        if (traceState.length() > 0) {
          traceState.append(',');
        }
        traceState.append(vendorState);
      }
      if (traceState.length() > 0) {
        setter.set(carrier, TRACE_STATE, traceState.toString());
      }
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static class W3CContextInterpreter extends ContextInterpreter {

    private final String ourMemberKey;
    private String traceParent;
    private String traceState;
    private boolean flagSampled;
    private boolean memberFound;

    private W3CContextInterpreter(String trustKey) {
      this.ourMemberKey = trustKey == null ? null : trustKey + VENDOR_SUFFIX;
    }

    @Override
    public ContextInterpreter reset() {
      traceParent = null;
      traceState = null;
      flagSampled = false;
      memberFound = false;
      return super.reset();
    }

    @Override
    public boolean accept(String key, String value) {
      if (null == key || key.isEmpty()) {
        return true;
      }
      String lowerCaseKey = toLowerCase(key);
      if (TRACE_PARENT.equals(lowerCaseKey)) {
        seen = true;
        if (traceParent != null) {
          // several traceparent headers are ambiguous
          invalidateContext();
        }
        traceParent = value;
      } else if (TRACE_STATE.equals(lowerCaseKey) && value != null) {
        traceState = traceState == null ? value : traceState + ',' + value;
      }
      return true;
    }

    @Override
    protected TraceContext complete() {
      if (!parseTraceParent(traceParent)) {
        return null;
      }
      if (traceState != null) {
        parseTraceState(traceState);
      }
      if (!memberFound) {
        // without our own entry the sampled flag of the traceparent is all there is
        builder.sampled(flagSampled);
      }
      return builder.build();
    }

    private boolean parseTraceParent(String value) {
      if (value == null) {
        return false;
      }
      String header = value.trim();
      String[] parts = header.split("-", -1);
      if (parts.length < 4 || !HexIds.isHex(parts[0], 2)) {
        log.debug("Ignoring malformed traceparent {}", value);
        return false;
      }
      String version = parts[0].toLowerCase(Locale.ROOT);
      if ("ff".equals(version)) {
        return false;
      }
      if ("00".equals(version) && parts.length != 4) {
        return false;
      }
      String traceId = parts[1];
      String parentId = parts[2];
      String flags = parts[3];
      if (!HexIds.isHex(traceId, 32)
          || !HexIds.isHex(parentId, 16)
          || !HexIds.isHex(flags, 2)
          || HexIds.isAllZeros(traceId)
          || HexIds.isAllZeros(parentId)) {
        log.debug("Ignoring invalid traceparent {}", value);
        return false;
      }
      builder
          .traceId(traceId.toLowerCase(Locale.ROOT))
          .spanId(parentId.toLowerCase(Locale.ROOT));
      flagSampled = (Integer.parseInt(flags, 16) & 0x01) == 0x01;
      return true;
    }

    private void parseTraceState(String value) {
      StringBuilder others = new StringBuilder();
      int members = 0;
      for (String rawMember : value.split(",")) {
        String member = rawMember.trim();
        if (member.isEmpty()) {
          continue;
        }
        int eq = member.indexOf('=');
        if (eq <= 0) {
          continue;
        }
        String memberKey = member.substring(0, eq);
        if (memberKey.equals(ourMemberKey)) {
          parseOurMember(member.substring(eq + 1));
        } else if (members < MAX_PASSED_THROUGH_MEMBERS) {
          if (others.length() > 0) {
            others.append(',');
          }
          others.append(member);
          members++;
        }
      }
      if (others.length() > 0) {
        builder.vendorState(others.toString());
      }
    }

    /** A malformed entry is dropped; the traceparent still stands. */
    private void parseOurMember(String value) {
      String[] fields = value.split("-", -1);
      if (fields.length < 9) {
        log.debug("Ignoring malformed tracestate entry {}", value);
        return;
      }
      String parentType = PropagationUtils.parentTypeName(fields[1]);
      long timestamp;
      try {
        timestamp = Long.parseLong(fields[8]);
      } catch (NumberFormatException e) {
        log.debug("Ignoring tracestate entry with bad timestamp {}", value);
        return;
      }
      if (parentType == null || fields[2].isEmpty() || fields[3].isEmpty()) {
        return;
      }
      memberFound = true;
      builder
          .parentType(parentType)
          .accountId(fields[2])
          .appId(fields[3])
          .trustKey(ourMemberKey.substring(0, ourMemberKey.length() - VENDOR_SUFFIX.length()))
          .transactionId(fields[5].isEmpty() ? null : fields[5])
          .timestampMillis(timestamp);
      if ("1".equals(fields[6])) {
        builder.sampled(Boolean.TRUE);
      } else if ("0".equals(fields[6])) {
        builder.sampled(Boolean.FALSE);
      }
      builder.priority(PropagationUtils.parsePriority(fields[7]));
    }
  }
}
