package ca.gc.cra.vartrunc.application.truncate;

import ca.gc.cra.vartrunc.application.json.CompactJsonWriter;
import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.segment.ArraySegment;
import ca.gc.cra.vartrunc.domain.segment.IntegerSegment;
import ca.gc.cra.vartrunc.domain.segment.ObjectSegment;
import ca.gc.cra.vartrunc.domain.segment.Segment;
import ca.gc.cra.vartrunc.domain.segment.Segments;
import ca.gc.cra.vartrunc.domain.segment.StringSegment;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import ca.gc.cra.vartrunc.domain.value.Value;
import ca.gc.cra.vartrunc.domain.value.Values;
import ca.gc.cra.vartrunc.logging.Logs;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point that truncates a {@link Segment} to the configured limits.
 * <p><strong>Why:</strong> Execution payloads must fit a byte budget before they are persisted inline, while
 * numbers and file references are kept intact.</p>
 * <p><strong>Role:</strong> Application service used by the offload coordinator and the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pass integers, floats, nulls and file references through; integer segments holding booleans become
 *   {@code 0} or {@code 1}.</li>
 *   <li>Shorten strings by character limit, then by byte budget.</li>
 *   <li>Truncate arrays and objects with {@code maxSizeBytes} as budget.</li>
 *   <li>Fall back to a shortened compact-JSON string when a structured result still exceeds the budget.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Increments {@code truncate.segment.truncated} and
 * {@code truncate.fallback.string}; logs fallbacks at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ValueTruncator {
  private static final Logger log = LoggerFactory.getLogger(ValueTruncator.class);
  private static final int PREVIEW_BYTES = 64;

  private final TruncatorConfig config;
  private final StringTruncator strings;
  private final ContainerTruncator containers;
  private final CompactJsonWriter writer;
  private final MetricsPort metrics;

  /**
   * Creates a truncator without metrics.
   *
   * @param config limits to apply
   */
  public ValueTruncator(TruncatorConfig config) {
    this(config, MetricsPort.NO_OP);
  }

  /**
   * Creates a truncator reporting to {@code metrics}.
   *
   * @param config limits to apply
   * @param metrics metrics sink
   */
  public ValueTruncator(TruncatorConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.strings = new StringTruncator(config.stringLengthLimit());
    this.containers = new ContainerTruncator(config);
    this.writer = new CompactJsonWriter();
  }

  /**
   * Truncates a segment.
   *
   * @param segment segment to truncate
   * @return result whose value fits {@code maxSizeBytes} unless it is an integer, float, none or file segment
   * @throws ca.gc.cra.vartrunc.domain.value.MaxDepthExceededException if the value nests too deeply
   */
  public TruncationResult truncate(Segment segment) {
    Objects.requireNonNull(segment, "segment");
    TruncationResult result = switch (segment.type()) {
      case INTEGER -> coerceInteger((IntegerSegment) segment);
      case FLOAT, NONE, FILE, ARRAY_FILE -> new TruncationResult(segment, false);
      case STRING -> truncateString((StringSegment) segment);
      case ARRAY -> enforceFinalSize(
          containers.truncateArray(((ArraySegment) segment).value(), config.maxSizeBytes()));
      case OBJECT -> enforceFinalSize(
          containers.truncateObject(((ObjectSegment) segment).value(), config.maxSizeBytes()));
    };
    if (result.truncated()) {
      metrics.increment("truncate.segment.truncated");
      log.debug("Truncated {} segment to {}", segment.type(), result.result().type());
    }
    return result;
  }

  /**
   * Truncates a value wrapped in its natural segment.
   *
   * @param value value to truncate
   * @return truncation result
   */
  public TruncationResult truncateValue(Value value) {
    return truncate(Segments.of(value));
  }

  /**
   * Truncates a whole inputs or outputs mapping as an object.
   *
   * @param mapping plain Java mapping
   * @return truncation result holding an {@code ObjectSegment}, or a {@code StringSegment} after fallback
   * @throws ca.gc.cra.vartrunc.domain.value.UnknownValueTypeException if the mapping holds unsupported types
   */
  public TruncationResult truncateVariableMapping(Map<String, ?> mapping) {
    return truncate(new ObjectSegment(Values.ofMap(mapping)));
  }

  /**
   * Returns the configured limits.
   *
   * @return configuration
   */
  public TruncatorConfig config() {
    return config;
  }

  private static TruncationResult coerceInteger(IntegerSegment segment) {
    if (segment.value() instanceof BooleanValue bool) {
      return new TruncationResult(new IntegerSegment(IntegerValue.of(bool.value() ? 1 : 0)), false);
    }
    return new TruncationResult(segment, false);
  }

  private TruncationResult truncateString(StringSegment segment) {
    TruncationPart part = strings.truncateString(segment.value(), config.maxSizeBytes());
    if (!part.truncated()) {
      return new TruncationResult(segment, false);
    }
    return new TruncationResult(new StringSegment((StringValue) part.value()), true);
  }

  private TruncationResult enforceFinalSize(TruncationPart part) {
    if (part.size() <= config.maxSizeBytes()) {
      return new TruncationResult(Segments.of(part.value()), part.truncated());
    }
    return fallbackToString(part.value());
  }

  /**
   * Serializes an already-truncated value and shortens the JSON text to the byte budget.
   *
   * <p>Container truncation always fits a budget of at least 5 bytes, so {@link #truncate(Segment)} only lands
   * here if a container result overshoots.</p>
   *
   * @param truncated structured value that still exceeds the budget
   * @return string segment, always flagged as truncated
   */
  TruncationResult fallbackToString(Value truncated) {
    String json = writer.write(truncated);
    TruncationPart part = StringTruncator.shape(
        StringValue.of(json), config.stringLengthLimit(), config.maxSizeBytes());
    metrics.increment("truncate.fallback.string");
    log.warn(
        "Structured value of {} bytes exceeds {} bytes; stored as JSON string preview {}",
        JsonSizeEstimator.estimateString(json),
        config.maxSizeBytes(),
        Logs.truncate(((StringValue) part.value()).value(), PREVIEW_BYTES));
    return new TruncationResult(new StringSegment((StringValue) part.value()), true);
  }
}
