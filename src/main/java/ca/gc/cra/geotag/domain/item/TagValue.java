package ca.gc.cra.geotag.domain.item;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed set of value shapes a metadata tag may hold.
 * <p><strong>Why:</strong> Tags are opaque strings, so stages switch on the variant instead of guessing types.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface TagValue
    permits TagValue.Text, TagValue.Integer, TagValue.RationalList, TagValue.Timestamp {

  static TagValue text(String value) {
    return new Text(value);
  }

  static TagValue integer(long value) {
    return new Integer(value);
  }

  static TagValue rationals(List<Rational> values) {
    return new RationalList(values);
  }

  static TagValue timestamp(LocalDateTime value) {
    return new Timestamp(value);
  }

  /**
   * Free text.
   *
   * @param value text; never {@code null}
   */
  record Text(String value) implements TagValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Whole number.
   *
   * @param value value
   */
  record Integer(long value) implements TagValue {}

  /**
   * Ordered rational components, e.g. degrees/minutes/seconds.
   *
   * @param values components; copied
   */
  record RationalList(List<Rational> values) implements TagValue {
    public RationalList {
      values = List.copyOf(Objects.requireNonNull(values, "values"));
    }
  }

  /**
   * Camera-local date and time without zone, as cameras record it.
   *
   * @param value local date-time; never {@code null}
   */
  record Timestamp(LocalDateTime value) implements TagValue {
    public Timestamp {
      Objects.requireNonNull(value, "value");
    }
  }
}
