package io.intellixity.sheetquery.value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * The one place where cell values are lifted, coerced to numbers and rendered as text.\n
 *
 * Filters, aggregates and projected cells all go through these functions.
 */
public final class Values {
  private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
  private static final int DISPLAY_SCALE = 6;

  private Values() {}

  /** Lifts a loader or JSON value. Booleans and other objects become their text form. */
  public static Value of(Object raw) {
    if (raw == null) return Value.NULL;
    if (raw instanceof Value v) return v;
    if (raw instanceof Number n) return Value.number(n.doubleValue());
    if (raw instanceof CharSequence cs) return Value.text(cs.toString());
    return Value.text(String.valueOf(raw));
  }

  /** Numbers pass through; text that reads as a decimal literal is parsed; anything else is empty. */
  public static OptionalDouble toNumber(Value v) {
    if (v instanceof Value.Numeric n) return OptionalDouble.of(n.value());
    if (v instanceof Value.Text t) {
      String s = t.value().trim();
      if (!DECIMAL.matcher(s).matches()) return OptionalDouble.empty();
      return OptionalDouble.of(Double.parseDouble(s));
    }
    return OptionalDouble.empty();
  }

  /**
   * Locale-independent cell text.\n
   *
   * Integral numbers print without a decimal point; other numbers print with at most six decimals,
   * rounded half-even on the exact binary value, with trailing zeros and point removed.
   */
  public static String display(Value v) {
    if (v == null || v instanceof Value.Null) return "";
    if (v instanceof Value.Numeric n) return formatNumber(n.value());
    return v.toString();
  }

  static String formatNumber(double d) {
    if (Double.isNaN(d)) return "nan";
    if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
    BigDecimal exact = new BigDecimal(d);
    if (d == Math.rint(d)) return exact.toBigInteger().toString();

    BigDecimal rounded = exact.setScale(DISPLAY_SCALE, RoundingMode.HALF_EVEN);
    String s = rounded.toPlainString();
    if (s.indexOf('.') >= 0) {
      int end = s.length();
      while (s.charAt(end - 1) == '0') end--;
      if (s.charAt(end - 1) == '.') end--;
      s = s.substring(0, end);
    }
    // BigDecimal drops the sign of a zero result; a tiny negative still renders as "-0".
    if (d < 0 && rounded.signum() == 0) return "-0";
    return s;
  }
}
