package io.intellixity.sheetquery.value;

import java.util.Objects;

/**
 * A single sheet cell (or filter operand): text, number or null.\n
 *
 * Equality is raw: {@code Text("1")} never equals {@code Numeric(1.0)}. Use {@link Values#toNumber(Value)}
 * for numeric comparisons and {@link Values#display(Value)} for output.
 */
public interface Value {
  Null NULL = new Null();

  static Value text(String s) {
    return s == null ? NULL : new Text(s);
  }

  static Value number(double d) {
    return new Numeric(d);
  }

  default boolean isNull() {
    return this instanceof Null;
  }

  record Text(String value) implements Value {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() { return value; }
  }

  record Numeric(double value) implements Value {
    // 0.0 and -0.0 compare equal, matching the == used by numeric filters.
    @Override
    public boolean equals(Object o) {
      return o instanceof Numeric n && n.value == value;
    }

    @Override
    public int hashCode() {
      return value == 0.0 ? 0 : Double.hashCode(value);
    }

    @Override
    public String toString() { return Values.display(this); }
  }

  record Null() implements Value {
    @Override
    public String toString() { return ""; }
  }
}
