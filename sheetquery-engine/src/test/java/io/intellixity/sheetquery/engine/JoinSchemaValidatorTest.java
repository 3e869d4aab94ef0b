package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.source.ColumnSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JoinSchemaValidatorTest {
  private static final List<ColumnSchema> SALES = List.of(
      ColumnSchema.of("region", "string"),
      ColumnSchema.of("category", "String"),
      ColumnSchema.of("revenue", "number"));

  @Test
  void matchingTypesProduceNoWarnings() {
    List<ColumnSchema> budget = List.of(ColumnSchema.of("region", "STRING"), ColumnSchema.of("category", "string"));
    assertEquals(List.of(), JoinSchemaValidator.validate(SALES, budget, List.of("region", "category"), "sales", "budget"));
  }

  @Test
  void differingTypesWarnButDoNotFail() {
    List<ColumnSchema> budget = List.of(ColumnSchema.of("region", "number"));
    List<String> warnings = JoinSchemaValidator.validate(SALES, budget, List.of("region"), "sales", "budget");
    assertEquals(List.of(
        "Join column 'region' uses incompatible types between 'sales' (string) and 'budget' (number)."), warnings);
  }

  @Test
  void undeclaredTypeOnEitherSideIsNotAMismatch() {
    List<ColumnSchema> budget = List.of(ColumnSchema.of("region", null));
    assertTrue(JoinSchemaValidator.validate(SALES, budget, List.of("region"), "sales", "budget").isEmpty());
    List<ColumnSchema> blank = List.of(ColumnSchema.of("region", " "));
    assertTrue(JoinSchemaValidator.validate(SALES, blank, List.of("region"), "sales", "budget").isEmpty());
  }

  @Test
  void missingKeyFailsNamingTheSide() {
    List<ColumnSchema> budget = List.of(ColumnSchema.of("region", "string"));

    QueryValidationException onPrimary = assertThrows(QueryValidationException.class,
        () -> JoinSchemaValidator.validate(SALES, budget, List.of("year"), "sales", "budget"));
    assertEquals("join column 'year' missing on sheet alias 'sales'", onPrimary.getMessage());

    QueryValidationException onJoin = assertThrows(QueryValidationException.class,
        () -> JoinSchemaValidator.validate(SALES, budget, List.of("category"), "sales", "budget"));
    assertEquals("join column 'category' missing on sheet alias 'budget'", onJoin.getMessage());
  }

  @Test
  void emptyKeysFail() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> JoinSchemaValidator.validate(SALES, SALES, List.of(), "sales", "other"));
    assertTrue(ex.getMessage().contains("other"));
  }
}
