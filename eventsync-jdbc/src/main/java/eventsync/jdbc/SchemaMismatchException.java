package eventsync.jdbc;

import java.util.List;

/**
 * Thrown at startup when a sync table is missing or lacks required columns.
 */
public class SchemaMismatchException extends RuntimeException {
  private final String table;
  private final List<String> missingColumns;

  public SchemaMismatchException(String table, List<String> missingColumns) {
    super(missingColumns.isEmpty()
        ? "Table '" + table + "' does not exist"
        : "Table '" + table + "' is missing columns " + missingColumns);
    this.table = table;
    this.missingColumns = List.copyOf(missingColumns);
  }

  public String table() {
    return table;
  }

  /**
   * Missing column names, lower case; empty when the whole table is missing.
   */
  public List<String> missingColumns() {
    return missingColumns;
  }
}
