package me.christianrobert.mspgsync.core.job.model.table;

import java.util.ArrayList;
import java.util.List;

/**
 * A source index that is not backing a primary key or unique constraint.
 * Filtered indexes carry the T-SQL filter predicate.
 */
public class IndexMetadata {
  private final String indexName;
  private final boolean unique;
  private final List<String> columnNames = new ArrayList<>();
  private final List<Boolean> descending = new ArrayList<>();
  private final String filterDefinition;

  public IndexMetadata(String indexName, boolean unique, String filterDefinition) {
    this.indexName = indexName;
    this.unique = unique;
    this.filterDefinition = filterDefinition;
  }

  public void addColumn(String columnName, boolean isDescending) {
    columnNames.add(columnName);
    descending.add(isDescending);
  }

  public String getIndexName() { return indexName; }
  public boolean isUnique() { return unique; }
  public List<String> getColumnNames() { return columnNames; }
  public boolean isDescending(int position) { return descending.get(position); }
  public String getFilterDefinition() { return filterDefinition; }

  public boolean isFiltered() {
    return filterDefinition != null && !filterDefinition.isBlank();
  }

  @Override
  public String toString() {
    return "IndexMetadata{name='" + indexName + "', unique=" + unique + ", columns=" + columnNames
        + (isFiltered() ? ", filter='" + filterDefinition + "'" : "") + "}";
  }
}
