package lockerhub.jdbc.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates optional filter predicates and their parameters.
 */
final class SqlWhere {
  private final List<String> clauses = new ArrayList<>();
  private final List<Object> params = new ArrayList<>();

  /** Adds {@code column=?} unless {@code value} is null. */
  SqlWhere eq(String column, Object value) {
    if (value != null) {
      clauses.add(column + "=?");
      params.add(value);
    }
    return this;
  }

  /** Adds {@code predicate} with its parameters unless {@code value} is null. */
  SqlWhere when(Object value, String predicate, Object... predicateParams) {
    if (value != null) {
      clause(predicate, predicateParams);
    }
    return this;
  }

  SqlWhere clause(String predicate, Object... predicateParams) {
    clauses.add(predicate);
    params.addAll(List.of(predicateParams));
    return this;
  }

  String sql() {
    return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
  }

  Object[] params() {
    return params.toArray();
  }

  /** Parameters followed by {@code extra}, for trailing LIMIT/OFFSET placeholders. */
  Object[] params(Object... extra) {
    List<Object> all = new ArrayList<>(params);
    all.addAll(List.of(extra));
    return all.toArray();
  }
}
