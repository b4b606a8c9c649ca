package com.github.rewrite.query.convert;

import lombok.Value;

import java.util.List;

/**
 * {@code from ... select ...}: a source clause, zero or more body clauses and a final projection.
 */
@Value
public class QueryExpression {

    List<QueryClause> clauses;

    public QueryExpression(List<QueryClause> clauses) {
        if (clauses.size() < 2 ||
                clauses.get(0).getKind() != QueryClauseKind.FROM ||
                clauses.get(clauses.size() - 1).getKind() != QueryClauseKind.SELECT) {
            throw new IllegalArgumentException("A query starts with from and ends with select: " + clauses);
        }
        this.clauses = List.copyOf(clauses);
    }

    public QueryClause getFromClause() {
        return clauses.get(0);
    }

    public List<QueryClause> getBodyClauses() {
        return clauses.subList(1, clauses.size() - 1);
    }

    public QueryClause getSelectClause() {
        return clauses.get(clauses.size() - 1);
    }
}
