package com.github.rewrite.query.convert;

public enum QueryClauseKind {
    FROM("from"),
    WHERE("where"),
    LET("let"),
    SELECT("select");

    private final String keyword;

    QueryClauseKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
