package io.intellixity.sqlforge.jdbc;

/** {@code insertId} is null when the dialect or driver does not report one. */
public record InsertResult(Long insertId, long numInsertedRows) {}
