package io.intellixity.sqlforge.jdbc;

public record UpdateResult(long numUpdatedRows) {}
