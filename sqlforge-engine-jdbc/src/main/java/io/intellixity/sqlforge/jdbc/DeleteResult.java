package io.intellixity.sqlforge.jdbc;

public record DeleteResult(long numDeletedRows) {}
