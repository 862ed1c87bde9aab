package io.intellixity.unipage.examples.domain;

/** Dynamic table listing; both values are validated as identifiers before they shape SQL. */
public record TableQuery(String table, String orderBy) {}
