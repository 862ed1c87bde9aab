package io.intellixity.unipage.examples.domain;

public record Book(long id, String title, String author, Integer year) {}
