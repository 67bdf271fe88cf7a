package io.relata.orm.query;

public enum SortOrder { ASC, DESC }
