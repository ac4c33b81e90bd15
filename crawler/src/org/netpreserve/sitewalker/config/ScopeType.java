package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ScopeType {
    PREFIX, PAGE, HOST, DOMAIN;

    @JsonCreator
    public static ScopeType fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
