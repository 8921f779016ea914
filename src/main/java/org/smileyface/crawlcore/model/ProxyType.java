package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProxyType {
    RESIDENTIAL,
    DATACENTER,
    MOBILE;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProxyType fromDb(String value) {
        return ProxyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
