package com.di.etlcontrol.typemap;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Primitive wire types used when staging a column's values in the intermediate (Avro) files.
 * The wire name is the Avro primitive name as it appears in the settings file.
 */
public enum SerializationFormat {

    INT("int"),
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double"),
    BOOLEAN("boolean"),
    STRING("string"),
    BYTES("bytes");

    private final String wireName;

    SerializationFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Looks up a format by its wire name, ignoring case and surrounding blanks. */
    public static Optional<SerializationFormat> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (SerializationFormat format : values()) {
            if (format.wireName.equals(key)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
