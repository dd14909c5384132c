package com.di.etlcontrol.typemap;

/**
 * Whether a source column type can be used in the warehouse unchanged or needs a cast.
 */
public enum TypeCategory {
    /** Value is passed through; only a serialization format is needed. */
    AS_IS,
    /** Value must be converted by a SQL expression built from a cast template. */
    CAST_NEEDED
}
