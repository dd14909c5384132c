package com.di.etlcontrol.typemap;

import com.di.etlcontrol.exception.EtlConfigurationException;

/**
 * Thrown while building a {@link TypeRuleTable} from settings when the table is malformed:
 * missing or duplicate default rule, blank, anchored or unparsable pattern, unknown
 * serialization format, or a cast template without exactly one placeholder.
 */
public class TypeMapConfigurationException extends EtlConfigurationException {

    public TypeMapConfigurationException(String message) {
        super(message);
    }

    public TypeMapConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
