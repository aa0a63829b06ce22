package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.schema.Field;
import org.dxworks.adaframe.schema.NodeKind;
import org.dxworks.adaframe.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide, one-time setup. Runs lazily on the first context creation;
 * calling it again, from any thread, has no effect.
 */
public final class Adaframe {

    private static final Logger LOG = LoggerFactory.getLogger(Adaframe.class);

    private static volatile boolean initialized;

    private Adaframe() {
        // utility class
    }

    public static void initialize() {
        if (initialized) {
            return;
        }
        synchronized (Adaframe.class) {
            if (initialized) {
                return;
            }
            Schema.validate();
            LOG.debug("Node schema loaded: {} kinds, {} fields", NodeKind.values().length, Field.values().length);
            initialized = true;
        }
    }

    public static boolean isInitialized() {
        return initialized;
    }
}
