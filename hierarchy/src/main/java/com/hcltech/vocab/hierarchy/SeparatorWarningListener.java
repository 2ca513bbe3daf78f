package com.hcltech.vocab.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives non-fatal parse warnings. Parsing always continues after a callback. */
@FunctionalInterface
public interface SeparatorWarningListener {

    /** Logs each warning at warn level. */
    SeparatorWarningListener LOGGING = new SeparatorWarningListener() {
        private final Logger log = LoggerFactory.getLogger(IndentParser.class);

        @Override
        public void onWarning(SeparatorAmbiguityWarning warning) {
            log.warn(warning.message());
        }
    };

    void onWarning(SeparatorAmbiguityWarning warning);
}
