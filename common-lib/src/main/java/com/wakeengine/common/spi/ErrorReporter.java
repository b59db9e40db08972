package com.wakeengine.common.spi;

import java.util.Map;

/**
 * Sink for errors absorbed inside the adaptation loop.
 */
public interface ErrorReporter {
    void report(Throwable error, Map<String, String> context);
}
