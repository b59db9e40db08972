package com.wakeengine.service.client;

import com.wakeengine.common.spi.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ErrorReporter} that writes absorbed adaptation errors to the application log.
 */
@Component
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(Throwable error, Map<String, String> context) {
        log.error("ADAPTATION_ERROR context={} errorType={} message={}",
                  new TreeMap<>(context), error.getClass().getSimpleName(), error.getMessage(), error);
    }
}
