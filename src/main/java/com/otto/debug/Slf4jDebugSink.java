package com.otto.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Routes debug hub output to SLF4J, one logger per tag ("otto.&lt;tag&gt;"). */
public final class Slf4jDebugSink implements DebugSink {

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger log = loggers.computeIfAbsent(tag == null ? "otto" : "otto." + tag, LoggerFactory::getLogger);
        switch (level) {
            case TRACE:
                log.trace(message, error);
                break;
            case DEBUG:
                log.debug(message, error);
                break;
            case INFO:
                log.info(message, error);
                break;
            case WARN:
                log.warn(message, error);
                break;
            case ERROR:
            default:
                log.error(message, error);
                break;
        }
    }
}
