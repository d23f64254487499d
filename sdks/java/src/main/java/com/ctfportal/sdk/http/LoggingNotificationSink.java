package com.ctfportal.sdk.http;

import com.ctfportal.sdk.errors.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: writes user-facing failures to the log.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(ErrorKind kind, String message) {
        logger.warn("[{}] {}", kind, message);
    }
}
