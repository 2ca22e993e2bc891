package io.ratelimits.grpc.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.Assert;
import org.junit.rules.ExternalResource;
import org.slf4j.LoggerFactory;
import org.slf4j.event.KeyValuePair;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Collects the events logged by one class's logger for the duration of a test.
 */
public class LogCaptureRule extends ExternalResource {
    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            // Snapshot the MDC and message on the logging thread
            event.prepareForDeferredProcessing();
            synchronized (this) {
                super.append(event);
            }
        }
    };

    public LogCaptureRule(Class<?> loggerClass) {
        this.logger = (Logger) LoggerFactory.getLogger(loggerClass);
    }

    @Override
    protected void before() {
        appender.start();
        logger.addAppender(appender);
    }

    @Override
    protected void after() {
        logger.detachAppender(appender);
        appender.stop();
    }

    public List<ILoggingEvent> events(String message) {
        synchronized (appender) {
            return appender.list.stream()
                    .filter(event -> message.equals(event.getMessage()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Events may be logged after the client has seen the response, so poll for a while.
     */
    public List<ILoggingEvent> awaitEvents(String message, int count) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (events(message).size() < count && System.nanoTime() < deadline) {
            try {
                TimeUnit.MILLISECONDS.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        List<ILoggingEvent> events = events(message);
        Assert.assertEquals("events for '" + message + "'", count, events.size());
        return events;
    }

    public ILoggingEvent awaitEvent(String message) {
        return awaitEvents(message, 1).get(0);
    }

    public static Object value(ILoggingEvent event, String key) {
        List<KeyValuePair> pairs = event.getKeyValuePairs() != null ? event.getKeyValuePairs() : new ArrayList<>();
        for (KeyValuePair pair : pairs) {
            if (key.equals(pair.key)) {
                return pair.value;
            }
        }
        return null;
    }

    public static void assertLevel(Level expected, ILoggingEvent event) {
        Assert.assertEquals(expected, event.getLevel());
    }
}
