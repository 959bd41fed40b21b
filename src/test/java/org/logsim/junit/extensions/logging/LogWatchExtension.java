package org.logsim.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by an
 * {@link AllowLog} or {@link ExpectLog} on the test method or class, and fails a test
 * whose {@link ExpectLog} events did not occur. Covered events are kept off the console.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = resolveRules(context);
        CapturingFilter filter = new CapturingFilter(rules);
        filter.start();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        ((LoggerContext) LoggerFactory.getILoggerFactory()).getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (Event event : filter.events) {
            if (!filter.rules.covers(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (Rule expected : filter.rules.expected) {
            long count = filter.events.stream().filter(expected::matches).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<Rule> allowed = new ArrayList<>();
        List<Rule> expected = new ArrayList<>();
        List<AnnotatedElement> elements = new ArrayList<>();
        context.getTestClass().ifPresent(elements::add);
        context.getTestMethod().ifPresent(elements::add);
        for (AnnotatedElement element : elements) {
            for (AllowLog allow : element.getAnnotationsByType(AllowLog.class)) {
                allowed.add(new Rule(allow.level(), allow.loggerPattern(), allow.messagePattern(), 0));
            }
            for (ExpectLog expect : element.getAnnotationsByType(ExpectLog.class)) {
                expected.add(new Rule(expect.level(), expect.loggerPattern(), expect.messagePattern(), expect.occurrences()));
            }
        }
        return new Rules(allowed, expected);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
        boolean matches(Event event) {
            return event.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, event.loggerName())
                    && Pattern.matches(messagePattern, event.message());
        }
    }

    private record Rules(List<Rule> allowed, List<Rule> expected) {
        boolean covers(Event event) {
            return allowed.stream().anyMatch(r -> r.matches(event)) || expected.stream().anyMatch(r -> r.matches(event));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // format is null when the logger is only asked whether a level is enabled
            if (level == null || format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            boolean covered = rules.covers(event);
            if (covered || level.isGreaterOrEqual(Level.WARN)) {
                events.add(event);
            }
            return covered ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
