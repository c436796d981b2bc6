package org.neurosync.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is announced with
 * {@link AllowLog} or {@link ExpectLog}, and fails it if an {@link ExpectLog} event did not
 * occur often enough. Events from any thread are captured, including HTTP client threads.
 * <p>
 * Announced events are kept out of the console output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String CAPTURE = "capture";

    @Override
    public void beforeAll(ExtensionContext context) {
        Capture capture = new Capture(rulesFor(context));
        capture.start();
        loggerContext().addTurboFilter(capture);
        context.getStore(NAMESPACE).put(CAPTURE, capture);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        Capture capture = context.getStore(NAMESPACE).get(CAPTURE, Capture.class);
        if (capture != null) {
            capture.clear();
            capture.rules = rulesFor(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        Capture capture = context.getStore(NAMESPACE).get(CAPTURE, Capture.class);
        if (capture == null) {
            return;
        }
        Rules rules = capture.rules;
        List<Event> events = capture.events();
        capture.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (Event event : events) {
                if (event.level().isGreaterOrEqual(rules.failLevel()) && !rules.announces(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expected : rules.expects()) {
            long count = events.stream().filter(event -> matches(event, expected.level(),
                expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        Capture capture = context.getStore(NAMESPACE).remove(CAPTURE, Capture.class);
        if (capture != null) {
            loggerContext().getTurboFilterList().remove(capture);
            capture.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules rulesFor(ExtensionContext context) {
        Optional<AnnotatedElement> element = context.getElement();
        Optional<Class<?>> testClass = context.getTestClass();
        FailOnLog failOnLog = element.map(e -> e.getAnnotation(FailOnLog.class))
            .or(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)))
            .orElse(null);

        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        testClass.ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        // For class-level contexts the element is the class itself.
        if (element.isPresent() && !element.equals(testClass.map(c -> (AnnotatedElement) c))) {
            allows.addAll(List.of(element.get().getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.get().getAnnotationsByType(ExpectLog.class)));
        }

        LogLevel level = failOnLog != null ? failOnLog.level() : LogLevel.WARN;
        boolean disabled = failOnLog != null && failOnLog.disabled();
        return new Rules(toLogback(level), disabled, List.copyOf(allows), List.copyOf(expects));
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.logger())
            && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Rules(Level failLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        Level captureLevel() {
            Level lowest = failLevel;
            for (AllowLog allow : allows) {
                lowest = lowerOf(lowest, toLogback(allow.level()));
            }
            for (ExpectLog expect : expects) {
                lowest = lowerOf(lowest, toLogback(expect.level()));
            }
            return lowest;
        }

        boolean announces(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }

        private static Level lowerOf(Level a, Level b) {
            return a.isGreaterOrEqual(b) ? b : a;
        }
    }

    /**
     * Records events at or above the capture level and suppresses announced ones.
     */
    private static final class Capture extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        private Capture(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(current.captureLevel())) {
                return FilterReply.NEUTRAL;
            }
            if (!level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.announces(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}
