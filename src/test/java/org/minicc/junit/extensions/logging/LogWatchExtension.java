package org.minicc.junit.extensions.logging;

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
 * Fails a test that logs WARN or ERROR events it did not declare with {@link AllowLog} or
 * {@link ExpectLog}, and a test whose {@link ExpectLog} events did not occur.
 * Declared events are kept out of the console output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = resolveRules(context);
        CapturingTurboFilter filter = new CapturingTurboFilter(rules);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        for (Event event : filter.events) {
            if (!rules.isDeclared(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        List<AnnotatedElement> elements = new ArrayList<>();
        context.getTestClass().ifPresent(elements::add);
        context.getTestMethod().ifPresent(elements::add);
        for (AnnotatedElement element : elements) {
            allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
        }
        return new Rules(List.copyOf(allows), List.copyOf(expects));
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName())
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.message()).matches();
    }

    private static Level toLogback(LogLevel level) {
        switch (level) {
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            default:
                return Level.ERROR;
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(List<AllowLog> allows, List<ExpectLog> expects) {
        boolean isDeclared(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also consults turbo filters for isXxxEnabled() calls, which carry no format.
            if (format == null || !level.isGreaterOrEqual(Level.WARN)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.isDeclared(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
