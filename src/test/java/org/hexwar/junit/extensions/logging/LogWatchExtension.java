package org.hexwar.junit.extensions.logging;

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
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} event did not occur often enough.
 * Annotations on the test class apply to every method.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (!rules.covers(event)) {
                problems.add("Unexpected log: [" + event.level + "] " + event.loggerName + " - " + event.message);
            }
        }
        for (Rule expected : rules.expects) {
            long count = filter.events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expected.occurrences, expected.level, expected.loggerPattern, expected.messagePattern, count));
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
        List<AnnotatedElement> sources = new ArrayList<>();
        context.getTestClass().ifPresent(sources::add);
        context.getTestMethod().ifPresent(sources::add);

        List<Rule> allows = new ArrayList<>();
        List<Rule> expects = new ArrayList<>();
        for (AnnotatedElement source : sources) {
            for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                allows.add(new Rule(allow.level().toLogback(), allow.loggerPattern(), allow.messagePattern(), 0));
            }
            for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                expects.add(new Rule(expect.level().toLogback(), expect.loggerPattern(), expect.messagePattern(),
                        expect.occurrences()));
            }
        }
        return new Rules(allows, expects);
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
    }

    private record Rule(Level level, String loggerPattern, String messagePattern, int occurrences) {
        boolean matches(CapturedEvent event) {
            return event.level.isGreaterOrEqual(level)
                    && Pattern.matches(loggerPattern, event.loggerName)
                    && Pattern.matches(messagePattern, event.message);
        }
    }

    private record Rules(List<Rule> allows, List<Rule> expects) {
        boolean covers(CapturedEvent event) {
            return allows.stream().anyMatch(rule -> rule.matches(event))
                    || expects.stream().anyMatch(rule -> rule.matches(event));
        }
    }

    /**
     * Records WARN and ERROR events, and every event an {@link ExpectLog} asks for. Covered
     * events are suppressed from the regular appenders.
     */
    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            boolean watched = level.isGreaterOrEqual(Level.WARN);
            boolean covered = rules.covers(event);
            if (watched || covered) {
                events.add(event);
            }
            return watched && covered ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
