package org.gathermine.junit.extensions.logging;

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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test on WARN and ERROR log events it did not declare.
 * <p>
 * Events matching {@link AllowLog} are tolerated, events matching {@link ExpectLog} are required.
 * Both are swallowed so they do not clutter the build output. Annotations on the class apply to
 * every test method in addition to the method's own.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = resolveRules(context);
            // A test may have reset the logger context, which drops turbo filters.
            if (!loggerContext().getTurboFilterList().contains(filter)) {
                loggerContext().addTurboFilter(filter);
            }
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (Rule expected : rules.expects) {
            long found = events.stream().filter(expected::matches).count();
            if (found < expected.occurrences) {
                problems.add(String.format("Missing expected log: %d x %s, found %d", expected.occurrences, expected, found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

        List<Rule> allows = new ArrayList<>();
        List<Rule> expects = new ArrayList<>();
        List<AnnotatedElement> elements = new ArrayList<>();
        context.getTestClass().ifPresent(elements::add);
        context.getTestMethod().ifPresent(elements::add);
        for (AnnotatedElement element : elements) {
            for (AllowLog allow : element.getAnnotationsByType(AllowLog.class)) {
                allows.add(new Rule(allow.level(), allow.loggerPattern(), allow.messagePattern(), 0));
            }
            for (ExpectLog expect : element.getAnnotationsByType(ExpectLog.class)) {
                expects.add(new Rule(expect.level(), expect.loggerPattern(), expect.messagePattern(), expect.occurrences()));
            }
        }

        Level minLevel = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also asks with a null format to check isXxxEnabled(); only real events count
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return event.level.isGreaterOrEqual(Level.WARN) && rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allows;
        final List<Rule> expects;

        Rules(Level minLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean permits(CapturedEvent event) {
            return allows.stream().anyMatch(rule -> rule.matches(event))
                    || expects.stream().anyMatch(rule -> rule.matches(event));
        }
    }

    private static final class Rule {
        final Level level;
        final Pattern logger;
        final Pattern message;
        final int occurrences;

        Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
            this.level = toLogback(level);
            this.logger = Pattern.compile(loggerPattern);
            this.message = Pattern.compile(messagePattern, Pattern.DOTALL);
            this.occurrences = occurrences;
        }

        boolean matches(CapturedEvent event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, logger.pattern(), message.pattern());
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
