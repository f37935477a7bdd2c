package io.github.graydavid.bayra.nodes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import io.github.graydavid.bayra.core.Node;
import io.github.graydavid.bayra.core.NumericValidityException;
import io.github.graydavid.bayra.core.Role;
import io.github.graydavid.bayra.core.TestData;
import io.github.graydavid.bayra.core.ZeroProbabilityException;

public class PotentialTest {

    private static Potential positiveConstraint(Object x) {
        return Potential.builder(Role.of("x-positive"))
                .parent("x", x)
                .build(arguments -> arguments.getDouble("x") > 0 ? 0.0 : Math.log(0));
    }

    @Test
    public void getLogpAppliesLogpFunctionToParentValues() {
        Stochastic<Double> x = TestData.flatStochastic("x", 2.0);

        Potential potential = Potential.builder(Role.of("potential"))
                .parent("x", x)
                .parent("scale", 3.0)
                .build(arguments -> -arguments.getDouble("x") * arguments.getDouble("scale"));

        assertThat(potential.getLogp(), is(-6.0));
        assertThat(potential.getKind(), is(Node.Kind.POTENTIAL));

        x.setValue(1.0);

        assertThat(potential.getLogp(), is(-3.0));
    }

    @Test
    public void getLogpLogsAccessAtTraceLevel() {
        Stochastic<Double> x = TestData.flatStochastic("x", 2.0);
        Potential potential = positiveConstraint(x);
        Logger logger = (Logger) LoggerFactory.getLogger(Potential.class);
        Level oldLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.TRACE);
        try {
            potential.getLogp();
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(oldLevel);
        }

        List<String> messages = appender.list.stream()
                .filter(event -> event.getLevel() == Level.TRACE)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
        assertThat(messages, contains(potential + ": logp accessed", potential + ": returning logp 0.0"));
    }

    @Test
    public void buildThrowsZeroProbabilityExceptionForForbiddenInitialParentValuesAndLeavesNoTraceInGraph() {
        Stochastic<Double> x = TestData.flatStochastic("x", -1.0);

        assertThrows(ZeroProbabilityException.class, () -> positiveConstraint(x));

        assertThat(x.getChildren(), empty());
        assertThat(x.getExtendedChildren(), empty());
    }

    @Test
    public void getLogpThrowsZeroProbabilityExceptionDescribingParentValuesWithoutCrashing() {
        Stochastic<Double> x = TestData.flatStochastic("x", 1.0);
        Potential potential = positiveConstraint(x);

        x.setValue(-1.0);
        ZeroProbabilityException exception = assertThrows(ZeroProbabilityException.class, potential::getLogp);

        assertThat(exception.getRole(), is(Role.of("x-positive")));
        assertThat(exception.getValue().isPresent(), is(false));
        assertThat(exception.getParentValues().getDouble("x"), is(-1.0));
        assertThat(exception.getMessage(), containsString("'x-positive'"));

        x.revert();

        assertThat(potential.getLogp(), is(0.0));
    }

    @Test
    public void getLogpThrowsNumericValidityExceptionForNaN() {
        Stochastic<Double> x = TestData.flatStochastic("x", 1.0);
        Potential potential = Potential.builder(Role.of("sqrt"))
                .parent("x", x)
                .build(arguments -> Math.sqrt(arguments.getDouble("x")));

        x.setValue(-1.0);

        assertThrows(NumericValidityException.class, potential::getLogp);
    }

    @Test
    public void potentialsAreExtendedChildrenOfTheStochasticsBehindTheirParents() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Stochastic<Double> b = TestData.flatStochastic("b", 2.0);
        Deterministic<Double> sum = TestData.sumDeterministic("sum", a, b);

        Potential potential = positiveConstraint(sum);

        assertThat(potential.getExtendedParents(), equalTo(Set.of(a, b)));
        assertThat(a.getExtendedChildren(), contains(potential));
        assertThat(b.getExtendedChildren(), contains(potential));
        assertThat(sum.getChildren(), contains(potential));
    }

    @Test
    public void getLogpIsComputedOnlyWhenExtendedParentsChange() {
        Stochastic<Double> x = TestData.flatStochastic("x", 1.0);
        AtomicInteger computations = new AtomicInteger();
        Potential potential = Potential.builder(Role.of("counting"))
                .parent("x", x)
                .build(arguments -> {
                    computations.incrementAndGet();
                    return -arguments.getDouble("x");
                });

        potential.getLogp();
        potential.getLogp();
        assertThat(computations.get(), is(1));

        x.setValue(3.0);
        assertThat(potential.getLogp(), is(-3.0));
        assertThat(computations.get(), is(2));
    }

    @Test
    public void potentialsCantBeParents() {
        Stochastic<Double> x = TestData.flatStochastic("x", 1.0);
        Potential potential = positiveConstraint(x);

        assertThrows(IllegalArgumentException.class,
                () -> Stochastic.<Double>builder(Role.of("child")).parent("potential", potential));
    }
}
