package io.github.graydavid.bayra.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.graydavid.bayra.nodes.Deterministic;
import io.github.graydavid.bayra.nodes.Potential;
import io.github.graydavid.bayra.nodes.Stochastic;

public class ClosuresTest {

    @Test
    public void extendParentsKeepsStochasticsAsIs() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Stochastic<Double> b = TestData.flatStochastic("b", 2.0);

        assertThat(Closures.extendParents(List.of(a, b)), equalTo(Set.of(a, b)));
    }

    @Test
    public void extendParentsLooksThroughChainsOfDeterministics() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Stochastic<Double> b = TestData.flatStochastic("b", 2.0);
        Deterministic<Double> sum = TestData.sumDeterministic("sum", a, b);
        Deterministic<Double> doubled = TestData.sumDeterministic("doubled", sum, sum);

        assertThat(Closures.extendParents(List.of(doubled)), containsInAnyOrder(a, b));
    }

    @Test
    public void extendParentsIgnoresConstantsAndLooksInsideContainers() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Stochastic<Double> b = TestData.flatStochastic("b", 2.0);
        Deterministic<Double> fromB = TestData.sumDeterministic("from-b", b);

        Set<Node> extended = Closures.extendParents(List.of(5.0, "constant", Container.of(a, Container.of(fromB))));

        assertThat(extended, containsInAnyOrder(a, b));
    }

    @Test
    public void extendParentsIgnoresPotentials() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Potential potential = Potential.builder(Role.of("potential")).parent("a", a).build(arguments -> 0.0);

        assertThat(Closures.extendParents(List.of(potential)), empty());
    }

    @Test
    public void extendChildrenLooksThroughChainsOfDeterministics() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Deterministic<Double> sum = TestData.sumDeterministic("sum", a);
        Deterministic<Double> doubled = TestData.sumDeterministic("doubled", sum, sum);
        Stochastic<Double> direct = TestData.normalStochastic("direct", 0.0, a);
        Stochastic<Double> throughOne = TestData.normalStochastic("through-one", 0.0, sum);
        Stochastic<Double> throughTwo = TestData.normalStochastic("through-two", 0.0, doubled);
        Potential potential = Potential.builder(Role.of("potential")).parent("doubled", doubled).build(arguments -> 0.0);

        Set<Node> extended = Closures.extendChildren(a.getChildren());

        assertThat(extended, containsInAnyOrder(direct, throughOne, throughTwo, potential));
    }

    @Test
    public void extendChildrenOfDeterministicWithoutChildrenIsEmpty() {
        Stochastic<Double> a = TestData.flatStochastic("a", 1.0);
        Deterministic<Double> sum = TestData.sumDeterministic("sum", a);

        assertThat(Closures.extendChildren(Set.of(sum)), empty());
    }
}
