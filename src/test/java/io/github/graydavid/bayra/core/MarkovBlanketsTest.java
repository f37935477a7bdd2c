package io.github.graydavid.bayra.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.graydavid.bayra.nodes.Deterministic;
import io.github.graydavid.bayra.nodes.Potential;
import io.github.graydavid.bayra.nodes.Stochastic;

public class MarkovBlanketsTest {
    private Stochastic<Double> mu;
    private Stochastic<Double> tau;
    private Stochastic<Double> z;
    private Stochastic<Double> x;
    private Deterministic<Double> shifted;
    private Stochastic<Double> y;
    private Potential potential;

    @BeforeEach
    public void setUp() {
        mu = TestData.flatStochastic("mu", 0.0);
        tau = TestData.flatStochastic("tau", 1.0);
        z = TestData.flatStochastic("z", 2.0);
        x = Stochastic.<Double>builder(Role.of("x"))
                .parent("mu", mu)
                .parent("tau", tau)
                .value(0.5)
                .build(arguments -> TestData.normalLogp(arguments.getDouble("value"), arguments.getDouble("mu")));
        shifted = TestData.sumDeterministic("shifted", mu, z);
        y = TestData.normalStochastic("y", 1.0, shifted);
        potential = Potential.builder(Role.of("potential")).parent("x", x).build(arguments -> -1.0);
    }

    @Test
    public void coparentsIncludesParentsOfExtendedChildrenAndNodeItself() {
        assertThat(MarkovBlankets.coparents(mu), containsInAnyOrder(mu, tau, z));
        assertThat(MarkovBlankets.coparents(x), containsInAnyOrder(x));
        assertThat(MarkovBlankets.coparents(y), containsInAnyOrder(y));
    }

    @Test
    public void moralNeighborsIncludesCoparentsAndExtendedRelationsButNoPotentials() {
        assertThat(MarkovBlankets.moralNeighbors(mu), containsInAnyOrder(mu, tau, z, x, y));
        assertThat(MarkovBlankets.moralNeighbors(x), containsInAnyOrder(x, mu, tau));
        assertThat(MarkovBlankets.moralNeighbors(x), not(hasItem(potential)));
        assertThat(MarkovBlankets.moralNeighbors(y), containsInAnyOrder(y, mu, z));
    }

    @Test
    public void moralNeighborsIsSymmetric() {
        for (Stochastic<Double> node : List.of(mu, tau, z, x, y)) {
            for (Node neighbor : MarkovBlankets.moralNeighbors(node)) {
                assertThat(node + " <-> " + neighbor, MarkovBlankets.moralNeighbors(neighbor), hasItem(node));
            }
        }
    }

    @Test
    public void markovBlanketIsMoralNeighborsPlusNodeItself() {
        assertThat(MarkovBlankets.markovBlanket(tau), containsInAnyOrder(tau, mu, x));
    }

    @Test
    public void neighborhoodsFollowRebinding() {
        y.getParents().rebind("mu", tau);

        assertThat(MarkovBlankets.moralNeighbors(mu), containsInAnyOrder(mu, tau, x));
        assertThat(MarkovBlankets.moralNeighbors(tau), containsInAnyOrder(tau, mu, x, y));
        assertThat(MarkovBlankets.moralNeighbors(z), containsInAnyOrder(z));
    }

    @Test
    public void stochasticsExposeTheSameNeighborhoods() {
        assertThat(mu.getCoparents(), containsInAnyOrder(mu, tau, z));
        assertThat(mu.getMoralNeighbors(), containsInAnyOrder(mu, tau, z, x, y));
        assertThat(mu.getMarkovBlanket(), containsInAnyOrder(mu, tau, z, x, y));
    }
}
