package dev.ragbench.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ragbench.gate.GateProperties;
import dev.ragbench.gate.PhaseDefinition;
import dev.ragbench.improvement.BacklogProperties;
import dev.ragbench.matching.MatchingProperties;
import dev.ragbench.pipeline.PipelineProperties;
import dev.ragbench.run.RunProperties;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.io.ClassPathResource;

/** Binds the shipped {@code application.yml} the way the application does at startup. */
class ApplicationConfigurationTest {

  private Binder binder;

  @BeforeEach
  void setUp() throws IOException {
    MutablePropertySources sources = new MutablePropertySources();
    new YamlPropertySourceLoader()
        .load("application", new ClassPathResource("application.yml"))
        .forEach(sources::addLast);
    binder =
        new Binder(
            ConfigurationPropertySources.from(sources),
            new PropertySourcesPlaceholdersResolver(sources));
  }

  @Test
  void pipelinesCarryTheirTargets() {
    PipelineProperties pipelines =
        binder.bind("ragbench.pipeline", PipelineProperties.class).get();

    assertThat(pipelines.endpoints())
        .containsOnlyKeys("standard", "graph", "quantitative", "orchestrator");
    assertThat(pipelines.endpoint("graph").url())
        .isEqualTo("http://localhost:5678/webhook/rag-graph");
    assertThat(pipelines.targets().get("orchestrator").p95LatencyMaxMs()).isEqualTo(15_000L);
    assertThat(pipelines.retry().maxAttempts()).isEqualTo(5);
  }

  @Test
  void everyPhaseBindsAndChainsToItsPredecessor() {
    GateProperties gate = binder.bind("ragbench.gate", GateProperties.class).get();

    assertThat(gate.phases()).containsOnlyKeys(1, 2, 3, 4, 5);
    PhaseDefinition baseline = gate.phases().get(1);
    assertThat(baseline.requiresPhase()).isNull();
    assertThat(baseline.pipelineTargets()).containsEntry("graph", 70.0);
    assertThat(baseline.stableIterations()).isEqualTo(3);
    assertThat(gate.phases().get(3).overallErrorRateMaxPct()).isEqualTo(10.0);
    assertThat(gate.phases().get(5).requiresPhase()).isEqualTo(4);
  }

  @Test
  void runMatchingAndBacklogSettingsBind() {
    RunProperties run = binder.bind("ragbench.run", RunProperties.class).get();
    MatchingProperties matching =
        binder.bind("ragbench.matching", MatchingProperties.class).get();
    BacklogProperties backlog = binder.bind("ragbench.backlog", BacklogProperties.class).get();

    assertThat(run.datasets()).hasSize(2);
    assertThat(run.collapse().maxErrorRatePct()).isEqualTo(80.0);
    assertThat(run.stages())
        .extracting(RunProperties.Stage::questions)
        .containsExactly(5, 10, 50);
    assertThat(run.stages().get(2).minAccuracyPct()).isNull();
    assertThat(matching).isEqualTo(MatchingProperties.defaults());
    assertThat(backlog.applierCommand()).isEmpty();
    assertThat(backlog.regressionTolerancePp()).isEqualTo(1.0);
  }
}
