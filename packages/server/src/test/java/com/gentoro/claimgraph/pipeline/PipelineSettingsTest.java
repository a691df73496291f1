package com.gentoro.claimgraph.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.ConfigurationProvider;
import com.gentoro.claimgraph.exception.ConfigException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class PipelineSettingsTest {

  @Test
  void emptyConfigurationYieldsDefaults() {
    assertEquals(PipelineSettings.DEFAULTS, PipelineSettings.from(new BaseConfiguration()));
  }

  @Test
  void readsOverridesAndKeepsDefaultsForTheRest() {
    PipelineSettings settings =
        PipelineSettings.from(new ConfigurationProvider("classpath:config/tuned.yaml").config());

    assertEquals(2, settings.verifyConcurrency());
    assertEquals(0.5, settings.marketRelevance());
    assertEquals(3, settings.derivativeSets());
    assertEquals(PipelineSettings.DEFAULTS.attachConcurrency(), settings.attachConcurrency());
    assertEquals(PipelineSettings.DEFAULTS.marketLimit(), settings.marketLimit());
  }

  @Test
  void rejectsNonPositiveConcurrency() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("graph.attach.concurrency", 0);

    ConfigException e = assertThrows(ConfigException.class, () -> PipelineSettings.from(config));
    assertTrue(e.getMessage().contains("graph.attach.concurrency"));
  }

  @Test
  void rejectsRelevanceOutsideUnitInterval() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("graph.market.relevance", 1.5);

    assertThrows(ConfigException.class, () -> PipelineSettings.from(config));
  }
}
