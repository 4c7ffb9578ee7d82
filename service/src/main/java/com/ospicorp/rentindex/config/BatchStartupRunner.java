package com.ospicorp.rentindex.config;

import com.ospicorp.rentindex.batch.BatchDefaults;
import com.ospicorp.rentindex.batch.BatchOrchestrator;
import com.ospicorp.rentindex.batch.BatchReport;
import com.ospicorp.rentindex.batch.RegionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

@Component
public class BatchStartupRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(BatchStartupRunner.class);

  private final BatchOrchestrator orchestrator;
  private final BatchDefaults defaults;
  private final Environment environment;
  private final boolean enabled;

  public BatchStartupRunner(BatchOrchestrator orchestrator, BatchDefaults defaults,
      Environment environment,
      @Value("${rentindex.batch.run-on-startup:false}") boolean enabled) {
    this.orchestrator = orchestrator;
    this.defaults = defaults;
    this.environment = environment;
    this.enabled = enabled;
  }

  @Override
  public void run(String... args) {
    if (!enabled) {
      log.debug("Startup batch disabled via property rentindex.batch.run-on-startup=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("test"))) {
      log.info("Skipping startup batch because active profile includes test");
      return;
    }
    BatchReport report = orchestrator.run(defaults.defaults());
    for (RegionOutcome failure : report.failures()) {
      log.info("Startup batch: region {} failed ({})", failure.region(), failure.failureKind());
    }
  }
}
