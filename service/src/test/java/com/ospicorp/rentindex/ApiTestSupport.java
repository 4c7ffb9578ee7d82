package com.ospicorp.rentindex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Boots the service against the synthetic dataset in a fresh temp directory. Subclasses share
 * one application context.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class ApiTestSupport {

  @DynamicPropertySource
  static void configureDataset(DynamicPropertyRegistry registry) throws IOException {
    Path directory = Files.createTempDirectory("rent-index-api");
    Path dataset = DatasetFixtures.writeDefaultDataset(directory);
    registry.add("rentindex.dataset.location", dataset::toString);
    registry.add("rentindex.output.forecast-root", () -> directory.resolve("forecasts").toString());
    registry.add("rentindex.output.volatility-root",
        () -> directory.resolve("volatility").toString());
  }
}
