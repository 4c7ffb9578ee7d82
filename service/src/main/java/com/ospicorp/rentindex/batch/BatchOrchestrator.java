package com.ospicorp.rentindex.batch;

import com.ospicorp.rentindex.artifact.ForecastArtifacts;
import com.ospicorp.rentindex.artifact.VolatilityArtifacts;
import com.ospicorp.rentindex.dataset.CsvDatasetReader;
import com.ospicorp.rentindex.dataset.DatasetStore;
import com.ospicorp.rentindex.dataset.DatasetTable;
import com.ospicorp.rentindex.dataset.GeoCatalog;
import com.ospicorp.rentindex.dataset.GeoLevels;
import com.ospicorp.rentindex.error.RegionDataException;
import com.ospicorp.rentindex.forecast.ForecastEngine;
import com.ospicorp.rentindex.forecast.ForecastResult;
import com.ospicorp.rentindex.series.model.RegionSeries;
import com.ospicorp.rentindex.series.service.SeriesExtractor;
import com.ospicorp.rentindex.volatility.VolatilityEstimator;
import com.ospicorp.rentindex.volatility.VolatilityMode;
import com.ospicorp.rentindex.volatility.VolatilityRequest;
import com.ospicorp.rentindex.volatility.VolatilityResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs extraction, forecast and volatility for many regions on a bounded worker pool.
 *
 * <p>Dataset-level faults abort the run before any region starts. After that every region is
 * independent: its faults are recorded in the report and the other regions carry on. Nothing
 * is retried.
 */
@Service
public class BatchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final GeoCatalog catalog;
  private final CsvDatasetReader reader;
  private final SeriesExtractor extractor;
  private final ForecastEngine forecastEngine;
  private final VolatilityEstimator volatilityEstimator;
  private final ForecastArtifacts forecastArtifacts;
  private final VolatilityArtifacts volatilityArtifacts;
  private final ReentrantLock readLock = new ReentrantLock();

  public BatchOrchestrator(GeoCatalog catalog, CsvDatasetReader reader, SeriesExtractor extractor,
      ForecastEngine forecastEngine, VolatilityEstimator volatilityEstimator,
      ForecastArtifacts forecastArtifacts, VolatilityArtifacts volatilityArtifacts) {
    this.catalog = catalog;
    this.reader = reader;
    this.extractor = extractor;
    this.forecastEngine = forecastEngine;
    this.volatilityEstimator = volatilityEstimator;
    this.forecastArtifacts = forecastArtifacts;
    this.volatilityArtifacts = volatilityArtifacts;
  }

  public BatchReport run(BatchRequest request) {
    request.validate();
    long started = System.currentTimeMillis();
    String geoColumn = GeoLevels.column(request.geoLevel());
    reader.requireColumns(request.datasetLocation(),
        List.of(geoColumn, CsvDatasetReader.DATE_COLUMN, request.valueColumn()));

    List<String> regions = request.allRegions()
        ? catalog.listRegions(request.datasetLocation(), request.geoLevel())
        : List.copyOf(new LinkedHashSet<>(trimmed(request.regions())));
    DatasetTable table = reader.load(request.datasetLocation(), geoColumn, request.valueColumn());

    int workers = Math.max(1, Math.min(request.workers(),
        Runtime.getRuntime().availableProcessors()));
    log.info("Starting batch: {} {} regions, mode {}, horizon {}, {} workers", regions.size(),
        request.geoLevel(), request.volatilityMode().tag(), request.horizon(), workers);

    List<RegionOutcome> outcomes = new ArrayList<>(regions.size());
    ExecutorService pool = Executors.newFixedThreadPool(workers, workerFactory());
    try {
      List<Future<RegionOutcome>> futures = new ArrayList<>(regions.size());
      for (String region : regions) {
        futures.add(pool.submit(() -> processRegion(request, table, geoColumn, region)));
      }
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(futures.get(i), regions.get(i)));
      }
    } finally {
      pool.shutdownNow();
    }

    int failed = (int) outcomes.stream().filter(RegionOutcome::failed).count();
    long elapsed = System.currentTimeMillis() - started;
    log.info("Batch finished in {} ms: {} regions, {} succeeded, {} failed", elapsed,
        outcomes.size(), outcomes.size() - failed, failed);
    return new BatchReport(request.geoLevel(), request.volatilityMode().tag(), outcomes.size(),
        outcomes.size() - failed, failed, elapsed, outcomes);
  }

  RegionOutcome processRegion(BatchRequest request, DatasetTable table, String geoColumn,
      String region) {
    RegionSeries series;
    try {
      series = extractor.extract(table, region);
    } catch (RuntimeException ex) {
      logFailure(region, "extraction", ex);
      return new RegionOutcome(region, StepStatus.FAILED, null, StepStatus.FAILED, null,
          kindOf(ex), ex.getMessage());
    }

    StepStatus forecastStatus = StepStatus.SKIPPED;
    String forecastPath = null;
    ForecastResult forecast = null;
    RuntimeException failure = null;
    if (request.runForecast()) {
      try {
        forecast = forecastEngine.forecast(series, request.horizon());
        forecastPath = forecastArtifacts.write(request.forecastRoot(), geoColumn, forecast);
        forecastStatus = StepStatus.SUCCEEDED;
      } catch (RuntimeException ex) {
        logFailure(region, "forecast", ex);
        forecastStatus = StepStatus.FAILED;
        forecast = null;
        failure = ex;
      }
    }

    StepStatus volatilityStatus;
    String volatilityPath = null;
    if (request.volatilityMode() == VolatilityMode.FORECAST && request.runForecast()
        && forecast == null) {
      // nothing to measure without this run's forecast
      volatilityStatus = StepStatus.SKIPPED;
    } else {
      try {
        VolatilityRequest volatilityRequest = volatilityRequest(request, geoColumn, series,
            forecast);
        VolatilityResult volatility = volatilityEstimator.estimate(volatilityRequest);
        volatilityPath = volatilityArtifacts.write(request.volatilityRoot(), geoColumn,
            volatility);
        volatilityStatus = StepStatus.SUCCEEDED;
      } catch (RuntimeException ex) {
        logFailure(region, "volatility", ex);
        volatilityStatus = StepStatus.FAILED;
        if (failure == null) {
          failure = ex;
        }
      }
    }

    return new RegionOutcome(region, forecastStatus, forecastPath, volatilityStatus,
        volatilityPath, failure == null ? null : kindOf(failure),
        failure == null ? null : failure.getMessage());
  }

  private VolatilityRequest volatilityRequest(BatchRequest request, String geoColumn,
      RegionSeries series, ForecastResult forecast) {
    if (request.volatilityMode() == VolatilityMode.RESIDUAL) {
      return new VolatilityRequest.FromResidual(series, request.window());
    }
    ForecastResult source = forecast != null
        ? forecast
        : guardedRead(() -> forecastArtifacts.read(request.forecastRoot(), geoColumn,
            series.region()));
    return new VolatilityRequest.FromForecast(source);
  }

  private <T> T guardedRead(Supplier<T> read) {
    DatasetStore store = reader.store();
    if (store.supportsConcurrentReads()) {
      return read.get();
    }
    readLock.lock();
    try {
      return read.get();
    } finally {
      readLock.unlock();
    }
  }

  private RegionOutcome await(Future<RegionOutcome> future, String region) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return new RegionOutcome(region, StepStatus.FAILED, null, StepStatus.FAILED, null,
          "interrupted", "Batch interrupted before region completed");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      log.error("Region {} failed unexpectedly", region, cause);
      return new RegionOutcome(region, StepStatus.FAILED, null, StepStatus.FAILED, null,
          "internal-error", String.valueOf(cause.getMessage()));
    }
  }

  private static void logFailure(String region, String step, RuntimeException ex) {
    if (ex instanceof RegionDataException) {
      log.warn("Region {} {} failed ({}): {}", region, step, kindOf(ex), ex.getMessage());
    } else {
      log.error("Region {} {} failed: {}", region, step, ex.getMessage(), ex);
    }
  }

  private static String kindOf(RuntimeException ex) {
    if (ex instanceof RegionDataException regionFault) {
      return regionFault.kind();
    }
    return "internal-error";
  }

  private static List<String> trimmed(List<String> regions) {
    return regions.stream().map(String::trim).filter(r -> !r.isEmpty()).toList();
  }

  private static ThreadFactory workerFactory() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread t = new Thread(runnable, "region-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
