package com.dataflow.pipeline.service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.dto.analysis.DiscoveryResult;
import com.dataflow.pipeline.dto.bundle.ProcessingMetadata;
import com.dataflow.pipeline.dto.bundle.ProcessingRequest;
import com.dataflow.pipeline.dto.bundle.ResultBundle;
import com.dataflow.pipeline.dto.chart.ChartSpec;
import com.dataflow.pipeline.dto.cleaning.CleaningPolicy;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.dto.pivot.PivotTable;
import com.dataflow.pipeline.dto.workbook.AssembledWorkbook;
import com.dataflow.pipeline.exception.ProcessingTimeoutException;
import com.dataflow.pipeline.service.analysis.PivotTableBuilderService;
import com.dataflow.pipeline.service.analysis.RelationshipDiscoveryService;
import com.dataflow.pipeline.service.bundle.BundleSerializerService;
import com.dataflow.pipeline.service.data_processing.DataCleaningService;
import com.dataflow.pipeline.service.data_processing.DatasetLoaderService;
import com.dataflow.pipeline.service.data_processing.MissingValueStrategy;
import com.dataflow.pipeline.service.rendering.ChartRenderingService;
import com.dataflow.pipeline.service.workbook.WorkbookAssemblerService;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the whole pipeline for one uploaded file: load, clean, discover relationships, build
 * pivots, render charts (dashboard requests only), assemble the workbook and package the result.
 * Structural input errors abort the run; chart rendering failures never do.
 */
@Slf4j
@Service
public class DataProcessingService {

  static final String REQUEST_ID_MDC_KEY = "requestId";
  static final String SOURCE_FILE_MDC_KEY = "sourceFile";

  private final DatasetLoaderService loaderService;
  private final DataCleaningService cleaningService;
  private final RelationshipDiscoveryService discoveryService;
  private final PivotTableBuilderService pivotBuilderService;
  private final ChartRenderingService chartRenderingService;
  private final WorkbookAssemblerService workbookAssemblerService;
  private final BundleSerializerService bundleSerializerService;
  private final ApplicationProperties properties;
  private final Executor pipelineExecutor;

  public DataProcessingService(
      DatasetLoaderService loaderService,
      DataCleaningService cleaningService,
      RelationshipDiscoveryService discoveryService,
      PivotTableBuilderService pivotBuilderService,
      ChartRenderingService chartRenderingService,
      WorkbookAssemblerService workbookAssemblerService,
      BundleSerializerService bundleSerializerService,
      ApplicationProperties properties,
      @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
    this.loaderService = loaderService;
    this.cleaningService = cleaningService;
    this.discoveryService = discoveryService;
    this.pivotBuilderService = pivotBuilderService;
    this.chartRenderingService = chartRenderingService;
    this.workbookAssemblerService = workbookAssemblerService;
    this.bundleSerializerService = bundleSerializerService;
    this.properties = properties;
    this.pipelineExecutor = pipelineExecutor;
  }

  public ResultBundle process(ProcessingRequest request) {
    String requestId = UUID.randomUUID().toString();
    MDC.put(REQUEST_ID_MDC_KEY, requestId);
    MDC.put(SOURCE_FILE_MDC_KEY, String.valueOf(request.getSourcePath()));
    try {
      return run(request);
    } finally {
      MDC.remove(REQUEST_ID_MDC_KEY);
      MDC.remove(SOURCE_FILE_MDC_KEY);
    }
  }

  /**
   * Same as {@link #process} but gives up once {@code deadline} has elapsed. The pipeline keeps no
   * shared state, so an abandoned run only costs the executor thread until it finishes.
   *
   * @throws ProcessingTimeoutException when the deadline passes first
   */
  public ResultBundle processWithin(ProcessingRequest request, Duration deadline) {
    CompletableFuture<ResultBundle> future =
        CompletableFuture.supplyAsync(() -> process(request), pipelineExecutor);
    try {
      return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Processing of {} exceeded {} ms", request.getSourcePath(), deadline.toMillis());
      throw new ProcessingTimeoutException(deadline);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Processing failed", cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new IllegalStateException("Interrupted while waiting for processing", e);
    }
  }

  private ResultBundle run(ProcessingRequest request) {
    long started = System.nanoTime();
    int requested = Math.max(1, request.getRequestedRelations());
    log.info(
        "Processing request: {} relationship(s) requested, dashboard {}",
        requested,
        request.isRequireDashboard() ? "requested" : "not requested");

    TabularDataset loaded = loaderService.load(request.getSourcePath());
    TabularDataset cleaned = cleaningService.clean(loaded, cleaningPolicy(request));

    DiscoveryResult discovery = discoveryService.discover(cleaned, requested);
    List<PivotTable> pivots = pivotBuilderService.buildAll(cleaned, discovery.getRelationships());

    boolean hasDashboard = request.isRequireDashboard() && !pivots.isEmpty();
    List<ChartSpec> charts = hasDashboard ? chartRenderingService.renderAll(pivots) : null;

    AssembledWorkbook workbook = workbookAssemblerService.assemble(cleaned, pivots, charts);

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    ProcessingMetadata metadata =
        ProcessingMetadata.builder()
            .rowsLoaded(loaded.rowCount())
            .rowsAfterCleaning(cleaned.rowCount())
            .columnsRemoved(loaded.columnCount() - cleaned.columnCount())
            .chartsEmbedded(workbook.getEmbeddedCharts())
            .processingTimeMs(elapsedMs)
            .build();

    ResultBundle bundle =
        ResultBundle.builder()
            .cleanedData(bundleSerializerService.cleanedRecords(cleaned))
            .pivotTables(bundleSerializerService.pivotPayloads(pivots))
            .hasDashboard(hasDashboard)
            .sheets(workbook.getSheetNames())
            .fileContentBase64(bundleSerializerService.encodeWorkbook(workbook.getContent()))
            .fileContentSha256(bundleSerializerService.contentAddress(workbook.getContent()))
            .fileName(outputFileName(request))
            .requestedRelations(requested)
            .generatedRelations(pivots.size())
            .description(request.getDescription())
            .charts(charts)
            .columnProfiles(discovery.getProfiles())
            .processingMetadata(metadata)
            .build();

    log.info(
        "Finished {}: {} of {} relationship(s) generated, {} chart(s) embedded in {} ms",
        bundle.getFileName(),
        bundle.getGeneratedRelations(),
        requested,
        metadata.getChartsEmbedded(),
        elapsedMs);
    return bundle;
  }

  CleaningPolicy cleaningPolicy(ProcessingRequest request) {
    return CleaningPolicy.builder()
        .columnsToRemove(CleaningPolicy.parseRemovalList(request.getRemoveFields()))
        .missingValueStrategy(
            MissingValueStrategy.forMode(properties.getCleaning().getMissingValues()))
        .build();
  }

  String outputFileName(ProcessingRequest request) {
    String name = request.getOutputFileName();
    if (name != null && !name.trim().isEmpty()) {
      return name.trim();
    }
    ApplicationProperties.Output output = properties.getOutput();
    return output.getFileNamePrefix()
        + UUID.randomUUID().toString().replace("-", "")
        + output.getFileNameSuffix();
  }
}
