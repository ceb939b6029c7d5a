package com.dataflow.pipeline.UnitTests.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.concurrent.Executor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.dataflow.pipeline.config.ApplicationProperties;
import com.dataflow.pipeline.config.ChartRenderingConfig;
import com.dataflow.pipeline.config.CoreConfig;
import com.dataflow.pipeline.config.DashboardLayout;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class CoreConfigTest {

  private CoreConfig coreConfig;
  private ApplicationProperties properties;

  @BeforeEach
  public void setUp() {
    coreConfig = new CoreConfig();
    properties = new ApplicationProperties();
  }

  @Test
  public void testObjectMapperConfiguration() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    assertFalse(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    assertEquals("\"2024-05-01\"", mapper.writeValueAsString(LocalDate.of(2024, 5, 1)));
  }

  @Test
  public void testRenderingConfigFromProperties() {
    properties.getRendering().setWidth(800);
    properties.getRendering().setPrimaryEnabled(false);

    ChartRenderingConfig config = coreConfig.chartRenderingConfig(properties);

    assertEquals(800, config.getWidth());
    assertEquals(400, config.getHeight());
    assertFalse(config.isPrimaryEnabled());
    assertTrue(config.isSecondaryEnabled());
  }

  @Test
  public void testDashboardLayoutFromProperties() {
    properties.getDashboard().setColumnSpacing(8);

    DashboardLayout layout = coreConfig.dashboardLayout(properties);

    assertEquals(5, layout.anchorRow(1));
    assertEquals(10, layout.anchorColumn(1));
    assertEquals(30, layout.anchorRow(2));
  }

  @Test
  public void testPipelineExecutorConfiguration() {
    Executor executor = coreConfig.pipelineExecutor();

    assertTrue(executor instanceof ThreadPoolTaskExecutor);
    ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
    assertEquals(4, taskExecutor.getCorePoolSize());
    assertEquals(8, taskExecutor.getMaxPoolSize());
    assertEquals(100, taskExecutor.getQueueCapacity());
    assertEquals("pipeline-", taskExecutor.getThreadNamePrefix());
    taskExecutor.shutdown();
  }
}
