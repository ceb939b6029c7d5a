package com.dataflow.pipeline.config;

import java.nio.file.Path;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public ChartRenderingConfig chartRenderingConfig(ApplicationProperties properties) {
    ApplicationProperties.Rendering rendering = properties.getRendering();
    return ChartRenderingConfig.builder()
        .width(rendering.getWidth())
        .height(rendering.getHeight())
        .primaryEnabled(rendering.isPrimaryEnabled())
        .secondaryEnabled(rendering.isSecondaryEnabled())
        .scratchDirectory(
            rendering.getScratchDirectory() == null
                ? null
                : Path.of(rendering.getScratchDirectory()))
        .build();
  }

  @Bean
  public DashboardLayout dashboardLayout(ApplicationProperties properties) {
    ApplicationProperties.Dashboard dashboard = properties.getDashboard();
    return DashboardLayout.builder()
        .title(dashboard.getTitle())
        .rowStart(dashboard.getRowStart())
        .rowSpacing(dashboard.getRowSpacing())
        .columnStart(dashboard.getColumnStart())
        .columnSpacing(dashboard.getColumnSpacing())
        .build();
  }

  @Bean
  public Executor pipelineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }
}
