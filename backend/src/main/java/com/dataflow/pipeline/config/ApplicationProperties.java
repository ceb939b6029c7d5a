package com.dataflow.pipeline.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.dataflow.pipeline.service.data_processing.MissingValueStrategy;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "pipeline")
public class ApplicationProperties {

  private Loader loader = new Loader();
  private Cleaning cleaning = new Cleaning();
  private Rendering rendering = new Rendering();
  private Dashboard dashboard = new Dashboard();
  private Output output = new Output();

  @Data
  public static class Loader {
    private List<String> spreadsheetExtensions = new ArrayList<>(Arrays.asList("xlsx", "xls"));
    private List<String> delimitedExtensions = new ArrayList<>(List.of("csv"));
    // common spreadsheet and database null spellings
    private List<String> missingValueTokens =
        new ArrayList<>(
            Arrays.asList(
                "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND",
                "1.#QNAN", "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null"));
    private int detectWindow = 20;
  }

  @Data
  public static class Cleaning {
    private MissingValueStrategy.Mode missingValues = MissingValueStrategy.Mode.DROP_ROWS;
  }

  @Data
  public static class Rendering {
    private int width = 600;
    private int height = 400;
    private boolean primaryEnabled = true;
    private boolean secondaryEnabled = true;
    private String scratchDirectory;
  }

  @Data
  public static class Dashboard {
    private String title = "Dashboard - Auto Generated";
    private int rowStart = 5;
    private int rowSpacing = 25;
    private int columnStart = 2;
    private int columnSpacing = 10;
  }

  @Data
  public static class Output {
    private String fileNamePrefix = "processed_";
    private String fileNameSuffix = ".xlsx";
  }
}
