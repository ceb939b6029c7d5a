package com.dataflow.pipeline.dto.workbook;

import java.util.List;

import lombok.Value;

@Value
public class AssembledWorkbook {
  /** Finished .xlsx file. */
  byte[] content;

  List<String> sheetNames;

  int embeddedCharts;
}
