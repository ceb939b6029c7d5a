package com.dataflow.pipeline.service.bundle;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.dataflow.pipeline.dto.bundle.PivotTablePayload;
import com.dataflow.pipeline.dto.bundle.ResultBundle;
import com.dataflow.pipeline.dto.dataset.TabularDataset;
import com.dataflow.pipeline.dto.pivot.PivotTable;
import com.dataflow.pipeline.exception.BundleIntegrityException;
import com.dataflow.pipeline.util.CellValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns in-memory pipeline results into their transport form: plain JSON-safe records, Base64
 * workbook content and its SHA-256 address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BundleSerializerService {

  private final ObjectMapper objectMapper;

  public List<Map<String, Object>> cleanedRecords(TabularDataset dataset) {
    return toRecordList(dataset.toRecords());
  }

  public List<PivotTablePayload> pivotPayloads(List<PivotTable> pivots) {
    List<PivotTablePayload> payloads = new ArrayList<>(pivots.size());
    for (PivotTable pivot : pivots) {
      payloads.add(
          PivotTablePayload.builder()
              .title(pivot.getTitle())
              .indexColumn(pivot.getIndexColumn())
              .columnHeaders(new ArrayList<>(pivot.getHeaders()))
              .data(toRecordList(pivot.toRecords()))
              .build());
    }
    return payloads;
  }

  public String encodeWorkbook(byte[] content) {
    return Base64.getEncoder().encodeToString(content);
  }

  public String contentAddress(byte[] content) {
    return Hashing.sha256().hashBytes(content).toString();
  }

  /**
   * Decodes the workbook carried by a bundle and checks it against the bundle's SHA-256 address,
   * when one is present.
   *
   * @throws BundleIntegrityException if the content is missing, not valid Base64 or does not match
   */
  public byte[] decodeWorkbook(ResultBundle bundle) {
    if (bundle.getFileContentBase64() == null) {
      throw new BundleIntegrityException("Bundle carries no workbook content");
    }
    byte[] content;
    try {
      content = Base64.getDecoder().decode(bundle.getFileContentBase64());
    } catch (IllegalArgumentException e) {
      throw new BundleIntegrityException("Workbook content is not valid Base64: " + e.getMessage());
    }
    String expected = bundle.getFileContentSha256();
    if (expected != null && !expected.equalsIgnoreCase(contentAddress(content))) {
      throw new BundleIntegrityException(
          "Workbook content of '" + bundle.getFileName() + "' does not match its SHA-256 address");
    }
    return content;
  }

  public String toJson(ResultBundle bundle) {
    try {
      return objectMapper.writeValueAsString(bundle);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize result bundle {}: {}", bundle.getFileName(), e.getMessage());
      throw new IllegalStateException("Result bundle is not serializable", e);
    }
  }

  /**
   * Recursively converts a value into JSON-safe form. Maps and collections are copied, date/time
   * values become ISO-8601 text and non-finite floating point numbers become null.
   */
  public Object toJsonSafe(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(String.valueOf(entry.getKey()), toJsonSafe(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof Collection) {
      List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
      for (Object item : (Collection<?>) value) {
        copy.add(toJsonSafe(item));
      }
      return copy;
    }
    if (CellValues.isTemporal(value)) {
      return CellValues.isoText(value);
    }
    if (value instanceof Double && !Double.isFinite((Double) value)) {
      return null;
    }
    if (value instanceof Float && !Float.isFinite((Float) value)) {
      return null;
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  private List<Map<String, Object>> toRecordList(List<Map<String, Object>> records) {
    List<Map<String, Object>> safe = new ArrayList<>(records.size());
    for (Map<String, Object> record : records) {
      safe.add((Map<String, Object>) toJsonSafe(record));
    }
    return safe;
  }
}
