package com.dataflow.pipeline.dto.analysis;

import java.util.List;

import lombok.Value;

@Value
public class DiscoveryResult {
  List<ColumnProfile> profiles;
  List<Relationship> relationships;
}
