package com.scholary.dubbing.pipeline;

import java.util.EnumMap;
import java.util.Map;

/** At most one output per stage. Once stored, an output is never replaced. */
class StageResultCache {

  private final Map<PipelineStage, Object> outputs = new EnumMap<>(PipelineStage.class);

  boolean contains(PipelineStage stage) {
    return outputs.containsKey(stage);
  }

  Object get(PipelineStage stage) {
    return outputs.get(stage);
  }

  void put(PipelineStage stage, Object output) {
    if (outputs.containsKey(stage)) {
      throw new IllegalStateException("Output of " + stage + " is already cached");
    }
    outputs.put(stage, output);
  }

  int size() {
    return outputs.size();
  }
}
