package com.eyelevel.documenttranslator.queue;

import com.eyelevel.documenttranslator.model.PipelineStage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The four stage queues, one per {@link PipelineStage}.
 */
public class StageQueues {

    private final Map<PipelineStage, StageQueue> queues;

    public StageQueues(Map<PipelineStage, StageQueue> queues) {
        EnumMap<PipelineStage, StageQueue> copy = new EnumMap<>(PipelineStage.class);
        copy.putAll(queues);
        for (PipelineStage stage : PipelineStage.values()) {
            if (!copy.containsKey(stage)) {
                throw new IllegalArgumentException("No queue configured for stage " + stage);
            }
        }
        this.queues = Collections.unmodifiableMap(copy);
    }

    public StageQueue get(PipelineStage stage) {
        return queues.get(stage);
    }

    /**
     * @return pending entry count per stage, in pipeline order.
     */
    public Map<PipelineStage, Long> pendingCounts() {
        Map<PipelineStage, Long> counts = new LinkedHashMap<>();
        queues.forEach((stage, queue) -> counts.put(stage, queue.size()));
        return counts;
    }
}
