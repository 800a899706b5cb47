package com.gt.recall.bulk;

import java.util.List;

public record BulkScheduleResult(List<String> scheduled,
                                 List<String> skipped,
                                 List<BulkItemFailure> failed,
                                 List<String> notProcessed,
                                 boolean cancelled) {

    public BulkScheduleResult {
        scheduled = List.copyOf(scheduled);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
        notProcessed = List.copyOf(notProcessed);
    }
}
