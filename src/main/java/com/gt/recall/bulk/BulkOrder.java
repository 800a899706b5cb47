package com.gt.recall.bulk;

public enum BulkOrder {
    // Items are scheduled in the order they were requested
    INPUT_ORDER,
    // Most important items first, so they take the earliest due dates when the batch is distributed
    IMPORTANCE
}
