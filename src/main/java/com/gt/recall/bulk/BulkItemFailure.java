package com.gt.recall.bulk;

public record BulkItemFailure(String itemId,
                              String errorType,
                              String message) { }
