package com.example.pageviews;

import org.apache.arrow.memory.RootAllocator;

/**
 * Process-wide Arrow root allocator, used by encoders that are not handed their own.
 */
public enum RootAllocatorFactory {
    INSTANCE;

    private RootAllocator rootAllocator;

    public synchronized RootAllocator getOrCreateRootAllocator(long limit) {
        if (rootAllocator == null) {
            rootAllocator = new RootAllocator(limit);
        }
        return rootAllocator;
    }
}
