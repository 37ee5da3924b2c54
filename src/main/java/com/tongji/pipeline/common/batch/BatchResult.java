package com.tongji.pipeline.common.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * 批处理结果：成功数、失败数与失败条目。
 *
 * <p>发布者、消费者与计数维护器共用的“部分失败”返回形态，
 * 调用方据此区分“全部失败”与“大部分成功，仅这些失败”。</p>
 *
 * @param successCount 成功条数
 * @param failedCount  失败条数
 * @param failedItems  失败条目（供调用方重试或转入死信）
 * @param <T>          条目类型
 */
public record BatchResult<T>(int successCount, int failedCount, List<T> failedItems) {

    public BatchResult {
        failedItems = failedItems == null ? List.of() : List.copyOf(failedItems);
    }

    public static <T> BatchResult<T> empty() {
        return new BatchResult<>(0, 0, List.of());
    }

    public static <T> BatchResult<T> allFailed(List<T> items) {
        return new BatchResult<>(0, items.size(), items);
    }

    public boolean hasFailures() {
        return failedCount > 0;
    }

    public int total() {
        return successCount + failedCount;
    }

    /**
     * 跨分块累加结果。
     */
    public static final class Accumulator<T> {
        private int success;
        private final List<T> failed = new ArrayList<>();

        public void succeeded(int n) {
            success += n;
        }

        public void failed(T item) {
            failed.add(item);
        }

        public void failedAll(List<T> items) {
            failed.addAll(items);
        }

        public void merge(BatchResult<T> other) {
            success += other.successCount();
            failed.addAll(other.failedItems());
        }

        public BatchResult<T> build() {
            return new BatchResult<>(success, failed.size(), failed);
        }
    }
}
