package com.tongji.pipeline.consumer;

/**
 * 一次消费调用（拉取 → 处理 → 上报）的汇总。
 *
 * @param fetched      拉取条数
 * @param succeeded    最终成功条数（含重投后成功）
 * @param redelivered  重投条数
 * @param deadLettered 转入死信条数
 */
public record ConsumeSummary(int fetched, int succeeded, int redelivered, int deadLettered) {

    public static ConsumeSummary idle() {
        return new ConsumeSummary(0, 0, 0, 0);
    }
}
