package com.tongji.pipeline.counter;

import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.counter.fanout.CounterFanout;
import com.tongji.pipeline.counter.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 计数维护器。
 * 职责：消费实体存储的变更流，把关系行的插入/删除换算为 ±1，并通过原子加法更新聚合计数。
 * 每个实例只关心一种关系类型；同一关系变更扇出的多条命令相互独立执行，单条记录失败不中断整批。
 *
 * <p>计数不做去重：至少一次投递下重复的 REMOVE 会使计数低于真实值。</p>
 */
public class CounterMaintainer {
    private static final Logger log = LoggerFactory.getLogger(CounterMaintainer.class);

    private final CounterFanout fanout;
    private final EntityStore store;
    private final int maxAttempts;

    public CounterMaintainer(CounterFanout fanout, EntityStore store, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.fanout = fanout;
        this.store = store;
        this.maxAttempts = maxAttempts;
    }

    public String relationType() {
        return fanout.relationType();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * 处理一批变更流记录。
     * 被跳过的记录（MODIFY、非本关系类型、键非法、主体类型不符）视为已处理；任一命令耗尽重试预算时该记录计为失败。
     * @param records 变更流记录
     * @return 成功数、失败数与失败记录
     */
    public BatchResult<ChangeFeedRecord> processBatch(List<ChangeFeedRecord> records) {
        BatchResult.Accumulator<ChangeFeedRecord> acc = new BatchResult.Accumulator<>();
        int applied = 0;
        for (ChangeFeedRecord record : records) {
            Optional<RelationshipChange> change = toChange(record);
            if (change.isEmpty()) {
                acc.succeeded(1);
                continue;
            }
            if (apply(change.get())) {
                acc.succeeded(1);
                applied++;
            } else {
                acc.failed(record);
            }
        }
        BatchResult<ChangeFeedRecord> result = acc.build();
        log.info("counter.maintain relation={} records={} applied={} failed={}",
                fanout.relationType(), records.size(), applied, result.failedCount());
        return result;
    }

    /**
     * 将记录解析为本关系类型的变更；不需处理的记录返回空。
     */
    Optional<RelationshipChange> toChange(ChangeFeedRecord record) {
        int delta = record.changeType() == null ? 0 : record.changeType().delta();
        if (delta == 0) {
            log.debug("counter.maintain skip changeType={} pk={} sk={}", record.changeType(), record.pk(), record.sk());
            return Optional.empty();
        }
        Optional<EntityKey> subject = EntityKey.parse(record.pk());
        Optional<EntityKey> relation = EntityKey.parse(record.sk());
        if (subject.isEmpty() || relation.isEmpty()) {
            log.warn("counter.maintain invalid key pk={} sk={} changeType={}", record.pk(), record.sk(), record.changeType());
            return Optional.empty();
        }
        if (!fanout.relationType().equals(relation.get().type())) {
            return Optional.empty();
        }
        if (!fanout.subjectType().equals(subject.get().type())) {
            log.warn("counter.maintain unexpected subject relation={} expected={} pk={} sk={}",
                    fanout.relationType(), fanout.subjectType(), record.pk(), record.sk());
            return Optional.empty();
        }
        return Optional.of(new RelationshipChange(subject.get(), relation.get().type(), relation.get().id(), delta));
    }

    private boolean apply(RelationshipChange change) {
        boolean ok = true;
        for (CounterUpdateCommand cmd : fanout.commands(change)) {
            // 各命令独立执行，前一条失败不影响后一条
            ok &= execute(cmd);
        }
        return ok;
    }

    private boolean execute(CounterUpdateCommand cmd) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                store.atomicAdd(cmd.aggregateKey(), cmd.field(), cmd.delta());
                return true;
            } catch (RuntimeException e) {
                log.warn("counter.maintain atomicAdd failed key={} field={} delta={} attempt={}/{} err={}",
                        cmd.aggregateKey(), cmd.field(), cmd.delta(), attempt, maxAttempts, e.getMessage());
            }
        }
        log.error("counter.maintain command exhausted key={} field={} delta={}", cmd.aggregateKey(), cmd.field(), cmd.delta());
        return false;
    }
}
