package com.tongji.pipeline.counter.changefeed;

import com.alibaba.otter.canal.client.CanalConnector;
import com.alibaba.otter.canal.client.CanalConnectors;
import com.alibaba.otter.canal.protocol.CanalEntry;
import com.alibaba.otter.canal.protocol.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.InvalidProtocolBufferException;
import com.tongji.pipeline.common.batch.BatchResult;
import com.tongji.pipeline.counter.ChangeFeedRecord;
import com.tongji.pipeline.counter.CounterMaintainer;
import com.tongji.pipeline.log.DeadLetterSink;
import com.tongji.pipeline.log.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Canal 变更流来源。
 * 职责：订阅 relationship 表的行级变更，转换为变更流记录后交给各计数维护器；
 * 计数更新耗尽重试的记录写入变更流死信主题后，才确认 Canal 位点。
 * 死信写入失败或其他批级异常时回滚到上次确认位点重放（至少一次）。
 */
@Service
public class CanalChangeFeedSource implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CanalChangeFeedSource.class);

    private final List<CounterMaintainer> maintainers;
    private final DeadLetterSink deadLetterSink;
    private final ObjectMapper objectMapper;
    private final TaskExecutor taskExecutor;
    private final Supplier<CanalConnector> connectorFactory;
    private final boolean enabled;
    private final String destination;
    private final String filter;
    private final int batchSize;
    private final long intervalMs;
    private final AtomicReference<Runnable> stopCallback = new AtomicReference<>();
    private volatile boolean running;
    private volatile boolean loopActive;

    /**
     * @param maintainers 计数维护器（每种关系类型一个）
     * @param deadLetterSink 变更流死信
     * @param objectMapper 死信负载序列化
     * @param taskExecutor 全局线程池
     * @param enabled 是否启用
     * @param host Canal 主机
     * @param port Canal 端口
     * @param destination 实例名
     * @param username 用户名
     * @param password 密码
     * @param filter 订阅过滤表达式（relationship 表）
     * @param batchSize 拉取批次大小
     * @param intervalMs 空轮询间隔毫秒
     */
    @Autowired
    public CanalChangeFeedSource(List<CounterMaintainer> maintainers,
                                 @Qualifier("relationshipChangesDeadLetterSink") DeadLetterSink deadLetterSink,
                                 ObjectMapper objectMapper,
                                 @Qualifier("taskExecutor") TaskExecutor taskExecutor,
                                 @Value("${canal.enabled:false}") boolean enabled,
                                 @Value("${canal.host}") String host,
                                 @Value("${canal.port}") int port,
                                 @Value("${canal.destination}") String destination,
                                 @Value("${canal.username}") String username,
                                 @Value("${canal.password}") String password,
                                 @Value("${canal.filter}") String filter,
                                 @Value("${canal.batchSize}") int batchSize,
                                 @Value("${canal.intervalMs}") long intervalMs) {
        this(maintainers, deadLetterSink, objectMapper, taskExecutor,
                () -> CanalConnectors.newSingleConnector(new InetSocketAddress(host, port), destination, username, password),
                enabled, destination, filter, batchSize, intervalMs);
    }

    CanalChangeFeedSource(List<CounterMaintainer> maintainers,
                          DeadLetterSink deadLetterSink,
                          ObjectMapper objectMapper,
                          TaskExecutor taskExecutor,
                          Supplier<CanalConnector> connectorFactory,
                          boolean enabled,
                          String destination,
                          String filter,
                          int batchSize,
                          long intervalMs) {
        this.maintainers = maintainers;
        this.deadLetterSink = deadLetterSink;
        this.objectMapper = objectMapper;
        this.taskExecutor = taskExecutor;
        this.connectorFactory = connectorFactory;
        this.enabled = enabled;
        this.destination = destination;
        this.filter = filter;
        this.batchSize = batchSize;
        this.intervalMs = intervalMs;
    }

    @Override
    public void start() {
        if (running || !enabled) {
            log.info("Canal change feed start skipped: running={} enabled={} dest={}", running, enabled, destination);
            return;
        }
        running = true;
        loopActive = true;
        taskExecutor.execute(this::runLoop);
    }

    private void runLoop() {
        CanalConnector connector = null;
        try {
            connector = connectorFactory.get();
            connector.connect();
            connector.subscribe(filter);
            // 从上次确认位点继续
            connector.rollback();
            log.info("Canal change feed subscribed: dest={} filter={} batchSize={} maintainers={}",
                    destination, filter, batchSize, maintainers.size());
            while (running) {
                Message message = connector.getWithoutAck(batchSize);
                if (message.getId() == -1 || message.getEntries() == null || message.getEntries().isEmpty()) {
                    sleepQuietly(intervalMs);
                    continue;
                }
                if (!process(connector, message)) {
                    sleepQuietly(intervalMs);
                }
            }
        } catch (Exception e) {
            log.error("Canal change feed error", e);
        } finally {
            running = false;
            if (connector != null) {
                try {
                    connector.disconnect();
                    log.info("Canal disconnected: dest={}", destination);
                } catch (Exception ex) {
                    log.warn("Canal disconnect failed: dest={} err={}", destination, ex.getMessage());
                }
            }
            loopActive = false;
            runStopCallback();
        }
    }

    /**
     * 处理一个 Canal 批次：分发、失败记录转入死信、确认位点；任一步骤异常则回滚该批次。
     * @return 批次是否已确认
     */
    boolean process(CanalConnector connector, Message message) {
        long batchId = message.getId();
        try {
            dispatch(toRecords(message.getEntries()), batchId);
            connector.ack(batchId);
            return true;
        } catch (Exception e) {
            log.error("Canal change feed batch failed, rolling back batchId={}", batchId, e);
            connector.rollback(batchId);
            return false;
        }
    }

    /**
     * 把同一批记录依次交给每个维护器；维护器各自过滤关系类型。
     * 计数更新耗尽重试的记录写入死信，死信写入失败时抛出，由调用方回滚整批。
     */
    void dispatch(List<ChangeFeedRecord> records, long batchId) {
        if (records.isEmpty()) {
            return;
        }
        for (CounterMaintainer m : maintainers) {
            BatchResult<ChangeFeedRecord> result = m.processBatch(records);
            for (ChangeFeedRecord failed : result.failedItems()) {
                deadLetterSink.send(toLogRecord(failed, batchId),
                        "counter " + m.relationType() + " update exhausted", m.maxAttempts());
            }
        }
    }

    private LogRecord toLogRecord(ChangeFeedRecord record, long batchId) {
        try {
            return new LogRecord(record.pk(), objectMapper.writeValueAsBytes(record), "canal-" + batchId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Change-feed record is not serializable: " + record.pk() + " " + record.sk(), e);
        }
    }

    static List<ChangeFeedRecord> toRecords(List<CanalEntry.Entry> entries) throws InvalidProtocolBufferException {
        List<ChangeFeedRecord> records = new ArrayList<>();
        for (CanalEntry.Entry entry : entries) {
            if (entry.getEntryType() != CanalEntry.EntryType.ROWDATA) {
                continue;
            }
            CanalEntry.RowChange rowChange = CanalEntry.RowChange.parseFrom(entry.getStoreValue());
            records.addAll(CanalRowConverter.toRecords(rowChange));
        }
        return records;
    }

    private void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    @Override
    public void stop() {
        running = false;
    }

    /**
     * 异步停止：拉取循环退出并断开连接后才回调，当前批次完成处理或回滚。
     */
    @Override
    public void stop(Runnable callback) {
        stopCallback.set(callback);
        running = false;
        if (!loopActive) {
            runStopCallback();
        }
    }

    private void runStopCallback() {
        // 循环线程与停止线程竞争，getAndSet 保证回调只执行一次
        Runnable callback = stopCallback.getAndSet(null);
        if (callback != null) {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
