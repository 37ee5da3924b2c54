package com.tongji.pipeline.counter.fanout;

import com.tongji.pipeline.counter.CounterUpdateCommand;
import com.tongji.pipeline.counter.RelationshipChange;

import java.util.List;

/**
 * 关系变更到计数更新命令的扇出规则。一种关系类型对应一个实现。
 */
public interface CounterFanout {

    /**
     * @return 关心的关系类型（sk 前缀），如 FOLLOW
     */
    String relationType();

    /**
     * @return 关系行主体（pk）必须具备的实体类型，如 USER、POST
     */
    String subjectType();

    /**
     * 计算一次关系变更需要执行的计数更新命令。
     * @param change 已过滤到本关系类型的变更
     * @return 显式的命令列表，各命令相互独立
     */
    List<CounterUpdateCommand> commands(RelationshipChange change);
}
