package com.tongji.pipeline.counter.store;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 聚合计数表 entity_counter 数据访问层。
 */
@Mapper
public interface CounterMapper {

    /**
     * 原子累加；行不存在时以 delta 作为初值插入。
     * @return 影响行数
     */
    @Insert("INSERT INTO entity_counter (aggregate_key, field, value, updated_at) " +
            "VALUES (#{aggregateKey}, #{field}, #{delta}, NOW()) " +
            "ON DUPLICATE KEY UPDATE value = value + #{delta}, updated_at = NOW()")
    int add(@Param("aggregateKey") String aggregateKey,
            @Param("field") String field,
            @Param("delta") long delta);
}
