package com.tongji.pipeline.relation.store;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 关系表 relationship 只读访问层（按 sk 反查关系主体）。
 */
@Mapper
public interface RelationshipMapper {

    @Select("SELECT COUNT(*) FROM relationship WHERE sk = #{sk}")
    long countBySk(@Param("sk") String sk);

    /**
     * 列出指向 sk 的全部关系主体键（形如 {@code USER#id}）。
     */
    @Select("SELECT pk FROM relationship WHERE sk = #{sk} ORDER BY pk")
    List<String> listPkBySk(@Param("sk") String sk);
}
