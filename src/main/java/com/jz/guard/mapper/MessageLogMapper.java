package com.jz.guard.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.guard.domain.entity.MessageLog;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;

@Mapper
public interface MessageLogMapper extends BaseMapper<MessageLog> {

    /** 滑动窗口：每次按当前时间重新计算，不做固定分桶 */
    @Select("""
        SELECT COUNT(*) FROM guard_message_log
         WHERE identity_key = #{identityKey}
           AND created_at > #{since}
    """)
    long countSince(@Param("identityKey") String identityKey, @Param("since") LocalDateTime since);
}
