package com.jz.guard.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.guard.domain.entity.GuardSession;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

/**
 * 计数一律在 SQL 里原子自增，不做"读出来 +1 再写回"。
 */
@Mapper
public interface GuardSessionMapper extends BaseMapper<GuardSession> {

    @Update("""
        UPDATE guard_session
           SET messages_sent = messages_sent + 1,
               last_activity = #{now},
               last_user_agent = #{userAgent}
         WHERE identity_key = #{identityKey}
    """)
    int incrementMessages(@Param("identityKey") String identityKey,
                          @Param("now") LocalDateTime now,
                          @Param("userAgent") String userAgent);

    @Update("""
        UPDATE guard_session
           SET flagged_messages = flagged_messages + 1
         WHERE identity_key = #{identityKey}
    """)
    int incrementFlagged(@Param("identityKey") String identityKey);

    @Select("SELECT flagged_messages FROM guard_session WHERE identity_key = #{identityKey}")
    Long selectFlaggedCount(@Param("identityKey") String identityKey);

    /** 无条件覆盖：重复封禁会替换原因和过期时间 */
    @Update("""
        UPDATE guard_session
           SET is_blocked = TRUE,
               block_reason = #{reason},
               block_expires = #{expires}
         WHERE identity_key = #{identityKey}
    """)
    int applyBlock(@Param("identityKey") String identityKey,
                   @Param("reason") String reason,
                   @Param("expires") LocalDateTime expires);

    @Update("""
        UPDATE guard_session
           SET is_blocked = FALSE,
               block_reason = '',
               block_expires = NULL
         WHERE identity_key = #{identityKey}
    """)
    int clearBlock(@Param("identityKey") String identityKey);

    /**
     * 条件解封：只有仍处于"已封禁且已过期"状态时才更新。
     * 返回 1 的那个调用方负责写 auto_expire 审计，并发读者不会重复写。
     */
    @Update("""
        UPDATE guard_session
           SET is_blocked = FALSE,
               block_reason = '',
               block_expires = NULL
         WHERE identity_key = #{identityKey}
           AND is_blocked = TRUE
           AND block_expires IS NOT NULL
           AND block_expires < #{now}
    """)
    int expireBlock(@Param("identityKey") String identityKey, @Param("now") LocalDateTime now);

    /** 当前仍生效的封禁数（已过期但还没被惰性解封的不算） */
    @Select("""
        SELECT COUNT(*) FROM guard_session
         WHERE is_blocked = TRUE
           AND (block_expires IS NULL OR block_expires >= #{now})
    """)
    long countEffectiveBlocks(@Param("now") LocalDateTime now);
}
