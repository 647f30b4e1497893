package com.etpassist.infrastructure.dao;

import com.etpassist.infrastructure.dao.po.EtpSessionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * ETP 会话 DAO
 *
 * @author etpassist
 * @since 2025-03-14
 */
@Mapper
public interface EtpSessionDao {

    /**
     * 插入会话
     */
    int insert(EtpSessionPO po);

    /**
     * 根据会话 ID 更新
     */
    int update(EtpSessionPO po);

    /**
     * 根据会话 ID 查询
     */
    EtpSessionPO selectBySessionId(@Param("sessionId") String sessionId);
}
