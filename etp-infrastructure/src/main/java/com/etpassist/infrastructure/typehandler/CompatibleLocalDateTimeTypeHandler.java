package com.etpassist.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 会话时间戳映射处理器：驱动返回 TIMESTAMPTZ、Instant 或 Timestamp 时统一转为 LocalDateTime。
 */
@MappedTypes(LocalDateTime.class)
public class CompatibleLocalDateTimeTypeHandler extends BaseTypeHandler<LocalDateTime> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalDateTime parameter, JdbcType jdbcType) throws SQLException {
        ps.setTimestamp(i, Timestamp.valueOf(parameter));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return convert(rs.getObject(columnName));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return convert(rs.getObject(columnIndex));
    }

    @Override
    public LocalDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return convert(cs.getObject(columnIndex));
    }

    static LocalDateTime convert(Object raw) throws SQLException {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDateTime value) {
            return value;
        }
        if (raw instanceof Timestamp value) {
            return value.toLocalDateTime();
        }
        if (raw instanceof OffsetDateTime value) {
            return value.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        }
        if (raw instanceof ZonedDateTime value) {
            return value.withZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        }
        if (raw instanceof Instant value) {
            return LocalDateTime.ofInstant(value, ZoneId.systemDefault());
        }
        throw new SQLException("Unsupported session timestamp type: " + raw.getClass().getName());
    }
}
