package com.etpassist.types.common;

/**
 * 全局常量定义类。
 *
 * @author etpassist
 * @since 2025-03-10
 */
public class Constants {

    /** 需求编号前缀，编号始终为 R1..Rn */
    public final static String REQUIREMENT_ID_PREFIX = "R";

    /** 用户选择“待定”时写入答案的标记 */
    public final static String PENDING_MARKER = "Pendente";

    /** 用户跳过或未提供信息时的占位值 */
    public final static String NOT_INFORMED = "não informado";

    /** 追加需求但未给出内容时的占位文本 */
    public final static String REQUIREMENT_PLACEHOLDER = "Novo requisito a detalhar";

    /** 最少需求条数 */
    public final static int MIN_REQUIREMENTS = 8;

    /** 最少策略条数 */
    public final static int MIN_STRATEGIES = 2;

}
