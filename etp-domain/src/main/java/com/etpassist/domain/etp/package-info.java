/**
 * ETP 领域 - 采购论证文档（Estudo Técnico Preliminar）对话式编写
 *
 * <p>职责：引导用户分阶段提供需求、要求、法律依据、价格调研、PCA 状态、分包决定与摘要，
 * 并把累积的结构化数据组装为固定章节。</p>
 *
 * <h3>核心组件</h3>
 * <ul>
 *   <li>StageTransitionDomainService：阶段状态机，除 refine 自循环外所有迁移都需要用户显式确认</li>
 *   <li>RequirementCommandInterpreter / AnswerInterpreterDomainService：把自由文本解析为结构化命令与意图</li>
 *   <li>RequirementsEngineDomainService：在有序需求列表上应用命令，保持 R1..Rn 连续编号</li>
 *   <li>DecisionArbitrationDomainService：三选一决策，优先于其他解析执行</li>
 *   <li>ResponsePayloadGuardDomainService：生成结果的最低内容保障与清洗</li>
 *   <li>EtpDocumentAssemblerDomainService：唯一的章节写入路径</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.etpassist.domain.etp.model.entity.EtpSessionEntity}</li>
 * </ul>
 *
 * @author etpassist
 * @since 2025-03-10
 */
package com.etpassist.domain.etp;
