package com.gdin.inspection.waterleak.exception;

/**
 * 错误分类。每个对外抛出的异常都必须带上其中之一。
 */
public enum ErrorKind {
    /**
     * 缺少波段/指标等输入，调用方按中性默认值处理
     */
    MISSING_INPUT,
    /**
     * 非数值、维度不一致或违反模型约束的输入
     */
    MALFORMED_INPUT,
    /**
     * 图存储不可达
     */
    GRAPH_CONNECTIVITY,
    /**
     * 边引用了不存在的节点等拓扑问题
     */
    TOPOLOGY_INTEGRITY
}
