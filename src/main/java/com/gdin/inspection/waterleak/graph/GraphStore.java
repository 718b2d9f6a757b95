package com.gdin.inspection.waterleak.graph;

import java.util.List;
import java.util.Optional;

/**
 * 图存储契约：顶点/边的增改、属性过滤查询、有界跳数的有向遍历。
 * 生产环境可对接 JanusGraph/Neptune 等图服务，测试/本地开发使用 {@link InMemoryGraphStore}。
 *
 * 所有方法在存储不可达时抛出 GraphConnectivityException。
 */
public interface GraphStore {

    /**
     * 按 id 新增或覆盖顶点
     */
    GraphVertex upsertVertex(GraphVertex vertex);

    /**
     * 按 id 新增或覆盖有向边。
     * @throws com.gdin.inspection.waterleak.exception.TopologyIntegrityException 任一端点顶点不存在
     */
    GraphEdge upsertEdge(GraphEdge edge);

    /**
     * 删除顶点及其全部关联边，不存在时忽略
     */
    void removeVertex(String id);

    /**
     * 删除边，不存在时忽略
     */
    void removeEdge(String id);

    Optional<GraphVertex> findVertex(String id);

    Optional<GraphEdge> findEdge(String id);

    /**
     * 按标签 + 全部条件（AND）过滤顶点，结果按写入顺序
     */
    List<GraphVertex> queryVertices(String label, List<PropertyPredicate> predicates);

    /**
     * 按标签 + 全部条件（AND）过滤边，结果按写入顺序
     */
    List<GraphEdge> queryEdges(String label, List<PropertyPredicate> predicates);

    List<GraphEdge> outEdges(String vertexId, String edgeLabel);

    /**
     * 从起点沿 edgeLabel 出边做广度优先遍历，最多 maxHops 跳。
     * @return 按发现顺序排列的可达顶点 id，不含起点，每个顶点只出现一次
     */
    List<String> traverseOut(String startVertexId, String edgeLabel, int maxHops);

    /**
     * 清空全部顶点和边（全量重建场景）
     */
    void clear();
}
