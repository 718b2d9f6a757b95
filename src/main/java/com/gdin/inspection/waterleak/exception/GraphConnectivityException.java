package com.gdin.inspection.waterleak.exception;

/**
 * 图存储连接失败。调用方可在瞬时故障时重试写操作。
 */
public class GraphConnectivityException extends RiskException {

    public GraphConnectivityException(String message, Throwable cause) {
        super(ErrorKind.GRAPH_CONNECTIVITY, message, cause);
    }
}
