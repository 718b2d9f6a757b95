package com.gdin.inspection.waterleak.exception;

public class TopologyIntegrityException extends RiskException {

    public TopologyIntegrityException(String message) {
        super(ErrorKind.TOPOLOGY_INTEGRITY, message);
    }
}
