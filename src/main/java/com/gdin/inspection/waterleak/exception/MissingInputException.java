package com.gdin.inspection.waterleak.exception;

/**
 * 输入缺失（如检测器所需波段不在本次采集中）。不中断流程，只记录在报告里。
 */
public class MissingInputException extends RiskException {

    public MissingInputException(String message) {
        super(ErrorKind.MISSING_INPUT, message);
    }
}
