package com.pep.exception;

/**
 * 生成结果无法解析为训练动作数组
 */
public class GenerationParseException extends GenerationException {

    public GenerationParseException(String message) {
        super(message);
    }

    public GenerationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
