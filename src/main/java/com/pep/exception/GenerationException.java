package com.pep.exception;

/**
 * 调用文本生成服务失败：传输错误、非成功状态或空响应，终止本次流水线
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
