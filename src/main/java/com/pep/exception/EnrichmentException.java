package com.pep.exception;

/**
 * 视频补全失败，仅在补全环节内部使用，不会向外传播
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
