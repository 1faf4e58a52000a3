package com.pep.exception;

/**
 * 训练库写入失败，终止剩余写入，已提交的记录不回滚
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
