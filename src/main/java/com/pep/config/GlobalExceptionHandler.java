package com.pep.config;

import com.pep.exception.GenerationException;
import com.pep.exception.PatientNotFoundException;
import com.pep.exception.PersistenceException;
import com.pep.exception.SecretUnavailableException;
import com.pep.exception.ValidationException;
import com.pep.model.vo.ErrorVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理器，所有错误都以 {"error": "..."} 返回
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 参数错误（400）
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorVO> handleValidationException(ValidationException e) {
        log.warn("参数错误: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 请求体不是合法 JSON（400）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorVO> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("请求体解析失败: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request - malformed JSON body");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorVO> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("缺少请求参数: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request - missing parameter " + e.getParameterName());
    }

    /**
     * 请求方法不支持（405），带 Allow 头
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorVO> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("请求方法不支持: {}", e.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED);
        if (e.getSupportedHttpMethods() != null) {
            builder.allow(e.getSupportedHttpMethods().toArray(new HttpMethod[0]));
        }
        return builder.body(new ErrorVO("Invalid request - method " + e.getMethod() + " not supported"));
    }

    /**
     * 请求体类型不支持（415）
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorVO> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        log.warn("请求体类型不支持: {}", e.getMessage());
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Invalid request - content type must be application/json");
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<ErrorVO> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException e) {
        log.warn("无法按要求的类型返回: {}", e.getMessage());
        return error(HttpStatus.NOT_ACCEPTABLE, "Invalid request - response is only available as application/json");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorVO> handleNoResource(NoResourceFoundException e) {
        log.warn("接口不存在: {}", e.getResourcePath());
        return error(HttpStatus.NOT_FOUND, "Not found");
    }

    /**
     * 患者不存在（404）
     */
    @ExceptionHandler(PatientNotFoundException.class)
    public ResponseEntity<ErrorVO> handlePatientNotFound(PatientNotFoundException e) {
        log.warn("患者不存在: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "Patient not found");
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorVO> handleGenerationException(GenerationException e) {
        log.error("生成训练动作失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error generating exercises: " + e.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorVO> handlePersistenceException(PersistenceException e) {
        log.error("保存训练动作失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error saving exercises: " + e.getMessage());
    }

    @ExceptionHandler(SecretUnavailableException.class)
    public ResponseEntity<ErrorVO> handleSecretUnavailable(SecretUnavailableException e) {
        log.error("密钥配置错误: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Service configuration error: " + e.getMessage());
    }

    /**
     * 处理所有异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorVO> handleException(Exception e) {
        log.error("系统异常", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error generating exercises: " + e.getMessage());
    }

    private static ResponseEntity<ErrorVO> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorVO(message));
    }
}
