package com.imperium.aries.controller;

import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.MailDeliveryException;
import com.imperium.aries.common.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 统一异常处理：HTTP 状态恒为 200，语义状态放在响应信封的 code 中。
 * 请求错误返回具体提示；服务器错误只返回通用提示，细节写日志。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String BAD_BODY_MSG = "请求数据格式有误";
    static final String METHOD_NOT_SUPPORTED_MSG = "不支持的请求方法";
    static final String MEDIA_TYPE_NOT_SUPPORTED_MSG = "不支持的请求数据类型";
    static final String NOT_FOUND_MSG = "接口不存在";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public Result<Void> handleBusiness(BusinessException ex) {
        return Result.requestError(ex.getMessage());
    }

    /** 覆盖 @Valid @RequestBody（MethodArgumentNotValidException 是其子类）与 @ModelAttribute 绑定失败 */
    @ExceptionHandler(BindException.class)
    public Result<Void> handleBind(BindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse(BAD_BODY_MSG);
        return Result.requestError(message);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public Result<Void> handleConstraintViolation(ConstraintViolationException ex) {
        String message = ex.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getMessage())
                .orElse(BAD_BODY_MSG);
        return Result.requestError(message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public Result<Void> handleMissingParam(MissingServletRequestParameterException ex) {
        return Result.requestError("缺少参数 " + ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public Result<Void> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return Result.requestError("参数 " + ex.getName() + " 格式有误");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadable(HttpMessageNotReadableException ex) {
        return Result.requestError(BAD_BODY_MSG);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public Result<Void> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return Result.requestError(METHOD_NOT_SUPPORTED_MSG);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public Result<Void> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return Result.requestError(MEDIA_TYPE_NOT_SUPPORTED_MSG);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public Result<Void> handleNotFound(Exception ex, HttpServletRequest request) {
        log.debug("{} {} not found", request.getMethod(), request.getRequestURI());
        return Result.requestError(NOT_FOUND_MSG);
    }

    @ExceptionHandler(MailDeliveryException.class)
    public Result<Void> handleMail(MailDeliveryException ex, HttpServletRequest request) {
        log.error("{} {} mail delivery failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return Result.serverError(ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed", request.getMethod(), request.getRequestURI(), ex);
        return Result.serverError();
    }
}
