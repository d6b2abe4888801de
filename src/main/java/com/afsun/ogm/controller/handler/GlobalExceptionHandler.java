package com.afsun.ogm.controller.handler;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.exceptions.OgmException;
import com.afsun.ogm.core.exceptions.ReferentialIntegrityException;
import com.afsun.ogm.core.exceptions.RequiredPropertyException;
import com.afsun.ogm.core.exceptions.SchemaException;
import com.afsun.ogm.core.exceptions.StoreException;
import com.afsun.ogm.core.exceptions.StoreTimeoutException;
import com.afsun.ogm.core.exceptions.StoreUnavailableException;
import com.afsun.ogm.core.exceptions.TypeMismatchException;
import com.afsun.ogm.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 将对象图映射的异常分类映射为统一的错误响应
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Schema 声明错误
     */
    @ExceptionHandler(SchemaException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleSchemaException(SchemaException e) {
        log.error("Schema 声明错误", e);
        return fail(500, e);
    }

    /**
     * 属性或关联目标类型不符
     */
    @ExceptionHandler(TypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleTypeMismatchException(TypeMismatchException e) {
        log.warn("类型不匹配: {}", e.getMessage());
        return fail(400, e);
    }

    /**
     * 缺少必填属性
     */
    @ExceptionHandler(RequiredPropertyException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleRequiredPropertyException(RequiredPropertyException e) {
        log.warn("缺少必填属性: {}", e.getMessage());
        return fail(400, e);
    }

    /**
     * 删除仍被引用的节点
     */
    @ExceptionHandler(ReferentialIntegrityException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Response<Void> handleReferentialIntegrityException(ReferentialIntegrityException e) {
        log.warn("引用完整性错误: {}", e.getMessage());
        return fail(409, e);
    }

    /**
     * 操作已删除或已脱离会话的实体
     */
    @ExceptionHandler(DetachedEntityException.class)
    @ResponseStatus(HttpStatus.GONE)
    public Response<Void> handleDetachedEntityException(DetachedEntityException e) {
        log.warn("实体已脱离会话: {}", e.getMessage());
        return fail(410, e);
    }

    /**
     * 图存储不可用
     */
    @ExceptionHandler(StoreUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Response<Void> handleStoreUnavailableException(StoreUnavailableException e) {
        log.warn("图存储不可用: {}", e.getMessage());
        return fail(503, e);
    }

    /**
     * 图存储超时
     */
    @ExceptionHandler(StoreTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Response<Void> handleStoreTimeoutException(StoreTimeoutException e) {
        log.warn("图存储超时: {}", e.getMessage());
        return fail(504, e);
    }

    /**
     * 其他存储错误，节点或关系不存在时返回 404
     */
    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Response<Void>> handleStoreException(StoreException e) {
        boolean notFound = "NODE_NOT_FOUND".equals(e.getErrorCode()) || "RELATIONSHIP_NOT_FOUND".equals(e.getErrorCode());
        HttpStatus status = notFound ? HttpStatus.NOT_FOUND : HttpStatus.INTERNAL_SERVER_ERROR;
        if (notFound) {
            log.warn("存储对象不存在: {}", e.getMessage());
        } else {
            log.error("图存储错误", e);
        }
        return ResponseEntity.status(status).body(fail(status.value(), e));
    }

    /**
     * 其他映射异常
     */
    @ExceptionHandler(OgmException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleOgmException(OgmException e) {
        log.error("对象图映射错误", e);
        return fail(500, e);
    }

    /**
     * 处理非法参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("非法参数: {}", e.getMessage());
        return Response.fail(400, "参数错误: " + e.getMessage());
    }

    /**
     * 处理其他未预期异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage() +
                           "\n请联系技术支持");
    }

    private static Response<Void> fail(int status, OgmException e) {
        return Response.fail(status, e.getErrorCode(), e.getFormattedMessage());
    }
}
