package com.cloudgov.trigger.http;

import com.cloudgov.api.response.Response;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 设计器 API 异常出口。
 * <p>
 * 编辑违规（放置、能力、层级声明等）原样返回 AppException 的响应码；
 * 请求本身无法绑定或解析时统一为 ILLEGAL_PARAMETER；其余按 UN_ERROR 返回，不泄露异常信息。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleDesignerViolation(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = abbreviate(StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo()));
        if (ResponseCode.UN_ERROR.getCode().equals(code)) {
            log.error("DESIGNER_FAILED {}, code={}, info={}", describe(request), code, info, ex);
        } else {
            log.warn("DESIGNER_REJECTED {}, code={}, info={}", describe(request), code, info);
        }
        return reply(code, info);
    }

    @ExceptionHandler({
            BindException.class,
            TypeMismatchException.class,
            ServletRequestBindingException.class,
            HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        String info = abbreviate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn("DESIGNER_BAD_REQUEST {}, type={}, info={}", describe(request), ex.getClass().getSimpleName(), info);
        return reply(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("DESIGNER_FAILED {}, type={}, info={}", describe(request), ex.getClass().getSimpleName(),
                abbreviate(ex.getMessage()), ex);
        return reply(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private Response<Object> reply(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    /**
     * 请求摘要：方法、路径与 MDC 中的 zoneId / traceId / requestId，缺失记为 "-"。
     */
    private String describe(HttpServletRequest request) {
        String method = request == null ? null : request.getMethod();
        String path = request == null ? null : request.getRequestURI();
        return "method=" + StringUtils.defaultIfBlank(method, "-")
                + ", path=" + StringUtils.defaultIfBlank(path, "-")
                + ", zoneId=" + StringUtils.defaultIfBlank(MDC.get("zoneId"), "-")
                + ", traceId=" + StringUtils.defaultIfBlank(MDC.get("traceId"), "-")
                + ", requestId=" + StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String abbreviate(String text) {
        return StringUtils.abbreviate(text, MAX_INFO_LENGTH);
    }
}
