package com.algohub.gameservice.common;

import com.algohub.core.exception.NextEventException;
import com.algohub.core.exception.ProcessEventException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * HTTP 接口的异常映射。
 * IllegalArgumentException 族（GameSetupException、UnknownPlayerException、MalformedMessageException）→ 400，
 * IllegalStateException 族（引擎时序错误等）→ 409，其余 → 500。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /** 引擎时序错误带上原因，方便排查是哪一步卡住了 */
    @ExceptionHandler({NextEventException.class, ProcessEventException.class})
    public ResponseEntity<ApiResponse<Object>> engineState(IllegalStateException e) {
        String reason = e instanceof NextEventException n ? n.getReason().name()
                : ((ProcessEventException) e).getReason().name();
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.conflict(reason + ": " + e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> internalError(Exception e) {
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError("internal server error"));
    }
}
