package com.duelhub.duelservice.common;

import com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException;
import com.duelhub.duelservice.games.duel.domain.exception.UnresolvableRoundException;
import com.duelhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 对决调用方错误：不存在类 404，参数类 400，其余 409。
     */
    @ExceptionHandler(DuelRejectedException.class)
    public ResponseEntity<ApiResponse<Object>> rejected(DuelRejectedException e) {
        if (e.getReason().notFound()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
        }
        if (e.getReason().badInput()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 回合无法结算：不向参与者伪造结果，返回 500 等待外部处理。
     */
    @ExceptionHandler(UnresolvableRoundException.class)
    public ResponseEntity<ApiResponse<Object>> unresolvable(UnresolvableRoundException e) {
        log.error("回合无法结算 match={} round={}", e.getMatchId(), e.getRoundNo(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError(e.getMessage()));
    }

    /**
     * 参数不合法（如缺少身份）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 其余业务状态冲突。
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
