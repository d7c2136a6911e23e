package com.duelhub.duelservice.games.duel.domain.exception;

import lombok.Getter;

/**
 * 调用方错误：同步返回给发起方，状态不变。
 */
@Getter
public class DuelRejectedException extends IllegalStateException {

    private final RejectReason reason;

    public DuelRejectedException(RejectReason reason, String message) {
        super(reason.name() + ": " + message);
        this.reason = reason;
    }
}
