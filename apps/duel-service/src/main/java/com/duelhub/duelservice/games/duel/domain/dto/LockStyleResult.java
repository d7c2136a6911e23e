package com.duelhub.duelservice.games.duel.domain.dto;

import com.duelhub.duelservice.games.duel.domain.enums.RoundPhase;

/**
 * 锁定流派的同步响应。
 *
 * @param accepted       是否接受（被拒绝时直接抛异常，这里恒为 true）
 * @param lockedStyle    自己锁定的流派
 * @param opponentLocked 对手是否已锁定（不透露对手流派）
 * @param phase          锁定后回合所处阶段（双方都锁定后进入 SWING）
 */
public record LockStyleResult(boolean accepted, String lockedStyle, boolean opponentLocked, RoundPhase phase) {
}
