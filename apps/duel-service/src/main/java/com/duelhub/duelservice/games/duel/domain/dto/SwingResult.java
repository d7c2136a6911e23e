package com.duelhub.duelservice.games.duel.domain.dto;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;

/**
 * 出手的同步响应。后出手覆盖先出手，因此 bestOutcomeSoFar 恒等于本次结果。
 */
public record SwingResult(Tier outcome, int swingsUsed, int swingsRemaining, Tier bestOutcomeSoFar) {
}
