package com.duelhub.duelservice.games.duel.domain.dto;

import com.duelhub.duelservice.games.duel.domain.enums.Tier;
import com.duelhub.duelservice.games.duel.domain.model.RoundOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 收手的同步响应。
 * outcome 只在本次调用触发结算时出现，且与广播给双方的结果是同一个对象。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StopResult(Tier bestOutcome, boolean roundResolved, RoundOutcome outcome) {
}
