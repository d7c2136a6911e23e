package com.duelhub.duelservice.games.duel.domain.style;

import lombok.Builder;
import lombok.Value;

/**
 * 流派效果（纯值对象）。
 * 未声明的字段取单位元：倍率 1.0、增量 0、无佯攻。
 * 所有倍率只做乘法叠加，见 {@link com.duelhub.duelservice.games.duel.domain.rule.ModifierResolver}。
 */
@Value
@Builder(toBuilder = true)
public class StyleEffect {

    /** 流派ID（小写，如 "balanced"） */
    String id;

    /** 自身命中倍率 */
    @Builder.Default double selfHitMult = 1.0;

    /** 自身暴击倍率 */
    @Builder.Default double selfCritMult = 1.0;

    /** 出手上限增减（结果下限为 1） */
    @Builder.Default int selfRollCapDelta = 0;

    /** 施加给对手的命中倍率 */
    @Builder.Default double opponentHitMult = 1.0;

    /** 自己获胜时推条倍率 */
    @Builder.Default double winPushMult = 1.0;

    /** 自己落败时，对手推条被放大的倍率 */
    @Builder.Default double loseOpponentPushMult = 1.0;

    /** 同档时是否由本流派胜出 */
    @Builder.Default boolean feintTiebreak = false;
}
