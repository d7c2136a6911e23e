package com.duelhub.duelservice.games.duel.domain.style;

import com.duelhub.duelservice.games.duel.domain.exception.DuelRejectedException;
import com.duelhub.duelservice.games.duel.domain.exception.RejectReason;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 流派目录：进程启动时加载一次，之后只读。
 * 新增/调参流派只改配置表，不碰状态机。
 */
public final class StyleCatalog {

    public static final String BALANCED = "balanced";
    public static final String AGGRESSIVE = "aggressive";
    public static final String PRECISE = "precise";
    public static final String POWER = "power";
    public static final String GUARD = "guard";
    public static final String FEINT = "feint";

    private final Map<String, StyleEffect> styles;
    private final String defaultStyleId;

    public StyleCatalog(Collection<StyleEffect> effects, String defaultStyleId) {
        Map<String, StyleEffect> m = new LinkedHashMap<>();
        for (StyleEffect e : effects) {
            m.put(normalize(e.getId()), e);
        }
        String def = normalize(defaultStyleId);
        if (!m.containsKey(def)) {
            throw new IllegalArgumentException("默认流派不在目录中: " + defaultStyleId);
        }
        this.styles = Collections.unmodifiableMap(m);
        this.defaultStyleId = def;
    }

    /**
     * 六种标准流派。
     */
    public static StyleCatalog canonical() {
        return new StyleCatalog(List.of(
                StyleEffect.builder().id(BALANCED).build(),
                StyleEffect.builder().id(AGGRESSIVE).selfHitMult(0.80).selfRollCapDelta(1).build(),
                StyleEffect.builder().id(PRECISE).selfHitMult(1.20).selfCritMult(0.50).build(),
                StyleEffect.builder().id(POWER).winPushMult(1.25).loseOpponentPushMult(1.20).build(),
                StyleEffect.builder().id(GUARD).selfRollCapDelta(-1).opponentHitMult(0.80).build(),
                StyleEffect.builder().id(FEINT).feintTiebreak(true).build()
        ), BALANCED);
    }

    public Optional<StyleEffect> lookup(String styleId) {
        if (styleId == null) return Optional.empty();
        return Optional.ofNullable(styles.get(normalize(styleId)));
    }

    /**
     * 查找流派，未知则按调用方错误拒绝。
     */
    public StyleEffect require(String styleId) {
        return lookup(styleId).orElseThrow(() ->
                new DuelRejectedException(RejectReason.UNKNOWN_STYLE, "未知流派: " + styleId));
    }

    /** 超时未锁定时默认使用的流派 */
    public StyleEffect defaultStyle() {
        return styles.get(defaultStyleId);
    }

    public Collection<StyleEffect> all() {
        return styles.values();
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }
}
