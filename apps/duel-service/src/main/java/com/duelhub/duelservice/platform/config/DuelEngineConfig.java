package com.duelhub.duelservice.platform.config;

import com.duelhub.duelservice.application.stats.CombatStatsDirectory;
import com.duelhub.duelservice.application.stats.ConfiguredCombatStatsDirectory;
import com.duelhub.duelservice.games.duel.domain.rule.ModifierResolver;
import com.duelhub.duelservice.games.duel.domain.rule.RollGenerator;
import com.duelhub.duelservice.games.duel.domain.rule.RollSourceFactory;
import com.duelhub.duelservice.games.duel.domain.rule.RoundScorer;
import com.duelhub.duelservice.games.duel.domain.rule.TierMarginPushCurve;
import com.duelhub.duelservice.games.duel.domain.style.StyleCatalog;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 对决引擎装配：流派目录、规则组件、随机源与时钟。
 * 规则组件都是无状态的纯对象，这里只负责按配置拼起来。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DuelProperties.class)
public class DuelEngineConfig {

    @Bean
    public StyleCatalog styleCatalog(DuelProperties props) {
        Map<String, DuelProperties.StyleRow> rows = props.getStyles();
        if (rows == null || rows.isEmpty()) {
            log.info("未配置流派表，使用标准六流派");
            StyleCatalog canonical = StyleCatalog.canonical();
            return new StyleCatalog(canonical.all(), props.getDefaultStyle());
        }
        List<StyleEffect> effects = new ArrayList<>();
        rows.forEach((id, row) -> effects.add(StyleEffect.builder()
                .id(id)
                .selfHitMult(row.getSelfHitMult())
                .selfCritMult(row.getSelfCritMult())
                .selfRollCapDelta(row.getSelfRollCapDelta())
                .opponentHitMult(row.getOpponentHitMult())
                .winPushMult(row.getWinPushMult())
                .loseOpponentPushMult(row.getLoseOpponentPushMult())
                .feintTiebreak(row.isFeintTiebreak())
                .build()));
        log.info("已加载流派表 {} 项，默认流派 {}", effects.size(), props.getDefaultStyle());
        return new StyleCatalog(effects, props.getDefaultStyle());
    }

    @Bean
    public ModifierResolver modifierResolver() {
        return new ModifierResolver();
    }

    @Bean
    public RollGenerator rollGenerator() {
        return new RollGenerator();
    }

    @Bean
    public RoundScorer roundScorer(DuelProperties props) {
        DuelProperties.Push p = props.getPush();
        return new RoundScorer(new TierMarginPushCurve(p.getBase(), p.getCriticalBonus(), p.getMarginBonus()));
    }

    /**
     * 每个对局一个 Random，种子来自 SecureRandom。
     * java.util.Random 自身线程安全，多个回合并发抽取也没有问题。
     */
    @Bean
    @ConditionalOnMissingBean
    public RollSourceFactory rollSourceFactory() {
        SecureRandom seeds = new SecureRandom();
        return matchId -> {
            Random r = new Random(seeds.nextLong());
            return r::nextDouble;
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public CombatStatsDirectory combatStatsDirectory(DuelProperties props) {
        return new ConfiguredCombatStatsDirectory(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
