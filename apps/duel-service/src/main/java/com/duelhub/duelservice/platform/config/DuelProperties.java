package com.duelhub.duelservice.platform.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对决引擎配置（前缀 duel）。
 * 流派表为空时使用标准六流派。
 * 计时时长至少 1 秒，启动时校验。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "duel")
public class DuelProperties {

    /** 选流派超时后的默认流派 */
    private String defaultStyle = "balanced";

    @Valid
    private Phase style = new Phase(10);
    @Valid
    private Swing swing = new Swing();
    private Push push = new Push();
    private Bar bar = new Bar();
    private Stats stats = new Stats();
    private Archive archive = new Archive();
    @Valid
    private Retention retention = new Retention();

    /** 流派表：styleId -> 修正项 */
    private Map<String, StyleRow> styles = new LinkedHashMap<>();

    @Data
    public static class Phase {
        @Min(1)
        private int seconds;

        public Phase() {
        }

        public Phase(int seconds) {
            this.seconds = seconds;
        }
    }

    @Data
    public static class Swing {
        /** 出手阶段时长（秒） */
        @Min(1)
        private int seconds = 30;
        /** 基础出手上限 */
        @Min(1)
        private int baseCap = 3;
    }

    @Data
    public static class Push {
        private double base = 10.0;
        private double criticalBonus = 1.5;
        private double marginBonus = 0.5;
    }

    @Data
    public static class Bar {
        private double start = 50.0;
        private double min = 0.0;
        private double max = 100.0;
    }

    @Data
    public static class Stats {
        private double baseHitChance = 0.65;
        private double baseCritRate = 0.10;
        /** 按参与者覆盖基础属性（未出现的字段沿用默认值） */
        private Map<String, StatsOverride> overrides = new LinkedHashMap<>();
    }

    @Data
    public static class StatsOverride {
        private Double baseHitChance;
        private Double baseCritRate;
        private Integer baseRollCap;
    }

    @Data
    public static class Archive {
        /** memory / redis */
        private String store = "memory";
        private Duration ttl = Duration.ofHours(48);
    }

    /**
     * 已终局对局在内存中的保留时长，到期后由清理任务移除。
     */
    @Data
    public static class Retention {
        @NotNull
        private Duration finished = Duration.ofMinutes(10);
        /** 清理任务间隔 */
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    /**
     * 流派表中的一行，缺省字段即为单位值。
     */
    @Data
    public static class StyleRow {
        private double selfHitMult = 1.0;
        private double selfCritMult = 1.0;
        private int selfRollCapDelta = 0;
        private double opponentHitMult = 1.0;
        private double winPushMult = 1.0;
        private double loseOpponentPushMult = 1.0;
        private boolean feintTiebreak = false;
    }
}
