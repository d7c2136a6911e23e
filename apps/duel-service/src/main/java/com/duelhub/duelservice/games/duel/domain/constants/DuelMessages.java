package com.duelhub.duelservice.games.duel.domain.constants;

/**
 * 对决相关的消息常量与事件类型。
 * 统一管理用户可见的提示，避免硬编码。
 */
public final class DuelMessages {

    private DuelMessages() {
        // 工具类，禁止实例化
    }

    // ========== 事件类型 ==========

    public static final String EVT_TICK = "TICK";
    public static final String EVT_SWING_STARTED = "SWING_STARTED";
    public static final String EVT_ROUND_RESOLVED = "ROUND_RESOLVED";
    public static final String EVT_MATCH_ENDED = "MATCH_ENDED";
    public static final String EVT_ERROR = "ERROR";

    // ========== 提示消息 ==========

    /** 对局不存在 */
    public static final String MATCH_NOT_FOUND = "对局不存在: %s";

    /** 回合不存在 */
    public static final String ROUND_NOT_FOUND = "第 %d 回合不存在";

    /** 不是该对局的参与者 */
    public static final String NOT_A_PARTICIPANT = "你不是该对局的参与者";

    /** 不能和自己对决 */
    public static final String CANNOT_DUEL_SELF = "不能向自己发起对决";

    /** 缺少对手 */
    public static final String OPPONENT_REQUIRED = "必须指定对手";

    /** 回合无法结算（需人工介入） */
    public static final String ROUND_UNRESOLVABLE = "第 %d 回合无法结算，已中止";

    public static String formatMatchNotFound(String matchId) {
        return String.format(MATCH_NOT_FOUND, matchId);
    }

    public static String formatRoundNotFound(int roundNo) {
        return String.format(ROUND_NOT_FOUND, roundNo);
    }

    public static String formatRoundUnresolvable(int roundNo) {
        return String.format(ROUND_UNRESOLVABLE, roundNo);
    }
}
