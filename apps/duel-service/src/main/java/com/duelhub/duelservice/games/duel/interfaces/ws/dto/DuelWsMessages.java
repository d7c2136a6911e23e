package com.duelhub.duelservice.games.duel.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 *   1. 前端 -> 后端：/app/duel.style、/app/duel.swing、/app/duel.stop
 *   2. 后端 -> 前端：BroadcastEvent（/user/queue/duel.events、/topic/duel.{matchId}）
 */
public class DuelWsMessages {

    /**
     * 锁定流派
     */
    @Data
    public static class StyleCmd {
        private String matchId;
        private int roundNo;
        private String styleId;
    }

    /**
     * 出手 / 收手（无额外字段）
     */
    @Data
    public static class RoundCmd {
        private String matchId;
        private int roundNo;
    }

    /**
     * 服务端推送的统一事件结构。
     *   - type：TICK / SWING_STARTED / ROUND_RESOLVED / MATCH_ENDED / ERROR
     *   - payload：事件内容
     */
    @Data
    public static class BroadcastEvent {
        private String matchId;
        private Integer roundNo;
        private String type;
        private Object payload;

        public static BroadcastEvent of(String matchId, Integer roundNo, String type, Object payload) {
            BroadcastEvent e = new BroadcastEvent();
            e.setMatchId(matchId);
            e.setRoundNo(roundNo);
            e.setType(type);
            e.setPayload(payload);
            return e;
        }
    }
}
