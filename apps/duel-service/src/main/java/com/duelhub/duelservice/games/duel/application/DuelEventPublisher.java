package com.duelhub.duelservice.games.duel.application;

import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.BroadcastEvent;

/**
 * 事件出口：把事件送到某个参与者的私有队列，或对局公共主题。
 */
public interface DuelEventPublisher {

    /** 推送到参与者私有事件队列 */
    void toParticipant(String participantId, BroadcastEvent event);

    /** 推送到对局公共主题（仅展示类事件） */
    void toMatch(String matchId, BroadcastEvent event);
}
