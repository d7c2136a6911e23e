package com.duelhub.duelservice.games.duel.infrastructure.ws;

import com.duelhub.duelservice.games.duel.application.DuelEventPublisher;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 的事件出口。
 *   - 私有事件：/user/{participantId}/queue/duel.events
 *   - 公共主题：/topic/duel.{matchId}
 */
@Component
@RequiredArgsConstructor
public class StompDuelEventPublisher implements DuelEventPublisher {

    public static final String USER_EVENTS = "/queue/duel.events";

    private final SimpMessagingTemplate messaging;

    @Override
    public void toParticipant(String participantId, BroadcastEvent event) {
        messaging.convertAndSendToUser(participantId, USER_EVENTS, event);
    }

    @Override
    public void toMatch(String matchId, BroadcastEvent event) {
        messaging.convertAndSend(topic(matchId), event);
    }

    public static String topic(String matchId) {
        return "/topic/duel." + matchId;
    }
}
