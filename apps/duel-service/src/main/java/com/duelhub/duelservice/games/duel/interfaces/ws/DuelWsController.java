package com.duelhub.duelservice.games.duel.interfaces.ws;

import com.duelhub.duelservice.games.duel.domain.constants.DuelMessages;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.BroadcastEvent;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.RoundCmd;
import com.duelhub.duelservice.games.duel.interfaces.ws.dto.DuelWsMessages.StyleCmd;
import com.duelhub.duelservice.games.duel.service.DuelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.function.Function;

/**
 * 对决 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/duel.style、/app/duel.swing、/app/duel.stop，
 * 同步结果只回给调用方（/user/queue/duel.reply），错误也只发给调用方。
 * 结算广播由 RoundNotificationDispatcher 负责，这里不重复推送。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class DuelWsController {

    static final String REPLY_QUEUE = "/queue/duel.reply";

    private final DuelService duelService;
    private final SimpMessagingTemplate messaging;

    @MessageMapping("/duel.style")
    public void lockStyle(StyleCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(sha, cmd.getMatchId(), cmd.getRoundNo(), "STYLE_LOCKED",
                userId -> duelService.lockStyle(cmd.getMatchId(), cmd.getRoundNo(), userId, cmd.getStyleId()));
    }

    @MessageMapping("/duel.swing")
    public void swing(RoundCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(sha, cmd.getMatchId(), cmd.getRoundNo(), "SWING",
                userId -> duelService.swing(cmd.getMatchId(), cmd.getRoundNo(), userId));
    }

    @MessageMapping("/duel.stop")
    public void stop(RoundCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(sha, cmd.getMatchId(), cmd.getRoundNo(), "STOP",
                userId -> duelService.stop(cmd.getMatchId(), cmd.getRoundNo(), userId));
    }

    private void handle(SimpMessageHeaderAccessor sha, String matchId, int roundNo, String replyType,
                        Function<String, Object> action) {
        Principal user = sha.getUser();
        if (user == null) {
            // 未认证连接没有用户目的地可回，直接记录
            log.warn("未认证的 STOMP 指令被忽略 type={} match={}", replyType, matchId);
            return;
        }
        String userId = user.getName();
        try {
            Object result = action.apply(userId);
            messaging.convertAndSendToUser(userId, REPLY_QUEUE, BroadcastEvent.of(matchId, roundNo, replyType, result));
        } catch (RuntimeException e) {
            log.debug("STOMP 指令被拒绝 user={} type={} match={}: {}", userId, replyType, matchId, e.getMessage());
            messaging.convertAndSendToUser(userId, REPLY_QUEUE,
                    BroadcastEvent.of(matchId, roundNo, DuelMessages.EVT_ERROR, e.getMessage()));
        }
    }
}
