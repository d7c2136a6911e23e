package com.duelhub.duelservice.games.duel.interfaces.http;

import com.duelhub.duelservice.games.duel.domain.dto.LockStyleResult;
import com.duelhub.duelservice.games.duel.domain.dto.StopResult;
import com.duelhub.duelservice.games.duel.domain.dto.SwingResult;
import com.duelhub.duelservice.games.duel.domain.model.MatchView;
import com.duelhub.duelservice.games.duel.domain.model.RoundStateView;
import com.duelhub.duelservice.games.duel.domain.style.StyleEffect;
import com.duelhub.duelservice.games.duel.interfaces.http.dto.CreateDuelRequest;
import com.duelhub.duelservice.games.duel.interfaces.http.dto.LockStyleRequest;
import com.duelhub.duelservice.games.duel.service.DuelService;
import com.duelhub.web.common.ApiResponse;
import com.duelhub.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;

/**
 * 对决 http 接口。调用方代表的参与者由 JWT subject 决定。
 * 出错时由 WebExceptionAdvice 统一映射状态码。
 */
@Slf4j
@RestController
@RequestMapping("/api/duels")
@RequiredArgsConstructor
public class DuelRestController {

    private final DuelService svc;

    /**
     * 发起对决：调用方为 A 方，opponentId 为 B 方。
     */
    @PostMapping
    public ResponseEntity<ApiResponse<MatchView>> create(@RequestBody CreateDuelRequest req,
                                                         @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireParticipantId(jwt);
        MatchView view = svc.createMatch(me, req == null ? null : req.getOpponentId());
        log.info("{} 发起对决 match={}", CurrentUserHelper.getDisplayName(jwt), view.getMatchId());
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    @GetMapping("/styles")
    public ResponseEntity<ApiResponse<Collection<StyleEffect>>> styles() {
        return ResponseEntity.ok(ApiResponse.success(svc.listStyles()));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<ApiResponse<MatchView>> match(@PathVariable("matchId") String matchId) {
        return ResponseEntity.ok(ApiResponse.success(svc.getMatch(matchId)));
    }

    @PostMapping("/{matchId}/rounds/{roundNo}/style")
    public ResponseEntity<ApiResponse<LockStyleResult>> lockStyle(@PathVariable("matchId") String matchId,
                                                                  @PathVariable("roundNo") int roundNo,
                                                                  @RequestBody LockStyleRequest req,
                                                                  @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireParticipantId(jwt);
        return ResponseEntity.ok(ApiResponse.success(
                svc.lockStyle(matchId, roundNo, me, req == null ? null : req.getStyleId())));
    }

    @PostMapping("/{matchId}/rounds/{roundNo}/swing")
    public ResponseEntity<ApiResponse<SwingResult>> swing(@PathVariable("matchId") String matchId,
                                                          @PathVariable("roundNo") int roundNo,
                                                          @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireParticipantId(jwt);
        return ResponseEntity.ok(ApiResponse.success(svc.swing(matchId, roundNo, me)));
    }

    @PostMapping("/{matchId}/rounds/{roundNo}/stop")
    public ResponseEntity<ApiResponse<StopResult>> stop(@PathVariable("matchId") String matchId,
                                                        @PathVariable("roundNo") int roundNo,
                                                        @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireParticipantId(jwt);
        return ResponseEntity.ok(ApiResponse.success(svc.stop(matchId, roundNo, me)));
    }

    /**
     * 回合状态；调用方是参与者时附带其私有字段。
     */
    @GetMapping("/{matchId}/rounds/{roundNo}")
    public ResponseEntity<ApiResponse<RoundStateView>> round(@PathVariable("matchId") String matchId,
                                                             @PathVariable("roundNo") int roundNo,
                                                             @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(ApiResponse.success(
                svc.getRoundState(matchId, roundNo, CurrentUserHelper.getParticipantId(jwt))));
    }
}
