package com.duelhub.web.common;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 当前调用方身份提取工具类
 *
 * 对决服务中，调用方代表哪一位参与者完全由 JWT 决定：
 * - 参与者ID = token subject（身份层签发，服务内不做二次映射）
 * - 显示名称 = name > preferred_username > subject
 *
 * 使用方式：
 * <pre>
 * {@code
 * @PostMapping("/{matchId}/rounds/{roundNo}/swing")
 * public ResponseEntity<?> swing(@AuthenticationPrincipal Jwt jwt, ...) {
 *     String participantId = CurrentUserHelper.requireParticipantId(jwt);
 *     // ...
 * }
 * }
 * </pre>
 */
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 获取参与者ID（JWT subject），jwt 为空时返回 null
     */
    public static String getParticipantId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    /**
     * 获取参与者ID，缺失时直接拒绝
     *
     * @throws IllegalArgumentException 未携带身份或 subject 为空
     */
    public static String requireParticipantId(Jwt jwt) {
        String id = getParticipantId(jwt);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("MISSING_IDENTITY: 未识别到调用方身份");
        }
        return id;
    }

    /**
     * 获取显示名称（用于日志/展示），优先 name，其次 preferred_username，最后 subject
     */
    public static String getDisplayName(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        return Optional.ofNullable(jwt.getClaimAsString("name"))
                .filter(s -> !s.isBlank())
                .or(() -> Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                        .filter(s -> !s.isBlank()))
                .orElse(jwt.getSubject());
    }
}
