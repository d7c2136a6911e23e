package com.duelhub.duelservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * WebSocket STOMP 认证拦截器
 *
 * 在 CONNECT 阶段验证 JWT 并设置用户身份。
 * 用户名取 token subject，与 REST 侧参与者ID一致，/user/{participantId}/queue/... 才能路由到本人。
 * 验证失败不设置用户，后续指令会被控制器忽略。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        // 支持 Authorization 或 access_token
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) auth = firstHeader(accessor, "authorization");
        if (auth == null) {
            String tokenOnly = firstHeader(accessor, "access_token");
            if (tokenOnly != null && !tokenOnly.isBlank()) auth = "Bearer " + tokenOnly.trim();
        }

        if (auth != null && auth.toLowerCase().startsWith("bearer ")) {
            String token = auth.substring(7).trim();
            try {
                Jwt jwt = jwtDecoder.decode(token);
                Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
                accessor.setUser(new JwtAuthenticationToken(jwt, authorities, jwt.getSubject()));
            } catch (JwtException e) {
                log.warn("STOMP CONNECT token 校验失败: {}", e.getMessage());
            }
        }
        return message;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
