package com.aitimeline.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Gateway 가 검증 후 전달하는 X-User-Id / X-User-Role 헤더로 SecurityContext 를 채운다.
 * 헤더가 없거나 숫자가 아니면 익명으로 통과시키고, 보호된 경로는 SecurityConfig 에서 401 처리된다.
 */
@Slf4j
@Component
public class GatewayUserFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String userIdHeader = request.getHeader(USER_ID_HEADER);

        if (StringUtils.hasText(userIdHeader)) {
            try {
                Long userId = Long.parseLong(userIdHeader.trim());
                String role = StringUtils.hasText(request.getHeader(USER_ROLE_HEADER))
                        ? request.getHeader(USER_ROLE_HEADER).trim().toUpperCase()
                        : "USER";

                UserPrincipal principal = new UserPrincipal(userId, role);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + role)));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (NumberFormatException e) {
                log.warn("[Gateway] Invalid {} header: {}", USER_ID_HEADER, userIdHeader);
            }
        }

        filterChain.doFilter(request, response);
    }
}
