package com.slb.fleet_backend.common.util;

import com.slb.fleet_backend.common.security.OperatorPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * 运维端 JWT 校验。令牌由外部账户服务签发（HS256，共享密钥），本服务只负责验签与还原身份。
 */
@Component
@Slf4j
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_UID = "uid";
    public static final String CLAIM_ROLE = "role";
    private static final String TOKEN_TYPE_ACCESS = "access";

    @Value("${security.jwt.secret}")
    private String secret;

    @Value("${security.jwt.access-token-expire:3600}")
    private long accessTokenExpire;  // seconds

    private Key key;

    @PostConstruct
    public void init() {
        // 保证 secret 至少 32 bytes，HS256 可用
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public Claims parseAccessClaims(String token) {
        Claims claims = Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
        String tokenType = claims.get(CLAIM_TYP, String.class);
        if (StringUtils.hasText(tokenType) && !TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
            throw new UnsupportedJwtException("Wrong token type: " + tokenType);
        }
        return claims;
    }

    /**
     * 从 claims 还原运维身份；uid 缺失时返回 null（调用方按 CLAIM_MISMATCH 处理）。
     */
    @Nullable
    public OperatorPrincipal toPrincipal(Claims claims) {
        Long uid = resolveUid(claims.get(CLAIM_UID));
        if (uid == null) {
            return null;
        }
        String username = claims.get(CLAIM_USERNAME, String.class);
        if (!StringUtils.hasText(username)) {
            username = claims.getSubject();
        }
        return new OperatorPrincipal(uid, username, claims.get(CLAIM_ROLE, String.class));
    }

    /** 签发访问令牌：生产环境由账户服务签发，这里用于联调与测试。 */
    public String generateAccessToken(Long uid, String username, @Nullable String role) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_TYP, TOKEN_TYPE_ACCESS);
        claims.put(CLAIM_USERNAME, username);
        claims.put(CLAIM_UID, uid);
        if (StringUtils.hasText(role)) claims.put(CLAIM_ROLE, role);
        Date now = new Date();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(username)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + accessTokenExpire * 1000))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    @Nullable
    private Long resolveUid(Object raw) {
        if (raw instanceof Number n) return n.longValue();
        if (raw instanceof String s && StringUtils.hasText(s)) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignore) {
                return null;
            }
        }
        return null;
    }
}
