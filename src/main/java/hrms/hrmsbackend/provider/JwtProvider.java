package hrms.hrmsbackend.provider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

@Slf4j
@Service
public class JwtProvider {

    public static final String EMPLOYEE_SUBJECT_PREFIX = "E:";
    public static final String ADMIN_SUBJECT_PREFIX = "A:";

    @Value("${secret-key}")
    private String secretKey;

    @Value("${jwt.access-token.expiration:28800000}") // 8시간
    private Long accessTokenExpiration;

    private Key signingKey;

    public JwtProvider() {
    }

    // 테스트용
    public JwtProvider(String secretKey, Long accessTokenExpiration) {
        this.secretKey = secretKey;
        this.accessTokenExpiration = accessTokenExpiration;
        init();
    }

    @PostConstruct
    public void init() {
        this.signingKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * subject 는 "E:{employeeId}" 또는 "A:{adminId}"
     */
    public String create(String subject, String role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + accessTokenExpiration);

        Claims claims = Jwts.claims().setSubject(subject);
        claims.put("role", role);
        claims.put("type", "access");

        log.info("Creating access token for subject: {}, expires at: {}", subject, expiryDate);
        return Jwts.builder()
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .setClaims(claims)
                .setIssuedAt(now)
                .setExpiration(expiryDate)
                .compact();
    }

    /**
     * 유효하면 subject, 만료/위조면 null
     */
    public String validate(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setAllowedClockSkewSeconds(30)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return claims.getSubject();
        } catch (ExpiredJwtException e) {
            log.warn("Access token expired: {}", e.getMessage());
            return null;
        } catch (Exception e) {
            log.warn("Invalid access token: {}", e.getMessage());
            return null;
        }
    }

    public long getAccessTokenExpirationTime() {
        return accessTokenExpiration / 1000;
    }
}
