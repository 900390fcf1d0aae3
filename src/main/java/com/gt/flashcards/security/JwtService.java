package com.gt.flashcards.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.function.Function;

// Tokens are issued by the account service; the subject is the user id that owns decks, notes and tags.
@Component
public class JwtService {

    private final String secret;
    private final long tokenExpirySec;
    private final Clock clock;

    @Autowired
    public JwtService(@Value("${server.jwt.secret}") String secret,
                      @Value("${server.jwt.cookieExpirySec:86400}") long tokenExpirySec,
                      Clock clock) {
        this.secret = secret;
        this.tokenExpirySec = tokenExpirySec;
        this.clock = clock;
    }

    public String extractUserId(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public Instant extractExpiration(String token) {
        return extractClaim(token, Claims::getExpiration).toInstant();
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSignKey())
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    public boolean validateToken(String token) {
        String userId = extractUserId(token);
        return userId != null && !userId.isBlank() && extractExpiration(token).isAfter(clock.instant());
    }

    public String generateToken(String userId) {
        Instant now = clock.instant();
        Instant expiryDate = now.plus(tokenExpirySec, ChronoUnit.SECONDS);

        return Jwts.builder()
                .setSubject(userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiryDate))
                .signWith(getSignKey(), SignatureAlgorithm.HS256).compact();
    }

    private Key getSignKey() {
        byte[] keyBytes = Base64.getDecoder().decode(this.secret);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
