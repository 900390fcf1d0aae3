package com.gt.flashcards.security;

import com.gt.flashcards.util.TestUtils;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class JwtServiceTests {

    private static final String SECRET = "c2VjcmV0LWtleS1mb3ItdGVzdGluZy10aGUtZmxhc2hjYXJkcy1zZXJ2ZXI=";
    private static final String OTHER_SECRET = "YS1kaWZmZXJlbnQtc2VjcmV0LWtleS11c2VkLXRvLWZvcmdlLXRva2VucyEh";

    private final JwtService jwtService = new JwtService(SECRET, 3600, TestUtils.FIXED_CLOCK);

    @Test
    public void testGenerateAndValidate() {
        String token = jwtService.generateToken(TestUtils.TEST_USER_ID);

        assertTrue(jwtService.validateToken(token));
        assertEquals(TestUtils.TEST_USER_ID, jwtService.extractUserId(token));
        assertEquals(TestUtils.NOW.plus(Duration.ofHours(1)), jwtService.extractExpiration(token));
    }

    @Test
    public void testExpiredToken() {
        String token = jwtService.generateToken(TestUtils.TEST_USER_ID);
        JwtService laterJwtService = new JwtService(SECRET, 3600, Clock.fixed(TestUtils.NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

        assertThrows(ExpiredJwtException.class, () -> laterJwtService.validateToken(token));
    }

    @Test
    public void testTokenSignedWithOtherKey() {
        String forgedToken = new JwtService(OTHER_SECRET, 3600, TestUtils.FIXED_CLOCK).generateToken(TestUtils.TEST_USER_ID);

        assertThrows(JwtException.class, () -> jwtService.validateToken(forgedToken));
    }
}
