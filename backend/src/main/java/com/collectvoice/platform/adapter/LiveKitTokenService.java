package com.collectvoice.platform.adapter;

import com.collectvoice.config.AppProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

@Service
public class LiveKitTokenService {

    private final AppProperties properties;
    private SecretKey secretKey;

    public LiveKitTokenService(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void initKey() {
        String secret = properties.livekit().apiSecret();
        if (secret == null || secret.isEmpty()) {
            throw new IllegalStateException("app.livekit.api-secret must be configured");
        }
        byte[] source = secret.getBytes(StandardCharsets.UTF_8);
        if (source.length < 32) {
            byte[] expanded = new byte[32];
            for (int i = 0; i < expanded.length; i++) {
                expanded[i] = source[i % source.length];
            }
            source = expanded;
        }
        this.secretKey = Keys.hmacShaKeyFor(source);
    }

    public String serverToken(String roomName) {
        Instant now = Instant.now();
        Map<String, Object> video = roomName == null
                ? Map.of("roomCreate", true, "roomList", true, "roomRecord", true, "roomAdmin", true)
                : Map.of("roomCreate", true, "roomList", true, "roomRecord", true, "roomAdmin", true, "room", roomName);
        return Jwts.builder()
                .issuer(properties.livekit().apiKey())
                .subject("collectvoice-engine")
                .claim("video", video)
                .claim("sip", Map.of("admin", true, "call", true))
                .notBefore(Date.from(now))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(properties.livekit().tokenTtlSeconds())))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    SecretKey secretKey() {
        return secretKey;
    }
}
