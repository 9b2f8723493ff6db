package ru.oparin.calendar.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Service;
import ru.oparin.calendar.config.properties.ExportProperties;
import ru.oparin.calendar.exception.InvalidExportTokenException;
import ru.oparin.calendar.exception.InvalidExportTokenException.Reason;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Подписанные экспортные ссылки.
 * <p>
 * Токен: base64url("владелец:времяВыдачиМс") + "." + base64url(HMAC-SHA256(секрет, соль + ":" + полезная нагрузка)).
 * Токены нигде не хранятся, отозвать токен до истечения срока нельзя.
 * * {@link javax.crypto.Mac} не потокобезопасен: {@link HmacUtils} создаётся на каждую подпись.
 */
@Slf4j
@Service
public class ExportTokenService {

    static final String SALT = "calendar-export-v1";

    private final byte[] secretKey;
    private final Duration defaultMaxAge;
    private final Clock clock;

    public ExportTokenService(ExportProperties exportProperties, Clock clock) {
        this.secretKey = exportProperties.getSecret().getBytes(StandardCharsets.UTF_8);
        this.defaultMaxAge = exportProperties.getMaxAge();
        this.clock = clock;
    }

    public String issue(Long ownerId) {
        String payload = ownerId + ":" + clock.instant().toEpochMilli();
        String token = encode(payload.getBytes(StandardCharsets.UTF_8)) + "." + encode(sign(payload));
        log.info("Выдана экспортная ссылка пользователю {}", ownerId);
        return token;
    }

    /**
     * Проверить токен со сроком жизни из настроек.
     */
    public Long redeem(String token) {
        return redeem(token, defaultMaxAge);
    }

    /**
     * Проверить подпись и срок жизни токена.
     *
     * @return ID владельца
     * @throws InvalidExportTokenException при неверной подписи или истёкшем сроке
     */
    public Long redeem(String token, Duration maxAge) {
        if (token == null || token.isBlank()) {
            throw new InvalidExportTokenException(Reason.MALFORMED);
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new InvalidExportTokenException(Reason.MALFORMED);
        }

        String payload = new String(Base64.decodeBase64(token.substring(0, dot)), StandardCharsets.UTF_8);
        byte[] signature = Base64.decodeBase64(token.substring(dot + 1));
        if (!MessageDigest.isEqual(sign(payload), signature)) {
            throw new InvalidExportTokenException(Reason.BAD_SIGNATURE);
        }

        String[] parts = payload.split(":");
        if (parts.length != 2) {
            throw new InvalidExportTokenException(Reason.MALFORMED);
        }
        long ownerId;
        long issuedAt;
        try {
            ownerId = Long.parseLong(parts[0]);
            issuedAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            throw new InvalidExportTokenException(Reason.MALFORMED);
        }

        Duration age = Duration.between(Instant.ofEpochMilli(issuedAt), clock.instant());
        if (age.compareTo(maxAge) > 0) {
            throw new InvalidExportTokenException(Reason.EXPIRED);
        }
        return ownerId;
    }

    private byte[] sign(String payload) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secretKey).hmac(SALT + ":" + payload);
    }

    private static String encode(byte[] bytes) {
        return Base64.encodeBase64URLSafeString(bytes);
    }
}
