package org.qbitspark.filevaultbackend.sharing_service.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

@Component
@RequiredArgsConstructor
public class ShareTokenGenerator {

    // 256 bits
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
