package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.model.Platform;
import reactor.core.publisher.Mono;

/**
 * Refresh strategy of one platform. Implementations only talk to the provider; persisting and
 * encrypting the result is the vault's job.
 */
public interface TokenRefresher {

    Platform getPlatform();

    Mono<RefreshedTokens> refresh(SocialAccount account, String accessToken, String refreshToken);
}
