package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.entity.metadata.AccountMetadata;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.repository.SocialAccountRepository;
import com.clipper.platform.publisher.security.EncryptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Hands out valid access tokens for connected accounts.
 * <p>
 * Tokens are stored encrypted and only decrypted for the call that needs them. A token within the
 * platform's refresh buffer of its expiry is refreshed first. Refreshes are single-flight per
 * account inside this process, and the account's {@code @Version} column guards against another
 * instance refreshing at the same time: the loser adopts the winner's tokens. A failed refresh
 * deactivates the account.
 */
@Service
@Slf4j
public class CredentialVault {

    private final SocialAccountRepository accountRepository;
    private final EncryptionService encryptionService;
    private final Map<Platform, TokenRefresher> refreshers = new EnumMap<>(Platform.class);
    private final Clock clock;
    private final Scheduler persistenceScheduler;
    private final SingleFlight<UUID, SocialAccount> refreshes = new SingleFlight<>();

    @Autowired
    public CredentialVault(SocialAccountRepository accountRepository, EncryptionService encryptionService,
                           List<TokenRefresher> refreshers) {
        this(accountRepository, encryptionService, refreshers, Clock.systemUTC(), Schedulers.boundedElastic());
    }

    CredentialVault(SocialAccountRepository accountRepository, EncryptionService encryptionService,
                    List<TokenRefresher> refreshers, Clock clock, Scheduler persistenceScheduler) {
        this.accountRepository = accountRepository;
        this.encryptionService = encryptionService;
        this.clock = clock;
        this.persistenceScheduler = persistenceScheduler;
        refreshers.forEach(refresher -> this.refreshers.put(refresher.getPlatform(), refresher));
    }

    public String encrypt(String token) {
        return encryptionService.encrypt(token);
    }

    public String decrypt(String ciphertext) {
        return encryptionService.decrypt(ciphertext);
    }

    /**
     * True when {@code now + buffer >= tokenExpiresAt}. Accounts without a recorded expiry are
     * never refreshed proactively.
     */
    public boolean needsRefresh(SocialAccount account) {
        OffsetDateTime expiresAt = account.getTokenExpiresAt();
        if (expiresAt == null) {
            return false;
        }
        OffsetDateTime threshold = OffsetDateTime.now(clock).plus(account.getPlatform().getRefreshBuffer());
        return !threshold.isBefore(expiresAt);
    }

    public Mono<AccessCredential> validCredential(SocialAccount account) {
        if (!needsRefresh(account)) {
            return Mono.fromCallable(() -> toCredential(account));
        }
        log.info("{} token for account {} expires at {}, refreshing",
                account.getPlatform().getDisplayName(), account.getId(), account.getTokenExpiresAt());
        return refresh(account).map(this::toCredential);
    }

    /**
     * Refresh unless another caller already did while this one waited.
     */
    public Mono<SocialAccount> refresh(SocialAccount account) {
        return refreshes.run(account.getId(), () -> loadCurrent(account)
                .flatMap(current -> needsRefresh(current) ? refreshNow(current) : Mono.just(current)));
    }

    /**
     * Refresh regardless of the recorded expiry, after the platform rejected {@code rejectedToken}.
     * A token stored since the rejection is adopted without another provider call. A shared
     * refresh that still carries the rejected token is followed by a refresh of this caller's own.
     */
    public Mono<SocialAccount> forceRefresh(SocialAccount account, String rejectedToken) {
        return refreshes.run(account.getId(), () -> rotateUnlessReplaced(account, rejectedToken))
                .flatMap(shared -> isReplaced(shared, rejectedToken)
                        ? Mono.just(shared)
                        : refreshes.run(account.getId(), () -> rotateUnlessReplaced(account, rejectedToken)));
    }

    private Mono<SocialAccount> rotateUnlessReplaced(SocialAccount account, String rejectedToken) {
        return loadCurrent(account)
                .flatMap(current -> isReplaced(current, rejectedToken) ? Mono.just(current) : refreshNow(current));
    }

    private boolean isReplaced(SocialAccount account, String rejectedToken) {
        return rejectedToken != null && !rejectedToken.equals(toCredential(account).getAccessToken());
    }

    public Mono<Void> deactivate(SocialAccount account, String reason) {
        return Mono.fromCallable(() -> {
                    log.warn("Deactivating {} account {}: {}", account.getPlatform().getDisplayName(),
                            account.getId(), reason);
                    account.setActive(false);
                    return accountRepository.deactivate(account.getId());
                })
                .subscribeOn(persistenceScheduler)
                .then();
    }

    private Mono<SocialAccount> loadCurrent(SocialAccount account) {
        return Mono.fromCallable(() -> accountRepository.findById(account.getId()).orElse(account))
                .subscribeOn(persistenceScheduler);
    }

    private Mono<SocialAccount> refreshNow(SocialAccount account) {
        TokenRefresher refresher = refreshers.get(account.getPlatform());
        if (refresher == null) {
            return Mono.error(new IllegalStateException("No token refresher for " + account.getPlatform()));
        }

        return Mono.defer(() -> refresher.refresh(account,
                        decrypt(account.getAccessTokenEncrypted()),
                        decrypt(account.getRefreshTokenEncrypted())))
                .flatMap(tokens -> store(account, tokens))
                .onErrorResume(error -> !(error instanceof ObjectOptimisticLockingFailureException),
                        error -> deactivate(account, "token refresh failed: " + error.getMessage())
                                .then(Mono.error(asPublishException(account, error))));
    }

    private Mono<SocialAccount> store(SocialAccount account, RefreshedTokens tokens) {
        return Mono.fromCallable(() -> {
                    account.setAccessTokenEncrypted(encrypt(tokens.getAccessToken()));
                    if (tokens.getRefreshToken() != null) {
                        account.setRefreshTokenEncrypted(encrypt(tokens.getRefreshToken()));
                    }
                    account.setTokenExpiresAt(OffsetDateTime.now(clock).plusSeconds(tokens.getExpiresInSeconds()));

                    AccountMetadata metadata = account.getMetadata();
                    if (tokens.getPublishingToken() != null && metadata != null) {
                        account.setMetadata(metadata.withPublishingToken(encrypt(tokens.getPublishingToken())));
                    }

                    SocialAccount saved = accountRepository.save(account);
                    log.info("Stored refreshed {} token for account {}, valid until {}",
                            account.getPlatform().getDisplayName(), account.getId(), saved.getTokenExpiresAt());
                    return saved;
                })
                .subscribeOn(persistenceScheduler)
                .onErrorResume(ObjectOptimisticLockingFailureException.class, e -> {
                    log.info("Account {} was refreshed concurrently elsewhere, adopting the stored token", account.getId());
                    return Mono.fromCallable(() -> accountRepository.findById(account.getId()).orElseThrow(() -> e))
                            .subscribeOn(persistenceScheduler);
                });
    }

    private AccessCredential toCredential(SocialAccount account) {
        AccountMetadata metadata = account.getMetadata();
        String encrypted = metadata != null && metadata.getPublishingTokenEncrypted() != null
                ? metadata.getPublishingTokenEncrypted()
                : account.getAccessTokenEncrypted();
        if (encrypted == null) {
            throw new AuthException("No " + account.getPlatform().getDisplayName()
                    + " access token stored for account " + account.getId());
        }
        return AccessCredential.builder()
                .accountId(account.getId())
                .platform(account.getPlatform())
                .accessToken(decrypt(encrypted))
                .username(account.getUsername())
                .metadata(metadata)
                .build();
    }

    private Throwable asPublishException(SocialAccount account, Throwable error) {
        if (error instanceof PublishException) {
            return error;
        }
        return new AuthException(account.getPlatform().getDisplayName() + " token refresh failed: "
                + error.getMessage(), error);
    }
}
