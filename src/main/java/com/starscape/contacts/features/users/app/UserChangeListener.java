package com.starscape.contacts.features.users.app;

import com.starscape.contacts.features.auth.domain.events.AvatarChanged;
import com.starscape.contacts.features.auth.domain.events.EmailConfirmed;
import com.starscape.contacts.features.auth.domain.events.PasswordChanged;
import com.starscape.contacts.features.users.infra.RedisUserCache;
import com.starscape.contacts.features.users.infra.S3AvatarStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Keeps the user cache and avatar storage in step with committed user changes.
 * Cached snapshots are dropped only after the new row is visible, so a concurrent
 * lookup cannot re-cache the old state.
 */
@Component
public class UserChangeListener {

    private static final Logger log = LoggerFactory.getLogger(UserChangeListener.class);

    private final RedisUserCache userCache;
    private final S3AvatarStorage avatarStorage;

    public UserChangeListener(RedisUserCache userCache, S3AvatarStorage avatarStorage) {
        this.userCache = userCache;
        this.avatarStorage = avatarStorage;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEmailConfirmed(EmailConfirmed event) {
        userCache.evict(event.userId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPasswordChanged(PasswordChanged event) {
        userCache.evict(event.userId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAvatarChanged(AvatarChanged event) {
        userCache.evict(event.userId());
        avatarStorage.deleteQuietly(event.userId(), event.previousAvatar());
    }

    /**
     * The user still points at the previous avatar; the freshly uploaded object is orphaned.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void onAvatarChangeRolledBack(AvatarChanged event) {
        log.warn("Avatar change rolled back for user {}, removing uploaded object", event.userId());
        avatarStorage.deleteQuietly(event.userId(), event.avatar());
    }
}
