package com.starscape.contacts.features.users.app;

import com.starscape.contacts.features.auth.domain.events.AvatarChanged;
import com.starscape.contacts.features.auth.domain.events.EmailConfirmed;
import com.starscape.contacts.features.auth.domain.events.PasswordChanged;
import com.starscape.contacts.features.users.infra.RedisUserCache;
import com.starscape.contacts.features.users.infra.S3AvatarStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.mockito.Mockito.*;

class UserChangeListenerTest {
    
    private static final String OLD_AVATAR = "http://s3/bucket/avatars/user_1/old.png";
    private static final String NEW_AVATAR = "http://s3/bucket/avatars/user_1/new.png";
    
    private RedisUserCache userCache;
    private S3AvatarStorage avatarStorage;
    private UserChangeListener listener;
    
    @BeforeEach
    void setUp() {
        userCache = mock(RedisUserCache.class);
        avatarStorage = mock(S3AvatarStorage.class);
        listener = new UserChangeListener(userCache, avatarStorage);
    }
    
    @Test
    void committedAvatarChangeEvictsCacheAndDeletesReplacedObject() {
        listener.onAvatarChanged(new AvatarChanged("user_1", OLD_AVATAR, NEW_AVATAR, Instant.now()));
        
        verify(userCache).evict("user_1");
        verify(avatarStorage).deleteQuietly("user_1", OLD_AVATAR);
        verify(avatarStorage, never()).deleteQuietly("user_1", NEW_AVATAR);
    }
    
    @Test
    void rolledBackAvatarChangeKeepsPreviousObjectAndRemovesUpload() {
        listener.onAvatarChangeRolledBack(new AvatarChanged("user_1", OLD_AVATAR, NEW_AVATAR, Instant.now()));
        
        verify(avatarStorage).deleteQuietly("user_1", NEW_AVATAR);
        verify(avatarStorage, never()).deleteQuietly("user_1", OLD_AVATAR);
        verifyNoInteractions(userCache);
    }
    
    @Test
    void committedConfirmationAndPasswordChangeEvictCache() {
        listener.onEmailConfirmed(new EmailConfirmed("user_1", Instant.now()));
        listener.onPasswordChanged(new PasswordChanged("user_2", Instant.now()));
        
        verify(userCache).evict("user_1");
        verify(userCache).evict("user_2");
        verifyNoInteractions(avatarStorage);
    }
}
