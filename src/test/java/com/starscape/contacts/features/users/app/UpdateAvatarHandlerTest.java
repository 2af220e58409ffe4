package com.starscape.contacts.features.users.app;

import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.auth.domain.UserRepository;
import com.starscape.contacts.features.auth.domain.events.AvatarChanged;
import com.starscape.contacts.features.users.api.dto.UserResponse;
import com.starscape.contacts.features.users.infra.AvatarResizer;
import com.starscape.contacts.features.users.infra.S3AvatarStorage;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class UpdateAvatarHandlerTest {
    
    private static final String OLD_AVATAR = "http://s3/bucket/avatars/user_1/old.png";
    private static final String NEW_AVATAR = "http://s3/bucket/avatars/user_1/new.png";
    
    @Test
    void defersCleanupOfReplacedAvatarToCommit() {
        UserRepository userRepository = mock(UserRepository.class);
        AvatarResizer avatarResizer = mock(AvatarResizer.class);
        S3AvatarStorage avatarStorage = mock(S3AvatarStorage.class);
        User user = new User("user_1", "avatarist", "avatar@example.com", "hash", OLD_AVATAR);
        user.clearDomainEvents();
        byte[] png = {1, 2, 3};
        when(userRepository.findById("user_1")).thenReturn(Optional.of(user));
        when(avatarResizer.resize(any())).thenReturn(png);
        when(avatarStorage.store("user_1", png)).thenReturn(NEW_AVATAR);
        
        UserResponse response = new UpdateAvatarHandler(userRepository, avatarResizer, avatarStorage)
            .handle("user_1", new byte[] {9});
        
        assertEquals(NEW_AVATAR, response.avatar());
        verify(userRepository).save(user);
        verify(avatarStorage, never()).deleteQuietly(anyString(), anyString());
        AvatarChanged event = (AvatarChanged) user.getDomainEvents().get(0);
        assertEquals(OLD_AVATAR, event.previousAvatar());
        assertEquals(NEW_AVATAR, event.avatar());
    }
}
