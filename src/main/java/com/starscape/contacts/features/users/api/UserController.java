package com.starscape.contacts.features.users.api;

import com.starscape.contacts.common.exception.NotFoundException;
import com.starscape.contacts.common.security.UserPrincipal;
import com.starscape.contacts.features.users.api.dto.UserResponse;
import com.starscape.contacts.features.users.app.CurrentUserLookup;
import com.starscape.contacts.features.users.app.UpdateAvatarHandler;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/users")
public class UserController {
    
    private final CurrentUserLookup currentUserLookup;
    private final UpdateAvatarHandler updateAvatarHandler;
    
    public UserController(CurrentUserLookup currentUserLookup, UpdateAvatarHandler updateAvatarHandler) {
        this.currentUserLookup = currentUserLookup;
        this.updateAvatarHandler = updateAvatarHandler;
    }
    
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal UserPrincipal principal) {
        UserResponse response = currentUserLookup.findById(principal.getUserId())
                .map(UserResponse::of)
                .orElseThrow(() -> new NotFoundException("User not found: " + principal.getUserId()));
        return ResponseEntity.ok(response);
    }
    
    @PatchMapping(value = "/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UserResponse> updateAvatar(
            @RequestParam("file") MultipartFile file,
            @AuthenticationPrincipal UserPrincipal principal) throws IOException {
        
        return ResponseEntity.ok(updateAvatarHandler.handle(principal.getUserId(), file.getBytes()));
    }
}
