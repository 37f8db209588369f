package com.ricemill.stockkeeper.security;

import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.repository.UserRepository;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Maps the authenticated principal to the stored user. Returns null when there
 * is none, which the authorization layer treats as "deny".
 */
@Component
public class CurrentActorResolver {

    private final UserRepository userRepository;

    public CurrentActorResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User currentActor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return userRepository.findByEmailIgnoreCase(auth.getName()).orElse(null);
    }
}
