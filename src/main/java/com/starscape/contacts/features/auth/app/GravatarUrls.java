package com.starscape.contacts.features.auth.app;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;

/**
 * Default avatar for new accounts: the Gravatar image registered for the email, if any.
 */
final class GravatarUrls {

    private static final String BASE_URL = "https://www.gravatar.com/avatar/";

    private GravatarUrls() {
    }

    static String forEmail(String email) {
        String hash = DigestUtils.md5Hex(email.trim().toLowerCase(Locale.ROOT));
        return BASE_URL + hash + "?d=identicon";
    }
}
