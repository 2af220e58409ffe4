package com.starscape.contacts.features.mail.app;

/**
 * Outbound HTML mail.
 */
public interface MailSender {

    /**
     * @throws MailDeliveryException if the provider rejects the message
     */
    void send(String to, String subject, String html);
}
